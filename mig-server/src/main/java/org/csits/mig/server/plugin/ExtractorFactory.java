package org.csits.mig.server.plugin;

import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;

/**
 * 抽取器工厂，按配置中的 type 标签注册。
 */
public interface ExtractorFactory {

    String getType();

    Extractor create(StepConfig step, JobRunContext context) throws Exception;
}
