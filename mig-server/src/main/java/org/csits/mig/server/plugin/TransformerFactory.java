package org.csits.mig.server.plugin;

import org.csits.mig.manager.plugin.Transformer;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;

/**
 * 转换器工厂。
 */
public interface TransformerFactory {

    String getType();

    Transformer create(StepConfig step, JobRunContext context) throws Exception;
}
