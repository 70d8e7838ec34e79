package org.csits.mig.server.plugin;

import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.LoadStepConfig;

/**
 * 加载器工厂。每次作业运行创建新的加载器实例，账本随实例创建。
 */
public interface LoaderFactory {

    String getType();

    Loader create(LoadStepConfig step, JobRunContext context) throws Exception;
}
