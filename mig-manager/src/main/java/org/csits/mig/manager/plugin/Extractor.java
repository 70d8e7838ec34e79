package org.csits.mig.manager.plugin;

import org.csits.mig.manager.model.Batch;

/**
 * 抽取适配器接口，从外部来源读取行。
 */
public interface Extractor {

    Batch extract() throws Exception;
}
