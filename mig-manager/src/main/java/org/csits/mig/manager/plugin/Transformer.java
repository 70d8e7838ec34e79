package org.csits.mig.manager.plugin;

import org.csits.mig.manager.model.Batch;

/**
 * 转换适配器接口。实现不得就地修改输入行，应返回新的批。
 */
public interface Transformer {

    Batch transform(Batch rows) throws Exception;
}
