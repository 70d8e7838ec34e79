package org.csits.mig.manager.plugin;

import java.util.Map;
import org.csits.mig.manager.model.Row;

/**
 * 行改写协议：加载器按行唯一标识收集被改写的行，由执行器替换进下一个加载器的输入批。
 */
public interface RowMutator {

    boolean hasMutatedRows();

    /**
     * 取出并清空本批改写集合，key 为行唯一标识。
     */
    Map<String, Row> collectMutatedRows();
}
