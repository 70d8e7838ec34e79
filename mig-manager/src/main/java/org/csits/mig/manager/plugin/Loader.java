package org.csits.mig.manager.plugin;

import org.csits.mig.manager.model.Batch;

/**
 * 加载器接口：消费一批行并对目标系统产生副作用。
 *
 * 加载器可以同时实现 {@link RowMutator}（向链中后续加载器暴露改写后的行）
 * 与 {@link LedgerProducer}（记录自己做了什么）。
 */
public interface Loader {

    /**
     * 加载器名称，对应配置中的 load[].name，也是其账本文件名前缀。
     */
    String getName();

    /**
     * 目标实体类型，例如 post、term；用于挑选主账本，未知时返回 null。
     */
    default String getDestinationType() {
        return null;
    }

    void load(Batch batch) throws Exception;

    /**
     * 所有批次处理完成后调用一次，用于刷新缓冲或释放目标连接。
     */
    default void close() throws Exception {
    }
}
