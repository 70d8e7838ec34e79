package org.csits.mig.manager.plugin;

import org.csits.mig.manager.model.Ledger;

/**
 * 产生账本的加载器。
 */
public interface LedgerProducer {

    /**
     * 是否已记录至少一条账本条目。
     */
    boolean hasLedger();

    /**
     * 当前账本，未配置账本时返回 null。
     */
    Ledger getLedger();

    /**
     * 配置中显式声明 primary: true 时为主账本。
     */
    default boolean isPrimaryLedger() {
        return false;
    }
}
