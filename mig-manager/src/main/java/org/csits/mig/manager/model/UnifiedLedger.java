package org.csits.mig.manager.model;

import java.util.Collections;
import java.util.List;

/**
 * 统一账本：以主账本为锚点、按行唯一标识左连接其余账本得到的作业级记录。
 */
public class UnifiedLedger extends Ledger {

    private final String primaryName;

    private final List<String> secondaryNames;

    public UnifiedLedger(String jobName, String primaryName, List<String> secondaryNames,
                         List<LedgerEntry> entries) {
        super(jobName, entries);
        this.primaryName = primaryName;
        this.secondaryNames = secondaryNames == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(secondaryNames);
    }

    public String getPrimaryName() {
        return primaryName;
    }

    public List<String> getSecondaryNames() {
        return secondaryNames;
    }
}
