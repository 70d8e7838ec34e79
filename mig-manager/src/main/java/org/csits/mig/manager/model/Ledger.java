package org.csits.mig.manager.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 账本：某个加载器在一次作业运行中按顺序追加的副作用记录。
 */
public class Ledger {

    private final String name;

    private final List<LedgerEntry> entries = new ArrayList<>();

    private LedgerSchema schema;

    public Ledger(String name) {
        this.name = name;
    }

    public Ledger(String name, List<LedgerEntry> entries) {
        this.name = name;
        if (entries != null) {
            this.entries.addAll(entries);
        }
    }

    public String getName() {
        return name;
    }

    public void append(LedgerEntry entry) {
        entries.add(entry);
    }

    public List<LedgerEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public LedgerSchema getSchema() {
        return schema;
    }

    public void setSchema(LedgerSchema schema) {
        this.schema = schema;
    }

    @Override
    public String toString() {
        return "Ledger(name=" + name + ", entries=" + entries.size() + ")";
    }
}
