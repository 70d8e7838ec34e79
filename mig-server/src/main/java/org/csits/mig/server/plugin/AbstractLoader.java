package org.csits.mig.server.plugin;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Ledger;
import org.csits.mig.manager.model.LedgerEntry;
import org.csits.mig.manager.model.LedgerSchema;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.plugin.LedgerProducer;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.manager.plugin.RowMutator;
import org.csits.mig.server.dto.LoadStepConfig;

/**
 * 加载器基类：提供行改写收集与账本记录。配置了 ledger 区块的加载器在构造时即创建空账本。
 * 账本声明了结构时，条目在记录时即按结构转换，无法转换的条目被拒绝并记录日志，不影响其余条目。
 */
@Slf4j
public abstract class AbstractLoader implements Loader, RowMutator, LedgerProducer {

    private final String name;

    private final String jobName;

    private final String destinationType;

    private final boolean primaryLedger;

    private final Ledger ledger;

    private final Map<String, Row> mutatedRows = new LinkedHashMap<>();

    protected AbstractLoader(LoadStepConfig step, String jobName) {
        this(step, jobName, step.getLedger() != null);
    }

    protected AbstractLoader(LoadStepConfig step, String jobName, boolean withLedger) {
        this.name = step.getName();
        this.jobName = jobName;
        this.destinationType = step.getDestinationType();
        LoadStepConfig.LoaderLedgerConfig ledgerConfig = step.getLedger();
        this.primaryLedger = ledgerConfig != null && ledgerConfig.isPrimary();
        if (withLedger) {
            this.ledger = new Ledger(name);
            if (ledgerConfig != null && ledgerConfig.getSchema() != null && !ledgerConfig.getSchema().isEmpty()) {
                ledger.setSchema(LedgerSchema.of(ledgerConfig.getSchema()));
            }
        } else {
            this.ledger = null;
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDestinationType() {
        return destinationType;
    }

    /**
     * 记录改写后的行，执行器会用它替换后续加载器输入中同一 uid 的行。
     */
    protected void mutateRow(Row replacement) {
        mutatedRows.put(replacement.uid(), replacement);
    }

    @Override
    public boolean hasMutatedRows() {
        return !mutatedRows.isEmpty();
    }

    @Override
    public Map<String, Row> collectMutatedRows() {
        Map<String, Row> collected = new LinkedHashMap<>(mutatedRows);
        mutatedRows.clear();
        return collected;
    }

    /**
     * 追加一条账本条目；未配置账本时忽略。
     */
    protected void createLedgerEntry(String uid, Map<String, ?> fields) {
        if (ledger == null) {
            log.debug("加载器未配置账本，忽略条目: loader={}, uid={}", name, uid);
            return;
        }
        LedgerEntry entry = LedgerEntry.of(uid, fields);
        LedgerSchema schema = ledger.getSchema();
        if (schema != null) {
            try {
                entry = LedgerEntry.of(uid, schema.apply(entry));
            } catch (IllegalArgumentException e) {
                log.warn("账本条目不符合结构，已拒绝: job={}, loader={}, uid={}, error={}",
                    jobName, name, uid, e.getMessage());
                return;
            }
        }
        ledger.append(entry);
    }

    @Override
    public boolean hasLedger() {
        return ledger != null && !ledger.isEmpty();
    }

    @Override
    public Ledger getLedger() {
        return ledger;
    }

    @Override
    public boolean isPrimaryLedger() {
        return primaryLedger;
    }
}
