package org.csits.mig.server.dto;

import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.UnifiedLedger;

/**
 * 在阶段之间传递的表状态，不可变。
 */
public final class PipelineState {

    private final Batch rows;

    private final UnifiedLedger ledger;

    private PipelineState(Batch rows, UnifiedLedger ledger) {
        this.rows = rows;
        this.ledger = ledger;
    }

    public static PipelineState initial() {
        return new PipelineState(Batch.empty(), null);
    }

    public Batch getRows() {
        return rows;
    }

    /**
     * 加载阶段写出的统一账本，未产生账本时为 null。
     */
    public UnifiedLedger getLedger() {
        return ledger;
    }

    public PipelineState withRows(Batch newRows) {
        return new PipelineState(newRows == null ? Batch.empty() : newRows, ledger);
    }

    public PipelineState withLedger(UnifiedLedger newLedger) {
        return new PipelineState(rows, newLedger);
    }
}
