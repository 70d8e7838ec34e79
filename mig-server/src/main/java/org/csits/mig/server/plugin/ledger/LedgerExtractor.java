package org.csits.mig.server.plugin.ledger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Ledger;
import org.csits.mig.manager.model.LedgerEntry;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.plugin.Extractor;
import org.csits.mig.server.exception.MissingDependencyDataException;
import org.csits.mig.server.service.LedgerRegistry;

/**
 * 把依赖作业的账本读成行，条目字段以 {prefix}.{field} 命名，每行分配新的唯一标识。
 */
@Slf4j
public class LedgerExtractor implements Extractor {

    private final LedgerRegistry ledgerRegistry;

    private final String job;

    private final String prefix;

    private final boolean required;

    public LedgerExtractor(LedgerRegistry ledgerRegistry, String job, String prefix, boolean required) {
        this.ledgerRegistry = ledgerRegistry;
        this.job = job;
        this.prefix = prefix;
        this.required = required;
    }

    @Override
    public Batch extract() {
        Optional<Ledger> ledger = ledgerRegistry.get(job);
        if (!ledger.isPresent()) {
            if (required) {
                throw new MissingDependencyDataException(job, "账本抽取失败，缺少依赖作业 " + job + " 的账本");
            }
            log.warn("依赖作业账本缺失，抽取结果为空: dependency={}", job);
            return Batch.empty();
        }
        List<Row> rows = new ArrayList<>(ledger.get().size());
        for (LedgerEntry entry : ledger.get().getEntries()) {
            Map<String, Object> values = new LinkedHashMap<>();
            entry.toMap().forEach((field, value) -> values.put(prefix + "." + field, value));
            rows.add(Row.of(values));
        }
        log.info("账本抽取完成: dependency={}, rows={}", job, rows.size());
        return Batch.of(rows);
    }
}
