package org.csits.mig.server.plugin.ledger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Ledger;
import org.csits.mig.manager.model.LedgerEntry;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.plugin.Transformer;
import org.csits.mig.server.exception.MissingDependencyDataException;
import org.csits.mig.server.service.LedgerRegistry;

/**
 * 按键把依赖作业账本中的字段并入行：row[key] 等于条目 ledgerKey 时，条目字段写为 {prefix}.{field}。
 * 同一键对应多条条目时取第一条。
 */
@Slf4j
public class LedgerLookupTransformer implements Transformer {

    private final LedgerRegistry ledgerRegistry;

    private final String job;

    private final String key;

    private final String ledgerKey;

    private final List<String> fields;

    private final String prefix;

    private final boolean required;

    public LedgerLookupTransformer(LedgerRegistry ledgerRegistry, String job, String key, String ledgerKey,
                                   List<String> fields, String prefix, boolean required) {
        this.ledgerRegistry = ledgerRegistry;
        this.job = job;
        this.key = key;
        this.ledgerKey = ledgerKey;
        this.fields = fields;
        this.prefix = prefix;
        this.required = required;
    }

    @Override
    public Batch transform(Batch rows) {
        Optional<Ledger> ledger = ledgerRegistry.get(job);
        if (!ledger.isPresent()) {
            if (required) {
                throw new MissingDependencyDataException(job, "账本关联失败，缺少依赖作业 " + job + " 的账本");
            }
            log.warn("依赖作业账本缺失，跳过账本关联: dependency={}", job);
            return rows;
        }
        Map<String, LedgerEntry> index = new HashMap<>();
        for (LedgerEntry entry : ledger.get().getEntries()) {
            Object value = entry.get(ledgerKey);
            if (value != null) {
                index.putIfAbsent(value.toString(), entry);
            }
        }
        List<Row> result = new ArrayList<>(rows.size());
        int matched = 0;
        for (Row row : rows) {
            Object value = row.valueOf(key);
            LedgerEntry entry = value == null ? null : index.get(value.toString());
            if (entry == null) {
                result.add(row);
                continue;
            }
            matched++;
            result.add(row.withAll(selectFields(entry)));
        }
        log.info("账本关联完成: dependency={}, rows={}, matched={}", job, rows.size(), matched);
        return Batch.of(result);
    }

    private Map<String, Object> selectFields(LedgerEntry entry) {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterable<String> names = fields.isEmpty() ? entry.fieldNames() : fields;
        for (String field : names) {
            if (entry.has(field)) {
                values.put(prefix + "." + field, entry.get(field));
            }
        }
        return values;
    }
}
