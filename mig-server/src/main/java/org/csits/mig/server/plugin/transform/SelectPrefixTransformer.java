package org.csits.mig.server.plugin.transform;

import java.util.ArrayList;
import java.util.List;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.plugin.Transformer;

/**
 * 只保留以给定前缀开头的字段，可选去掉前缀。唯一标识字段始终保留。
 */
public class SelectPrefixTransformer implements Transformer {

    private final List<String> prefixes;

    private final boolean removePrefix;

    public SelectPrefixTransformer(List<String> prefixes, boolean removePrefix) {
        this.prefixes = prefixes;
        this.removePrefix = removePrefix;
    }

    @Override
    public Batch transform(Batch rows) {
        List<Row> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            result.add(select(row));
        }
        return Batch.of(result);
    }

    private Row select(Row row) {
        List<String> dropped = new ArrayList<>();
        for (String name : row.toMap().keySet()) {
            if (!Row.UID.equals(name) && matching(name) == null) {
                dropped.add(name);
            }
        }
        Row selected = row.without(dropped.toArray(new String[0]));
        if (!removePrefix) {
            return selected;
        }
        for (String name : new ArrayList<>(selected.toMap().keySet())) {
            String prefix = matching(name);
            if (prefix == null || Row.UID.equals(name)) {
                continue;
            }
            String stripped = name.substring(prefix.length());
            if (stripped.startsWith(".")) {
                stripped = stripped.substring(1);
            }
            if (!stripped.isEmpty()) {
                selected = selected.rename(name, stripped);
            }
        }
        return selected;
    }

    private String matching(String name) {
        for (String prefix : prefixes) {
            if (name.startsWith(prefix)) {
                return prefix;
            }
        }
        return null;
    }
}
