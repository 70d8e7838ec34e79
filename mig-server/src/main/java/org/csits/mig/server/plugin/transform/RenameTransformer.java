package org.csits.mig.server.plugin.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.plugin.Transformer;

/**
 * 按映射重命名字段，不存在的字段忽略。
 */
public class RenameTransformer implements Transformer {

    private final Map<String, String> renames;

    public RenameTransformer(Map<String, String> renames) {
        this.renames = renames;
    }

    @Override
    public Batch transform(Batch rows) {
        List<Row> result = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Row renamed = row;
            for (Map.Entry<String, String> rename : renames.entrySet()) {
                renamed = renamed.rename(rename.getKey(), rename.getValue());
            }
            result.add(renamed);
        }
        return Batch.of(result);
    }
}
