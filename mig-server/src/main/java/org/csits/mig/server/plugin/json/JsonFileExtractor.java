package org.csits.mig.server.plugin.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.plugin.Extractor;

/**
 * 从 JSON 数组文件读取行，可选地给字段名加前缀（prefix.field）。
 */
@Slf4j
public class JsonFileExtractor implements Extractor {

    private static final TypeReference<List<LinkedHashMap<String, Object>>> RECORDS =
        new TypeReference<List<LinkedHashMap<String, Object>>>() {
        };

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Path file;

    private final String prefix;

    public JsonFileExtractor(Path file, String prefix) {
        this.file = file;
        this.prefix = prefix;
    }

    @Override
    public Batch extract() throws IOException {
        if (Files.notExists(file)) {
            throw new IOException("抽取文件不存在: " + file);
        }
        List<LinkedHashMap<String, Object>> records = objectMapper.readValue(file.toFile(), RECORDS);
        List<Row> rows = new ArrayList<>(records == null ? 0 : records.size());
        if (records != null) {
            for (Map<String, Object> record : records) {
                rows.add(Row.of(withPrefix(record)));
            }
        }
        log.info("JSON 抽取完成: file={}, rows={}", file, rows.size());
        return Batch.of(rows);
    }

    private Map<String, Object> withPrefix(Map<String, Object> record) {
        if (prefix == null || prefix.isEmpty()) {
            return record;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        record.forEach((k, v) -> result.put(Row.UID.equals(k) ? k : prefix + "." + k, v));
        return result;
    }
}
