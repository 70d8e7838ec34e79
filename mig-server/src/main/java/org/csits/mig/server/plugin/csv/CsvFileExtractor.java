package org.csits.mig.server.plugin.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
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
 * 从带表头的 CSV 文件读取行，列名取自表头，值均为字符串。可选地给字段名加前缀（prefix.field）。
 */
@Slf4j
public class CsvFileExtractor implements Extractor {

    private final CsvMapper csvMapper = new CsvMapper();

    private final Path file;

    private final String prefix;

    private final char separator;

    public CsvFileExtractor(Path file, String prefix, char separator) {
        this.file = file;
        this.prefix = prefix;
        this.separator = separator;
    }

    @Override
    public Batch extract() throws IOException {
        if (Files.notExists(file)) {
            throw new IOException("抽取文件不存在: " + file);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
        List<Row> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> records = csvMapper.readerFor(Map.class)
            .with(schema)
            .readValues(file.toFile())) {
            while (records.hasNext()) {
                rows.add(Row.of(withPrefix(records.next())));
            }
        }
        log.info("CSV 抽取完成: file={}, rows={}", file, rows.size());
        return Batch.of(rows);
    }

    private Map<String, Object> withPrefix(Map<String, String> record) {
        Map<String, Object> result = new LinkedHashMap<>();
        boolean prefixed = prefix != null && !prefix.isEmpty();
        record.forEach((k, v) -> result.put(!prefixed || Row.UID.equals(k) ? k : prefix + "." + k, v));
        return result;
    }
}
