package org.csits.mig.server.plugin.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.csits.mig.manager.filesystem.FileSystemManager;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.plugin.AbstractFileLoader;

/**
 * 把行写成带表头的 CSV。列为各记录字段的并集，按首次出现的顺序排列，缺失的字段写为空。
 * 列表与嵌套对象以 JSON 文本写入单元格。
 */
public class CsvFileLoader extends AbstractFileLoader {

    private final CsvMapper csvMapper = new CsvMapper();

    private final ObjectMapper jsonMapper = new ObjectMapper();

    private final char separator;

    public CsvFileLoader(LoadStepConfig step, String jobName, FileSystemManager fileSystemManager, Path target,
                         List<String> prefixes, char separator) {
        super(step, jobName, fileSystemManager, target, prefixes);
        this.separator = separator;
    }

    @Override
    protected void write(Path target, List<Map<String, Object>> records) throws IOException {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            columns.addAll(record.keySet());
        }
        CsvSchema.Builder builder = CsvSchema.builder().setUseHeader(true).setColumnSeparator(separator);
        for (String column : columns) {
            builder.addColumn(column);
        }
        List<Map<String, String>> cells = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            Map<String, String> line = new LinkedHashMap<>();
            for (String column : columns) {
                line.put(column, cell(record.get(column)));
            }
            cells.add(line);
        }
        csvMapper.writer(builder.build()).writeValue(target.toFile(), cells);
    }

    private String cell(Object value) throws JsonProcessingException {
        if (value == null) {
            return null;
        }
        if (value instanceof Collection || value instanceof Map) {
            return jsonMapper.writeValueAsString(value);
        }
        return value.toString();
    }
}
