package org.csits.mig.server.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.model.Ledger;
import org.csits.mig.manager.model.LedgerEntry;
import org.csits.mig.manager.model.LedgerSchema;
import org.springframework.stereotype.Component;

/**
 * 账本文件读写：JSON 数组，每个元素为一条扁平条目。文件名 {name}-ledger-{时间戳}.json。
 */
@Slf4j
@Component
public class LedgerFileStore {

    static final String LEDGER_INFIX = "-ledger-";

    static final String SUFFIX = ".json";

    private static final TypeReference<List<LinkedHashMap<String, Object>>> RECORDS =
        new TypeReference<List<LinkedHashMap<String, Object>>>() {
        };

    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static String fileName(String name, String timestamp) {
        return name + LEDGER_INFIX + timestamp + SUFFIX;
    }

    public static String globPattern(String name) {
        return name + LEDGER_INFIX + "*" + SUFFIX;
    }

    /**
     * 从文件名中取出时间戳部分，不符合命名规则时返回 null。
     */
    public static String timestampOf(String name, Path file) {
        String fileName = file.getFileName().toString();
        String prefix = name + LEDGER_INFIX;
        if (!fileName.startsWith(prefix) || !fileName.endsWith(SUFFIX)) {
            return null;
        }
        return fileName.substring(prefix.length(), fileName.length() - SUFFIX.length());
    }

    /**
     * 写出账本，声明了结构时按结构排序并转换字段。
     */
    public Path write(Path dir, String fileName, Ledger ledger) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(fileName);
        LedgerSchema schema = ledger.getSchema();
        List<Map<String, Object>> records = new ArrayList<>(ledger.size());
        for (LedgerEntry entry : ledger.getEntries()) {
            records.add(schema == null ? entry.toMap() : schema.apply(entry));
        }
        jsonMapper.writeValue(file.toFile(), records);
        log.info("账本已写出: ledger={}, entries={}, file={}", ledger.getName(), records.size(), file);
        return file;
    }

    public Ledger read(Path file, String name) throws IOException {
        List<LinkedHashMap<String, Object>> records = jsonMapper.readValue(file.toFile(), RECORDS);
        Ledger ledger = new Ledger(name);
        if (records == null) {
            return ledger;
        }
        for (Map<String, Object> record : records) {
            try {
                ledger.append(LedgerEntry.fromMap(record));
            } catch (IllegalArgumentException e) {
                throw new IOException("账本文件格式错误: " + file + ", " + e.getMessage(), e);
            }
        }
        log.debug("账本已读取: ledger={}, entries={}, file={}", name, ledger.size(), file);
        return ledger;
    }
}
