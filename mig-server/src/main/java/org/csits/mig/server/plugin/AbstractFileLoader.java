package org.csits.mig.server.plugin;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.filesystem.FileSystemManager;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.LedgerEntry;
import org.csits.mig.manager.model.Row;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.LoadStepConfig;

/**
 * 文件加载器基类：各批次先缓存，关闭时一次写出。
 * 配置 prefix 时只保留这些前缀的字段并去掉前缀。
 * 配置账本时每行记录写出文件与位置，条目只在文件写出成功后进入账本。
 */
@Slf4j
public abstract class AbstractFileLoader extends AbstractLoader {

    private final FileSystemManager fileSystemManager;

    private final Path target;

    private final List<String> prefixes;

    private final List<Map<String, Object>> buffer = new ArrayList<>();

    private final List<LedgerEntry> pendingEntries = new ArrayList<>();

    protected AbstractFileLoader(LoadStepConfig step, String jobName, FileSystemManager fileSystemManager,
                                 Path target, List<String> prefixes) {
        super(step, jobName);
        this.fileSystemManager = fileSystemManager;
        this.target = target;
        this.prefixes = prefixes;
    }

    /**
     * 目标文件：{path}/{file}-{runId}.{extension}；overwrite 为 true 时为 {path}/{file}.{extension}。
     * path 默认 settings.output_path，file 默认加载器名，file 自带的扩展名会被去掉。
     */
    public static Path resolveTarget(LoadStepConfig step, JobRunContext context, String extension) {
        String dir = step.getString("path");
        if (dir == null || dir.isEmpty()) {
            dir = context.getSettings() == null ? "output" : context.getSettings().getOutputPath();
        }
        String suffix = "." + extension;
        String file = step.getString("file");
        if (file == null || file.isEmpty()) {
            file = step.getName();
        } else if (file.endsWith(suffix)) {
            file = file.substring(0, file.length() - suffix.length());
        }
        if (step.getBoolean("overwrite", false)) {
            return Paths.get(dir).resolve(file + suffix);
        }
        return Paths.get(dir).resolve(file + "-" + context.getRunId() + suffix);
    }

    public Path getTarget() {
        return target;
    }

    @Override
    public void load(Batch batch) {
        for (Row row : batch) {
            buffer.add(select(row));
            if (getLedger() != null) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("file", target.getFileName().toString());
                entry.put("position", buffer.size() - 1);
                pendingEntries.add(LedgerEntry.of(row.uid(), entry));
            }
        }
        log.debug("文件加载缓存: loader={}, rows={}, buffered={}", getName(), batch.size(), buffer.size());
    }

    @Override
    public void close() throws IOException {
        try {
            Path dir = target.toAbsolutePath().getParent();
            if (dir != null) {
                fileSystemManager.ensureDirectory(dir);
            }
            write(target, buffer);
            for (LedgerEntry entry : pendingEntries) {
                createLedgerEntry(entry.getUid(), entry.toMap());
            }
            log.info("文件加载完成: loader={}, rows={}, file={}", getName(), buffer.size(), target);
        } finally {
            buffer.clear();
            pendingEntries.clear();
        }
    }

    /**
     * 把缓存的全部记录写入目标文件。
     */
    protected abstract void write(Path target, List<Map<String, Object>> records) throws IOException;

    private Map<String, Object> select(Row row) {
        if (prefixes.isEmpty()) {
            return new LinkedHashMap<>(row.toMap());
        }
        Map<String, Object> record = new LinkedHashMap<>();
        row.toMap().forEach((name, value) -> {
            for (String prefix : prefixes) {
                String normalized = prefix.endsWith(".") ? prefix : prefix + ".";
                if (name.startsWith(normalized)) {
                    record.put(name.substring(normalized.length()), value);
                    return;
                }
            }
        });
        return record;
    }
}
