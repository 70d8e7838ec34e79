package org.csits.mig.server.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.filesystem.FileSystemManager;
import org.csits.mig.manager.model.Ledger;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.exception.MissingDependencyDataException;
import org.springframework.stereotype.Component;

/**
 * 已持久化账本的按需加载缓存，键为作业名。读取该作业账本目录下时间戳最新的文件。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerRegistry {

    private final MigrationConfigService migrationConfigService;
    private final FileSystemManager fileSystemManager;
    private final LedgerFileStore ledgerFileStore;

    private final Map<String, Ledger> cache = new HashMap<>();

    /**
     * 取作业的最新账本；作业未配置、无账本文件或读取失败时返回空并告警。
     */
    public Optional<Ledger> get(String name) {
        Ledger cached = cache.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<JobConfig> job = migrationConfigService.findJob(name);
        if (!job.isPresent()) {
            log.warn("依赖数据缺失: 作业 {} 未在配置中定义", name);
            return Optional.empty();
        }
        Path dir = migrationConfigService.resolveLedgerDir(job.get());
        try {
            List<Path> files = fileSystemManager.listFiles(dir, LedgerFileStore.globPattern(name));
            Optional<Path> latest = files.stream()
                .filter(f -> LedgerFileStore.timestampOf(name, f) != null)
                .max(Comparator.comparing(f -> Objects.requireNonNull(LedgerFileStore.timestampOf(name, f))));
            if (!latest.isPresent()) {
                log.warn("依赖数据缺失: 作业 {} 在 {} 下没有账本文件", name, dir);
                return Optional.empty();
            }
            Ledger ledger = ledgerFileStore.read(latest.get(), name);
            cache.put(name, ledger);
            log.info("已加载账本: job={}, entries={}, file={}", name, ledger.size(), latest.get());
            return Optional.of(ledger);
        } catch (IOException e) {
            log.warn("依赖数据缺失: 作业 {} 的账本读取失败, dir={}", name, dir, e);
            return Optional.empty();
        }
    }

    /**
     * 取作业账本，缺失时抛出 {@link MissingDependencyDataException}。
     */
    public Ledger require(String name) {
        return get(name).orElseThrow(() ->
            new MissingDependencyDataException(name, "缺少依赖作业 " + name + " 的账本"));
    }

    public boolean isLoaded(String name) {
        return cache.containsKey(name);
    }

    public void unload(String name) {
        if (cache.remove(name) != null) {
            log.debug("已卸载账本: job={}", name);
        }
    }

    public void unloadAll() {
        cache.clear();
    }
}
