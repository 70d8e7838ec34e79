package org.csits.mig.server.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.mig.manager.batch.RunTimestampGenerator;
import org.csits.mig.manager.model.Ledger;
import org.csits.mig.manager.model.LedgerEntry;
import org.csits.mig.manager.model.UnifiedLedger;
import org.csits.mig.manager.plugin.LedgerProducer;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.dto.JobConfig;
import org.springframework.stereotype.Service;

/**
 * 作业结束时收集各加载器账本，持久化并合并为统一账本。
 *
 * <p>只有一个账本时直接以作业名写出。多个账本时先各自写出，再以主账本为锚点按 uid 左连接其余账本，
 * 次账本字段以 {加载器名}.{字段} 命名；同一 uid 匹配多条次账本条目时，各字段合并为列表。
 * 主账本中没有对应 uid 的次账本条目不会进入统一账本，只在日志中计数。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerManager {

    private final MigrationConfigService migrationConfigService;
    private final LedgerFileStore ledgerFileStore;
    private final RunTimestampGenerator runTimestampGenerator;

    public Optional<UnifiedLedger> finalize(JobConfig job, List<Loader> loaders) throws IOException {
        return finalize(job, loaders, runTimestampGenerator.next());
    }

    public Optional<UnifiedLedger> finalize(JobConfig job, List<Loader> loaders, String timestamp)
        throws IOException {
        List<Loader> producers = new ArrayList<>();
        for (Loader loader : loaders) {
            if (loader instanceof LedgerProducer) {
                LedgerProducer producer = (LedgerProducer) loader;
                if (producer.hasLedger() && producer.getLedger() != null && !producer.getLedger().isEmpty()) {
                    producers.add(loader);
                }
            }
        }
        if (producers.isEmpty()) {
            log.info("作业未产生账本: job={}", job.getName());
            return Optional.empty();
        }
        Path dir = migrationConfigService.resolveLedgerDir(job);

        if (producers.size() == 1) {
            Ledger only = ledgerOf(producers.get(0));
            UnifiedLedger unified = new UnifiedLedger(job.getName(), only.getName(),
                Collections.emptyList(), only.getEntries());
            unified.setSchema(only.getSchema());
            ledgerFileStore.write(dir, LedgerFileStore.fileName(job.getName(), timestamp), unified);
            return Optional.of(unified);
        }

        for (Loader producer : producers) {
            Ledger ledger = ledgerOf(producer);
            ledgerFileStore.write(dir, LedgerFileStore.fileName(ledger.getName(), timestamp), ledger);
        }
        Loader primary = choosePrimary(job, producers);
        List<Ledger> secondaries = new ArrayList<>();
        for (Loader producer : producers) {
            if (producer != primary) {
                secondaries.add(ledgerOf(producer));
            }
        }
        UnifiedLedger unified = join(job.getName(), ledgerOf(primary), secondaries);
        ledgerFileStore.write(dir, LedgerFileStore.fileName(job.getName(), timestamp), unified);
        log.info("统一账本已生成: job={}, primary={}, secondaries={}, entries={}",
            job.getName(), unified.getPrimaryName(), unified.getSecondaryNames(), unified.size());
        return Optional.of(unified);
    }

    /**
     * 主账本：显式 primary，其次目标类型等于作业 principal_entity，最后取声明顺序第一个。
     */
    Loader choosePrimary(JobConfig job, List<Loader> producers) {
        for (Loader loader : producers) {
            if (((LedgerProducer) loader).isPrimaryLedger()) {
                return loader;
            }
        }
        String principal = job.getPrincipalEntity();
        if (principal != null) {
            for (Loader loader : producers) {
                if (principal.equals(loader.getDestinationType())) {
                    return loader;
                }
            }
        }
        return producers.get(0);
    }

    UnifiedLedger join(String jobName, Ledger primary, List<Ledger> secondaries) {
        Set<String> primaryUids = new HashSet<>();
        for (LedgerEntry entry : primary.getEntries()) {
            primaryUids.add(entry.getUid());
        }
        List<Map<String, List<LedgerEntry>>> indexes = new ArrayList<>(secondaries.size());
        for (Ledger secondary : secondaries) {
            Map<String, List<LedgerEntry>> index = new LinkedHashMap<>();
            int unmatched = 0;
            for (LedgerEntry entry : secondary.getEntries()) {
                index.computeIfAbsent(entry.getUid(), k -> new ArrayList<>()).add(entry);
                if (!primaryUids.contains(entry.getUid())) {
                    unmatched++;
                }
            }
            if (unmatched > 0) {
                log.warn("次账本条目在主账本中无对应 uid，未进入统一账本: job={}, ledger={}, primary={}, count={}",
                    jobName, secondary.getName(), primary.getName(), unmatched);
            }
            indexes.add(index);
        }

        List<LedgerEntry> joined = new ArrayList<>(primary.size());
        for (LedgerEntry entry : primary.getEntries()) {
            Map<String, Object> fields = new LinkedHashMap<>(entry.toMap());
            for (int i = 0; i < secondaries.size(); i++) {
                List<LedgerEntry> matches = indexes.get(i).get(entry.getUid());
                if (matches != null) {
                    merge(fields, secondaries.get(i).getName(), matches);
                }
            }
            joined.add(LedgerEntry.of(entry.getUid(), fields));
        }
        List<String> secondaryNames = new ArrayList<>();
        for (Ledger secondary : secondaries) {
            secondaryNames.add(secondary.getName());
        }
        UnifiedLedger unified = new UnifiedLedger(jobName, primary.getName(), secondaryNames, joined);
        unified.setSchema(primary.getSchema());
        return unified;
    }

    private void merge(Map<String, Object> fields, String ledgerName, List<LedgerEntry> matches) {
        if (matches.size() == 1) {
            LedgerEntry match = matches.get(0);
            for (String field : match.fieldNames()) {
                if (!LedgerEntry.UID.equals(field)) {
                    fields.put(ledgerName + "." + field, match.get(field));
                }
            }
            return;
        }
        Set<String> names = new LinkedHashSet<>();
        for (LedgerEntry match : matches) {
            names.addAll(match.fieldNames());
        }
        names.remove(LedgerEntry.UID);
        for (String field : names) {
            List<Object> values = new ArrayList<>(matches.size());
            for (LedgerEntry match : matches) {
                values.add(match.get(field));
            }
            fields.put(ledgerName + "." + field, values);
        }
    }

    private Ledger ledgerOf(Loader loader) {
        return ((LedgerProducer) loader).getLedger();
    }
}
