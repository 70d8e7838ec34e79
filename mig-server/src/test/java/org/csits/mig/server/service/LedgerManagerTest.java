package org.csits.mig.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.csits.mig.manager.batch.RunTimestampGenerator;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.LedgerEntry;
import org.csits.mig.manager.model.Row;
import org.csits.mig.manager.model.UnifiedLedger;
import org.csits.mig.manager.plugin.Loader;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.exception.RecoverableWriteException;
import org.csits.mig.server.plugin.ScriptedLoader;
import org.csits.mig.server.worker.core.LoaderChainExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LedgerManagerTest {

    private static final String TS = "20250101120000_001";

    @Mock
    private MigrationConfigService migrationConfigService;

    @TempDir
    Path tempDir;

    private LedgerManager ledgerManager;
    private JobConfig job;
    private Row r1;
    private Row r2;

    @BeforeEach
    void setUp() {
        when(migrationConfigService.resolveLedgerDir(any(JobConfig.class))).thenReturn(tempDir);
        ledgerManager = new LedgerManager(migrationConfigService, new LedgerFileStore(), new RunTimestampGenerator());
        job = new JobConfig();
        job.setName("posts");
        r1 = Row.of("r1", Map.of("post.title", "one"));
        r2 = Row.of("r2", Map.of("post.title", "two"));
    }

    private List<String> ledgerFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    private static Map<String, Object> fields(Object... kv) {
        LinkedHashMap<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        return map;
    }

    @Test
    void finalize_noLedgersYieldsNothing() throws IOException {
        ScriptedLoader plain = new ScriptedLoader("plain");
        ScriptedLoader emptyLedger = new ScriptedLoader("empty", null, true);
        plain.load(Batch.of(r1));

        Optional<UnifiedLedger> result = ledgerManager.finalize(job, Arrays.asList(plain, emptyLedger), TS);

        assertThat(result).isEmpty();
        assertThat(ledgerFiles()).isEmpty();
    }

    @Test
    void finalize_emptyLoaderListYieldsNothing() throws IOException {
        assertThat(ledgerManager.finalize(job, Collections.emptyList(), TS)).isEmpty();
    }

    @Test
    void finalize_singleLedgerWrittenUnderJobName() throws IOException {
        ScriptedLoader loader = new ScriptedLoader("posts_db", "post", true)
            .recording(row -> fields("post_id", 7));
        loader.load(Batch.of(r1));

        UnifiedLedger unified = ledgerManager.finalize(job, Collections.singletonList(loader), TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(unified.getName()).isEqualTo("posts");
        assertThat(unified.getPrimaryName()).isEqualTo("posts_db");
        assertThat(unified.getSecondaryNames()).isEmpty();
        assertThat(unified.getEntries()).extracting(LedgerEntry::getUid).containsExactly("r1");
        assertThat(ledgerFiles()).containsExactly("posts-ledger-" + TS + ".json");
    }

    @Test
    void finalize_leftJoinKeepsOneRowPerPrimaryEntry() throws IOException {
        ScriptedLoader primary = new ScriptedLoader("posts_db", "post", true)
            .recording(row -> fields("post_id", row.uid().equals("r1") ? 1 : 2));
        ScriptedLoader meta = new ScriptedLoader("meta", "meta", true)
            .recording(row -> fields("meta_id", 10));
        primary.load(Batch.of(r1, r2));
        meta.load(Batch.of(r1));
        job.setPrincipalEntity("post");

        UnifiedLedger unified = ledgerManager.finalize(job, Arrays.asList(meta, primary), TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(unified.getPrimaryName()).isEqualTo("posts_db");
        assertThat(unified.getSecondaryNames()).containsExactly("meta");
        assertThat(unified.getEntries()).hasSize(2);
        LedgerEntry first = unified.getEntries().get(0);
        LedgerEntry second = unified.getEntries().get(1);
        assertThat(first.getUid()).isEqualTo("r1");
        assertThat(first.get("post_id")).isEqualTo(1);
        assertThat(first.get("meta.meta_id")).isEqualTo(10);
        assertThat(second.has("meta.meta_id")).isFalse();
        assertThat(ledgerFiles()).containsExactly(
            "meta-ledger-" + TS + ".json",
            "posts-ledger-" + TS + ".json",
            "posts_db-ledger-" + TS + ".json");
    }

    @Test
    void finalize_explicitPrimaryWinsOverPrincipalEntity() throws IOException {
        ScriptedLoader byEntity = new ScriptedLoader("posts_db", "post", true)
            .recording(row -> fields("post_id", 1));
        ScriptedLoader explicit = new ScriptedLoader(ScriptedLoader.step("audit", "audit", true, true))
            .recording(row -> fields("checked", true));
        byEntity.load(Batch.of(r1));
        explicit.load(Batch.of(r1));
        job.setPrincipalEntity("post");

        UnifiedLedger unified = ledgerManager.finalize(job, Arrays.asList(byEntity, explicit), TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(unified.getPrimaryName()).isEqualTo("audit");
        assertThat(unified.getEntries().get(0).get("posts_db.post_id")).isEqualTo(1);
    }

    @Test
    void finalize_firstLedgerIsPrimaryWithoutHints() throws IOException {
        ScriptedLoader first = new ScriptedLoader("first", null, true).recording(row -> fields("a", 1));
        ScriptedLoader second = new ScriptedLoader("second", null, true).recording(row -> fields("b", 2));
        first.load(Batch.of(r1));
        second.load(Batch.of(r1));

        UnifiedLedger unified = ledgerManager.finalize(job, Arrays.asList(first, second), TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(unified.getPrimaryName()).isEqualTo("first");
    }

    @Test
    void finalize_multipleSecondaryMatchesCollapseIntoLists() throws IOException {
        ScriptedLoader primary = new ScriptedLoader("posts_db", null, true).recording(row -> fields("post_id", 1));
        ScriptedLoader terms = new ScriptedLoader("terms", null, true);
        primary.load(Batch.of(r1));
        terms.recording(row -> fields("term_id", 5)).load(Batch.of(r1));
        terms.recording(row -> fields("term_id", 6)).load(Batch.of(r1));

        UnifiedLedger unified = ledgerManager.finalize(job, Arrays.asList(primary, terms), TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(unified.getEntries()).hasSize(1);
        assertThat(unified.getEntries().get(0).get("terms.term_id")).isEqualTo(Arrays.asList(5, 6));
    }

    @Test
    void finalize_secondaryEntriesWithoutPrimaryAreDropped() throws IOException {
        ScriptedLoader primary = new ScriptedLoader("posts_db", null, true).recording(row -> fields("post_id", 1));
        ScriptedLoader meta = new ScriptedLoader("meta", null, true).recording(row -> fields("meta_id", 9));
        primary.load(Batch.of(r1));
        meta.load(Batch.of(r1, r2));

        UnifiedLedger unified = ledgerManager.finalize(job, Arrays.asList(primary, meta), TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(unified.getEntries()).extracting(LedgerEntry::getUid).containsExactly("r1");
    }

    @Test
    void finalize_primaryFailingOnSecondRowYieldsSingleJoinedEntry() throws IOException {
        ScriptedLoader l1 = new ScriptedLoader("l1");
        ScriptedLoader l2 = new ScriptedLoader(ScriptedLoader.step("l2", "post", true, true))
            .recording(row -> fields("post_id", 100))
            .failingOn("r2", new RecoverableWriteException("rejected"));
        ScriptedLoader l3 = new ScriptedLoader("l3", "meta", true)
            .recording(row -> fields("meta_id", row.uid().equals("r1") ? 31 : 32));
        List<Loader> loaders = Arrays.asList(l1, l2, l3);

        new LoaderChainExecutor("posts", false).run(loaders, Batch.of(r1, r2), null);
        UnifiedLedger unified = ledgerManager.finalize(job, loaders, TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(unified.getPrimaryName()).isEqualTo("l2");
        assertThat(unified.getEntries()).hasSize(1);
        LedgerEntry entry = unified.getEntries().get(0);
        assertThat(entry.getUid()).isEqualTo("r1");
        assertThat(entry.get("post_id")).isEqualTo(100);
        assertThat(entry.get("l3.meta_id")).isEqualTo(31);
    }

    @Test
    void finalize_entryViolatingSchemaDoesNotLoseOtherLedgers() throws IOException {
        LoadStepConfig typed = ScriptedLoader.step("posts_db", "post", true, true);
        typed.getLedger().getSchema().put("post_id", "integer");
        ScriptedLoader primary = new ScriptedLoader(typed)
            .recording(row -> fields("post_id", row.uid().equals("r1") ? "11" : "not-a-number"));
        ScriptedLoader meta = new ScriptedLoader("meta", "meta", true).recording(row -> fields("meta_id", 9));
        primary.load(Batch.of(r1, r2));
        meta.load(Batch.of(r1, r2));

        UnifiedLedger unified = ledgerManager.finalize(job, Arrays.asList(primary, meta), TS)
            .orElseThrow(IllegalStateException::new);

        assertThat(ledgerFiles()).containsExactly(
            "meta-ledger-" + TS + ".json",
            "posts-ledger-" + TS + ".json",
            "posts_db-ledger-" + TS + ".json");
        assertThat(unified.getEntries()).extracting(LedgerEntry::getUid).containsExactly("r1");
        assertThat(unified.getEntries().get(0).get("post_id")).isEqualTo(11L);
    }
}
