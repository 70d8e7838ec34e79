package org.csits.mig.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.csits.mig.dao.InMemoryJobRunRepository;
import org.csits.mig.dao.JobRunEntity;
import org.csits.mig.dao.JobRunRepository;
import org.csits.mig.dao.JobRunStatus;
import org.csits.mig.manager.batch.RunTimestampGenerator;
import org.csits.mig.manager.filesystem.LocalFileSystemManager;
import org.csits.mig.manager.model.Ledger;
import org.csits.mig.server.constants.PhaseType;
import org.csits.mig.server.dto.RunOptions;
import org.csits.mig.server.dto.RunSummary;
import org.csits.mig.server.exception.JobGraphValidationException;
import org.csits.mig.server.plugin.csv.CsvFileExtractorFactory;
import org.csits.mig.server.plugin.csv.CsvFileLoaderFactory;
import org.csits.mig.server.plugin.json.JsonFileExtractorFactory;
import org.csits.mig.server.plugin.json.JsonFileLoaderFactory;
import org.csits.mig.server.plugin.ledger.LedgerExtractorFactory;
import org.csits.mig.server.plugin.ledger.LedgerLoaderFactory;
import org.csits.mig.server.plugin.ledger.LedgerLookupTransformerFactory;
import org.csits.mig.server.plugin.transform.RenameTransformerFactory;
import org.csits.mig.server.plugin.transform.SelectPrefixTransformerFactory;
import org.csits.mig.server.worker.core.ExtractorRegistry;
import org.csits.mig.server.worker.core.LoaderRegistry;
import org.csits.mig.server.worker.core.PhaseProcessorFactory;
import org.csits.mig.server.worker.core.TransformerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class MigrationPipelineTest {

    @TempDir
    Path tempDir;

    private MigrationConfigService configService;
    private JobRunRepository repository;
    private LedgerRegistry ledgerRegistry;
    private LedgerFileStore fileStore;
    private MigrationPipeline pipeline;

    @BeforeEach
    void setUp() throws IOException {
        LocalFileSystemManager fileSystemManager = new LocalFileSystemManager();
        ExtractorRegistry extractors = new ExtractorRegistry(Arrays.asList(
            new JsonFileExtractorFactory(), new CsvFileExtractorFactory(), new LedgerExtractorFactory()));
        TransformerRegistry transformers = new TransformerRegistry(Arrays.asList(
            new SelectPrefixTransformerFactory(), new RenameTransformerFactory(), new LedgerLookupTransformerFactory()));
        LoaderRegistry loaders = new LoaderRegistry(Arrays.asList(
            new JsonFileLoaderFactory(fileSystemManager), new CsvFileLoaderFactory(fileSystemManager),
            new LedgerLoaderFactory()));
        configService = new MigrationConfigService(new YamlConfigLoader(), new DefaultResourceLoader(),
            extractors, transformers, loaders);
        RunTimestampGenerator timestamps = new RunTimestampGenerator();
        fileStore = new LedgerFileStore();
        repository = new InMemoryJobRunRepository();
        ledgerRegistry = new LedgerRegistry(configService, fileSystemManager, fileStore);
        LedgerManager ledgerManager = new LedgerManager(configService, fileStore, timestamps);
        pipeline = new MigrationPipeline(configService, new JobGraphValidator(), new JobStateMachine(repository),
            repository, ledgerRegistry, new PhaseProcessorFactory(extractors, transformers, loaders, ledgerManager),
            timestamps);

        write("terms.json", "[{\"id\":1,\"slug\":\"news\"},{\"id\":2,\"slug\":\"blog\"}]");
        write("posts.json", "[{\"title\":\"A\",\"category\":\"news\"},"
            + "{\"title\":\"B\",\"category\":\"blog\"},{\"title\":\"C\",\"category\":\"none\"}]");
    }

    private void write(String name, String content) throws IOException {
        Files.write(tempDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    private String path(String name) {
        return "'" + tempDir.resolve(name) + "'";
    }

    private String termsJob() {
        return "  - name: terms\n"
            + "    ledger: {path: terms}\n"
            + "    extract:\n"
            + "      - {type: json, path: " + path("terms.json") + ", prefix: source}\n"
            + "    transform:\n"
            + "      - type: rename\n"
            + "        fields: {source.id: ledger.term_id, source.slug: ledger.slug}\n"
            + "    load:\n"
            + "      - name: terms_ledger\n"
            + "        type: ledger\n"
            + "        ledger:\n"
            + "          schema: {term_id: integer, slug: string}\n";
    }

    private String postsJob(String dependsOn) {
        return "  - name: posts\n"
            + "    depends_on: [" + dependsOn + "]\n"
            + "    extract:\n"
            + "      - {type: json, path: " + path("posts.json") + ", prefix: post}\n"
            + "    transform:\n"
            + "      - {type: ledger_lookup, job: terms, key: post.category, ledger_key: slug,"
            + " fields: [term_id], prefix: post}\n"
            + "    load:\n"
            + "      - name: posts_json\n"
            + "        type: json\n"
            + "        path: " + path("out") + "\n"
            + "        prefix: post\n"
            + "        ledger: {primary: true}\n";
    }

    private void configure(String jobs) {
        configService.loadFromString("ledger:\n  path: " + path("ledgers") + "\n"
            + "settings:\n  batch_size: 2\n  reclaim_memory: false\n"
            + "migration:\n" + jobs);
    }

    private List<Map<String, Object>> readOutput() throws IOException {
        List<Path> files;
        try (Stream<Path> stream = Files.list(tempDir.resolve("out"))) {
            files = stream.collect(Collectors.toList());
        }
        assertThat(files).hasSize(1);
        assertThat(files.get(0).getFileName().toString()).startsWith("posts_json-").endsWith(".json");
        return new ObjectMapper().readValue(files.get(0).toFile(), new TypeReference<List<Map<String, Object>>>() {
        });
    }

    @Test
    void run_dependentJobReadsLedgerOfEarlierJob() throws IOException {
        configure(termsJob() + postsJob("terms"));

        RunSummary summary = pipeline.run(new RunOptions());

        assertThat(summary.getSucceeded()).isEqualTo(2);
        assertThat(summary.getFailed()).isZero();
        List<Map<String, Object>> posts = readOutput();
        assertThat(posts).hasSize(3);
        assertThat(posts.get(0)).containsEntry("title", "A").containsEntry("term_id", 1);
        assertThat(posts.get(1)).containsEntry("term_id", 2);
        assertThat(posts.get(2)).doesNotContainKey("term_id");

        Ledger postsLedger = ledgerRegistry.get("posts").orElseThrow(IllegalStateException::new);
        assertThat(postsLedger.size()).isEqualTo(3);
        assertThat(postsLedger.getEntries().get(2).get("position")).isEqualTo(2);
        assertThat(repository.findAll()).extracting(JobRunEntity::getStatus)
            .containsOnly(JobRunStatus.DONE);
        assertThat(ledgerRegistry.isLoaded("terms")).isFalse();
    }

    @Test
    void run_csvJobRewritesFixedFileWhenOverwriting() throws IOException {
        write("users.csv", "id,login\n1,alice\n2,bob\n");
        String users = "  - name: users\n"
            + "    extract:\n"
            + "      - {type: csv, path: " + path("users.csv") + ", prefix: user}\n"
            + "    transform:\n"
            + "      - type: rename\n"
            + "        fields: {user.id: ledger.user_id}\n"
            + "    load:\n"
            + "      - {name: users_csv, type: csv, path: " + path("out") + ", file: users.csv,"
            + " overwrite: true, prefix: user}\n"
            + "      - name: users_ledger\n"
            + "        type: ledger\n"
            + "        ledger:\n"
            + "          schema: {user_id: integer}\n";
        configure(users);

        pipeline.run(new RunOptions());
        RunSummary summary = pipeline.run(new RunOptions());

        assertThat(summary.getSucceeded()).isEqualTo(1);
        try (Stream<Path> stream = Files.list(tempDir.resolve("out"))) {
            assertThat(stream.map(p -> p.getFileName().toString())).containsExactly("users.csv");
        }
        assertThat(Files.readAllLines(tempDir.resolve("out").resolve("users.csv"), StandardCharsets.UTF_8))
            .containsExactly("login", "alice", "bob");
        Ledger ledger = ledgerRegistry.get("users").orElseThrow(IllegalStateException::new);
        assertThat(ledger.getEntries().get(1).get("user_id")).isEqualTo(2);
    }

    @Test
    void run_invalidGraphStartsNothing() {
        configure(postsJob("terms") + termsJob());

        assertThatThrownBy(() -> pipeline.run(new RunOptions()))
            .isInstanceOf(JobGraphValidationException.class)
            .hasMessageContaining("posts");
        assertThat(repository.count()).isZero();
        assertThat(Files.exists(tempDir.resolve("out"))).isFalse();
    }

    @Test
    void run_failedJobDoesNotStopIndependentJobs() throws IOException {
        String broken = "  - name: broken\n"
            + "    extract:\n"
            + "      - {type: json, path: " + path("missing.json") + "}\n"
            + "    load:\n"
            + "      - {name: broken_ledger, type: ledger}\n";
        configure(broken + termsJob());

        RunSummary summary = pipeline.run(new RunOptions());

        assertThat(summary.getFailed()).isEqualTo(1);
        assertThat(summary.getFailedJobs()).containsExactly("broken");
        assertThat(summary.getSucceeded()).isEqualTo(1);
        assertThat(repository.findByJobName("broken").get(0).getStatus()).isEqualTo(JobRunStatus.FAILED);
        assertThat(repository.findByJobName("broken").get(0).getErrorMessage()).contains("missing.json");
        assertThat(ledgerRegistry.get("terms")).isPresent();
    }

    @Test
    void run_dryRunExecutesNothing() {
        configure(termsJob() + postsJob("terms"));
        RunOptions options = new RunOptions();
        options.setDryRun(true);
        options.getSkip().add("posts");

        RunSummary summary = pipeline.run(options);

        assertThat(summary.getProcessed()).isZero();
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(repository.count()).isZero();
        assertThat(Files.exists(tempDir.resolve("ledgers"))).isFalse();
    }

    @Test
    void run_jobsOptionSelectsSubset() {
        configure(termsJob() + postsJob("terms"));
        RunOptions options = new RunOptions();
        options.getJobs().add("terms");

        RunSummary summary = pipeline.run(options);

        assertThat(summary.getSucceeded()).isEqualTo(1);
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(repository.findByJobName("posts")).isEmpty();
        assertThat(Files.exists(tempDir.resolve("out"))).isFalse();
    }

    @Test
    void run_phaseOptionStopsAfterThatPhase() {
        configure(termsJob());
        RunOptions options = new RunOptions();
        options.setPhase(PhaseType.TRANSFORM);

        RunSummary summary = pipeline.run(options);

        assertThat(summary.getSucceeded()).isEqualTo(1);
        assertThat(repository.findByJobName("terms").get(0).getStatus()).isEqualTo(JobRunStatus.TRANSFORM_RUNNING);
        assertThat(Files.exists(tempDir.resolve("ledgers"))).isFalse();
    }
}
