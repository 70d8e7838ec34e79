package org.csits.mig.server.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.LoadStepConfig;
import org.csits.mig.server.dto.MigrationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class YamlConfigLoaderTest {

    private YamlConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new YamlConfigLoader();
    }

    @Test
    void loadMigrationConfig_parsesJobsInOrder() throws IOException {
        MigrationConfig config = loader.loadMigrationConfig(new ClassPathResource("conf/test_migration.yaml"));

        assertThat(config.getLedger().getPath()).isEqualTo("build/ledgers");
        assertThat(config.getSettings().getBatchSize()).isEqualTo(2);
        assertThat(config.getSettings().getReclaimMemory()).isFalse();
        assertThat(config.getMigration()).extracting(JobConfig::getName).containsExactly("terms", "posts");

        JobConfig terms = config.getMigration().get(0);
        assertThat(terms.getPrincipalEntity()).isEqualTo("term");
        assertThat(terms.getLedger().getPath()).isEqualTo("terms");
        assertThat(terms.getDependsOn()).isEmpty();
        assertThat(terms.getExtract().get(0).getType()).isEqualTo("json");
        assertThat(terms.getExtract().get(0).getString("path")).isEqualTo("data/terms.json");

        LoadStepConfig ledgerStep = terms.getLoad().get(0);
        assertThat(ledgerStep.getDestinationType()).isEqualTo("term");
        assertThat(ledgerStep.getLedger().isPrimary()).isTrue();
        assertThat(ledgerStep.getLedger().getSchema()).containsEntry("term_id", "integer");
    }

    @Test
    void loadMigrationConfig_keepsAdapterOptions() throws IOException {
        MigrationConfig config = loader.loadMigrationConfig(new ClassPathResource("conf/test_migration.yaml"));

        JobConfig posts = config.getMigration().get(1);
        assertThat(posts.getDependsOn()).containsExactly("terms");
        assertThat(posts.getBatchSize()).isEqualTo(10);
        assertThat(posts.getExtract().get(0).getBoolean("required", true)).isFalse();
        assertThat(posts.getTransform().get(0).getStringList("prefix")).containsExactly("source.");
        assertThat(posts.getTransform().get(1).getStringMap("fields")).containsEntry("title", "post_title");
        assertThat(posts.getLoad().get(0).getLedger()).isNull();
    }

    @Test
    void loadMigrationConfigFromString_fillsDefaults() throws IOException {
        MigrationConfig config = loader.loadMigrationConfigFromString("migration:\n  - name: a\n");

        assertThat(config.getLedger().getPath()).isEqualTo("ledgers");
        assertThat(config.getSettings().getBatchSize()).isEqualTo(500);
        assertThat(config.getSettings().getReclaimMemory()).isTrue();
        assertThat(config.getMigration().get(0).getLoad()).isEmpty();
    }
}
