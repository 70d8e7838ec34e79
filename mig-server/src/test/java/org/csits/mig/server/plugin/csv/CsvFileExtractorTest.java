package org.csits.mig.server.plugin.csv;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Row;
import org.csits.mig.server.dto.JobConfig;
import org.csits.mig.server.dto.JobRunContext;
import org.csits.mig.server.dto.StepConfig;
import org.csits.mig.server.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvFileExtractorTest {

    @TempDir
    Path tempDir;

    @Test
    void extract_readsHeaderColumnsWithPrefix() throws IOException {
        Path file = tempDir.resolve("users.csv");
        Files.write(file, "id,login,email\n1,alice,a@example.com\n2,bob,\n".getBytes(StandardCharsets.UTF_8));

        Batch batch = new CsvFileExtractor(file, "user", ',').extract();

        assertThat(batch.size()).isEqualTo(2);
        Row first = batch.getRows().get(0);
        assertThat(first.valueOf("user.id")).isEqualTo("1");
        assertThat(first.valueOf("user.login")).isEqualTo("alice");
        assertThat(first.valueOf("user.email")).isEqualTo("a@example.com");
        assertThat(first.uid()).isNotEmpty();
        assertThat(batch.getRows().get(1).valueOf("user.email")).isEqualTo("");
    }

    @Test
    void extract_keepsUidColumnAndHonoursSeparator() throws IOException {
        Path file = tempDir.resolve("rows.csv");
        Files.write(file, "etl.uid;name\nfixed;News\n".getBytes(StandardCharsets.UTF_8));

        Row row = new CsvFileExtractor(file, "term", ';').extract().getRows().get(0);

        assertThat(row.uid()).isEqualTo("fixed");
        assertThat(row.valueOf("term.name")).isEqualTo("News");
    }

    @Test
    void extract_missingFileThrows() {
        assertThatThrownBy(() -> new CsvFileExtractor(tempDir.resolve("none.csv"), null, ',').extract())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("none.csv");
    }

    @Test
    void factory_requiresPathAndSingleCharacterSeparator() {
        JobConfig job = new JobConfig();
        job.setName("users");
        JobRunContext context = new JobRunContext(1L, "20250101000000_001", job, null, null, null);
        StepConfig step = new StepConfig();
        step.setType("csv");

        assertThatThrownBy(() -> new CsvFileExtractorFactory().create(step, context))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("path");

        step.setOption("path", tempDir.resolve("users.csv").toString());
        step.setOption("separator", "||");
        assertThatThrownBy(() -> new CsvFileExtractorFactory().create(step, context))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("||");
    }
}
