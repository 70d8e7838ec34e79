package org.csits.mig.server.plugin.json;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.csits.mig.manager.model.Batch;
import org.csits.mig.manager.model.Row;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileExtractorTest {

    @TempDir
    Path tempDir;

    @Test
    void extract_readsRecordsWithPrefix() throws IOException {
        Path file = tempDir.resolve("terms.json");
        Files.write(file, "[{\"id\":1,\"name\":\"News\"},{\"id\":2,\"name\":\"Blog\"}]".getBytes(StandardCharsets.UTF_8));

        Batch batch = new JsonFileExtractor(file, "source").extract();

        assertThat(batch.size()).isEqualTo(2);
        Row first = batch.getRows().get(0);
        assertThat(first.valueOf("source.id")).isEqualTo(1);
        assertThat(first.valueOf("source.name")).isEqualTo("News");
        assertThat(first.uid()).isNotEmpty();
    }

    @Test
    void extract_keepsExistingUidWithoutPrefix() throws IOException {
        Path file = tempDir.resolve("rows.json");
        Files.write(file, "[{\"etl.uid\":\"fixed\",\"a\":true}]".getBytes(StandardCharsets.UTF_8));

        Row row = new JsonFileExtractor(file, null).extract().getRows().get(0);

        assertThat(row.uid()).isEqualTo("fixed");
        assertThat(row.valueOf("a")).isEqualTo(true);
    }

    @Test
    void extract_missingFileThrows() {
        assertThatThrownBy(() -> new JsonFileExtractor(tempDir.resolve("none.json"), null).extract())
            .isInstanceOf(IOException.class)
            .hasMessageContaining("none.json");
    }
}
