package org.csits.mig.manager.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BatchTest {

    @Test
    void replace_substitutesOnlyMatchingIdentifiers() {
        Row r1 = Row.of("r1", Map.of("v", 1));
        Row r2 = Row.of("r2", Map.of("v", 2));
        Batch batch = Batch.of(r1, r2);
        Row r2Mutated = r2.with("post.ID", 10);

        Batch replaced = batch.replace(Map.of("r2", r2Mutated));

        assertThat(replaced.getRows()).containsExactly(r1, r2Mutated);
        assertThat(batch.getRows()).containsExactly(r1, r2);
    }

    @Test
    void replace_ignoresUnknownIdentifiers() {
        Row r1 = Row.of("r1", Map.of("v", 1));
        Batch batch = Batch.of(r1);

        Batch replaced = batch.replace(Map.of("zz", Row.of("zz", Map.of())));

        assertThat(replaced.getRows()).containsExactly(r1);
    }

    @Test
    void split_chunksPreserveOrder() {
        Batch batch = Batch.of(
            Row.of("r1", Map.of()), Row.of("r2", Map.of()), Row.of("r3", Map.of()));

        List<Batch> chunks = batch.split(2);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0).getRows()).extracting(Row::uid).containsExactly("r1", "r2");
        assertThat(chunks.get(1).getRows()).extracting(Row::uid).containsExactly("r3");
    }

    @Test
    void append_concatenates() {
        Batch a = Batch.of(Row.of("r1", Map.of()));
        Batch b = Batch.of(Row.of("r2", Map.of()));

        assertThat(a.append(b).getRows()).extracting(Row::uid).containsExactly("r1", "r2");
        assertThat(Batch.empty().append(b)).isSameAs(b);
    }
}
