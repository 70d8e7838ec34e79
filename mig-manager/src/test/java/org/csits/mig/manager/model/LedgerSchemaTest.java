package org.csits.mig.manager.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LedgerSchemaTest {

    @Test
    void apply_ordersDeclaredFieldsAndCoercesTypes() {
        Map<String, String> declared = new LinkedHashMap<>();
        declared.put("post_id", "integer");
        declared.put("published", "boolean");
        declared.put("tags", "list");
        declared.put("missing", "string");
        LedgerSchema schema = LedgerSchema.of(declared);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("extra", "x");
        fields.put("tags", "news");
        fields.put("published", "true");
        fields.put("post_id", "42");

        Map<String, Object> out = schema.apply(LedgerEntry.of("r1", fields));

        assertThat(out.keySet()).containsExactly("uid", "post_id", "published", "tags", "missing", "extra");
        assertThat(out.get("post_id")).isEqualTo(42L);
        assertThat(out.get("published")).isEqualTo(true);
        assertThat(out.get("tags")).isEqualTo(List.of("news"));
        assertThat(out.get("missing")).isNull();
    }

    @Test
    void of_rejectsUnknownType() {
        assertThatThrownBy(() -> LedgerSchema.of(Map.of("a", "decimal128")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("a");
    }

    @Test
    void apply_rejectsUnparseableNumber() {
        LedgerSchema schema = LedgerSchema.of(Map.of("post_id", "integer"));

        assertThatThrownBy(() -> schema.apply(LedgerEntry.of("r1", Map.of("post_id", "abc"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("post_id");
    }
}
