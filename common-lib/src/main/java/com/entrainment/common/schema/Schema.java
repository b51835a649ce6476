package com.entrainment.common.schema;

import com.entrainment.common.exception.SchemaDefinitionException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of field rules. Validation reports fields in declaration order.
 */
public record Schema(List<FieldRule> fields) {

    public Schema {
        fields = List.copyOf(fields);
        Set<String> seen = new HashSet<>();
        for (FieldRule rule : fields) {
            if (!seen.add(rule.name())) {
                throw new SchemaDefinitionException(rule.name(), "declared more than once");
            }
        }
    }

    public static Schema of(FieldRule... rules) {
        return new Schema(List.of(rules));
    }
}
