package com.entrainment.common.schema;

import com.entrainment.common.exception.SchemaDefinitionException;

import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Declarative constraints for one field. Absent constraints are {@code null}.
 *
 * <p>Create through the typed factories, which reject inconsistent declarations at
 * build time:
 * <pre>
 *   FieldRule.string("name").required().length(1, 100).pattern("^[a-z]+$").build();
 * </pre>
 */
public record FieldRule(
    String name,
    FieldType type,
    boolean required,
    Double minValue,
    Double maxValue,
    Integer minLength,
    Integer maxLength,
    Pattern pattern,
    List<String> allowedValues,
    Integer minItems,
    Integer maxItems,
    FieldType itemType,
    Schema nested
) {
    public static Builder string(String name)   { return new Builder(name, FieldType.STRING); }
    public static Builder integer(String name)  { return new Builder(name, FieldType.INTEGER); }
    public static Builder decimal(String name)  { return new Builder(name, FieldType.FLOAT); }
    public static Builder bool(String name)     { return new Builder(name, FieldType.BOOLEAN); }
    public static Builder array(String name)    { return new Builder(name, FieldType.ARRAY); }
    public static Builder object(String name)   { return new Builder(name, FieldType.OBJECT); }
    public static Builder datetime(String name) { return new Builder(name, FieldType.DATETIME); }

    public static final class Builder {

        private final String name;
        private final FieldType type;
        private boolean required;
        private Double minValue;
        private Double maxValue;
        private Integer minLength;
        private Integer maxLength;
        private Pattern pattern;
        private List<String> allowedValues;
        private Integer minItems;
        private Integer maxItems;
        private FieldType itemType;
        private Schema nested;

        private Builder(String name, FieldType type) {
            if (name == null || name.isBlank()) {
                throw new SchemaDefinitionException(String.valueOf(name), "field name must not be blank");
            }
            this.name = name;
            this.type = type;
        }

        public Builder required() {
            this.required = true;
            return this;
        }

        public Builder range(double min, double max) {
            requireType(type.isNumeric(), "numeric range");
            if (min > max) throw new SchemaDefinitionException(name, "min " + min + " > max " + max);
            this.minValue = min;
            this.maxValue = max;
            return this;
        }

        public Builder min(double min) {
            requireType(type.isNumeric(), "minimum value");
            this.minValue = min;
            return this;
        }

        public Builder length(int min, int max) {
            requireType(type == FieldType.STRING, "length bounds");
            if (min < 0 || min > max) {
                throw new SchemaDefinitionException(name, "invalid length bounds " + min + ".." + max);
            }
            this.minLength = min;
            this.maxLength = max;
            return this;
        }

        public Builder pattern(String regex) {
            requireType(type == FieldType.STRING, "pattern");
            try {
                this.pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new SchemaDefinitionException(name, "invalid pattern " + regex, e);
            }
            return this;
        }

        public Builder allowedValues(String... values) {
            requireType(type == FieldType.STRING, "allowed values");
            if (values.length == 0) throw new SchemaDefinitionException(name, "allowed values must not be empty");
            this.allowedValues = List.of(values);
            return this;
        }

        public Builder items(int min, int max) {
            requireType(type == FieldType.ARRAY, "item count bounds");
            if (min < 0 || min > max) {
                throw new SchemaDefinitionException(name, "invalid item bounds " + min + ".." + max);
            }
            this.minItems = min;
            this.maxItems = max;
            return this;
        }

        public Builder maxItems(int max) {
            requireType(type == FieldType.ARRAY, "item count bounds");
            this.maxItems = max;
            return this;
        }

        public Builder itemType(FieldType itemType) {
            requireType(type == FieldType.ARRAY, "item type");
            this.itemType = itemType;
            return this;
        }

        public Builder nested(Schema schema) {
            requireType(type == FieldType.OBJECT, "nested schema");
            this.nested = schema;
            return this;
        }

        public FieldRule build() {
            return new FieldRule(name, type, required, minValue, maxValue, minLength, maxLength,
                pattern, allowedValues, minItems, maxItems, itemType, nested);
        }

        private void requireType(boolean condition, String constraint) {
            if (!condition) {
                throw new SchemaDefinitionException(name,
                    constraint + " is not applicable to type " + type.wireName());
            }
        }
    }
}
