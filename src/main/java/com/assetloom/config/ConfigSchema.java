package com.assetloom.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Field-level schema for a flat JSON configuration object.
 *
 * Each known field has a type, an optional default and optional bounds.
 * {@link #resolve(Map)} checks parsed values against them and returns the
 * complete settings map with defaults filled in.
 */
public class ConfigSchema {

    private final Map<String, FieldDefinition> fields;

    private ConfigSchema(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates parsed values and fills in defaults.
     *
     * Values for fields the schema does not know are dropped.
     *
     * @param values parsed values by field name, null meaning absent
     * @return every field with a value, in declaration order
     * @throws ConfigValidationException if a value is mistyped, out of range or a required field is absent
     */
    public Map<String, Object> resolve(Map<String, Object> values) throws ConfigValidationException {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            String name = entry.getKey();
            FieldDefinition field = entry.getValue();
            Object value = values.get(name);

            if (value == null) {
                if (field.required()) {
                    throw new ConfigValidationException(String.format("Required field '%s' is missing", name));
                }
                if (field.defaultValue() != null) {
                    resolved.put(name, field.defaultValue());
                }
                continue;
            }

            field.check(name, value);
            resolved.put(name, value);
        }
        return resolved;
    }

    public boolean isKnownField(String name) {
        return fields.containsKey(name);
    }

    /**
     * Builder for schemas.
     */
    public static class Builder {
        private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();

        public Builder field(String name, FieldDefinition definition) {
            fields.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(definition, "definition"));
            return this;
        }

        public ConfigSchema build() {
            return new ConfigSchema(fields);
        }
    }

    /**
     * Constraints on one field.
     *
     * @param type expected value type
     * @param required whether the field must be present
     * @param defaultValue value used when absent, may be null
     * @param min inclusive lower bound for numbers, may be null
     * @param max inclusive upper bound for numbers, may be null
     * @param pattern regular expression strings must match, may be null
     */
    public record FieldDefinition(
        FieldType type,
        boolean required,
        Object defaultValue,
        Long min,
        Long max,
        Pattern pattern
    ) {

        public FieldDefinition {
            Objects.requireNonNull(type, "type");
        }

        public static FieldBuilder of(FieldType type) {
            return new FieldBuilder(type);
        }

        void check(String name, Object value) throws ConfigValidationException {
            if (!type.accepts(value)) {
                throw new ConfigValidationException(String.format("Field '%s' expected %s, got %s",
                    name, type.name().toLowerCase(Locale.ROOT), describe(value)));
            }

            if (value instanceof Number number) {
                long actual = number.longValue();
                if (min != null && actual < min) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %d is below minimum %d", name, actual, min));
                }
                if (max != null && actual > max) {
                    throw new ConfigValidationException(
                        String.format("Field '%s' value %d is above maximum %d", name, actual, max));
                }
            }

            if (value instanceof String text && pattern != null && !pattern.matcher(text).matches()) {
                throw new ConfigValidationException(
                    String.format("Field '%s' value '%s' does not match '%s'", name, text, pattern.pattern()));
            }
        }

        private static String describe(Object value) {
            return value.getClass().getSimpleName() + " " + value;
        }
    }

    /**
     * Builder for field definitions.
     */
    public static class FieldBuilder {
        private final FieldType type;
        private boolean required;
        private Object defaultValue;
        private Long min;
        private Long max;
        private Pattern pattern;

        private FieldBuilder(FieldType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public FieldBuilder required(boolean required) {
            this.required = required;
            return this;
        }

        public FieldBuilder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public FieldBuilder range(long min, long max) {
            this.min = min;
            this.max = max;
            return this;
        }

        public FieldBuilder min(long min) {
            this.min = min;
            return this;
        }

        public FieldBuilder pattern(String regex) {
            this.pattern = Pattern.compile(regex);
            return this;
        }

        public FieldDefinition build() {
            return new FieldDefinition(type, required, defaultValue, min, max, pattern);
        }
    }

    /**
     * Value types a field can declare.
     */
    public enum FieldType {
        STRING,
        INTEGER,
        BOOLEAN;

        boolean accepts(Object value) {
            return switch (this) {
                case STRING -> value instanceof String;
                case INTEGER -> value instanceof Integer || value instanceof Long;
                case BOOLEAN -> value instanceof Boolean;
            };
        }
    }
}
