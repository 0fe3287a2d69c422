package com.nevis.hybrid.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.nevis.hybrid.exception.ValidationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON-like value attached to a document as metadata.
 */
@JsonSerialize(using = MetadataValueJson.Serializer.class)
@JsonDeserialize(using = MetadataValueJson.Deserializer.class)
public sealed interface MetadataValue {

    record StringValue(String value) implements MetadataValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Numbers compare by value, so {@code 1} and {@code 1.0} are equal.
     */
    record NumberValue(BigDecimal value) implements MetadataValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberValue other && value.compareTo(other.value) == 0;
        }

        @Override
        public int hashCode() {
            return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
        }
    }

    record BooleanValue(boolean value) implements MetadataValue {}

    record NullValue() implements MetadataValue {
        public static final NullValue INSTANCE = new NullValue();
    }

    record ListValue(List<MetadataValue> values) implements MetadataValue {
        public ListValue {
            List<MetadataValue> copy = new ArrayList<>(values.size());
            values.forEach(value -> copy.add(value == null ? NullValue.INSTANCE : value));
            values = Collections.unmodifiableList(copy);
        }
    }

    record MapValue(Map<String, MetadataValue> values) implements MetadataValue {
        public MapValue {
            values = normalize(values);
        }
    }

    static MetadataValue of(String value) {
        return value == null ? NullValue.INSTANCE : new StringValue(value);
    }

    static MetadataValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static MetadataValue of(double value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static MetadataValue of(boolean value) {
        return new BooleanValue(value);
    }

    static MetadataValue nullValue() {
        return NullValue.INSTANCE;
    }

    static MetadataValue list(MetadataValue... values) {
        return new ListValue(List.of(values));
    }

    /**
     * Converts plain Java values ({@code String}, {@code Number}, {@code Boolean}, {@code null},
     * {@code List}, {@code Map} with string keys) into metadata.
     */
    static MetadataValue from(Object raw) {
        if (raw == null) {
            return NullValue.INSTANCE;
        }
        if (raw instanceof MetadataValue value) {
            return value;
        }
        if (raw instanceof String s) {
            return new StringValue(s);
        }
        if (raw instanceof BigDecimal d) {
            return new NumberValue(d);
        }
        if (raw instanceof Double || raw instanceof Float) {
            return new NumberValue(BigDecimal.valueOf(((Number) raw).doubleValue()));
        }
        if (raw instanceof Number n) {
            return new NumberValue(new BigDecimal(n.toString()));
        }
        if (raw instanceof Boolean b) {
            return new BooleanValue(b);
        }
        if (raw instanceof List<?> list) {
            return new ListValue(list.stream().map(MetadataValue::from).toList());
        }
        if (raw instanceof Map<?, ?> map) {
            return new MapValue(fromMap(map));
        }
        throw new IllegalArgumentException("Unsupported metadata value type: " + raw.getClass().getName());
    }

    /**
     * Copies a metadata map, reading a {@code null} value as JSON null.
     *
     * @throws ValidationException on a {@code null} key
     */
    static Map<String, MetadataValue> normalize(Map<String, MetadataValue> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, MetadataValue> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> {
            if (key == null) {
                throw new ValidationException("Metadata keys cannot be null");
            }
            copy.put(key, value == null ? NullValue.INSTANCE : value);
        });
        return Collections.unmodifiableMap(copy);
    }

    static Map<String, MetadataValue> fromMap(Map<?, ?> raw) {
        Map<String, MetadataValue> result = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (!(key instanceof String name)) {
                throw new IllegalArgumentException("Metadata keys must be strings, got: " + key);
            }
            result.put(name, from(value));
        });
        return result;
    }
}
