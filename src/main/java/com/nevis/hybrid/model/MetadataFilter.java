package com.nevis.hybrid.model;

import com.nevis.hybrid.exception.FilterException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Conjunction of predicates over a document's metadata. Applied before ranking.
 *
 * <p>Paths are dot separated ({@code author.name}) and walk nested maps; an integer segment indexes
 * into a list ({@code tags.0}, {@code tags.-1} for the last element). A missing path never matches,
 * whatever the condition.
 */
public final class MetadataFilter {

    private static final Pattern LIST_INDEX = Pattern.compile("-?\\d+");

    private static final MetadataFilter NONE = new MetadataFilter(List.of());

    public enum Operator {
        EQUALS,
        CONTAINS
    }

    public record Condition(String path, Operator operator, MetadataValue value) {

        public List<String> segments() {
            return Arrays.asList(path.split("\\.", -1));
        }
    }

    private final List<Condition> conditions;

    private MetadataFilter(List<Condition> conditions) {
        this.conditions = Collections.unmodifiableList(conditions);
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a filter made of {@code EQUALS} conditions only.
     */
    public static MetadataFilter equalsAll(Map<String, MetadataValue> values) {
        Builder builder = builder();
        if (values != null) {
            values.forEach(builder::equalTo);
        }
        return builder.build();
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public boolean matches(Map<String, MetadataValue> metadata) {
        for (Condition condition : conditions) {
            MetadataValue actual = resolve(metadata, condition.segments());
            if (actual == null) {
                return false;
            }
            boolean matched = switch (condition.operator()) {
                case EQUALS -> valueEquals(actual, condition.value());
                case CONTAINS -> containsTopLevel(actual, condition.value());
            };
            if (!matched) {
                return false;
            }
        }
        return true;
    }

    private static MetadataValue resolve(Map<String, MetadataValue> metadata, List<String> segments) {
        if (metadata == null) {
            return null;
        }
        MetadataValue current = metadata.get(segments.get(0));
        for (int i = 1; i < segments.size() && current != null; i++) {
            current = step(current, segments.get(i));
        }
        return current;
    }

    // same walk as jsonb #>: keys into maps, integer indexes into lists, negative counting from the end
    private static MetadataValue step(MetadataValue current, String segment) {
        if (current instanceof MetadataValue.MapValue map) {
            return map.values().get(segment);
        }
        if (current instanceof MetadataValue.ListValue list && LIST_INDEX.matcher(segment).matches()) {
            int size = list.values().size();
            long index;
            try {
                index = Long.parseLong(segment);
            } catch (NumberFormatException e) {
                return null;
            }
            if (index < 0) {
                index += size;
            }
            return index >= 0 && index < size ? list.values().get((int) index) : null;
        }
        return null;
    }

    static boolean valueEquals(MetadataValue left, MetadataValue right) {
        if (left instanceof MetadataValue.NumberValue l && right instanceof MetadataValue.NumberValue r) {
            return l.value().compareTo(r.value()) == 0;
        }
        return left.equals(right);
    }

    // jsonb @> semantics: a list may contain a bare scalar only at the top level
    private static boolean containsTopLevel(MetadataValue container, MetadataValue candidate) {
        if (container instanceof MetadataValue.ListValue list && isScalar(candidate)) {
            return list.values().stream().anyMatch(element -> valueEquals(element, candidate));
        }
        return contains(container, candidate);
    }

    private static boolean contains(MetadataValue container, MetadataValue candidate) {
        if (container instanceof MetadataValue.MapValue map && candidate instanceof MetadataValue.MapValue sub) {
            for (Map.Entry<String, MetadataValue> entry : sub.values().entrySet()) {
                MetadataValue actual = map.values().get(entry.getKey());
                if (actual == null || !contains(actual, entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        if (container instanceof MetadataValue.ListValue list && candidate instanceof MetadataValue.ListValue sub) {
            for (MetadataValue wanted : sub.values()) {
                boolean found = list.values().stream().anyMatch(element -> contains(element, wanted));
                if (!found) {
                    return false;
                }
            }
            return true;
        }
        if (isScalar(container) && isScalar(candidate)) {
            return valueEquals(container, candidate);
        }
        return false;
    }

    private static boolean isScalar(MetadataValue value) {
        return !(value instanceof MetadataValue.ListValue) && !(value instanceof MetadataValue.MapValue);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetadataFilter other && conditions.equals(other.conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        return "MetadataFilter" + conditions;
    }

    public static class Builder {

        private static final int MAX_PATH_DEPTH = 16;

        private final List<Condition> conditions = new ArrayList<>();

        public Builder equalTo(String path, MetadataValue value) {
            return add(path, Operator.EQUALS, value);
        }

        public Builder contains(String path, MetadataValue value) {
            return add(path, Operator.CONTAINS, value);
        }

        public Builder add(String path, Operator operator, MetadataValue value) {
            if (path == null || path.isBlank()) {
                throw new FilterException("Filter path cannot be blank");
            }
            if (operator == null) {
                throw new FilterException("Filter operator is missing for path '" + path + "'");
            }
            String[] segments = path.split("\\.", -1);
            if (segments.length > MAX_PATH_DEPTH) {
                throw new FilterException("Filter path '" + path + "' is nested too deeply");
            }
            for (String segment : segments) {
                if (segment.isBlank()) {
                    throw new FilterException("Filter path '" + path + "' has an empty segment");
                }
            }
            MetadataValue normalized = value == null ? MetadataValue.NullValue.INSTANCE : value;
            conditions.add(new Condition(path, operator, normalized));
            return this;
        }

        public MetadataFilter build() {
            return conditions.isEmpty() ? NONE : new MetadataFilter(new ArrayList<>(conditions));
        }
    }
}
