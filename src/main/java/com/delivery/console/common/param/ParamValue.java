package com.delivery.console.common.param;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Request parameter tree. Every value sent to the delivery API is a {@link Scalar},
 * an ordered {@link Sequence} or a keyed {@link Mapping}; trees are immutable once built.
 */
public sealed interface ParamValue permits ParamValue.Scalar, ParamValue.Sequence, ParamValue.Mapping {

    /**
     * Empty values (null, "", numeric zero, false, empty sequence or mapping) are never signed
     * and never sent.
     */
    boolean isEmpty();

    static Scalar none() {
        return Scalar.NONE;
    }

    static Scalar of(String value) {
        return value == null ? Scalar.NONE : new Scalar(value);
    }

    static Scalar of(long value) {
        return new Scalar(value);
    }

    static Scalar of(double value) {
        return new Scalar(value);
    }

    static Scalar of(BigDecimal value) {
        return value == null ? Scalar.NONE : new Scalar(value);
    }

    static Scalar of(boolean value) {
        return new Scalar(value);
    }

    static Sequence sequence(ParamValue... items) {
        return new Sequence(Arrays.asList(items));
    }

    static Sequence sequence(List<? extends ParamValue> items) {
        return new Sequence(new ArrayList<ParamValue>(items));
    }

    static Mapping.Builder mapping() {
        return new Mapping.Builder();
    }

    /**
     * Converts plain Java values into a tree: maps become mappings (keys via {@code toString}),
     * iterables and arrays become sequences, Jackson nodes are walked, everything else is a scalar.
     */
    static ParamValue from(Object raw) {
        if (raw == null) {
            return Scalar.NONE;
        }
        if (raw instanceof ParamValue value) {
            return value;
        }
        if (raw instanceof JsonNode node) {
            return fromJson(node);
        }
        if (raw instanceof Map<?, ?> map) {
            Mapping.Builder builder = mapping();
            map.forEach((key, value) -> builder.put(String.valueOf(key), from(value)));
            return builder.build();
        }
        if (raw instanceof Iterable<?> iterable) {
            List<ParamValue> items = new ArrayList<>();
            for (Object item : iterable) {
                items.add(from(item));
            }
            return new Sequence(items);
        }
        if (raw instanceof Object[] array) {
            List<ParamValue> items = new ArrayList<>(array.length);
            for (Object item : array) {
                items.add(from(item));
            }
            return new Sequence(items);
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return new Scalar(((Number) raw).longValue());
        }
        if (raw instanceof Float number) {
            if (number.isNaN() || number.isInfinite()) {
                return new Scalar(number.doubleValue());
            }
            return new Scalar(new BigDecimal(number.toString()));
        }
        if (raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean) {
            return new Scalar(raw instanceof CharSequence ? raw.toString() : raw);
        }
        if (raw instanceof Character || raw instanceof Enum<?>) {
            return new Scalar(raw.toString());
        }
        throw new IllegalArgumentException("Unsupported parameter type: " + raw.getClass().getName());
    }

    private static ParamValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Scalar.NONE;
        }
        if (node.isObject()) {
            Mapping.Builder builder = mapping();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.put(field.getKey(), fromJson(field.getValue()));
            }
            return builder.build();
        }
        if (node.isArray()) {
            List<ParamValue> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJson(item)));
            return new Sequence(items);
        }
        if (node.isBoolean()) {
            return new Scalar(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new Scalar(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new Scalar(node.decimalValue());
        }
        return new Scalar(node.asText());
    }

    /**
     * A single value. Holds a {@link String}, {@link Number}, {@link Boolean} or nothing.
     */
    final class Scalar implements ParamValue {
        static final Scalar NONE = new Scalar(null);

        private final Object value;

        private Scalar(Object value) {
            this.value = value;
        }

        public Object value() {
            return value;
        }

        /**
         * Text the server sees for this value, both in the signing string and on the wire.
         */
        public String text() {
            if (value == null) {
                return "";
            }
            if (value instanceof Boolean flag) {
                return flag ? "True" : "False";
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.toPlainString();
            }
            if (value instanceof Double number) {
                if (number.isNaN()) {
                    return "nan";
                }
                if (number.isInfinite()) {
                    return number > 0 ? "inf" : "-inf";
                }
                return BigDecimal.valueOf(number).toPlainString();
            }
            return value.toString();
        }

        @Override
        public boolean isEmpty() {
            if (value == null) {
                return true;
            }
            if (value instanceof String text) {
                return text.isEmpty();
            }
            if (value instanceof Boolean flag) {
                return !flag;
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.signum() == 0;
            }
            if (value instanceof BigInteger integer) {
                return integer.signum() == 0;
            }
            if (value instanceof Double) {
                return ((Number) value).doubleValue() == 0.0d;
            }
            return ((Number) value).longValue() == 0L;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Scalar other)) {
                return false;
            }
            return Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return value == null ? "null" : text();
        }
    }

    /**
     * Ordered items; order is kept on the wire and in the signing string.
     */
    record Sequence(List<ParamValue> items) implements ParamValue {
        public Sequence {
            Objects.requireNonNull(items, "items");
            List<ParamValue> copy = new ArrayList<>(items.size());
            for (ParamValue item : items) {
                copy.add(item == null ? Scalar.NONE : item);
            }
            items = Collections.unmodifiableList(copy);
        }

        @Override
        public boolean isEmpty() {
            return items.isEmpty();
        }
    }

    /**
     * Keyed values. Insertion order is kept for encoding; signing sorts keys itself.
     */
    record Mapping(Map<String, ParamValue> entries) implements ParamValue {
        public Mapping {
            Objects.requireNonNull(entries, "entries");
            Map<String, ParamValue> copy = new LinkedHashMap<>();
            entries.forEach((key, value) -> copy.put(Objects.requireNonNull(key, "key"), value == null ? Scalar.NONE : value));
            entries = Collections.unmodifiableMap(copy);
        }

        @Override
        public boolean isEmpty() {
            return entries.isEmpty();
        }

        public ParamValue get(String key) {
            return entries.get(key);
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        /**
         * Returns a copy with {@code other}'s entries laid over this one's. Existing keys keep
         * their position, new keys go to the end.
         */
        public Mapping merge(Mapping other) {
            Map<String, ParamValue> merged = new LinkedHashMap<>(entries);
            merged.putAll(other.entries);
            return new Mapping(merged);
        }

        public Mapping with(String key, ParamValue value) {
            Map<String, ParamValue> merged = new LinkedHashMap<>(entries);
            merged.put(key, value);
            return new Mapping(merged);
        }

        public Mapping withoutEmpty() {
            Map<String, ParamValue> kept = new LinkedHashMap<>();
            entries.forEach((key, value) -> {
                if (!value.isEmpty()) {
                    kept.put(key, value);
                }
            });
            return new Mapping(kept);
        }

        public static final class Builder {
            private final Map<String, ParamValue> entries = new LinkedHashMap<>();

            private Builder() {
            }

            public Builder put(String key, ParamValue value) {
                entries.put(key, value);
                return this;
            }

            public Builder put(String key, String value) {
                return put(key, ParamValue.of(value));
            }

            public Builder put(String key, long value) {
                return put(key, ParamValue.of(value));
            }

            public Builder put(String key, BigDecimal value) {
                return put(key, ParamValue.of(value));
            }

            public Builder putObject(String key, Object value) {
                return put(key, ParamValue.from(value));
            }

            public Mapping build() {
                return new Mapping(entries);
            }
        }
    }
}
