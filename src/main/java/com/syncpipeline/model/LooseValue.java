package com.syncpipeline.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A loosely-typed value as decoded from the sync source.
 *
 * Only the record validator inspects these directly; everything downstream of
 * validation works with {@link RawRecord}.
 */
public sealed interface LooseValue
        permits LooseValue.Text, LooseValue.Numeric, LooseValue.Mapping, LooseValue.Absent, LooseValue.Unsupported {

    /**
     * Returns the string content when this is {@link Text}.
     */
    default Optional<String> asText() {
        return this instanceof Text text ? Optional.of(text.value()) : Optional.empty();
    }

    /**
     * Returns this value as a {@link Mapping} when it is one.
     */
    default Optional<Mapping> asMapping() {
        return this instanceof Mapping mapping ? Optional.of(mapping) : Optional.empty();
    }

    default boolean isAbsent() {
        return this instanceof Absent;
    }

    static LooseValue absent() {
        return Absent.INSTANCE;
    }

    record Text(String value) implements LooseValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    record Numeric(BigDecimal value) implements LooseValue {
        public Numeric {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Nested key-value mapping. Key order follows the source document.
     */
    record Mapping(Map<String, LooseValue> entries) implements LooseValue {
        public Mapping {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        /**
         * Value under {@code key}, or {@link Absent} when the key is not present.
         */
        public LooseValue get(String key) {
            LooseValue value = entries.get(key);
            return value != null ? value : Absent.INSTANCE;
        }

        /**
         * True when the key exists and carries something other than {@link Absent}.
         */
        public boolean has(String key) {
            return !get(key).isAbsent();
        }
    }

    enum Absent implements LooseValue {
        INSTANCE
    }

    /**
     * A decoded shape with no loose-value counterpart, e.g. a boolean or an array.
     * {@code token} is the value as it appeared in the source, e.g. {@code true} or {@code [1,2]}.
     */
    record Unsupported(String typeName, String token) implements LooseValue {
        public Unsupported {
            Objects.requireNonNull(typeName, "typeName");
            Objects.requireNonNull(token, "token");
        }
    }
}
