package com.syncpipeline.model;

import java.util.Map;
import java.util.Objects;

/**
 * A validated record handed to storage. Read-only view over the source mapping.
 */
public record RawRecord(LooseValue.Mapping fields) {

    public static final String ID = "id";

    public RawRecord {
        Objects.requireNonNull(fields, "fields");
    }

    public static RawRecord of(LooseValue.Mapping fields) {
        return new RawRecord(fields);
    }

    public LooseValue get(String key) {
        return fields.get(key);
    }

    /**
     * Identifier rendered as text. Numeric ids use their plain string form,
     * unsupported shapes their source token.
     */
    public String id() {
        LooseValue value = fields.get(ID);
        if (value instanceof LooseValue.Text text) {
            return text.value();
        }
        if (value instanceof LooseValue.Numeric numeric) {
            return numeric.value().toPlainString();
        }
        if (value instanceof LooseValue.Unsupported unsupported) {
            return unsupported.token();
        }
        return String.valueOf(value);
    }

    public Map<String, LooseValue> entries() {
        return fields.entries();
    }
}
