package com.syncpipeline.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.syncpipeline.model.LooseValue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts decoded sync payloads into {@link LooseValue}s.
 *
 * Accepts either a Jackson tree or the plain object graph a JSON decoder produces
 * (maps, strings, numbers, null). Shapes outside string / number / mapping / null,
 * and NaN or infinite numbers, become {@link LooseValue.Unsupported} rather than being coerced.
 */
@Component
@RequiredArgsConstructor
public class LooseValueMapper {

    private final ObjectMapper objectMapper;

    /**
     * Parse a JSON array of records. Each array element becomes one batch entry.
     *
     * @throws IllegalArgumentException if the document is not valid JSON or not an array
     */
    public List<LooseValue> readBatch(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Batch payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Batch payload must be a JSON array");
        }
        return toBatch(root);
    }

    public List<LooseValue> toBatch(JsonNode array) {
        List<LooseValue> batch = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            batch.add(fromNode(element));
        }
        return batch;
    }

    public List<LooseValue> toBatch(List<?> decoded) {
        List<LooseValue> batch = new ArrayList<>(decoded.size());
        for (Object element : decoded) {
            batch.add(fromObject(element));
        }
        return batch;
    }

    public LooseValue fromNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return LooseValue.absent();
        }
        if (node.isTextual()) {
            return new LooseValue.Text(node.textValue());
        }
        if (node.isNumber()) {
            if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
                return new LooseValue.Unsupported("non-finite number", node.asText());
            }
            return new LooseValue.Numeric(node.decimalValue());
        }
        if (node.isObject()) {
            Map<String, LooseValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), fromNode(field.getValue()));
            }
            return new LooseValue.Mapping(entries);
        }
        return new LooseValue.Unsupported(node.getNodeType().name().toLowerCase(), node.toString());
    }

    public LooseValue fromObject(Object value) {
        if (value == null) {
            return LooseValue.absent();
        }
        if (value instanceof LooseValue loose) {
            return loose;
        }
        if (value instanceof CharSequence text) {
            return new LooseValue.Text(text.toString());
        }
        if (value instanceof Number number) {
            if (!isFinite(number)) {
                return new LooseValue.Unsupported("non-finite number", number.toString());
            }
            return new LooseValue.Numeric(toDecimal(number));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, LooseValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    return new LooseValue.Unsupported("map with " + typeOf(entry.getKey()) + " keys", String.valueOf(map));
                }
                entries.put(key, fromObject(entry.getValue()));
            }
            return new LooseValue.Mapping(entries);
        }
        return new LooseValue.Unsupported(typeOf(value), String.valueOf(value));
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) return decimal;
        if (number instanceof BigInteger integer) return new BigDecimal(integer);
        if (number instanceof Double || number instanceof Float) return BigDecimal.valueOf(number.doubleValue());
        return BigDecimal.valueOf(number.longValue());
    }

    private static boolean isFinite(Number number) {
        if (number instanceof Double || number instanceof Float) {
            return Double.isFinite(number.doubleValue());
        }
        return true;
    }

    private static String typeOf(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
