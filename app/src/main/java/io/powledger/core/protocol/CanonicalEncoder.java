package io.powledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic rendering of nested key/value structures.
 *
 * Every map is re-keyed into natural key order (recursively), lists keep their
 * element order, and the result is written as compact JSON. Two structures with
 * the same entries therefore encode to the same bytes no matter how they were
 * built.
 *
 * Mining payload layout: {@code previousBlockId + encode(data) + version}. The
 * proof hash appends the decimal nonce to that string.
 */
public final class CanonicalEncoder {

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private CanonicalEncoder() {}

    /** Recursively ordered copy of {@code value}; scalars are returned as-is. */
    public static Object sorted(Object value) {
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> out = new TreeMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), sorted(e.getValue()));
            }
            return out;
        }
        if (value instanceof Collection<?> items) {
            List<Object> out = new ArrayList<>(items.size());
            for (Object item : items) {
                out.add(sorted(item));
            }
            return out;
        }
        return value;
    }

    public static String encode(Object value) {
        try {
            return JSON.writeValueAsString(sorted(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not encodable", e);
        }
    }

    public static byte[] encodeBytes(Object value) {
        return encode(value).getBytes(StandardCharsets.UTF_8);
    }

    /** Canonical form of a block's transactions, keyed by transaction id. */
    public static String encodeData(Map<String, Transaction> data) {
        Map<String, Object> view = new TreeMap<>();
        for (Map.Entry<String, Transaction> e : data.entrySet()) {
            view.put(e.getKey(), e.getValue().toHashingMap());
        }
        return encode(view);
    }

    public static String miningPayload(String previousBlockId, Map<String, Transaction> data, String version) {
        return (previousBlockId == null ? "" : previousBlockId) + encodeData(data) + version;
    }
}
