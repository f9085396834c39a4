package com.telcobright.repartition.db.gateway;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * One row of a dictionary query, keyed by column label (case-insensitive).
 */
public final class ResultRow {

    private final Map<String, Object> values;

    public ResultRow(Map<String, ?> values) {
        TreeMap<String, Object> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    public static ResultRow of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        TreeMap<String, Object> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return new ResultRow(map);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    /**
     * Numeric value of a column; null reads as 0.
     */
    public long getLong(String column) {
        Object value = values.get(column);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    public int getInt(String column) {
        return Math.toIntExact(getLong(column));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
