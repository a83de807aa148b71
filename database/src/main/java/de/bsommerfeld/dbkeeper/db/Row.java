package de.bsommerfeld.dbkeeper.db;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One result row, keyed by column label in select order. SQLite hands back
 * whatever storage class the value has, so the typed getters coerce numbers
 * and numeric text.
 */
public final class Row {

    private final Map<String, Object> values;

    public Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String column) {
        if (!values.containsKey(column)) {
            throw new IllegalStateException("No column '" + column + "' in row " + values.keySet());
        }
        return values.get(column);
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    public long getLong(String column) {
        Object value = get(column);
        if (value == null)
            return 0L;
        if (value instanceof Number number)
            return number.longValue();
        return (long) Double.parseDouble(value.toString());
    }

    public int getInt(String column) {
        return (int) getLong(column);
    }

    public double getDouble(String column) {
        Object value = get(column);
        if (value == null)
            return 0.0;
        if (value instanceof Number number)
            return number.doubleValue();
        return Double.parseDouble(value.toString());
    }

    public boolean getBoolean(String column) {
        return getLong(column) != 0;
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
