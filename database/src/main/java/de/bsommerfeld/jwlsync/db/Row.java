package de.bsommerfeld.jwlsync.db;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record of an {@link EntityKind}: the values of
 * {@link EntityKind#columns()} in order, plus the source-side surrogate id when
 * the kind has one. Values are whatever the JDBC driver returned
 * ({@code Integer}, {@code Long}, {@code Double}, {@code String},
 * {@code byte[]} or {@code null}).
 */
public final class Row {

    private final EntityKind kind;
    private final Long sourceId;
    private final Object[] values;

    public Row(EntityKind kind, Long sourceId, Object[] values) {
        if (values.length != kind.columns().size()) {
            throw new IllegalArgumentException("Expected " + kind.columns().size() + " values for "
                    + kind + " but got " + values.length);
        }
        this.kind = kind;
        this.sourceId = sourceId;
        this.values = values.clone();
    }

    public EntityKind kind() {
        return kind;
    }

    /** Source-side surrogate id, {@code null} for kinds without one. */
    public Long sourceId() {
        return sourceId;
    }

    public Object get(String column) {
        return values[kind.columnIndex(column)];
    }

    public Object get(int index) {
        return values[index];
    }

    public void set(String column, Object value) {
        values[kind.columnIndex(column)] = value;
    }

    public int size() {
        return values.length;
    }

    /** Column name to value, in column order. Used for log output. */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(kind.columns().get(i), values[i]);
        }
        return map;
    }

    @Override
    public String toString() {
        return kind + (sourceId != null ? "#" + sourceId : "") + Arrays.toString(values);
    }
}
