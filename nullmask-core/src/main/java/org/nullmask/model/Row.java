package org.nullmask.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from column name to {@link Value}. Iteration follows insertion order.
 */
public final class Row {

    private final Map<String, Value> cells;

    private Row(Map<String, Value> cells) {
        this.cells = Collections.unmodifiableMap(cells);
    }

    /**
     * Copies the given cells. Java {@code null} values are stored as the null marker.
     */
    public static Row of(Map<String, ?> cells) {
        Objects.requireNonNull(cells, "cells must not be null");
        Map<String, Value> copy = new LinkedHashMap<>();
        cells.forEach((column, value) -> copy.put(column, Value.of(value)));
        return new Row(copy);
    }

    /**
     * Returns the value of the column; throws if the column is not part of this row.
     */
    public Value get(String column) {
        Value value = cells.get(column);
        if (value == null) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return value;
    }

    public Map<String, Value> cells() {
        return cells;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Row that)) return false;
        return cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
