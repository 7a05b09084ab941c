package org.nullmask.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered sequence of rows sharing one ordered schema.
 * Every row holds exactly the schema's columns, possibly with the null marker.
 */
public final class Dataset {

    private final List<String> schema;
    private final List<Row> rows;

    private Dataset(List<String> schema, List<Row> rows) {
        this.schema = List.copyOf(schema);
        this.rows = List.copyOf(rows);
    }

    /**
     * @throws SchemaMismatchException if the schema is empty, has duplicate names,
     *                                 or a row's columns differ from the schema
     */
    public static Dataset of(List<String> schema, List<Row> rows) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        validateSchema(schema);

        Set<String> expected = Set.copyOf(schema);
        for (int i = 0; i < rows.size(); i++) {
            Row row = rows.get(i);
            if (row == null || !row.cells().keySet().equals(expected)) {
                throw new SchemaMismatchException(String.format(
                        "Row %d does not match schema %s: %s", i, schema, row == null ? null : row.cells().keySet()));
            }
        }
        return new Dataset(schema, rows);
    }

    private static void validateSchema(List<String> schema) {
        if (schema.isEmpty()) {
            throw new SchemaMismatchException("Dataset schema has no columns");
        }
        Set<String> seen = new HashSet<>();
        List<String> duplicates = new ArrayList<>();
        for (String column : schema) {
            if (column == null) {
                throw new SchemaMismatchException("Dataset schema contains a null column name");
            }
            if (!seen.add(column)) {
                duplicates.add(column);
            }
        }
        if (!duplicates.isEmpty()) {
            throw new SchemaMismatchException("Dataset schema has duplicate columns: " + duplicates);
        }
    }

    public List<String> schema() {
        return schema;
    }

    public List<Row> rows() {
        return rows;
    }

    public Row row(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Dataset that)) return false;
        return schema.equals(that.schema) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, rows);
    }

    @Override
    public String toString() {
        return "Dataset{schema=" + schema + ", rows=" + rows.size() + "}";
    }
}
