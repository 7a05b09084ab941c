package org.nullmask.engine;

import org.nullmask.config.ConfigException;
import org.nullmask.config.ConfigViolation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The set of columns eligible for null injection, resolved once per run.
 */
public final class ColumnSelector {

    private final Set<String> eligible;

    private ColumnSelector(Set<String> eligible) {
        this.eligible = Collections.unmodifiableSet(eligible);
    }

    /**
     * Resolves the eligible columns against a schema.
     *
     * @param schema            ordered column names of the dataset
     * @param configuredColumns allow-list; empty means every schema column is eligible
     * @return selector whose columns follow schema order
     * @throws ConfigException with one UNKNOWN_COLUMN violation per name missing from the schema
     */
    public static ColumnSelector resolve(List<String> schema, Optional<Set<String>> configuredColumns) {
        if (configuredColumns.isEmpty()) {
            return new ColumnSelector(new LinkedHashSet<>(schema));
        }

        Set<String> configured = configuredColumns.get();
        List<ConfigViolation> unknown = ConfigViolation.unknownColumns(schema, configured);
        if (!unknown.isEmpty()) {
            throw new ConfigException(unknown);
        }

        Set<String> ordered = new LinkedHashSet<>();
        for (String column : schema) {
            if (configured.contains(column)) {
                ordered.add(column);
            }
        }
        return new ColumnSelector(ordered);
    }

    public boolean contains(String column) {
        return eligible.contains(column);
    }

    public Set<String> eligibleColumns() {
        return eligible;
    }
}
