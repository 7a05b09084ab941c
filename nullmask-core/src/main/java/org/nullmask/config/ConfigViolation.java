package org.nullmask.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One problem found while validating injection settings.
 *
 * @param type    the kind of violation
 * @param subject the offending input as given (probability, pattern, column name, ...)
 * @param message human-readable description
 */
public record ConfigViolation(Type type, String subject, String message) {

    public enum Type {
        INVALID_PROBABILITY,
        INVALID_PATTERN,
        EMPTY_COLUMN_LIST,
        UNKNOWN_COLUMN,
        INVALID_PARALLELISM
    }

    /**
     * One UNKNOWN_COLUMN violation per configured name missing from the schema, in configured order.
     */
    public static List<ConfigViolation> unknownColumns(List<String> schema, Collection<String> configured) {
        Set<String> known = new HashSet<>(schema);
        List<ConfigViolation> unknown = new ArrayList<>();
        for (String name : configured) {
            if (!known.contains(name)) {
                unknown.add(new ConfigViolation(Type.UNKNOWN_COLUMN, name,
                        "Column '" + name + "' not found in dataset schema " + schema));
            }
        }
        return unknown;
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
