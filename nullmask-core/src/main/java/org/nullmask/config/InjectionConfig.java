package org.nullmask.config;

import lombok.Builder;
import org.nullmask.options.NullMaskOptions;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validated settings of one null-injection run.
 * <p>
 * Instances only come out of {@link #builder()}: {@code build()} checks every input and throws a
 * {@link ConfigException} listing all violations at once. When the dataset schema is passed along,
 * configured columns missing from it are reported in the same exception. Unset seed and parallelism
 * fall back to {@link NullMaskOptions.Injection} defaults; an unset probability is a violation.
 */
public final class InjectionConfig {

    private final double probability;
    private final Pattern pattern;
    private final Set<String> columns;
    private final long seed;
    private final int parallelism;

    private InjectionConfig(double probability, Pattern pattern, Set<String> columns, long seed, int parallelism) {
        this.probability = probability;
        this.pattern = pattern;
        this.columns = columns;
        this.seed = seed;
        this.parallelism = parallelism;
    }

    /**
     * @param probability chance of replacing a candidate cell, within [0, 1]
     * @param pattern     regular expression, or null to consider every value
     * @param columns     column allow-list, or null for all columns; must not be empty when given
     * @param seed        seed of the per-cell draw, or null for the default
     * @param parallelism number of worker units, or null for the default
     * @param schema      column names of the target dataset, or null to skip the column membership check
     */
    @Builder
    private static InjectionConfig create(Double probability, String pattern, Collection<String> columns,
                                          Long seed, Integer parallelism, List<String> schema) {
        List<ConfigViolation> violations = new ArrayList<>();

        if (probability == null || probability.isNaN() || probability < 0.0 || probability > 1.0) {
            violations.add(new ConfigViolation(ConfigViolation.Type.INVALID_PROBABILITY, String.valueOf(probability),
                    "Probability must be between 0.0 and 1.0, got " + probability));
        }

        Pattern compiled = null;
        if (pattern != null) {
            try {
                compiled = Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                violations.add(new ConfigViolation(ConfigViolation.Type.INVALID_PATTERN, pattern,
                        "Invalid pattern '" + pattern + "': " + e.getDescription()));
            }
        }

        Set<String> allowList = null;
        if (columns != null) {
            allowList = new LinkedHashSet<>();
            for (String column : columns) {
                allowList.add(column == null ? "" : column.trim());
            }
            if (allowList.isEmpty()) {
                violations.add(new ConfigViolation(ConfigViolation.Type.EMPTY_COLUMN_LIST, "",
                        "Column list is empty; omit it to select all columns"));
            } else if (schema != null) {
                violations.addAll(ConfigViolation.unknownColumns(schema, allowList));
            }
        }

        int workers = parallelism != null ? parallelism : NullMaskOptions.Injection.PARALLELISM_DEFAULT;
        if (workers < 1) {
            violations.add(new ConfigViolation(ConfigViolation.Type.INVALID_PARALLELISM, String.valueOf(workers),
                    "Parallelism must be at least 1, got " + workers));
        }

        if (!violations.isEmpty()) {
            throw new ConfigException(violations);
        }

        return new InjectionConfig(
                probability,
                compiled,
                allowList == null ? null : Collections.unmodifiableSet(allowList),
                seed != null ? seed : NullMaskOptions.Injection.SEED_DEFAULT,
                workers);
    }

    public double probability() {
        return probability;
    }

    public Optional<Pattern> pattern() {
        return Optional.ofNullable(pattern);
    }

    /** Configured allow-list in first-seen order, or empty when every column is eligible. */
    public Optional<Set<String>> columns() {
        return Optional.ofNullable(columns);
    }

    public long seed() {
        return seed;
    }

    public int parallelism() {
        return parallelism;
    }

    @Override
    public String toString() {
        return "InjectionConfig{probability=" + probability
                + ", pattern=" + (pattern == null ? null : pattern.pattern())
                + ", columns=" + columns
                + ", seed=" + seed
                + ", parallelism=" + parallelism + "}";
    }
}
