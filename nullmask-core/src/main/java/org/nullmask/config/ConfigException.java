package org.nullmask.config;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised before any row is processed when injection settings are invalid.
 * Carries every violation that was found, not only the first one.
 */
public class ConfigException extends RuntimeException {

    private final List<ConfigViolation> violations;

    public ConfigException(List<ConfigViolation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<ConfigViolation> getViolations() {
        return violations;
    }

    public boolean has(ConfigViolation.Type type) {
        return violations.stream().anyMatch(v -> v.type() == type);
    }

    private static String describe(List<ConfigViolation> violations) {
        return violations.stream()
                .map(ConfigViolation::message)
                .collect(Collectors.joining("; ", "Invalid configuration: ", ""));
    }
}
