package org.nullmask.engine;

import org.nullmask.model.Value;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a value is a replacement candidate.
 * <p>
 * The null marker never matches. Without a pattern every other value matches; with one, the
 * pattern must be found somewhere in the value's canonical text (no implicit anchoring).
 */
public final class PatternMatcher {

    private final Pattern pattern;

    private PatternMatcher(Pattern pattern) {
        this.pattern = pattern;
    }

    public static PatternMatcher of(Optional<Pattern> pattern) {
        return new PatternMatcher(pattern.orElse(null));
    }

    public boolean matches(Value value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (pattern == null) {
            return true;
        }
        return pattern.matcher(value.canonicalText()).find();
    }
}
