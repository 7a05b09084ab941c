package org.nullmask.options;

/**
 * Defines configuration option constants used throughout nullmask.
 * The configuration loader and the CLI share these keys so both read settings the same way.
 */
public final class NullMaskOptions {

    private NullMaskOptions() {
    }

    /**
     * Profile-related settings.
     */
    public static final class Profile {
        private Profile() {}

        /**
         * Default profile name.
         */
        public static final String DEFAULT = "default";

        /**
         * Profile environment variable name.
         */
        public static final String ENV_VAR = "NULLMASK_PROFILE";

        /**
         * Configuration file name.
         */
        public static final String CONFIG_FILE = "nullmask.yaml";
    }

    /**
     * Null-injection settings.
     */
    public static final class Injection {
        private Injection() {}

        /**
         * Chance that a candidate cell is replaced with null.
         * Default: 0.1
         */
        public static final String PROBABILITY_KEY = "nullmask.injection.probability";
        public static final double PROBABILITY_DEFAULT = 0.1;

        /**
         * Regular expression a value's text must contain to be a candidate. No default.
         */
        public static final String PATTERN_KEY = "nullmask.injection.pattern";

        /**
         * Comma-separated column allow-list. No default (all columns).
         */
        public static final String COLUMNS_KEY = "nullmask.injection.columns";

        /**
         * Seed of the per-cell draw.
         * Default: 0
         */
        public static final String SEED_KEY = "nullmask.injection.seed";
        public static final long SEED_DEFAULT = 0L;

        /**
         * Number of worker units rows are split across.
         * Default: 1
         */
        public static final String PARALLELISM_KEY = "nullmask.injection.parallelism";
        public static final int PARALLELISM_DEFAULT = 1;
    }
}
