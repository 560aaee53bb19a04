package com.tabflow.config;

import java.util.Map;

/**
 * Configuration for the workflow compiler, loaded from environment variables.
 * <p>
 * Validation mode: TABFLOW_STRICT_VALIDATION (default true). In strict mode any fatal validation
 * error aborts compilation; in lenient mode compilation proceeds and only surfaces the issues.
 * <p>
 * Loop bounds: TABFLOW_DEFAULT_LOOP_ITERATIONS, TABFLOW_LOOP_ITERATIONS_WARN_ABOVE.
 * Data-flow checks: TABFLOW_WARN_MISSING_OUTPUT_KEY.
 */
public final class CompilerConfig {

    private static final String ENV_STRICT_VALIDATION = "TABFLOW_STRICT_VALIDATION";
    private static final String ENV_DEFAULT_LOOP_ITERATIONS = "TABFLOW_DEFAULT_LOOP_ITERATIONS";
    private static final String ENV_LOOP_ITERATIONS_WARN_ABOVE = "TABFLOW_LOOP_ITERATIONS_WARN_ABOVE";
    private static final String ENV_WARN_MISSING_OUTPUT_KEY = "TABFLOW_WARN_MISSING_OUTPUT_KEY";

    private static final boolean DEFAULT_STRICT_VALIDATION = true;
    private static final int DEFAULT_LOOP_ITERATIONS = 5;
    private static final int DEFAULT_LOOP_ITERATIONS_WARN_ABOVE = 100;
    private static final boolean DEFAULT_WARN_MISSING_OUTPUT_KEY = true;

    private final boolean strictValidation;
    private final int defaultLoopIterations;
    private final int loopIterationsWarnAbove;
    private final boolean warnMissingOutputKey;

    private CompilerConfig(Builder b) {
        this.strictValidation = b.strictValidation;
        this.defaultLoopIterations = b.defaultLoopIterations;
        this.loopIterationsWarnAbove = b.loopIterationsWarnAbove;
        this.warnMissingOutputKey = b.warnMissingOutputKey;
    }

    /** Defaults only; ignores the environment. */
    public static CompilerConfig defaults() {
        return builder().build();
    }

    /** Whether fatal validation errors abort compilation (TABFLOW_STRICT_VALIDATION). Default true. */
    public boolean isStrictValidation() {
        return strictValidation;
    }

    /** Iteration bound assumed for a loop task whose config omits {@code max_iterations}. Default 5. */
    public int getDefaultLoopIterations() {
        return defaultLoopIterations;
    }

    /** Loop bounds above this value produce a warning. Default 100. */
    public int getLoopIterationsWarnAbove() {
        return loopIterationsWarnAbove;
    }

    /** Whether a task feeding another task without an {@code output_key} produces a warning. Default true. */
    public boolean isWarnMissingOutputKey() {
        return warnMissingOutputKey;
    }

    public static CompilerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads settings from the given variables (same names as the process environment).
     * Missing, blank or unparseable values fall back to defaults.
     */
    public static CompilerConfig fromEnvironment(Map<String, String> env) {
        Map<String, String> vars = env != null ? env : Map.of();
        return builder()
                .strictValidation(parseBoolean(vars.get(ENV_STRICT_VALIDATION), DEFAULT_STRICT_VALIDATION))
                .defaultLoopIterations(parsePositiveInt(vars.get(ENV_DEFAULT_LOOP_ITERATIONS), DEFAULT_LOOP_ITERATIONS))
                .loopIterationsWarnAbove(parsePositiveInt(vars.get(ENV_LOOP_ITERATIONS_WARN_ABOVE), DEFAULT_LOOP_ITERATIONS_WARN_ABOVE))
                .warnMissingOutputKey(parseBoolean(vars.get(ENV_WARN_MISSING_OUTPUT_KEY), DEFAULT_WARN_MISSING_OUTPUT_KEY))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .strictValidation(strictValidation)
                .defaultLoopIterations(defaultLoopIterations)
                .loopIterationsWarnAbove(loopIterationsWarnAbove)
                .warnMissingOutputKey(warnMissingOutputKey);
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        return defaultValue;
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        int parsed = parseInt(value, defaultValue);
        return parsed > 0 ? parsed : defaultValue;
    }

    @Override
    public String toString() {
        return "CompilerConfig{strictValidation=" + strictValidation
                + ", defaultLoopIterations=" + defaultLoopIterations
                + ", loopIterationsWarnAbove=" + loopIterationsWarnAbove
                + ", warnMissingOutputKey=" + warnMissingOutputKey + "}";
    }

    public static final class Builder {
        private boolean strictValidation = DEFAULT_STRICT_VALIDATION;
        private int defaultLoopIterations = DEFAULT_LOOP_ITERATIONS;
        private int loopIterationsWarnAbove = DEFAULT_LOOP_ITERATIONS_WARN_ABOVE;
        private boolean warnMissingOutputKey = DEFAULT_WARN_MISSING_OUTPUT_KEY;

        public Builder strictValidation(boolean strictValidation) {
            this.strictValidation = strictValidation;
            return this;
        }

        public Builder defaultLoopIterations(int defaultLoopIterations) {
            if (defaultLoopIterations <= 0) {
                throw new IllegalArgumentException("defaultLoopIterations must be positive, got: " + defaultLoopIterations);
            }
            this.defaultLoopIterations = defaultLoopIterations;
            return this;
        }

        public Builder loopIterationsWarnAbove(int loopIterationsWarnAbove) {
            if (loopIterationsWarnAbove <= 0) {
                throw new IllegalArgumentException("loopIterationsWarnAbove must be positive, got: " + loopIterationsWarnAbove);
            }
            this.loopIterationsWarnAbove = loopIterationsWarnAbove;
            return this;
        }

        public Builder warnMissingOutputKey(boolean warnMissingOutputKey) {
            this.warnMissingOutputKey = warnMissingOutputKey;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }
    }
}
