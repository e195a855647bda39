/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.infra.config;

import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Configuration of the string theory.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables:
 * <pre>
 * OSTRICH_EAGER=true
 * OSTRICH_LENGTH=off|on|auto
 * OSTRICH_FORWARD=true
 * OSTRICH_DECISION_CACHE_SIZE=3
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults with environment overrides
 * OstrichConfig config = OstrichConfig.loadDefault();
 *
 * // Explicit configuration
 * OstrichConfig config = OstrichConfig.builder()
 *     .lengthMode(LengthMode.ON)
 *     .decisionCacheSize(3)
 *     .build();
 * }</pre>
 */
public final class OstrichConfig {

    private static final Logger logger = Logger.getLogger(OstrichConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_EAGER = "OSTRICH_EAGER";
    static final String ENV_LENGTH = "OSTRICH_LENGTH";
    static final String ENV_FORWARD = "OSTRICH_FORWARD";
    static final String ENV_DECISION_CACHE_SIZE = "OSTRICH_DECISION_CACHE_SIZE";

    public static final int DEFAULT_DECISION_CACHE_SIZE = 3;

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final boolean eagerAutomataOperations;
    private final LengthMode lengthMode;
    private final boolean forwardApprox;
    private final int decisionCacheSize;

    private OstrichConfig(Builder builder) {
        this.eagerAutomataOperations = builder.eagerAutomataOperations;
        this.lengthMode = builder.lengthMode;
        this.forwardApprox = builder.forwardApprox;
        this.decisionCacheSize = builder.decisionCacheSize;
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults overridden by the process environment.
     */
    public static OstrichConfig loadDefault() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Defaults overridden by the given variables; unknown keys are ignored.
     *
     * @throws IllegalArgumentException if a recognised variable has an invalid value
     */
    public static OstrichConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();

        String eager = env.get(ENV_EAGER);
        if (eager != null) {
            builder.eagerAutomataOperations(parseBoolean(ENV_EAGER, eager));
        }
        String length = env.get(ENV_LENGTH);
        if (length != null) {
            builder.lengthMode(LengthMode.parse(length));
        }
        String forward = env.get(ENV_FORWARD);
        if (forward != null) {
            builder.forwardApprox(parseBoolean(ENV_FORWARD, forward));
        }
        String cacheSize = env.get(ENV_DECISION_CACHE_SIZE);
        if (cacheSize != null) {
            builder.decisionCacheSize(parseInt(ENV_DECISION_CACHE_SIZE, cacheSize));
        }

        OstrichConfig config = builder.build();
        logger.fine("Loaded configuration: " + config);
        return config;
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "true", "on", "yes", "1" -> true;
            case "false", "off", "no", "0" -> false;
            default -> throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
        };
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public boolean eagerAutomataOperations() {
        return eagerAutomataOperations;
    }

    public LengthMode lengthMode() {
        return lengthMode;
    }

    public boolean forwardApprox() {
        return forwardApprox;
    }

    public int decisionCacheSize() {
        return decisionCacheSize;
    }

    public OstrichFlags toFlags() {
        return new OstrichFlags(eagerAutomataOperations, lengthMode, forwardApprox);
    }

    @Override
    public String toString() {
        return "OstrichConfig{eager=" + eagerAutomataOperations
                + ", length=" + lengthMode
                + ", forward=" + forwardApprox
                + ", decisionCacheSize=" + decisionCacheSize + "}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean eagerAutomataOperations = false;
        private LengthMode lengthMode = LengthMode.AUTO;
        private boolean forwardApprox = false;
        private int decisionCacheSize = DEFAULT_DECISION_CACHE_SIZE;

        private Builder() {
        }

        public Builder eagerAutomataOperations(boolean eager) {
            this.eagerAutomataOperations = eager;
            return this;
        }

        public Builder lengthMode(LengthMode lengthMode) {
            if (lengthMode == null) {
                throw new IllegalArgumentException("lengthMode must not be null");
            }
            this.lengthMode = lengthMode;
            return this;
        }

        public Builder forwardApprox(boolean forward) {
            this.forwardApprox = forward;
            return this;
        }

        public Builder decisionCacheSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("Decision cache size must be positive, got " + size);
            }
            this.decisionCacheSize = size;
            return this;
        }

        public Builder flags(OstrichFlags flags) {
            this.eagerAutomataOperations = flags.eagerAutomataOperations();
            this.forwardApprox = flags.forwardApprox();
            return lengthMode(flags.useLength());
        }

        public OstrichConfig build() {
            return new OstrichConfig(this);
        }
    }
}
