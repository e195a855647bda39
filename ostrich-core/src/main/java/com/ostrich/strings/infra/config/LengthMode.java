/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.infra.config;

import java.util.Locale;

/**
 * Length reasoning mode of the string theory.
 */
public enum LengthMode {
    OFF,
    ON,
    /** Enabled; the model search decides per problem how eagerly to use it */
    AUTO;

    public static LengthMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid length mode '" + value + "', expected one of off, on, auto", e);
        }
    }
}
