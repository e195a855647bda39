/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Objects;

/**
 * The equation {@code left = right}.
 */
public record Equality(Term left, Term right) {

    public Equality {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
    }

    public static Equality of(Term left, Term right) {
        return new Equality(left, right);
    }

    public static Equality of(Term left, long value) {
        return new Equality(left, new IntegerTerm(value));
    }

    @Override
    public String toString() {
        return left + " = " + right;
    }
}
