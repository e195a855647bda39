/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Objects;

/**
 * A domain sort of the string theory.
 *
 * <p>Character sorts are bounded integer intervals {@code [lowerBound, upperBound]};
 * all other sorts leave the bounds at zero.
 */
public record Sort(String name, Kind kind, int lowerBound, int upperBound) {

    public enum Kind {
        /** Bounded integer interval of character codes */
        CHAR,
        /** Finite sequences of characters */
        STRING,
        /** Opaque, uninterpreted regular languages */
        REGEX,
        /** Host integers (lengths, indexes) */
        INTEGER
    }

    public static final Sort STRING = new Sort("String", Kind.STRING, 0, 0);
    public static final Sort REGEX = new Sort("RegLan", Kind.REGEX, 0, 0);
    public static final Sort INTEGER = new Sort("Int", Kind.INTEGER, 0, 0);

    public Sort {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(
                    "Empty sort interval [" + lowerBound + ", " + upperBound + "] for " + name);
        }
    }

    /**
     * Creates the character sort {@code [0, alphabetSize - 1]}.
     */
    public static Sort charSort(int alphabetSize) {
        if (alphabetSize <= 0) {
            throw new IllegalArgumentException("Alphabet size must be positive, got " + alphabetSize);
        }
        return new Sort("Char", Kind.CHAR, 0, alphabetSize - 1);
    }

    public boolean contains(int code) {
        return kind == Kind.CHAR && code >= lowerBound && code <= upperBound;
    }

    @Override
    public String toString() {
        return kind == Kind.CHAR ? name + "[" + lowerBound + ", " + upperBound + "]" : name;
    }
}
