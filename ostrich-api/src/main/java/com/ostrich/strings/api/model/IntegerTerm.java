/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Set;

/**
 * An integer literal; also used for character codes.
 */
public record IntegerTerm(long value) implements Term {

    @Override
    public Set<ConstantTerm> constants() {
        return Set.of();
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
