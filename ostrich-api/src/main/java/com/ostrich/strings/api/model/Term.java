/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import java.util.Set;

/**
 * A host-level term.
 */
public interface Term {

    /**
     * @return the variables occurring in this term
     */
    Set<ConstantTerm> constants();
}
