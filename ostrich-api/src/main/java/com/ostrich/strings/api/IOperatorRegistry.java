/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api;

import com.ostrich.strings.api.model.OperatorEntry;
import com.ostrich.strings.api.model.PredicateSymbol;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only view of the operator registry handed to the string model search.
 *
 * <p>Every predicate of the theory has exactly one entry.
 */
public interface IOperatorRegistry {

    Optional<OperatorEntry> lookup(PredicateSymbol predicate);

    Collection<OperatorEntry> entries();

    int size();
}
