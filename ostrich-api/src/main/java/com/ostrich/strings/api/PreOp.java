/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;
import java.util.Optional;

/**
 * Automata-level semantic operation implementing one string function or relation.
 *
 * <p>The string model search propagates regular constraints backwards through a
 * PreOp; this interface only fixes the identity of the operation and its forward
 * evaluation on concrete words, which model search uses to check candidate
 * assignments. Implementations must be immutable.
 */
public interface PreOp {

    /**
     * @return a stable, human-readable name of the operation
     */
    String name();

    /**
     * Evaluates the operation on concrete words.
     *
     * <p>Character arguments are passed as singleton lists.
     *
     * @param arguments argument words, in the order of the entry's argument selector
     * @return the result word, or empty if the operation is not word-valued or
     *         cannot be evaluated forwards
     */
    default Optional<IntList> eval(List<IntList> arguments) {
        return Optional.empty();
    }
}
