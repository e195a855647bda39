/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Optional;

/**
 * Concrete finite-state transducer over the character alphabet, produced once per
 * named transducer by an {@link ITransducerCompiler}.
 */
public interface CompiledTransducer {

    String name();

    int stateCount();

    /**
     * Runs the transducer on a word.
     *
     * @return the output for functional transducers, empty if the input is
     *         rejected or the relation is not functional
     */
    default Optional<IntList> apply(IntList input) {
        return Optional.empty();
    }
}
