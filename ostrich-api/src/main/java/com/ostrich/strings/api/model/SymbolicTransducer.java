/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Algebraic description of a string transducer as supplied by extension code.
 *
 * <p>Each transition reads one character in {@code [lower, upper]} and emits the
 * {@code output} template, where {@code $} stands for the character read.
 * Structural checks (reachable states, finiteness) are left to the transducer
 * compiler.
 */
public record SymbolicTransducer(int initialState, IntSet acceptingStates, List<Transition> transitions) {

    public record Transition(int source, int target, int lower, int upper, String output) {
        public Transition {
            Objects.requireNonNull(output, "output must not be null");
        }
    }

    public SymbolicTransducer {
        acceptingStates = IntSets.unmodifiable(new IntOpenHashSet(acceptingStates));
        transitions = List.copyOf(transitions);
    }

    public static Builder builder(int initialState) {
        return new Builder(initialState);
    }

    public static final class Builder {
        private final int initialState;
        private final IntSet acceptingStates = new IntOpenHashSet();
        private final List<Transition> transitions = new ArrayList<>();

        private Builder(int initialState) {
            this.initialState = initialState;
        }

        public Builder accepting(int state) {
            acceptingStates.add(state);
            return this;
        }

        public Builder transition(int source, int target, int lower, int upper, String output) {
            transitions.add(new Transition(source, target, lower, upper, output));
            return this;
        }

        public SymbolicTransducer build() {
            return new SymbolicTransducer(initialState, acceptingStates, transitions);
        }
    }
}
