/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

import it.unimi.dsi.fastutil.ints.IntList;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Assignment of lengths and literal words to terms, witnessing that a constraint
 * set is satisfiable under the string theory. Immutable.
 */
public final class StringModel {

    public static final StringModel EMPTY = new StringModel(Map.of());

    private final Map<Term, ModelValue> values;

    private StringModel(Map<Term, ModelValue> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static StringModel of(Map<Term, ModelValue> values) {
        return new StringModel(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<Term, ModelValue> values() {
        return values;
    }

    public Optional<ModelValue> get(Term term) {
        return Optional.ofNullable(values.get(term));
    }

    /**
     * @return the length (integer) assignments, in insertion order
     */
    public Map<Term, Long> lengths() {
        Map<Term, Long> result = new LinkedHashMap<>();
        for (Map.Entry<Term, ModelValue> entry : values.entrySet()) {
            if (entry.getValue() instanceof ModelValue.Length length) {
                result.put(entry.getKey(), length.value());
            }
        }
        return result;
    }

    /**
     * @return the word assignments, in insertion order
     */
    public Map<Term, IntList> words() {
        Map<Term, IntList> result = new LinkedHashMap<>();
        for (Map.Entry<Term, ModelValue> entry : values.entrySet()) {
            if (entry.getValue() instanceof ModelValue.Word word) {
                result.put(entry.getKey(), word.codes());
            }
        }
        return result;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StringModel other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "StringModel" + values;
    }

    public static final class Builder {
        private final Map<Term, ModelValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder length(Term term, long value) {
            values.put(Objects.requireNonNull(term), new ModelValue.Length(value));
            return this;
        }

        public Builder word(Term term, String text) {
            values.put(Objects.requireNonNull(term), ModelValue.Word.of(text));
            return this;
        }

        public Builder word(Term term, IntList codes) {
            values.put(Objects.requireNonNull(term), new ModelValue.Word(codes));
            return this;
        }

        public StringModel build() {
            return new StringModel(values);
        }
    }
}
