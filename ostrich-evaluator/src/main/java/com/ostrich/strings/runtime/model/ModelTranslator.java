/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.runtime.model;

import com.ostrich.strings.api.model.Equality;
import com.ostrich.strings.api.model.ModelValue;
import com.ostrich.strings.api.model.StringModel;
import com.ostrich.strings.api.model.Term;
import com.ostrich.strings.api.model.TermOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a string model into equalities the host can assert directly.
 *
 * <p>A cached model may stem from an earlier proof state, so it can mention
 * variables the current term order no longer knows. Assignments to such terms
 * are dropped. No new variables are ever introduced.
 */
public final class ModelTranslator {
    private static final Logger logger = Logger.getLogger(ModelTranslator.class.getName());

    private final IStringTermBuilder termBuilder;

    public ModelTranslator(IStringTermBuilder termBuilder) {
        this.termBuilder = Objects.requireNonNull(termBuilder, "termBuilder must not be null");
    }

    /**
     * @return word equalities {@code v = literal(w)} followed by length
     *         equalities {@code v = n}, for terms covered by {@code order}
     */
    public List<Equality> translate(StringModel model, TermOrder order) {
        List<Equality> words = new ArrayList<>();
        List<Equality> lengths = new ArrayList<>();
        int dropped = 0;

        for (Map.Entry<Term, ModelValue> entry : model.values().entrySet()) {
            Term term = entry.getKey();
            if (!order.covers(term)) {
                dropped++;
                continue;
            }
            if (entry.getValue() instanceof ModelValue.Length length) {
                lengths.add(Equality.of(term, length.value()));
            } else if (entry.getValue() instanceof ModelValue.Word word) {
                words.add(Equality.of(term, termBuilder.literal(word.codes())));
            }
        }

        if (dropped > 0 && logger.isLoggable(Level.FINE)) {
            logger.fine("Dropped " + dropped + " stale model assignments not covered by " + order);
        }

        List<Equality> result = new ArrayList<>(words.size() + lengths.size());
        result.addAll(words);
        result.addAll(lengths);
        return result;
    }
}
