/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.catalogue;

import com.ostrich.strings.api.PreOp;
import com.ostrich.strings.api.model.Atom;
import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.api.model.Term;
import com.ostrich.strings.preop.BuiltinPreOp;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A user-registered string function together with the PreOp implementing it.
 *
 * <p>The selectors operate on atoms of the function's relational form, whose
 * last argument is the function result.
 */
public record ExtraFunction(
        FunctionSymbol function,
        PreOp operation,
        Function<Atom, List<Term>> argumentSelector,
        Function<Atom, Term> resultSelector
) {
    public static final String REVERSE_NAME = "str.reverse";

    public ExtraFunction {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(argumentSelector, "argumentSelector must not be null");
        Objects.requireNonNull(resultSelector, "resultSelector must not be null");
    }

    public String name() {
        return function.name();
    }

    /**
     * {@code str.reverse : String -> String}, registered by default.
     */
    public static ExtraFunction reverse() {
        return new ExtraFunction(
                FunctionSymbol.of(REVERSE_NAME, List.of(Sort.STRING), Sort.STRING),
                BuiltinPreOp.REVERSE,
                a -> List.of(a.get(0)),
                a -> a.get(1));
    }
}
