/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.runtime.model;

import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.FunctionTerm;
import com.ostrich.strings.api.model.IntegerTerm;
import com.ostrich.strings.api.model.Term;
import com.ostrich.strings.catalogue.BuiltinFunction;
import com.ostrich.strings.catalogue.SymbolCatalogue;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;

/**
 * Encodes a word as {@code str.cons(c1, str.cons(c2, ... str.empty))}.
 */
public final class ConsStringTermBuilder implements IStringTermBuilder {

    private final FunctionSymbol cons;
    private final FunctionTerm empty;
    private final int alphabetSize;

    public ConsStringTermBuilder(SymbolCatalogue catalogue) {
        this.cons = catalogue.function(BuiltinFunction.STR_CONS);
        this.empty = new FunctionTerm(catalogue.function(BuiltinFunction.STR_EMPTY), List.of());
        this.alphabetSize = catalogue.alphabetSize();
    }

    @Override
    public Term literal(IntList word) {
        Term result = empty;
        for (int i = word.size() - 1; i >= 0; i--) {
            int code = word.getInt(i);
            if (code < 0 || code >= alphabetSize) {
                throw new IllegalArgumentException(
                        "Character code " + code + " outside alphabet of size " + alphabetSize);
            }
            result = new FunctionTerm(cons, List.of(new IntegerTerm(code), result));
        }
        return result;
    }
}
