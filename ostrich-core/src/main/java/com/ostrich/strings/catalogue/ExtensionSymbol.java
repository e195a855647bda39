/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.catalogue;

import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.SymbolCategory;

import java.util.Optional;

/**
 * A symbol contributed by an extension, as resolved by name from input formulas:
 * either an extra function (with its relational predicate) or a transducer predicate.
 */
public record ExtensionSymbol(String name, SymbolCategory category, FunctionSymbol function,
                              PredicateSymbol predicate) {

    public Optional<FunctionSymbol> asFunction() {
        return Optional.ofNullable(function);
    }

    public boolean isFunction() {
        return function != null;
    }
}
