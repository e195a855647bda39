/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.support;

import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.catalogue.BuiltinFunction;
import com.ostrich.strings.catalogue.BuiltinPredicate;
import com.ostrich.strings.catalogue.ExtensionSymbol;
import com.ostrich.strings.catalogue.Support;
import com.ostrich.strings.catalogue.SymbolCatalogue;
import com.ostrich.strings.infra.config.OstrichFlags;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes which predicates the theory decides completely under a configuration.
 *
 * <p>A predicate is supported iff it is a complete core string/regex predicate,
 * or it is {@code str.len} with length reasoning enabled, or it belongs to an
 * extension (extra function or transducer). Pure and deterministic.
 */
public final class SupportClassifier {

    private SupportClassifier() {
    }

    public static SupportedPredicates classify(SymbolCatalogue catalogue, OstrichFlags flags) {
        Set<PredicateSymbol> supported = new LinkedHashSet<>();

        for (BuiltinPredicate builtin : BuiltinPredicate.values()) {
            if (builtin.support() == Support.COMPLETE) {
                supported.add(catalogue.predicate(builtin));
            }
        }

        for (BuiltinFunction builtin : BuiltinFunction.values()) {
            if (isSupported(builtin.support(), flags)) {
                supported.add(catalogue.predicate(builtin));
            }
        }

        for (ExtensionSymbol extension : catalogue.extensionSymbols().values()) {
            supported.add(extension.predicate());
        }

        Set<PredicateSymbol> unsupported = new LinkedHashSet<>(catalogue.predicates());
        unsupported.removeAll(supported);

        return new SupportedPredicates(supported, unsupported);
    }

    private static boolean isSupported(Support support, OstrichFlags flags) {
        return switch (support) {
            case COMPLETE -> true;
            case WITH_LENGTH -> flags.lengthReasoningEnabled();
            case NONE -> false;
        };
    }
}
