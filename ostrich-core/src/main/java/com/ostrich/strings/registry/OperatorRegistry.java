/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.registry;

import com.ostrich.strings.api.CompiledTransducer;
import com.ostrich.strings.api.IOperatorRegistry;
import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.OperatorEntry;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.SymbolCategory;
import com.ostrich.strings.catalogue.BuiltinFunction;
import com.ostrich.strings.catalogue.BuiltinPredicate;
import com.ostrich.strings.catalogue.ExtraFunction;
import com.ostrich.strings.catalogue.SymbolCatalogue;
import com.ostrich.strings.preop.TransducerPreOp;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Frozen mapping from every predicate of a {@link SymbolCatalogue} to the PreOp
 * implementing it.
 *
 * <p>Instances are immutable and safe to share between concurrent proof branches.
 */
public final class OperatorRegistry implements IOperatorRegistry {
    private static final Logger logger = Logger.getLogger(OperatorRegistry.class.getName());

    private final SymbolCatalogue catalogue;
    private final Map<PredicateSymbol, OperatorEntry> entries;

    private OperatorRegistry(SymbolCatalogue catalogue, Map<PredicateSymbol, OperatorEntry> entries) {
        this.catalogue = catalogue;
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Builds the registry for a catalogue.
     *
     * @param compiledTransducers compiled form of every transducer predicate, by name
     * @throws IllegalStateException if a transducer predicate has no compiled form
     */
    public static OperatorRegistry build(SymbolCatalogue catalogue, Map<String, CompiledTransducer> compiledTransducers) {
        Map<PredicateSymbol, OperatorEntry> entries = new LinkedHashMap<>();

        for (BuiltinPredicate builtin : BuiltinPredicate.values()) {
            PredicateSymbol p = catalogue.predicate(builtin);
            // str.in_re(s, re): the regex constrains the string
            OperatorEntry entry = builtin == BuiltinPredicate.STR_IN_RE
                    ? new OperatorEntry(p, SymbolCategory.PREDEFINED, builtin.operation(),
                            Selectors.argument(1), Selectors.result(0))
                    : new OperatorEntry(p, SymbolCategory.PREDEFINED, builtin.operation(),
                            Selectors.allArguments(), Selectors.result(0));
            register(entries, entry);
        }

        for (BuiltinFunction builtin : BuiltinFunction.values()) {
            register(entries, new OperatorEntry(catalogue.predicate(builtin), SymbolCategory.PREDEFINED,
                    builtin.operation(), Selectors.functionArguments(), Selectors.functionResult()));
        }

        for (ExtraFunction extra : catalogue.extraFunctions()) {
            register(entries, new OperatorEntry(catalogue.functionalPredicate(extra.function()),
                    SymbolCategory.EXTRA_FUNCTION, extra.operation(),
                    extra.argumentSelector(), extra.resultSelector()));
        }

        for (Map.Entry<String, PredicateSymbol> t : catalogue.transducerPredicates().entrySet()) {
            CompiledTransducer compiled = compiledTransducers.get(t.getKey());
            if (compiled == null) {
                throw new IllegalStateException("No compiled form for transducer '" + t.getKey() + "'");
            }
            register(entries, new OperatorEntry(t.getValue(), SymbolCategory.TRANSDUCER,
                    new TransducerPreOp(compiled), Selectors.argument(0), Selectors.result(1)));
        }

        for (PredicateSymbol p : catalogue.predicates()) {
            if (!entries.containsKey(p)) {
                throw new IllegalStateException("Predicate without operator: " + p);
            }
        }

        logger.fine(String.format("OperatorRegistry built: %d entries", entries.size()));
        return new OperatorRegistry(catalogue, entries);
    }

    private static void register(Map<PredicateSymbol, OperatorEntry> entries, OperatorEntry entry) {
        if (entries.putIfAbsent(entry.predicate(), entry) != null) {
            throw new IllegalStateException("Duplicate operator for predicate " + entry.predicate());
        }
    }

    @Override
    public Optional<OperatorEntry> lookup(PredicateSymbol predicate) {
        return Optional.ofNullable(entries.get(predicate));
    }

    /**
     * Looks up the entry of a function through its relational form.
     */
    public Optional<OperatorEntry> lookup(FunctionSymbol function) {
        return lookup(catalogue.functionalPredicate(function));
    }

    @Override
    public Collection<OperatorEntry> entries() {
        return entries.values();
    }

    @Override
    public int size() {
        return entries.size();
    }
}
