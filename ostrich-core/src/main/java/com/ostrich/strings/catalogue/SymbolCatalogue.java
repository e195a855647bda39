/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.catalogue;

import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.api.model.SymbolCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sorts, functions and predicates of the string theory for a fixed alphabet.
 *
 * <p>Every function {@code f : s1 .. sn -> s} is paired with a functional
 * predicate of arity {@code n + 1}; the catalogue keeps the mapping in both
 * directions so that the function behind a predicate is a plain lookup.
 *
 * <p>The catalogue is immutable once constructed.
 */
public final class SymbolCatalogue {

    private final int alphabetSize;
    private final Sort charSort;
    private final List<Sort> sorts;

    private final Map<BuiltinFunction, FunctionSymbol> builtinFunctions = new EnumMap<>(BuiltinFunction.class);
    private final Map<BuiltinPredicate, PredicateSymbol> builtinPredicates = new EnumMap<>(BuiltinPredicate.class);
    private final List<ExtraFunction> extraFunctions;
    private final Map<String, PredicateSymbol> transducerPredicates;

    private final List<FunctionSymbol> functions;
    private final List<PredicateSymbol> predicates;
    private final Map<FunctionSymbol, PredicateSymbol> functionPredicates;
    private final Map<PredicateSymbol, FunctionSymbol> predicateFunctions;
    private final Map<PredicateSymbol, SymbolCategory> categories;
    private final Map<String, ExtensionSymbol> extensionSymbols;

    /**
     * @param alphabetSize     number of characters, fixed for the lifetime of the process
     * @param extraFunctions   user functions, in registration order
     * @param transducerNames  names of the transducer predicates, in registration order
     * @throws IllegalArgumentException if two symbols share a name
     */
    public SymbolCatalogue(int alphabetSize, List<ExtraFunction> extraFunctions, List<String> transducerNames) {
        this.alphabetSize = alphabetSize;
        this.charSort = Sort.charSort(alphabetSize);
        this.sorts = List.of(charSort, Sort.STRING, Sort.REGEX);
        this.extraFunctions = List.copyOf(extraFunctions);

        Map<String, Object> names = new HashMap<>();
        List<FunctionSymbol> allFunctions = new ArrayList<>();
        List<PredicateSymbol> allPredicates = new ArrayList<>();
        Map<FunctionSymbol, PredicateSymbol> funToPred = new LinkedHashMap<>();
        Map<PredicateSymbol, FunctionSymbol> predToFun = new HashMap<>();
        Map<PredicateSymbol, SymbolCategory> cats = new HashMap<>();

        // Predefined predicates come first, then the relational forms of all functions
        for (BuiltinPredicate builtin : BuiltinPredicate.values()) {
            PredicateSymbol p = new PredicateSymbol(builtin.symbolName(), resolve(builtin.argumentKinds()));
            claim(names, p.name(), p);
            builtinPredicates.put(builtin, p);
            allPredicates.add(p);
            cats.put(p, SymbolCategory.PREDEFINED);
        }

        for (BuiltinFunction builtin : BuiltinFunction.values()) {
            FunctionSymbol f = new FunctionSymbol(builtin.symbolName(), resolve(builtin.argumentKinds()),
                    resolve(builtin.resultKind()), builtin.isPartial());
            claim(names, f.name(), f);
            builtinFunctions.put(builtin, f);
            allFunctions.add(f);
            PredicateSymbol p = relationalForm(f);
            funToPred.put(f, p);
            predToFun.put(p, f);
            allPredicates.add(p);
            cats.put(p, SymbolCategory.PREDEFINED);
        }

        Map<String, ExtensionSymbol> extensions = new LinkedHashMap<>();
        for (ExtraFunction extra : this.extraFunctions) {
            FunctionSymbol f = extra.function();
            claim(names, f.name(), f);
            allFunctions.add(f);
            PredicateSymbol p = relationalForm(f);
            funToPred.put(f, p);
            predToFun.put(p, f);
            allPredicates.add(p);
            cats.put(p, SymbolCategory.EXTRA_FUNCTION);
            extensions.put(f.name(), new ExtensionSymbol(f.name(), SymbolCategory.EXTRA_FUNCTION, f, p));
        }

        Map<String, PredicateSymbol> transducers = new LinkedHashMap<>();
        for (String name : transducerNames) {
            PredicateSymbol p = new PredicateSymbol(name, List.of(Sort.STRING, Sort.STRING));
            claim(names, name, p);
            transducers.put(name, p);
            allPredicates.add(p);
            cats.put(p, SymbolCategory.TRANSDUCER);
            extensions.put(name, new ExtensionSymbol(name, SymbolCategory.TRANSDUCER, null, p));
        }

        this.functions = List.copyOf(allFunctions);
        this.predicates = List.copyOf(allPredicates);
        this.functionPredicates = Collections.unmodifiableMap(funToPred);
        this.predicateFunctions = Collections.unmodifiableMap(predToFun);
        this.categories = Collections.unmodifiableMap(cats);
        this.transducerPredicates = Collections.unmodifiableMap(transducers);
        this.extensionSymbols = Collections.unmodifiableMap(extensions);
    }

    private static PredicateSymbol relationalForm(FunctionSymbol f) {
        List<Sort> argumentSorts = new ArrayList<>(f.argumentSorts());
        argumentSorts.add(f.resultSort());
        return new PredicateSymbol(f.name(), argumentSorts);
    }

    /**
     * Whether {@code name} belongs to a predefined function or predicate and so
     * cannot be used for an extra function or transducer.
     */
    public static boolean isBuiltinName(String name) {
        for (BuiltinPredicate builtin : BuiltinPredicate.values()) {
            if (builtin.symbolName().equals(name)) {
                return true;
            }
        }
        for (BuiltinFunction builtin : BuiltinFunction.values()) {
            if (builtin.symbolName().equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static void claim(Map<String, Object> names, String name, Object symbol) {
        Object previous = names.putIfAbsent(name, symbol);
        if (previous != null) {
            throw new IllegalArgumentException("Duplicate symbol name: " + name);
        }
    }

    private List<Sort> resolve(List<Sort.Kind> kinds) {
        List<Sort> result = new ArrayList<>(kinds.size());
        for (Sort.Kind kind : kinds) {
            result.add(resolve(kind));
        }
        return result;
    }

    private Sort resolve(Sort.Kind kind) {
        return switch (kind) {
            case CHAR -> charSort;
            case STRING -> Sort.STRING;
            case REGEX -> Sort.REGEX;
            case INTEGER -> Sort.INTEGER;
        };
    }

    // --- Public Accessors ---

    public int alphabetSize() {
        return alphabetSize;
    }

    public Sort charSort() {
        return charSort;
    }

    public Sort stringSort() {
        return Sort.STRING;
    }

    public Sort regexSort() {
        return Sort.REGEX;
    }

    /**
     * @return the domain sorts: characters, strings and regular languages
     */
    public List<Sort> sorts() {
        return sorts;
    }

    public List<FunctionSymbol> functions() {
        return functions;
    }

    /**
     * @return predefined predicates, relational forms of all functions and
     *         transducer predicates
     */
    public List<PredicateSymbol> predicates() {
        return predicates;
    }

    public List<ExtraFunction> extraFunctions() {
        return extraFunctions;
    }

    public Map<String, PredicateSymbol> transducerPredicates() {
        return transducerPredicates;
    }

    public FunctionSymbol function(BuiltinFunction builtin) {
        return builtinFunctions.get(builtin);
    }

    public PredicateSymbol predicate(BuiltinPredicate builtin) {
        return builtinPredicates.get(builtin);
    }

    /**
     * @return the relational form of a predefined function
     */
    public PredicateSymbol predicate(BuiltinFunction builtin) {
        return functionPredicates.get(builtinFunctions.get(builtin));
    }

    public PredicateSymbol functionalPredicate(FunctionSymbol function) {
        PredicateSymbol p = functionPredicates.get(Objects.requireNonNull(function, "function must not be null"));
        if (p == null) {
            throw new IllegalArgumentException("Function not in catalogue: " + function);
        }
        return p;
    }

    /**
     * Reverse of {@link #functionalPredicate(FunctionSymbol)}.
     *
     * @return the function a predicate encodes, empty for genuine predicates
     */
    public Optional<FunctionSymbol> originatingFunction(PredicateSymbol predicate) {
        return Optional.ofNullable(predicateFunctions.get(predicate));
    }

    public Optional<SymbolCategory> category(PredicateSymbol predicate) {
        return Optional.ofNullable(categories.get(predicate));
    }

    public boolean contains(PredicateSymbol predicate) {
        return categories.containsKey(predicate);
    }

    /**
     * Resolves an extension symbol (extra function or transducer) by name.
     */
    public Optional<ExtensionSymbol> extensionSymbol(String name) {
        return Optional.ofNullable(extensionSymbols.get(name));
    }

    public Map<String, ExtensionSymbol> extensionSymbols() {
        return extensionSymbols;
    }

    public PredicateSymbol emptyPredicate() {
        return predicate(BuiltinFunction.STR_EMPTY);
    }

    public PredicateSymbol consPredicate() {
        return predicate(BuiltinFunction.STR_CONS);
    }

    public PredicateSymbol concatPredicate() {
        return predicate(BuiltinFunction.STR_CONCAT);
    }
}
