/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.theory;

import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.SatSoundness;
import com.ostrich.strings.api.model.TermOrder;
import com.ostrich.strings.catalogue.SymbolCatalogue;
import com.ostrich.strings.infra.config.OstrichFlags;
import com.ostrich.strings.registry.OperatorRegistry;
import com.ostrich.strings.session.SolvingSession;
import com.ostrich.strings.support.SupportedPredicates;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The frozen string theory: symbol catalogue, operator registry and support
 * classification for one configuration.
 *
 * <p>This type has no registration methods; it is produced exactly once by the
 * theory builder and is immutable and thread-safe afterwards. The only mutable
 * state it references is the {@link SolvingSession}'s incompleteness flag.
 */
public final class StringTheory {
    private static final Logger logger = Logger.getLogger(StringTheory.class.getName());

    /** Number of characters, fixed process-wide */
    public static final int ALPHABET_SIZE = 1 << 16;

    private final String name;
    private final SymbolCatalogue catalogue;
    private final OperatorRegistry registry;
    private final SupportedPredicates supportedPredicates;
    private final OstrichFlags flags;
    private final SolvingSession session;

    public StringTheory(String name, SymbolCatalogue catalogue, OperatorRegistry registry,
                        SupportedPredicates supportedPredicates, OstrichFlags flags, SolvingSession session) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.supportedPredicates = Objects.requireNonNull(supportedPredicates, "supportedPredicates must not be null");
        this.flags = Objects.requireNonNull(flags, "flags must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    /**
     * Soundness gate run on every constraint set before it is decided.
     *
     * <p>Raises the session's incompleteness flag if the set mentions an
     * unsupported predicate. Performs no rewriting.
     *
     * @return {@code facts}, unchanged
     */
    public ConstraintSet preprocess(ConstraintSet facts, TermOrder order) {
        if (supportedPredicates.containsUnsupported(facts.predicates())) {
            if (session.markIncomplete("unsupported predicates in " + unsupportedIn(facts))) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Incompleteness raised while preprocessing " + facts);
                }
            }
        }
        return facts;
    }

    private List<String> unsupportedIn(ConstraintSet facts) {
        return facts.predicates().stream()
                .filter(supportedPredicates.unsupported()::contains)
                .map(PredicateSymbol::name)
                .toList();
    }

    /**
     * Satisfiability answers are sound for elementary and existential problems only.
     */
    public boolean isSoundForSat(SatSoundness config) {
        return switch (config) {
            case ELEMENTARY, EXISTENTIAL -> true;
            case GENERAL -> false;
        };
    }

    /**
     * @return whether the facts share at least one predicate with this theory
     */
    public boolean mentionsTheory(ConstraintSet facts) {
        for (PredicateSymbol p : facts.predicates()) {
            if (catalogue.contains(p)) {
                return true;
            }
        }
        return false;
    }

    // --- Public Accessors ---

    public String name() {
        return name;
    }

    public SymbolCatalogue catalogue() {
        return catalogue;
    }

    public OperatorRegistry registry() {
        return registry;
    }

    public SupportedPredicates supportedPredicates() {
        return supportedPredicates;
    }

    public OstrichFlags flags() {
        return flags;
    }

    public SolvingSession session() {
        return session;
    }

    public int alphabetSize() {
        return catalogue.alphabetSize();
    }

    public List<FunctionSymbol> functions() {
        return catalogue.functions();
    }

    public List<PredicateSymbol> predicates() {
        return catalogue.predicates();
    }

    @Override
    public String toString() {
        return name + "{predicates=" + catalogue.predicates().size()
                + ", unsupported=" + supportedPredicates.unsupported().size()
                + ", transducers=" + catalogue.transducerPredicates().size()
                + ", flags=" + flags + "}";
    }
}
