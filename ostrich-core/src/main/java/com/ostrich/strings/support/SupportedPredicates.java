/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.support;

import com.ostrich.strings.api.model.PredicateSymbol;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Partition of the declared predicates into those the theory decides completely
 * and those it does not.
 */
public record SupportedPredicates(Set<PredicateSymbol> supported, Set<PredicateSymbol> unsupported) {

    public SupportedPredicates {
        supported = Collections.unmodifiableSet(new LinkedHashSet<>(supported));
        unsupported = Collections.unmodifiableSet(new LinkedHashSet<>(unsupported));
    }

    public boolean isSupported(PredicateSymbol predicate) {
        return supported.contains(predicate);
    }

    public boolean containsUnsupported(Collection<PredicateSymbol> predicates) {
        if (unsupported.isEmpty()) {
            return false;
        }
        for (PredicateSymbol p : predicates) {
            if (unsupported.contains(p)) {
                return true;
            }
        }
        return false;
    }
}
