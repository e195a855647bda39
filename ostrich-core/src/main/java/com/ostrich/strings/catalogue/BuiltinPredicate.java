/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.catalogue;

import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.preop.BuiltinPreOp;

import java.util.List;

import static com.ostrich.strings.api.model.Sort.Kind.REGEX;
import static com.ostrich.strings.api.model.Sort.Kind.STRING;

/**
 * Predefined string predicates.
 */
public enum BuiltinPredicate {
    STR_IN_RE("str.in_re", List.of(STRING, REGEX), BuiltinPreOp.REGEX_MEMBERSHIP, Support.COMPLETE),
    STR_PREFIXOF("str.prefixof", List.of(STRING, STRING), BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_SUFFIXOF("str.suffixof", List.of(STRING, STRING), BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_CONTAINS("str.contains", List.of(STRING, STRING), BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_LE("str.<=", List.of(STRING, STRING), BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_LT("str.<", List.of(STRING, STRING), BuiltinPreOp.UNINTERPRETED, Support.NONE);

    private final String symbolName;
    private final List<Sort.Kind> argumentKinds;
    private final BuiltinPreOp operation;
    private final Support support;

    BuiltinPredicate(String symbolName, List<Sort.Kind> argumentKinds, BuiltinPreOp operation, Support support) {
        this.symbolName = symbolName;
        this.argumentKinds = argumentKinds;
        this.operation = operation;
        this.support = support;
    }

    public String symbolName() {
        return symbolName;
    }

    public List<Sort.Kind> argumentKinds() {
        return argumentKinds;
    }

    public BuiltinPreOp operation() {
        return operation;
    }

    public Support support() {
        return support;
    }
}
