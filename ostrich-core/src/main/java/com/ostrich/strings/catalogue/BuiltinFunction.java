/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.catalogue;

import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.preop.BuiltinPreOp;

import java.util.List;

import static com.ostrich.strings.api.model.Sort.Kind.CHAR;
import static com.ostrich.strings.api.model.Sort.Kind.INTEGER;
import static com.ostrich.strings.api.model.Sort.Kind.REGEX;
import static com.ostrich.strings.api.model.Sort.Kind.STRING;

/**
 * Predefined string and regex functions.
 */
public enum BuiltinFunction {
    STR_EMPTY("str.empty", List.of(), STRING, BuiltinPreOp.EMPTY, Support.COMPLETE),
    STR_CONS("str.cons", List.of(CHAR, STRING), STRING, BuiltinPreOp.CONS, Support.COMPLETE),
    STR_HEAD("str.head", List.of(STRING), CHAR, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_TAIL("str.tail", List.of(STRING), STRING, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_CONCAT("str.++", List.of(STRING, STRING), STRING, BuiltinPreOp.CONCAT, Support.COMPLETE),
    STR_LEN("str.len", List.of(STRING), INTEGER, BuiltinPreOp.LENGTH, Support.WITH_LENGTH),
    STR_AT("str.at", List.of(STRING, INTEGER), STRING, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_CHAR("str.char", List.of(STRING, INTEGER), CHAR, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_SUBSTR("str.substr", List.of(STRING, INTEGER, INTEGER), STRING, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_INDEXOF("str.indexof", List.of(STRING, STRING, INTEGER), INTEGER, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_REPLACE("str.replace", List.of(STRING, STRING, STRING), STRING, BuiltinPreOp.REPLACE, Support.COMPLETE),
    STR_REPLACE_ALL("str.replace_all", List.of(STRING, STRING, STRING), STRING, BuiltinPreOp.REPLACE_ALL, Support.COMPLETE),
    STR_REPLACE_RE("str.replace_re", List.of(STRING, REGEX, STRING), STRING, BuiltinPreOp.REPLACE_RE, Support.COMPLETE),
    STR_REPLACE_RE_ALL("str.replace_re_all", List.of(STRING, REGEX, STRING), STRING, BuiltinPreOp.REPLACE_RE_ALL, Support.COMPLETE),
    STR_TO_INT("str.to_int", List.of(STRING), INTEGER, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_FROM_INT("str.from_int", List.of(INTEGER), STRING, BuiltinPreOp.UNINTERPRETED, Support.NONE),
    STR_TO_RE("str.to_re", List.of(STRING), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_NONE("re.none", List.of(), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_EPS("re.eps", List.of(), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_ALL("re.all", List.of(), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_ALLCHAR("re.allchar", List.of(), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_RANGE("re.range", List.of(CHAR, CHAR), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_CONCAT("re.++", List.of(REGEX, REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_UNION("re.union", List.of(REGEX, REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_INTER("re.inter", List.of(REGEX, REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_STAR("re.*", List.of(REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_PLUS("re.+", List.of(REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_OPT("re.opt", List.of(REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_COMP("re.comp", List.of(REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_LOOP("re.loop", List.of(INTEGER, INTEGER, REGEX), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE),
    RE_FROM_STR("re.from_str", List.of(STRING), REGEX, BuiltinPreOp.REGEX_CONSTRUCTION, Support.COMPLETE);

    private final String symbolName;
    private final List<Sort.Kind> argumentKinds;
    private final Sort.Kind resultKind;
    private final BuiltinPreOp operation;
    private final Support support;

    BuiltinFunction(String symbolName, List<Sort.Kind> argumentKinds, Sort.Kind resultKind,
                    BuiltinPreOp operation, Support support) {
        this.symbolName = symbolName;
        this.argumentKinds = argumentKinds;
        this.resultKind = resultKind;
        this.operation = operation;
        this.support = support;
    }

    public String symbolName() {
        return symbolName;
    }

    public List<Sort.Kind> argumentKinds() {
        return argumentKinds;
    }

    public Sort.Kind resultKind() {
        return resultKind;
    }

    public BuiltinPreOp operation() {
        return operation;
    }

    public Support support() {
        return support;
    }

    /**
     * Partial functions may be undefined for some inputs (e.g. head of the empty string).
     */
    public boolean isPartial() {
        return this == STR_HEAD || this == STR_TAIL || this == STR_CHAR;
    }
}
