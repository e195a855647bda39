/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

/**
 * Origin of a function or predicate symbol.
 */
public enum SymbolCategory {
    /** Core string and regex operations shipped with the theory */
    PREDEFINED,
    /** User-registered functions such as {@code str.reverse} */
    EXTRA_FUNCTION,
    /** Binary string relations backed by a named transducer */
    TRANSDUCER
}
