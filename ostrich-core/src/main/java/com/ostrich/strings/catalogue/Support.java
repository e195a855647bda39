/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.catalogue;

/**
 * How completely the string theory decides a predefined symbol.
 */
public enum Support {
    /** Always decided completely */
    COMPLETE,
    /** Decided completely only while length reasoning is enabled */
    WITH_LENGTH,
    /** Treated as uninterpreted; occurrences make the theory incomplete */
    NONE
}
