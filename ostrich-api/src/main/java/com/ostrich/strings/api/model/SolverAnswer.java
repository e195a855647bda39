/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

/**
 * Overall answer of a solving session.
 */
public enum SolverAnswer {
    SAT,
    UNSAT,
    UNKNOWN
}
