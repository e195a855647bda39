/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.exceptions;

/**
 * Internal failure of the string model search, e.g. an unsupported automaton
 * construction. Surfaced to the host, never mistaken for unsatisfiability.
 */
public class StringSolverException extends StringTheoryException {

    public StringSolverException(String message) {
        super(message);
    }

    public StringSolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
