/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.exceptions;

/**
 * Base class of all failures raised by the string theory.
 *
 * <p>Unchecked, like the rest of the solver's failure modes, so that the host's
 * proof search is not forced to thread checked exceptions through every callback.
 */
public class StringTheoryException extends RuntimeException {

    public StringTheoryException(String message) {
        super(message);
    }

    public StringTheoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
