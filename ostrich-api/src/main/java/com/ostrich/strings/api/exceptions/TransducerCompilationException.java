/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.exceptions;

/**
 * Thrown when a symbolic transducer cannot be translated into a finite-state
 * transducer. Fatal to theory construction.
 */
public class TransducerCompilationException extends StringTheoryException {

    private final String transducerName;

    public TransducerCompilationException(String transducerName, String message) {
        super("Cannot compile transducer '" + transducerName + "': " + message);
        this.transducerName = transducerName;
    }

    public TransducerCompilationException(String transducerName, String message, Throwable cause) {
        super("Cannot compile transducer '" + transducerName + "': " + message, cause);
        this.transducerName = transducerName;
    }

    public String getTransducerName() {
        return transducerName;
    }
}
