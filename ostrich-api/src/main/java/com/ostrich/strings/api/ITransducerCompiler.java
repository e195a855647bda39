/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api;

import com.ostrich.strings.api.exceptions.TransducerCompilationException;
import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.api.model.SymbolicTransducer;

/**
 * Contract for translating symbolic transducers into concrete finite-state form.
 */
@FunctionalInterface
public interface ITransducerCompiler {

    /**
     * @param name         name under which the transducer was registered
     * @param transducer   symbolic description
     * @param alphabetSize size of the character alphabet
     * @param stringSort   string sort of the theory the transducer operates on
     * @return the compiled transducer
     * @throws TransducerCompilationException if the description is malformed or
     *                                        has no finite-state counterpart
     */
    CompiledTransducer compile(String name, SymbolicTransducer transducer, int alphabetSize, Sort stringSort);
}
