/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.preop;

import com.ostrich.strings.api.CompiledTransducer;
import com.ostrich.strings.api.PreOp;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * PreOp of a transducer predicate {@code t(input, output)}.
 */
public final class TransducerPreOp implements PreOp {

    private final CompiledTransducer transducer;

    public TransducerPreOp(CompiledTransducer transducer) {
        this.transducer = Objects.requireNonNull(transducer, "transducer must not be null");
    }

    public CompiledTransducer transducer() {
        return transducer;
    }

    @Override
    public String name() {
        return "transducer:" + transducer.name();
    }

    @Override
    public Optional<IntList> eval(List<IntList> arguments) {
        if (arguments.size() != 1) {
            throw new IllegalArgumentException(name() + " expects 1 argument, got " + arguments.size());
        }
        return transducer.apply(arguments.get(0));
    }

    @Override
    public String toString() {
        return name();
    }
}
