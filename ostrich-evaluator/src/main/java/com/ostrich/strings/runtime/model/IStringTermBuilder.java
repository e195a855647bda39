/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.runtime.model;

import com.ostrich.strings.api.model.Term;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Builds the ground host term denoting a literal word.
 */
@FunctionalInterface
public interface IStringTermBuilder {

    Term literal(IntList word);
}
