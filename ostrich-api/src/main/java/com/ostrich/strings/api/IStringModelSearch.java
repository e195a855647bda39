/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api;

import com.ostrich.strings.api.exceptions.StringSolverException;
import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.DecisionOutcome;
import com.ostrich.strings.api.model.TermOrder;

/**
 * Contract of the automata-based routine that searches a string model for a
 * constraint set.
 *
 * <p>Implementations must be deterministic: the same constraint set and registry
 * must always produce the same outcome, since outcomes are cached per snapshot.
 */
@FunctionalInterface
public interface IStringModelSearch {

    /**
     * @param facts    the constraint set to decide
     * @param order    the host's current variable ordering
     * @param registry operators of every symbol that may occur in {@code facts}
     * @return a model, or {@link DecisionOutcome#noModel()} if the facts are unsatisfiable
     * @throws StringSolverException on internal failure; never reported as "no model"
     */
    DecisionOutcome findStringModel(ConstraintSet facts, TermOrder order, IOperatorRegistry registry);
}
