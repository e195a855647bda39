/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api;

import com.ostrich.strings.api.model.Action;
import com.ostrich.strings.api.model.Equality;
import com.ostrich.strings.api.model.Goal;

import java.util.List;
import java.util.Optional;

/**
 * Callbacks the host proof search invokes on the string theory.
 *
 * <p>The host first calls {@link #decide(Goal)} and, once a goal has been accepted,
 * {@link #extractModel(Goal)} for the same proof state. Both calls observe the same
 * decision outcome.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Action> actions = plugin.decide(goal);
 * if (actions.isEmpty()) {
 *     Optional<List<Equality>> model = plugin.extractModel(goal);
 * }
 * }</pre>
 */
public interface IStringTheoryPlugin {

    /**
     * Decides the goal's constraint set.
     *
     * @return an empty list if the theory accepts the goal, corrective actions
     *         otherwise (a contradiction if no string model exists)
     */
    List<Action> decide(Goal goal);

    /**
     * Extracts the string model of an accepted goal as host-level equalities.
     *
     * @return empty if the theory has nothing to contribute to this goal
     */
    Optional<List<Equality>> extractModel(Goal goal);
}
