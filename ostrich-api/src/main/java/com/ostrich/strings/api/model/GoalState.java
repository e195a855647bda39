/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

/**
 * Phase of the host's proof search in which a goal is presented.
 */
public enum GoalState {
    /** Early phase, other theories are still contributing */
    EAGER,
    /** Intermediate phase, facts may still change */
    INTERMEDIATE,
    /** All other reasoning has finished; the string theory must decide */
    FINAL
}
