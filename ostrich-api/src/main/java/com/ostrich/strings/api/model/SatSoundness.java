/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api.model;

/**
 * Soundness configuration under which a satisfiability answer is reported.
 */
public enum SatSoundness {
    /** Only elementary (quantifier-free, ground) reasoning */
    ELEMENTARY,
    /** Existentially quantified problems */
    EXISTENTIAL,
    /** Arbitrary quantification */
    GENERAL
}
