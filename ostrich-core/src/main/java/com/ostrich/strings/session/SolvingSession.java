/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.session;

import com.ostrich.strings.api.model.SolverAnswer;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Session-wide soundness bookkeeping.
 *
 * <p>The incompleteness flag is reset at session start, raised monotonically
 * while constraint sets are preprocessed, and read when the session's final
 * answer is reported. Safe for concurrent proof branches.
 */
public final class SolvingSession {
    private static final Logger logger = Logger.getLogger(SolvingSession.class.getName());

    private final AtomicBoolean incomplete = new AtomicBoolean(false);
    private final AtomicReference<String> incompletenessReason = new AtomicReference<>();

    /**
     * Clears the incompleteness flag. Call at the start of every solving session.
     */
    public void reset() {
        incomplete.set(false);
        incompletenessReason.set(null);
    }

    /**
     * Raises the incompleteness flag.
     *
     * @return true if this call raised it, false if it was already raised
     */
    public boolean markIncomplete(String reason) {
        if (incomplete.compareAndSet(false, true)) {
            incompletenessReason.set(reason);
            logger.warning("String theory is incomplete for this problem: " + reason);
            return true;
        }
        return false;
    }

    public boolean isIncomplete() {
        return incomplete.get();
    }

    /**
     * @return the reason given when the flag was first raised, or null
     */
    public String incompletenessReason() {
        return incompletenessReason.get();
    }

    /**
     * Downgrades a satisfiability answer that may not be trusted.
     *
     * @param answer      the answer found by the proof search
     * @param soundForSat whether the theories are sound for satisfiability under the
     *                    active soundness configuration
     * @return {@link SolverAnswer#UNKNOWN} instead of {@code SAT} when the session is
     *         incomplete or the configuration is unsound; the answer itself otherwise
     */
    public SolverAnswer finalizeAnswer(SolverAnswer answer, boolean soundForSat) {
        if (answer == SolverAnswer.SAT && (isIncomplete() || !soundForSat)) {
            return SolverAnswer.UNKNOWN;
        }
        return answer;
    }
}
