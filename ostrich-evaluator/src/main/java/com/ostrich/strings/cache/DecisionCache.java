/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.cache;

import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.DecisionOutcome;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Bounded memory of decision outcomes, keyed by constraint-set snapshot.
 *
 * <p>The host consults the string theory twice for the same proof state, once to
 * decide and once to extract a model. Both calls must observe the same outcome,
 * which the cache guarantees as long as the entry has not been evicted; model
 * search being deterministic, a recomputation after eviction yields the same
 * outcome again.
 */
public interface DecisionCache {

    /**
     * Returns the cached outcome for {@code facts}, computing it with {@code search}
     * on a miss.
     *
     * <p>{@code search} runs at most once per key at a time: concurrent callers for
     * the same key wait for that computation and observe its result. If it throws,
     * nothing is stored and the exception propagates to every waiting caller.
     */
    DecisionOutcome get(ConstraintSet facts, Supplier<DecisionOutcome> search);

    /**
     * Returns the cached outcome without computing it. Refreshes recency on a hit.
     */
    Optional<DecisionOutcome> getIfPresent(ConstraintSet facts);

    /**
     * Membership test that does not affect recency.
     */
    boolean contains(ConstraintSet facts);

    int size();

    int capacity();

    void invalidateAll();

    CacheMetrics getMetrics();

    /**
     * Cache metrics for monitoring and tuning.
     */
    record CacheMetrics(
            long totalRequests,
            long hits,
            long misses,
            long evictions,
            long currentSize,
            double hitRate
    ) {
        public String format() {
            return String.format(
                    "Decision Cache Metrics: requests=%d, hits=%d (%.1f%%), misses=%d, evictions=%d, size=%d",
                    totalRequests, hits, hitRate * 100, misses, evictions, currentSize
            );
        }
    }
}
