/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.cache;

import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.DecisionOutcome;
import com.ostrich.strings.infra.config.OstrichConfig;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Strict least-recently-used implementation of {@link DecisionCache}.
 *
 * <p>Entries live in an access-ordered {@link LinkedHashMap} guarded by a lock, so
 * lookup, insertion and eviction are a single atomic step. Computations in
 * progress are tracked per key so that a model search never runs twice for the
 * same snapshot concurrently. The lock is not held while a search runs.
 */
public class LruDecisionCache implements DecisionCache {
    private static final Logger logger = Logger.getLogger(LruDecisionCache.class.getName());

    private final int maxSize;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<ConstraintSet, DecisionOutcome> entries;
    private final ConcurrentHashMap<ConstraintSet, CompletableFuture<DecisionOutcome>> inFlight =
            new ConcurrentHashMap<>();

    private final LongAdder totalRequests = new LongAdder();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public LruDecisionCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ConstraintSet, DecisionOutcome> eldest) {
                if (size() > LruDecisionCache.this.maxSize) {
                    evictions.increment();
                    if (logger.isLoggable(Level.FINE)) {
                        logger.fine("Evicted decision for " + eldest.getKey());
                    }
                    return true;
                }
                return false;
            }
        };
        logger.info(String.format("LruDecisionCache initialized: maxSize=%d", maxSize));
    }

    @Override
    public DecisionOutcome get(ConstraintSet facts, Supplier<DecisionOutcome> search) {
        Objects.requireNonNull(facts, "facts must not be null");
        Objects.requireNonNull(search, "search must not be null");
        totalRequests.increment();

        DecisionOutcome cached = lookup(facts);
        if (cached != null) {
            hits.increment();
            return cached;
        }

        CompletableFuture<DecisionOutcome> pending = new CompletableFuture<>();
        CompletableFuture<DecisionOutcome> running = inFlight.putIfAbsent(facts, pending);
        if (running != null) {
            // Another caller is computing this key
            hits.increment();
            return await(running);
        }

        try {
            // The computation may have finished between lookup and registration
            cached = lookup(facts);
            if (cached != null) {
                hits.increment();
                pending.complete(cached);
                return cached;
            }

            misses.increment();
            DecisionOutcome outcome = Objects.requireNonNull(search.get(), "model search returned null");
            store(facts, outcome);
            pending.complete(outcome);
            return outcome;
        } catch (RuntimeException | Error e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(facts, pending);
        }
    }

    @Override
    public Optional<DecisionOutcome> getIfPresent(ConstraintSet facts) {
        totalRequests.increment();
        DecisionOutcome cached = lookup(facts);
        if (cached != null) {
            hits.increment();
        } else {
            misses.increment();
        }
        return Optional.ofNullable(cached);
    }

    @Override
    public boolean contains(ConstraintSet facts) {
        lock.lock();
        try {
            return entries.containsKey(facts);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return maxSize;
    }

    @Override
    public void invalidateAll() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        logger.fine("Decision cache cleared");
    }

    @Override
    public CacheMetrics getMetrics() {
        long requests = totalRequests.sum();
        long hitCount = hits.sum();
        double hitRate = requests > 0 ? (double) hitCount / requests : 0.0;
        return new CacheMetrics(requests, hitCount, misses.sum(), evictions.sum(), size(), hitRate);
    }

    private DecisionOutcome lookup(ConstraintSet facts) {
        lock.lock();
        try {
            // get() on an access-ordered map refreshes recency
            return entries.get(facts);
        } finally {
            lock.unlock();
        }
    }

    private void store(ConstraintSet facts, DecisionOutcome outcome) {
        lock.lock();
        try {
            entries.put(facts, outcome);
        } finally {
            lock.unlock();
        }
    }

    private static DecisionOutcome await(CompletableFuture<DecisionOutcome> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link LruDecisionCache}.
     */
    public static class Builder {
        private int maxSize = OstrichConfig.DEFAULT_DECISION_CACHE_SIZE;

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder config(OstrichConfig config) {
            this.maxSize = config.decisionCacheSize();
            return this;
        }

        public LruDecisionCache build() {
            return new LruDecisionCache(maxSize);
        }
    }
}
