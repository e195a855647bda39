/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.api;

import java.util.Map;

/**
 * Callback interface for theory construction stage events.
 *
 * <p>Theory construction consists of 3 stages:
 * <ol>
 *   <li>TRANSDUCER_TRANSLATION - Compile every registered symbolic transducer</li>
 *   <li>REGISTRY_BUILDING - Bind every predicate to its PreOp</li>
 *   <li>SUPPORT_CLASSIFICATION - Partition predicates into supported and unsupported</li>
 * </ol>
 */
public interface CompilationListener {

    void onStageStart(String stageName, int stageNumber, int totalStages);

    void onStageComplete(String stageName, StageResult result);

    void onError(String stageName, Exception error);

    /**
     * Result of a single construction stage.
     *
     * @param stageName     Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics       Stage-specific metrics (e.g., "transducerCount", "unsupportedPredicates")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }
    }
}
