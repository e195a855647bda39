/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.runtime.decision;

import com.ostrich.strings.api.IStringModelSearch;
import com.ostrich.strings.api.IStringTheoryPlugin;
import com.ostrich.strings.api.model.Action;
import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.DecisionOutcome;
import com.ostrich.strings.api.model.Equality;
import com.ostrich.strings.api.model.Goal;
import com.ostrich.strings.api.model.GoalState;
import com.ostrich.strings.api.model.StringModel;
import com.ostrich.strings.api.model.TermOrder;
import com.ostrich.strings.cache.DecisionCache;
import com.ostrich.strings.cache.LruDecisionCache;
import com.ostrich.strings.infra.config.OstrichConfig;
import com.ostrich.strings.runtime.model.ConsStringTermBuilder;
import com.ostrich.strings.runtime.model.ModelTranslator;
import com.ostrich.strings.theory.StringTheory;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The string theory's side of the host proof search.
 *
 * <p>Only goals in the {@link GoalState#FINAL} state are decided; in every other
 * state the theory defers to the remaining reasoning. A final goal is
 * <ol>
 *   <li>checked by the soundness gate,</li>
 *   <li>rewritten if its word equations are cyclic (this short-circuits the decision),</li>
 *   <li>decided through the decision cache, running the model search on a miss.</li>
 * </ol>
 * A goal with a string model is accepted without further action; one without is
 * closed with a contradiction.
 *
 * <p>{@link #extractModel(Goal)} consults the same cache, so deciding and model
 * extraction always agree on the outcome for a proof state.
 *
 * <h2>Error Handling</h2>
 * <p>Failures of the model search are never cached and never reported as "no
 * model"; they propagate to the host unchanged.
 */
public class StringGoalHandler implements IStringTheoryPlugin {
    private static final Logger logger = Logger.getLogger(StringGoalHandler.class.getName());

    private final StringTheory theory;
    private final IStringModelSearch modelSearch;
    private final DecisionCache decisionCache;
    private final CyclicEquationBreaker cycleBreaker;
    private final ModelTranslator modelTranslator;
    private final Tracer tracer;

    private final LongAdder finalGoals = new LongAdder();
    private final LongAdder deferredGoals = new LongAdder();
    private final LongAdder cyclesBroken = new LongAdder();
    private final LongAdder goalsAccepted = new LongAdder();
    private final LongAdder contradictions = new LongAdder();
    private final LongAdder modelsExtracted = new LongAdder();
    private final LongAdder extractionsDeferred = new LongAdder();

    public StringGoalHandler(StringTheory theory, IStringModelSearch modelSearch,
                             DecisionCache decisionCache, ModelTranslator modelTranslator, Tracer tracer) {
        this.theory = Objects.requireNonNull(theory, "theory must not be null");
        this.modelSearch = Objects.requireNonNull(modelSearch, "modelSearch must not be null");
        this.decisionCache = Objects.requireNonNull(decisionCache, "decisionCache must not be null");
        this.modelTranslator = Objects.requireNonNull(modelTranslator, "modelTranslator must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.cycleBreaker = new CyclicEquationBreaker(theory.catalogue());
    }

    public StringGoalHandler(StringTheory theory, IStringModelSearch modelSearch, OstrichConfig config) {
        this(theory, modelSearch,
                LruDecisionCache.builder().config(config).build(),
                new ModelTranslator(new ConsStringTermBuilder(theory.catalogue())),
                OpenTelemetry.noop().getTracer("ostrich-evaluator"));
    }

    public StringGoalHandler(StringTheory theory, IStringModelSearch modelSearch) {
        this(theory, modelSearch,
                LruDecisionCache.builder().build(),
                new ModelTranslator(new ConsStringTermBuilder(theory.catalogue())),
                OpenTelemetry.noop().getTracer("ostrich-evaluator"));
    }

    @Override
    public List<Action> decide(Goal goal) {
        Objects.requireNonNull(goal, "goal must not be null");
        if (goal.state() != GoalState.FINAL) {
            deferredGoals.increment();
            return List.of();
        }
        finalGoals.increment();

        Span span = tracer.spanBuilder("string-theory-decide").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("atoms", goal.facts().atoms().size());
            ConstraintSet facts = theory.preprocess(goal.facts(), goal.order());

            // Runs on every visit, cached or not, since it may change the facts
            Optional<List<Action>> corrections = cycleBreaker.breakCycles(facts);
            if (corrections.isPresent()) {
                cyclesBroken.increment();
                span.setAttribute("cycleBroken", true);
                return corrections.get();
            }

            DecisionOutcome outcome = cachedOutcome(facts, goal.order());
            span.setAttribute("modelFound", outcome.hasModel());
            if (outcome.hasModel()) {
                goalsAccepted.increment();
                return List.of();
            }
            contradictions.increment();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("No string model for " + facts);
            }
            return List.of(Action.contradiction());
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public Optional<List<Equality>> extractModel(Goal goal) {
        Objects.requireNonNull(goal, "goal must not be null");
        ConstraintSet facts = goal.facts();
        if (!theory.mentionsTheory(facts)) {
            extractionsDeferred.increment();
            return Optional.empty();
        }

        Span span = tracer.spanBuilder("string-theory-extract-model").startSpan();
        try (Scope scope = span.makeCurrent()) {
            DecisionOutcome outcome = cachedOutcome(facts, goal.order());
            StringModel model = outcome.model().orElseThrow(() -> new IllegalStateException(
                    "No string model exists for " + facts + "; only accepted goals have a model"));

            List<Equality> equalities = modelTranslator.translate(model, goal.order());
            modelsExtracted.increment();
            span.setAttribute("equalities", equalities.size());
            return Optional.of(equalities);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private DecisionOutcome cachedOutcome(ConstraintSet facts, TermOrder order) {
        return decisionCache.get(facts, () -> {
            long start = System.nanoTime();
            DecisionOutcome outcome = modelSearch.findStringModel(facts, order, theory.registry());
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Model search finished in %d us: %s",
                        (System.nanoTime() - start) / 1_000, outcome.hasModel() ? "model" : "no model"));
            }
            return outcome;
        });
    }

    public StringTheory getTheory() {
        return theory;
    }

    public DecisionCache getDecisionCache() {
        return decisionCache;
    }

    /**
     * Returns decision counters together with the decision cache metrics.
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("finalGoals", finalGoals.sum());
        metrics.put("deferredGoals", deferredGoals.sum());
        metrics.put("cyclesBroken", cyclesBroken.sum());
        metrics.put("goalsAccepted", goalsAccepted.sum());
        metrics.put("contradictions", contradictions.sum());
        metrics.put("modelsExtracted", modelsExtracted.sum());
        metrics.put("extractionsDeferred", extractionsDeferred.sum());
        metrics.put("decisionCache", decisionCache.getMetrics());
        return metrics;
    }
}
