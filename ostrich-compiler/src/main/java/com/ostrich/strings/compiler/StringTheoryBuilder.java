/*
 * Copyright (c) 2025 Ostrich String Solver
 * Licensed under the Apache License, Version 2.0
 */
package com.ostrich.strings.compiler;

import com.ostrich.strings.api.CompilationListener;
import com.ostrich.strings.api.CompiledTransducer;
import com.ostrich.strings.api.ITransducerCompiler;
import com.ostrich.strings.api.PreOp;
import com.ostrich.strings.api.exceptions.TransducerCompilationException;
import com.ostrich.strings.api.model.Atom;
import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.api.model.SymbolicTransducer;
import com.ostrich.strings.api.model.Term;
import com.ostrich.strings.catalogue.ExtraFunction;
import com.ostrich.strings.catalogue.SymbolCatalogue;
import com.ostrich.strings.infra.config.OstrichConfig;
import com.ostrich.strings.infra.config.OstrichFlags;
import com.ostrich.strings.registry.OperatorRegistry;
import com.ostrich.strings.session.SolvingSession;
import com.ostrich.strings.support.SupportClassifier;
import com.ostrich.strings.support.SupportedPredicates;
import com.ostrich.strings.theory.StringTheory;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Open, mutable phase of the string theory.
 *
 * <p>Extra functions and transducers are registered here. The first call to
 * {@link #theory()} freezes the builder, compiles every registered transducer
 * exactly once and produces the immutable {@link StringTheory}; later calls
 * return the same instance. Registering after that point is a usage error.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * StringTheoryBuilder builder = new StringTheoryBuilder(compiler, OstrichFlags.DEFAULT);
 * builder.addTransducer("toUpper", toUpperTransducer);
 * StringTheory theory = builder.theory();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are thread-safe. Concurrent first calls to {@link #theory()}
 * block until one of them has finished construction.
 */
public class StringTheoryBuilder {
    private static final Logger logger = Logger.getLogger(StringTheoryBuilder.class.getName());

    public static final String NAME = "OSTRICH";

    private static final int TOTAL_STAGES = 3;
    private static final String STAGE_TRANSDUCERS = "TRANSDUCER_TRANSLATION";
    private static final String STAGE_REGISTRY = "REGISTRY_BUILDING";
    private static final String STAGE_SUPPORT = "SUPPORT_CLASSIFICATION";

    private final ITransducerCompiler transducerCompiler;
    private final OstrichFlags flags;
    private final Tracer tracer;
    private final SolvingSession session;

    private final Object lock = new Object();

    // Guarded by lock
    private final List<ExtraFunction> extraFunctions = new ArrayList<>();
    private final Map<String, SymbolicTransducer> transducers = new LinkedHashMap<>();
    private CompilationListener listener;
    private boolean frozen;
    private boolean constructing;
    private StringTheory theory;
    private RuntimeException constructionFailure;

    public StringTheoryBuilder(ITransducerCompiler transducerCompiler, OstrichFlags flags,
                               Tracer tracer, SolvingSession session) {
        this.transducerCompiler = Objects.requireNonNull(transducerCompiler, "transducerCompiler must not be null");
        this.flags = Objects.requireNonNull(flags, "flags must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.extraFunctions.add(ExtraFunction.reverse());
    }

    public StringTheoryBuilder(ITransducerCompiler transducerCompiler, OstrichFlags flags) {
        this(transducerCompiler, flags, OpenTelemetry.noop().getTracer("ostrich-compiler"), new SolvingSession());
    }

    public static StringTheoryBuilder fromConfig(ITransducerCompiler transducerCompiler, OstrichConfig config) {
        return new StringTheoryBuilder(transducerCompiler, config.toFlags());
    }

    // ========================================================================
    // REGISTRATION (open phase only)
    // ========================================================================

    /**
     * Registers a transducer predicate {@code name(input, output)}.
     *
     * @throws IllegalStateException    if the theory has already been built
     * @throws IllegalArgumentException if the name is taken by a predefined symbol,
     *                                  an extra function or another transducer
     */
    public void addTransducer(String name, SymbolicTransducer transducer) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(transducer, "transducer must not be null");
        synchronized (lock) {
            checkOpen("transducer '" + name + "'");
            checkNameFree(name);
            transducers.put(name, transducer);
        }
    }

    /**
     * Registers a user function with the PreOp implementing it.
     *
     * @throws IllegalStateException    if the theory has already been built
     * @throws IllegalArgumentException if the name is taken by a predefined symbol,
     *                                  another extra function or a transducer
     */
    public void addExtraFunction(ExtraFunction extraFunction) {
        Objects.requireNonNull(extraFunction, "extraFunction must not be null");
        synchronized (lock) {
            checkOpen("function '" + extraFunction.name() + "'");
            checkNameFree(extraFunction.name());
            extraFunctions.add(extraFunction);
        }
    }

    public void addExtraFunction(FunctionSymbol function, PreOp operation,
                                 Function<Atom, List<Term>> argumentSelector,
                                 Function<Atom, Term> resultSelector) {
        addExtraFunction(new ExtraFunction(function, operation, argumentSelector, resultSelector));
    }

    public void setCompilationListener(CompilationListener listener) {
        synchronized (lock) {
            this.listener = listener;
        }
    }

    public boolean isFrozen() {
        synchronized (lock) {
            return frozen;
        }
    }

    private void checkOpen(String what) {
        if (frozen) {
            throw new IllegalStateException(
                    "Cannot register " + what + ": the " + NAME + " theory has already been built");
        }
    }

    // Symbol names share one namespace across predefined symbols and both extension kinds
    private void checkNameFree(String name) {
        if (SymbolCatalogue.isBuiltinName(name)) {
            throw new IllegalArgumentException("Name clashes with a predefined symbol: " + name);
        }
        if (transducers.containsKey(name)) {
            throw new IllegalArgumentException("Transducer already registered: " + name);
        }
        for (ExtraFunction existing : extraFunctions) {
            if (existing.name().equals(name)) {
                throw new IllegalArgumentException("Function already registered: " + name);
            }
        }
    }

    // ========================================================================
    // FREEZING
    // ========================================================================

    /**
     * Freezes the builder and returns the theory, constructing it on the first call.
     *
     * @throws TransducerCompilationException if a transducer cannot be compiled;
     *                                        rethrown by every later call
     * @throws IllegalStateException          if called re-entrantly during construction
     */
    public StringTheory theory() {
        synchronized (lock) {
            if (theory != null) {
                return theory;
            }
            if (constructionFailure != null) {
                throw constructionFailure;
            }
            if (constructing) {
                throw new IllegalStateException("Re-entrant construction of the " + NAME + " theory");
            }

            frozen = true;
            constructing = true;
            try {
                theory = construct();
                return theory;
            } catch (RuntimeException e) {
                constructionFailure = e;
                throw e;
            } finally {
                constructing = false;
            }
        }
    }

    private StringTheory construct() {
        Span span = tracer.spanBuilder("build-string-theory").startSpan();
        try (Scope scope = span.makeCurrent()) {
            long startTime = System.nanoTime();

            Map<String, CompiledTransducer> compiled = runStage(STAGE_TRANSDUCERS, 1,
                    this::compileTransducers,
                    result -> Map.of("transducerCount", result.size()));
            span.setAttribute("transducerCount", compiled.size());

            SymbolCatalogue catalogue = new SymbolCatalogue(
                    StringTheory.ALPHABET_SIZE, extraFunctions, new ArrayList<>(transducers.keySet()));
            OperatorRegistry registry = runStage(STAGE_REGISTRY, 2,
                    () -> OperatorRegistry.build(catalogue, compiled),
                    result -> Map.of("operatorCount", result.size()));
            span.setAttribute("operatorCount", registry.size());

            SupportedPredicates supported = runStage(STAGE_SUPPORT, 3,
                    () -> SupportClassifier.classify(catalogue, flags),
                    result -> Map.of(
                            "supportedPredicates", result.supported().size(),
                            "unsupportedPredicates", result.unsupported().size()));

            StringTheory built = new StringTheory(NAME, catalogue, registry, supported, flags, session);

            long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
            span.setAttribute("constructionTimeMs", elapsedMs);
            logger.info(String.format("%s theory built in %d ms: %d predicates, %d unsupported, %d transducers",
                    NAME, elapsedMs, catalogue.predicates().size(),
                    supported.unsupported().size(), compiled.size()));
            return built;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private Map<String, CompiledTransducer> compileTransducers() {
        Map<String, CompiledTransducer> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, SymbolicTransducer> entry : transducers.entrySet()) {
            String name = entry.getKey();
            logger.info("Translating transducer " + name + " ...");
            compiled.put(name, compileTransducer(name, entry.getValue()));
        }
        return compiled;
    }

    private CompiledTransducer compileTransducer(String name, SymbolicTransducer transducer) {
        Span span = tracer.spanBuilder("compile-transducer").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("transducer", name);
            CompiledTransducer result = transducerCompiler.compile(
                    name, transducer, StringTheory.ALPHABET_SIZE, Sort.STRING);
            if (result == null) {
                throw new TransducerCompilationException(name, "compiler returned no transducer");
            }
            span.setAttribute("stateCount", result.stateCount());
            return result;
        } catch (TransducerCompilationException e) {
            span.recordException(e);
            throw e;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw new TransducerCompilationException(name, String.valueOf(e.getMessage()), e);
        } finally {
            span.end();
        }
    }

    private <T> T runStage(String stageName, int stageNumber, Supplier<T> stage,
                           Function<T, Map<String, Object>> metrics) {
        CompilationListener current = listener;
        if (current != null) {
            current.onStageStart(stageName, stageNumber, TOTAL_STAGES);
        }
        long start = System.nanoTime();
        try {
            T result = stage.get();
            CompilationListener.StageResult stageResult =
                    new CompilationListener.StageResult(stageName, System.nanoTime() - start, metrics.apply(result));
            logger.fine(() -> "Stage " + stageName + " completed in " + stageResult.durationMillis() + " ms");
            if (current != null) {
                current.onStageComplete(stageName, stageResult);
            }
            return result;
        } catch (RuntimeException e) {
            if (current != null) {
                current.onError(stageName, e);
            }
            throw e;
        }
    }
}
