package com.ostrich.strings.compiler;

import com.ostrich.strings.api.CompilationListener;
import com.ostrich.strings.api.CompiledTransducer;
import com.ostrich.strings.api.ITransducerCompiler;
import com.ostrich.strings.api.exceptions.TransducerCompilationException;
import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.OperatorEntry;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.api.model.SymbolCategory;
import com.ostrich.strings.api.model.SymbolicTransducer;
import com.ostrich.strings.catalogue.ExtraFunction;
import com.ostrich.strings.infra.config.LengthMode;
import com.ostrich.strings.infra.config.OstrichConfig;
import com.ostrich.strings.infra.config.OstrichFlags;
import com.ostrich.strings.preop.BuiltinPreOp;
import com.ostrich.strings.theory.StringTheory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StringTheoryBuilderTest {

    @Mock
    private ITransducerCompiler compiler;

    private SymbolicTransducer copy;
    private StringTheoryBuilder builder;

    @BeforeEach
    void setUp() {
        // Copies its input
        copy = SymbolicTransducer.builder(0)
                .accepting(0)
                .transition(0, 0, 0, 0xFFFF, "$")
                .build();
        when(compiler.compile(anyString(), any(), anyInt(), any()))
                .thenAnswer(invocation -> compiled(invocation.getArgument(0)));
        builder = new StringTheoryBuilder(compiler, OstrichFlags.DEFAULT);
    }

    private record FakeTransducer(String name, int stateCount) implements CompiledTransducer {
    }

    private static CompiledTransducer compiled(String name) {
        return new FakeTransducer(name, 1);
    }

    @Test
    @DisplayName("Should build a theory containing registered extensions")
    void shouldBuildTheoryWithExtensions() {
        // Given
        builder.addTransducer("copy", copy);

        // When
        StringTheory theory = builder.theory();

        // Then
        assertThat(theory.name()).isEqualTo(StringTheoryBuilder.NAME);
        assertThat(theory.alphabetSize()).isEqualTo(65536);
        PredicateSymbol predicate = theory.catalogue().transducerPredicates().get("copy");
        assertThat(predicate).isNotNull();
        assertThat(theory.registry().lookup(predicate))
                .map(OperatorEntry::category)
                .contains(SymbolCategory.TRANSDUCER);
        assertThat(theory.catalogue().extensionSymbol(ExtraFunction.REVERSE_NAME)).isPresent();
        assertThat(theory.supportedPredicates().isSupported(predicate)).isTrue();
        verify(compiler).compile(eq("copy"), eq(copy), eq(StringTheory.ALPHABET_SIZE), eq(Sort.STRING));
    }

    @Test
    @DisplayName("Should reject registration after the theory has been built")
    void shouldRejectRegistrationAfterFreeze() {
        // Given
        builder.theory();

        // Then
        assertThat(builder.isFrozen()).isTrue();
        assertThatThrownBy(() -> builder.addTransducer("late", copy))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("late");
        assertThatThrownBy(() -> builder.addExtraFunction(new ExtraFunction(
                FunctionSymbol.of("str.twice", List.of(Sort.STRING), Sort.STRING),
                BuiltinPreOp.CONCAT, a -> List.of(a.get(0), a.get(0)), a -> a.get(1))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject duplicate registrations")
    void shouldRejectDuplicates() {
        builder.addTransducer("copy", copy);

        assertThatThrownBy(() -> builder.addTransducer("copy", copy))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addExtraFunction(ExtraFunction.reverse()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ExtraFunction.REVERSE_NAME);
    }

    @Test
    @DisplayName("Should register extra functions with their selectors")
    void shouldRegisterExtraFunction() {
        // Given
        FunctionSymbol twice = FunctionSymbol.of("str.twice", List.of(Sort.STRING), Sort.STRING);
        builder.addExtraFunction(twice, BuiltinPreOp.CONCAT, a -> List.of(a.get(0), a.get(0)), a -> a.get(1));

        // When
        StringTheory theory = builder.theory();

        // Then
        PredicateSymbol predicate = theory.catalogue().functionalPredicate(twice);
        assertThat(theory.registry().lookup(predicate))
                .map(OperatorEntry::operation)
                .contains(BuiltinPreOp.CONCAT);
        assertThat(theory.functions()).contains(twice);
    }

    @Test
    @DisplayName("Should compile each transducer once across repeated calls")
    void shouldCompileOnce() {
        // Given
        builder.addTransducer("copy", copy);
        builder.addTransducer("toLower", copy);

        // When
        StringTheory first = builder.theory();
        StringTheory second = builder.theory();

        // Then
        assertThat(second).isSameAs(first);
        verify(compiler, times(1)).compile(eq("copy"), any(), anyInt(), any());
        verify(compiler, times(1)).compile(eq("toLower"), any(), anyInt(), any());
    }

    @Test
    @DisplayName("Should compile each transducer once under concurrent calls")
    void shouldCompileOnceConcurrently() throws Exception {
        // Given
        AtomicInteger compilations = new AtomicInteger();
        ITransducerCompiler slowCompiler = (name, transducer, alphabetSize, stringSort) -> {
            compilations.incrementAndGet();
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return compiled(name);
        };
        StringTheoryBuilder concurrent = new StringTheoryBuilder(slowCompiler, OstrichFlags.DEFAULT);
        concurrent.addTransducer("copy", copy);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<StringTheory>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<StringTheory> task = () -> {
                    start.await();
                    return concurrent.theory();
                };
                results.add(executor.submit(task));
            }

            // When
            start.countDown();

            // Then
            StringTheory first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<StringTheory> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
            assertThat(compilations.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should surface and memoize compilation failures")
    void shouldMemoizeCompilationFailure() {
        // Given
        doThrow(new IllegalArgumentException("infinite state space"))
                .when(compiler).compile(eq("broken"), any(), anyInt(), any());
        builder.addTransducer("broken", copy);

        // When / Then
        assertThatThrownBy(() -> builder.theory())
                .isInstanceOf(TransducerCompilationException.class)
                .hasMessageContaining("broken")
                .hasMessageContaining("infinite state space")
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .satisfies(e -> assertThat(((TransducerCompilationException) e).getTransducerName())
                        .isEqualTo("broken"));
        assertThatThrownBy(() -> builder.theory())
                .isInstanceOf(TransducerCompilationException.class);
        verify(compiler, times(1)).compile(eq("broken"), any(), anyInt(), any());
    }

    @Test
    @DisplayName("Should reject re-entrant construction")
    void shouldRejectReentrantConstruction() {
        // Given
        StringTheoryBuilder[] holder = new StringTheoryBuilder[1];
        ITransducerCompiler reentrant = (name, transducer, alphabetSize, stringSort) -> {
            holder[0].theory();
            return compiled(name);
        };
        holder[0] = new StringTheoryBuilder(reentrant, OstrichFlags.DEFAULT);
        holder[0].addTransducer("copy", copy);

        // When / Then
        assertThatThrownBy(() -> holder[0].theory())
                .isInstanceOf(TransducerCompilationException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class)
                .hasStackTraceContaining("Re-entrant");
    }

    @Test
    @DisplayName("Should classify length support according to configuration")
    void shouldApplyConfiguration() {
        // Given
        OstrichConfig config = OstrichConfig.builder().lengthMode(LengthMode.OFF).build();

        // When
        StringTheory theory = StringTheoryBuilder.fromConfig(compiler, config).theory();

        // Then
        assertThat(theory.flags().useLength()).isEqualTo(LengthMode.OFF);
        assertThat(theory.supportedPredicates().unsupported())
                .extracting(PredicateSymbol::name)
                .contains("str.len");
    }

    @Test
    @DisplayName("Should report construction stages to the listener")
    void shouldNotifyListener() {
        // Given
        CompilationListener listener = mock(CompilationListener.class);
        builder.setCompilationListener(listener);
        builder.addTransducer("copy", copy);

        // When
        builder.theory();

        // Then
        InOrder ordered = inOrder(listener);
        ordered.verify(listener).onStageStart("TRANSDUCER_TRANSLATION", 1, 3);
        ordered.verify(listener).onStageComplete(eq("TRANSDUCER_TRANSLATION"), any());
        ordered.verify(listener).onStageStart("REGISTRY_BUILDING", 2, 3);
        ordered.verify(listener).onStageComplete(eq("REGISTRY_BUILDING"), any());
        ordered.verify(listener).onStageStart("SUPPORT_CLASSIFICATION", 3, 3);
        ordered.verify(listener).onStageComplete(eq("SUPPORT_CLASSIFICATION"), any());
    }

    @Test
    @DisplayName("Stage metrics include the transducer count")
    void shouldReportStageMetrics() {
        // Given
        List<CompilationListener.StageResult> results = new ArrayList<>();
        builder.setCompilationListener(new CompilationListener() {
            @Override
            public void onStageStart(String stageName, int stageNumber, int totalStages) {
            }

            @Override
            public void onStageComplete(String stageName, StageResult result) {
                results.add(result);
            }

            @Override
            public void onError(String stageName, Exception error) {
            }
        });
        builder.addTransducer("copy", copy);

        // When
        builder.theory();

        // Then
        assertThat(results).hasSize(3);
        assertThat(results.get(0).metrics()).isEqualTo(Map.of("transducerCount", 1));
        assertThat(results).allSatisfy(result -> {
            assertThat(result.durationNanos()).isNotNegative();
            assertThat(result.durationMillis()).isEqualTo(result.durationNanos() / 1_000_000);
        });
    }

    @Test
    @DisplayName("Should reject a transducer named like an extra function or predefined symbol")
    void shouldRejectTransducerNameClash() {
        assertThatThrownBy(() -> builder.addTransducer(ExtraFunction.REVERSE_NAME, copy))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ExtraFunction.REVERSE_NAME);
        assertThatThrownBy(() -> builder.addTransducer("str.++", copy))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("str.++");
        assertThatThrownBy(() -> builder.addTransducer("str.in_re", copy))
                .isInstanceOf(IllegalArgumentException.class);

        // The builder stays usable and nothing was compiled for the rejected names
        StringTheory theory = builder.theory();
        assertThat(theory.catalogue().transducerPredicates()).isEmpty();
        verify(compiler, times(0)).compile(anyString(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("Should reject an extra function named like a predefined symbol or transducer")
    void shouldRejectExtraFunctionNameClash() {
        // Given
        builder.addTransducer("copy", copy);
        FunctionSymbol len = FunctionSymbol.of("str.len", List.of(Sort.STRING), Sort.STRING);
        FunctionSymbol copyFunction = FunctionSymbol.of("copy", List.of(Sort.STRING), Sort.STRING);

        // Then
        assertThatThrownBy(() -> builder.addExtraFunction(len, BuiltinPreOp.CONCAT,
                a -> List.of(a.get(0), a.get(0)), a -> a.get(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("str.len");
        assertThatThrownBy(() -> builder.addExtraFunction(copyFunction, BuiltinPreOp.CONCAT,
                a -> List.of(a.get(0), a.get(0)), a -> a.get(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("copy");

        StringTheory theory = builder.theory();
        assertThat(theory.catalogue().transducerPredicates()).containsOnlyKeys("copy");
        assertThat(theory.catalogue().extensionSymbol("str.len")).isEmpty();
    }
}
