package com.ostrich.strings.cache;

import com.ostrich.strings.api.exceptions.StringSolverException;
import com.ostrich.strings.api.model.Atom;
import com.ostrich.strings.api.model.ConstantTerm;
import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.DecisionOutcome;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.api.model.StringModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LruDecisionCacheTest {

    private static final PredicateSymbol EMPTY = new PredicateSymbol("str.empty", List.of(Sort.STRING));

    private LruDecisionCache cache;

    @BeforeEach
    void setUp() {
        cache = LruDecisionCache.builder().build();
    }

    private static ConstraintSet facts(String variable) {
        return ConstraintSet.of(Atom.of(EMPTY, ConstantTerm.string(variable)));
    }

    private static DecisionOutcome model(String variable) {
        return DecisionOutcome.sat(StringModel.builder().word(ConstantTerm.string(variable), "").build());
    }

    @Test
    @DisplayName("Default capacity is three")
    void shouldDefaultToCapacityThree() {
        assertThat(cache.capacity()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should compute once and reuse the outcome for equal snapshots")
    void shouldComputeOncePerKey() {
        // Given
        AtomicInteger searches = new AtomicInteger();

        // When
        DecisionOutcome first = cache.get(facts("x"), () -> {
            searches.incrementAndGet();
            return model("x");
        });
        DecisionOutcome second = cache.get(facts("x"), () -> {
            searches.incrementAndGet();
            return DecisionOutcome.noModel();
        });

        // Then
        assertThat(searches.get()).isEqualTo(1);
        assertThat(second).isSameAs(first);
        assertThat(cache.getMetrics().hits()).isEqualTo(1);
        assertThat(cache.getMetrics().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cache no-model outcomes")
    void shouldCacheNoModel() {
        cache.get(facts("x"), DecisionOutcome::noModel);

        assertThat(cache.getIfPresent(facts("x"))).contains(DecisionOutcome.noModel());
    }

    @Test
    @DisplayName("Should evict the least recently accessed snapshot")
    void shouldEvictLeastRecentlyUsed() {
        // Given
        cache.get(facts("a"), () -> model("a"));
        cache.get(facts("b"), () -> model("b"));
        cache.get(facts("c"), () -> model("c"));
        cache.get(facts("a"), () -> model("a"));

        // When
        cache.get(facts("d"), () -> model("d"));

        // Then
        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.contains(facts("b"))).isFalse();
        assertThat(cache.getIfPresent(facts("a"))).contains(model("a"));
        assertThat(cache.getIfPresent(facts("c"))).contains(model("c"));
        assertThat(cache.getIfPresent(facts("d"))).contains(model("d"));
        assertThat(cache.getMetrics().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not cache failed searches")
    void shouldNotCacheFailures() {
        // When
        assertThatThrownBy(() -> cache.get(facts("x"), () -> {
            throw new StringSolverException("automaton too large");
        })).isInstanceOf(StringSolverException.class)
                .hasMessageContaining("automaton too large");

        // Then
        assertThat(cache.contains(facts("x"))).isFalse();
        assertThat(cache.get(facts("x"), () -> model("x"))).isEqualTo(model("x"));
    }

    @Test
    @DisplayName("Concurrent requests for one snapshot share a single search")
    void shouldShareConcurrentComputation() throws Exception {
        // Given
        AtomicInteger searches = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<DecisionOutcome>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<DecisionOutcome> task = () -> cache.get(facts("x"), () -> {
                    searches.incrementAndGet();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return model("x");
                });
                results.add(executor.submit(task));
            }

            // When
            Thread.sleep(100);
            release.countDown();

            // Then
            for (Future<DecisionOutcome> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(model("x"));
            }
            assertThat(searches.get()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should clear all entries")
    void shouldInvalidateAll() {
        cache.get(facts("a"), () -> model("a"));
        cache.get(facts("b"), () -> model("b"));

        cache.invalidateAll();

        assertThat(cache.size()).isZero();
        assertThat(cache.getIfPresent(facts("a"))).isEmpty();
    }

    @Test
    @DisplayName("Should reject non-positive capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> LruDecisionCache.builder().maxSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
