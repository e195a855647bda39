package com.ostrich.strings.catalogue;

import com.ostrich.strings.api.model.FunctionSymbol;
import com.ostrich.strings.api.model.PredicateSymbol;
import com.ostrich.strings.api.model.Sort;
import com.ostrich.strings.api.model.SymbolCategory;
import com.ostrich.strings.theory.StringTheory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolCatalogueTest {

    private SymbolCatalogue catalogue;

    @BeforeEach
    void setUp() {
        catalogue = new SymbolCatalogue(StringTheory.ALPHABET_SIZE,
                List.of(ExtraFunction.reverse()), List.of("toUpper"));
    }

    @Test
    @DisplayName("Every function has a functional predicate of arity n+1")
    void shouldPairEveryFunctionWithPredicate() {
        for (FunctionSymbol f : catalogue.functions()) {
            PredicateSymbol p = catalogue.functionalPredicate(f);

            assertThat(p.arity()).isEqualTo(f.arity() + 1);
            assertThat(p.name()).isEqualTo(f.name());
            assertThat(p.argumentSorts().get(f.arity())).isEqualTo(f.resultSort());
            assertThat(catalogue.originatingFunction(p)).contains(f);
        }
    }

    @Test
    @DisplayName("Genuine predicates have no originating function")
    void shouldNotMapGenuinePredicatesToFunctions() {
        PredicateSymbol inRe = catalogue.predicate(BuiltinPredicate.STR_IN_RE);
        PredicateSymbol transducer = catalogue.transducerPredicates().get("toUpper");

        assertThat(catalogue.originatingFunction(inRe)).isEmpty();
        assertThat(catalogue.originatingFunction(transducer)).isEmpty();
    }

    @Test
    @DisplayName("Character sort is bounded by the alphabet size")
    void shouldBoundCharacterSort() {
        Sort charSort = catalogue.charSort();

        assertThat(catalogue.alphabetSize()).isEqualTo(65536);
        assertThat(charSort.contains(0)).isTrue();
        assertThat(charSort.contains(65535)).isTrue();
        assertThat(charSort.contains(65536)).isFalse();
        assertThat(catalogue.sorts()).containsExactly(charSort, Sort.STRING, Sort.REGEX);
    }

    @Test
    @DisplayName("Predicates are categorised by origin")
    void shouldCategorisePredicates() {
        FunctionSymbol reverse = catalogue.extensionSymbol(ExtraFunction.REVERSE_NAME)
                .flatMap(ExtensionSymbol::asFunction)
                .orElseThrow();

        assertThat(catalogue.category(catalogue.concatPredicate())).contains(SymbolCategory.PREDEFINED);
        assertThat(catalogue.category(catalogue.functionalPredicate(reverse))).contains(SymbolCategory.EXTRA_FUNCTION);
        assertThat(catalogue.category(catalogue.transducerPredicates().get("toUpper"))).contains(SymbolCategory.TRANSDUCER);
        assertThat(catalogue.extensionSymbol("toUpper").orElseThrow().isFunction()).isFalse();
    }

    @Test
    @DisplayName("Transducer predicates relate two strings")
    void shouldDeclareTransducerAsBinaryStringPredicate() {
        PredicateSymbol toUpper = catalogue.transducerPredicates().get("toUpper");

        assertThat(toUpper.argumentSorts()).containsExactly(Sort.STRING, Sort.STRING);
        assertThat(catalogue.predicates()).contains(toUpper);
    }

    @Test
    @DisplayName("Should reject a transducer named like a predefined symbol")
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> new SymbolCatalogue(StringTheory.ALPHABET_SIZE, List.of(), List.of("str.++")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("str.++");
    }

    @Test
    @DisplayName("Unknown functions have no functional predicate")
    void shouldRejectForeignFunction() {
        FunctionSymbol foreign = FunctionSymbol.of("foo", List.of(Sort.STRING), Sort.STRING);

        assertThatThrownBy(() -> catalogue.functionalPredicate(foreign))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
