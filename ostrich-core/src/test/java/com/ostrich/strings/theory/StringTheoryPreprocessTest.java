package com.ostrich.strings.theory;

import com.ostrich.strings.api.model.ConstantTerm;
import com.ostrich.strings.api.model.ConstraintSet;
import com.ostrich.strings.api.model.IntegerTerm;
import com.ostrich.strings.api.model.SatSoundness;
import com.ostrich.strings.api.model.TermOrder;
import com.ostrich.strings.catalogue.BuiltinFunction;
import com.ostrich.strings.catalogue.SymbolCatalogue;
import com.ostrich.strings.infra.config.LengthMode;
import com.ostrich.strings.infra.config.OstrichFlags;
import com.ostrich.strings.registry.OperatorRegistry;
import com.ostrich.strings.session.SolvingSession;
import com.ostrich.strings.support.SupportClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StringTheoryPreprocessTest {

    private SymbolCatalogue catalogue;
    private SolvingSession session;

    private final ConstantTerm x = ConstantTerm.string("x");
    private final ConstantTerm y = ConstantTerm.string("y");
    private final ConstantTerm ab = ConstantTerm.string("ab");
    private final ConstantTerm n = ConstantTerm.integer("n");
    private final TermOrder order = TermOrder.of(x, y, ab, n);

    @BeforeEach
    void setUp() {
        catalogue = new SymbolCatalogue(StringTheory.ALPHABET_SIZE, List.of(), List.of());
        session = new SolvingSession();
    }

    private StringTheory theory(LengthMode mode) {
        OstrichFlags flags = new OstrichFlags(false, mode, false);
        return new StringTheory("OSTRICH", catalogue, OperatorRegistry.build(catalogue, Map.of()),
                SupportClassifier.classify(catalogue, flags), flags, session);
    }

    /** {@code x = ab ++ y, len(x) = n, n = 5} */
    private ConstraintSet concatWithLength() {
        return ConstraintSet.builder()
                .atom(catalogue.concatPredicate(), ab, y, x)
                .atom(catalogue.predicate(BuiltinFunction.STR_LEN), x, n)
                .equality(n, 5)
                .build();
    }

    @Test
    @DisplayName("Supported facts never raise incompleteness")
    void shouldNotFlagSupportedFacts() {
        StringTheory theory = theory(LengthMode.ON);
        ConstraintSet facts = concatWithLength();

        ConstraintSet result = theory.preprocess(facts, order);

        assertThat(result).isSameAs(facts);
        assertThat(session.isIncomplete()).isFalse();
    }

    @Test
    @DisplayName("Length with length reasoning off raises incompleteness and leaves facts unchanged")
    void shouldFlagLengthWhenLengthReasoningOff() {
        StringTheory theory = theory(LengthMode.OFF);
        ConstraintSet facts = concatWithLength();

        ConstraintSet result = theory.preprocess(facts, order);

        assertThat(result).isSameAs(facts);
        assertThat(result).isEqualTo(concatWithLength());
        assertThat(session.isIncomplete()).isTrue();
        assertThat(session.incompletenessReason()).contains("str.len");
        assertThat(theory.supportedPredicates().isSupported(catalogue.concatPredicate())).isTrue();
    }

    @Test
    @DisplayName("Incompleteness is raised once however often unsupported facts are seen")
    void shouldRaiseIncompletenessOnce() {
        StringTheory theory = theory(LengthMode.AUTO);
        ConstraintSet facts = ConstraintSet.builder()
                .atom(catalogue.predicate(BuiltinFunction.STR_AT), x, new IntegerTerm(0), y)
                .build();

        theory.preprocess(facts, order);
        String firstReason = session.incompletenessReason();
        theory.preprocess(ConstraintSet.builder()
                .atom(catalogue.predicate(BuiltinFunction.STR_HEAD), x, ConstantTerm.string("c"))
                .build(), order);

        assertThat(session.isIncomplete()).isTrue();
        assertThat(session.incompletenessReason()).isEqualTo(firstReason).contains("str.at");
    }

    @Test
    @DisplayName("Satisfiability is sound for elementary and existential problems only")
    void shouldReportSoundnessForSat() {
        StringTheory theory = theory(LengthMode.AUTO);

        assertThat(theory.isSoundForSat(SatSoundness.ELEMENTARY)).isTrue();
        assertThat(theory.isSoundForSat(SatSoundness.EXISTENTIAL)).isTrue();
        assertThat(theory.isSoundForSat(SatSoundness.GENERAL)).isFalse();
    }

    @Test
    @DisplayName("Should recognise facts mentioning the theory")
    void shouldDetectTheoryPredicates() {
        StringTheory theory = theory(LengthMode.AUTO);

        assertThat(theory.mentionsTheory(concatWithLength())).isTrue();
        assertThat(theory.mentionsTheory(ConstraintSet.builder().equality(n, 5).build())).isFalse();
    }
}
