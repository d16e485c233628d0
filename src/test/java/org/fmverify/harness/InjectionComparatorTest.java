package org.fmverify.harness;

import org.fmverify.analysis.AnalysisOptions;
import org.fmverify.analysis.AnalysisResult;
import org.fmverify.analysis.DefectAnalyzer;
import org.fmverify.analysis.Sat4jBackend;
import org.fmverify.io.HierarchicalTextParser;
import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Literal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.fmverify.model.AuditVocabulary.CANONICAL_ROOT;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InjectionComparatorTest {

    private static final String CLEAN = """
            namespace T
            features
                InternalAuditSystem
                    mandatory
                        m
                    optional
                        p
                        q
                        r
                        s
            constraints
                p => s
            """;

    private final InjectionComparator comparator = new InjectionComparator();
    private DefectAnalyzer analyzer;
    private FeatureModel clean;

    @Mock
    private AnalysisResult mockedResult;

    @BeforeEach
    void setUp() throws Exception {
        analyzer = new DefectAnalyzer(new Sat4jBackend(), AnalysisOptions.defaults().withThreads(2));
        clean = new HierarchicalTextParser().parse(CLEAN).model();
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    private static Constraint rootImplies(Literal rhs) {
        return Constraint.implication(Literal.positive(CANONICAL_ROOT), rhs);
    }

    private FeatureModel injectedModel() throws Exception {
        return clean.withPrependedConstraints(List.of(
                rootImplies(Literal.negative("q")),
                rootImplies(Literal.positive("r"))));
    }

    @Test
    @DisplayName("Difetti iniettati rilevati: classe OK con aspettative e fatti nuovi")
    void testDetectedInjection() throws Exception {
        FeatureModel injected = injectedModel();

        ComparisonResult comparison = comparator.compare(clean, injected, analyzer.analyze(injected), null);

        assertThat(comparison.detectionClass()).isEqualTo(DetectionClass.OK);
        assertThat(comparison.isOk()).isTrue();
        assertThat(comparison.newFacts()).hasSize(2);
        assertThat(comparison.removedFacts()).isEmpty();
        assertThat(comparison.expectedDead()).containsExactly("q");
        assertThat(comparison.expectedFalseOptional()).containsExactly("r");
        assertThat(comparison.missed()).isEmpty();
        assertThat(comparison.oracleConsistent()).isNull();
    }

    @Test
    @DisplayName("Controllo incrociato con l'oracolo")
    void testOracleCrossCheck() throws Exception {
        FeatureModel injected = injectedModel();
        AnalysisResult result = analyzer.analyze(injected);

        OracleRecord matching = new OracleRecord("t_injected.uvl", "t.uvl", "q", "r", "s");
        OracleRecord wrongDead = new OracleRecord("t_injected.uvl", "t.uvl", "p", "r", "s");
        OracleRecord unknownFeature = new OracleRecord("t_injected.uvl", "t.uvl", "q", "r", "ghost");

        assertThat(comparator.compare(clean, injected, result, matching).oracleConsistent()).isTrue();
        assertThat(comparator.compare(clean, injected, result, wrongDead).oracleConsistent()).isFalse();
        assertThat(comparator.compare(clean, injected, result, unknownFeature).oracleConsistent()).isFalse();
    }

    @Test
    @DisplayName("Modello iniettato VOID: le aspettative per-feature non si applicano")
    void testVoidInjectedModel() throws Exception {
        FeatureModel injected = clean.withPrependedConstraints(List.of(rootImplies(Literal.negative("m"))));
        AnalysisResult result = analyzer.analyze(injected);

        ComparisonResult comparison = comparator.compare(clean, injected, result,
                new OracleRecord("t_injected.uvl", "t.uvl", "m", "p", "s"));

        assertThat(result.isVoid()).isTrue();
        assertThat(comparison.expectedDead()).containsExactly("m");
        assertThat(comparison.missed()).isEmpty();
        assertThat(comparison.detectionClass()).isEqualTo(DetectionClass.OK);
        assertThat(comparison.oracleConsistent()).isTrue();
    }

    @Test
    @DisplayName("Bersaglio false-optional sotto un gruppo mandatory: non rilevabile, DETECTOR_MISS")
    void testFalseOptionalTargetOutsideOptionalGroup() throws Exception {
        FeatureModel injected = clean.withPrependedConstraints(List.of(
                rootImplies(Literal.negative("q")),
                rootImplies(Literal.positive("m"))));
        AnalysisResult result = analyzer.analyze(injected);

        ComparisonResult comparison = comparator.compare(clean, injected, result,
                new OracleRecord("t_injected.uvl", "t.uvl", "q", "m", "s"));

        assertThat(result.getDeadFeatures()).contains("q");
        assertThat(result.getFalseOptionalFeatures()).doesNotContain("m");
        assertThat(comparison.expectedFalseOptional()).containsExactly("m");
        assertThat(comparison.missed()).containsExactly("FO:m");
        assertThat(comparison.detectionClass()).isEqualTo(DetectionClass.DETECTOR_MISS);
        assertThat(comparison.oracleConsistent()).isFalse();
    }

    @Test
    @DisplayName("Nessun fatto nuovo: MISSING_INJECTION")
    void testMissingInjection() {
        ComparisonResult comparison = comparator.compare(clean, clean, analyzer.analyze(clean), null);

        assertThat(comparison.detectionClass()).isEqualTo(DetectionClass.MISSING_INJECTION);
        assertThat(comparison.newFacts()).isEmpty();
    }

    @Test
    @DisplayName("Rilevazione parziale: DETECTOR_MISS con le etichette mancanti")
    void testPartialDetection() throws Exception {
        when(mockedResult.getDeadFeatures()).thenReturn(List.of("q"));
        when(mockedResult.getFalseOptionalFeatures()).thenReturn(List.of());
        when(mockedResult.hasDefects()).thenReturn(true);

        ComparisonResult comparison = comparator.compare(clean, injectedModel(), mockedResult, null);

        assertThat(comparison.detectionClass()).isEqualTo(DetectionClass.DETECTOR_MISS);
        assertThat(comparison.missed()).containsExactly("FO:r");
    }

    @Test
    @DisplayName("Nessun difetto segnalato: DETECTOR_MISS")
    void testNoDefectsReported() throws Exception {
        when(mockedResult.hasDefects()).thenReturn(false);

        ComparisonResult comparison = comparator.compare(clean, injectedModel(), mockedResult, null);

        assertThat(comparison.detectionClass()).isEqualTo(DetectionClass.DETECTOR_MISS);
        assertThat(comparison.missed()).containsExactly("DF:q", "FO:r");
    }

    @Test
    @DisplayName("Fatto nuovo verso una feature assente dal modello iniettato: INVALID_TARGET")
    void testInvalidTarget(@Mock FeatureModel injected) {
        when(injected.getImplications()).thenReturn(List.of(rootImplies(Literal.negative("ghost"))));
        when(injected.hasFeature(CANONICAL_ROOT)).thenReturn(true);
        when(injected.hasFeature("ghost")).thenReturn(false);

        ComparisonResult comparison = comparator.compare(clean, injected, mockedResult, null);

        assertThat(comparison.detectionClass()).isEqualTo(DetectionClass.INVALID_TARGET);
    }
}
