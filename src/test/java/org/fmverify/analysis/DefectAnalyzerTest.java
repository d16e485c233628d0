package org.fmverify.analysis;

import org.fmverify.cnf.CompilationPolicy;
import org.fmverify.io.HierarchicalTextParser;
import org.fmverify.model.FeatureModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DefectAnalyzerTest {

    private DefectAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new DefectAnalyzer(new Sat4jBackend(), AnalysisOptions.defaults().withThreads(2));
    }

    @AfterEach
    void tearDown() {
        analyzer.close();
    }

    private static FeatureModel parse(String text) throws Exception {
        return new HierarchicalTextParser().parse(text).model();
    }

    @Test
    @DisplayName("Modello pulito: nessun difetto e colonna Defects a None")
    void testCleanModel() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        mandatory
                            a
                        optional
                            b
                constraints
                """);

        AnalysisResult result = analyzer.analyze(model);

        assertThat(result.getStatus()).isEqualTo(AnalysisResult.Status.CONSISTENT);
        assertThat(result.getDeadFeatures()).isEmpty();
        assertThat(result.getFalseOptionalFeatures()).isEmpty();
        assertThat(result.getRedundantClauses()).isNull();
        assertThat(result.hasDefects()).isFalse();
        assertThat(result.defectsText()).isEqualTo("None");
        assertThat(result.satLabel()).isEqualTo("SAT");
        assertThat(result.getRoot()).isEqualTo("InternalAuditSystem");
    }

    @Test
    @DisplayName("Un figlio mandatory escluso dalla radice rende il modello VOID senza difetti per-feature")
    void testVoidTakesPrecedence() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        mandatory
                            a
                        optional
                            b
                constraints
                    InternalAuditSystem => !a
                """);

        AnalysisResult result = analyzer.analyze(model);

        assertThat(result.isVoid()).isTrue();
        assertThat(result.getDeadFeatures()).isEmpty();
        assertThat(result.getFalseOptionalFeatures()).isEmpty();
        assertThat(result.defectLabels()).containsExactly("VOID_MODEL");
        assertThat(result.satLabel()).isEqualTo("UNSAT");
        assertThat(result.hasDefects()).isTrue();
    }

    @Test
    @DisplayName("Esclusività del gruppo alternative: un figlio che implica il fratello è morto")
    void testAlternativeExclusivity() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        alternative
                            x
                            y
                constraints
                    x => y
                """);

        AnalysisResult result = analyzer.analyze(model);

        assertThat(result.getStatus()).isEqualTo(AnalysisResult.Status.CONSISTENT);
        assertThat(result.getDeadFeatures()).containsExactly("x");
        assertThat(result.defectLabels()).containsExactly("DF:x");
    }

    @Test
    @DisplayName("Figlio opzionale implicato dalla radice è false-optional")
    void testFalseOptional() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        optional
                            b
                            c
                constraints
                    InternalAuditSystem => b
                """);

        AnalysisResult result = analyzer.analyze(model);

        assertThat(result.getFalseOptionalFeatures()).containsExactly("b");
        assertThat(result.getDeadFeatures()).isEmpty();
        assertThat(result.defectsText()).isEqualTo("FO:b");
    }

    @Test
    @DisplayName("Un figlio mandatory che esclude il padre rende morti entrambi")
    void testMandatorySemantics() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        optional
                            p
                                mandatory
                                    q
                constraints
                    q => !p
                """);

        AnalysisResult result = analyzer.analyze(model);

        // q richiede p ma lo esclude: entrambi morti, modello comunque soddisfacibile
        assertThat(result.getStatus()).isEqualTo(AnalysisResult.Status.CONSISTENT);
        assertThat(result.getDeadFeatures()).containsExactly("p", "q");
    }

    @Test
    @DisplayName("La politica IMPLICATIONS_ONLY ignora equivalenze e vincoli unitari")
    void testImplicationsOnlyPolicy() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        optional
                            b
                            c
                            d
                constraints
                    b <=> c
                    InternalAuditSystem => c
                    !d
                """);

        AnalysisResult result = analyzer.analyze(model);

        assertThat(result.getFalseOptionalFeatures()).containsExactly("c");
        assertThat(result.getDeadFeatures()).isEmpty();
    }

    @Test
    @DisplayName("La politica FULL compila equivalenze e vincoli unitari")
    void testFullPolicy() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        optional
                            b
                            c
                            d
                constraints
                    b <=> c
                    InternalAuditSystem => c
                    !d
                """);

        AnalysisOptions options = AnalysisOptions.defaults().withThreads(2).withPolicy(CompilationPolicy.FULL);
        try (DefectAnalyzer full = new DefectAnalyzer(new Sat4jBackend(), options)) {
            AnalysisResult result = full.analyze(model);

            assertThat(result.getFalseOptionalFeatures()).containsExactly("b", "c");
            assertThat(result.getDeadFeatures()).containsExactly("d");
        }
    }

    @Test
    @DisplayName("Il controllo di ridondanza individua l'implicazione già garantita dal gruppo mandatory")
    void testRedundancyCheck() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        mandatory
                            a
                        optional
                            b
                constraints
                    InternalAuditSystem => a
                """);

        AnalysisOptions options = AnalysisOptions.defaults().withThreads(2).withRedundancyCheck(true);
        try (DefectAnalyzer redundancy = new DefectAnalyzer(new Sat4jBackend(), options)) {
            AnalysisResult result = redundancy.analyze(model);

            assertThat(result.getRedundantClauses()).contains("imp:InternalAuditSystem => a");
            assertThat(result.getRedundancyNote()).isNull();
            assertThat(result.defectLabels()).anyMatch(label -> label.startsWith("RE_CLAUSES:"));
            assertThat(result.hasDefects()).isTrue();
        }
    }

    @Test
    @DisplayName("Oltre il limite di clausole il controllo di ridondanza viene saltato con nota")
    void testRedundancySkippedAboveLimit() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        optional
                            a
                            b
                constraints
                """);

        AnalysisOptions options = AnalysisOptions.defaults().withThreads(1)
                .withRedundancyCheck(true).withMaxRedundancyClauses(1);
        try (DefectAnalyzer limited = new DefectAnalyzer(new Sat4jBackend(), options)) {
            AnalysisResult result = limited.analyze(model);

            assertThat(result.getRedundantClauses()).isNull();
            assertThat(result.getRedundancyNote()).isEqualTo("RE_SKIPPED:clauses=3>1");
            assertThat(result.defectLabels()).isEmpty();
        }
    }

    @Test
    @DisplayName("Una radice non canonica viene annotata nella colonna Defects ma non è un difetto")
    void testNonCanonicalRootNote() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    Top
                        optional
                            a
                constraints
                """);

        AnalysisResult result = analyzer.analyze(model);

        assertThat(result.getRoot()).isEqualTo("Top");
        assertThat(result.getRootNote()).startsWith("WARNING:canonical_root_missing");
        assertThat(result.hasDefects()).isFalse();
        assertThat(result.defectsText()).isEqualTo(result.getRootNote());
    }

    @Test
    @DisplayName("La nota radice del parser prevale su quella calcolata")
    void testParserRootNoteWins() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    Top
                        optional
                            a
                constraints
                """);

        AnalysisResult result = analyzer.analyze(model, "WARNING:explicit_root(Top)");

        assertThat(result.getRootNote()).isEqualTo("WARNING:explicit_root(Top)");
    }

    @Test
    @DisplayName("Le statistiche contano tutte le query eseguite")
    void testStatistics() throws Exception {
        FeatureModel model = parse("""
                namespace T
                features
                    InternalAuditSystem
                        optional
                            a
                            b
                constraints
                """);

        AnalysisResult result = analyzer.analyze(model);

        // 1 vuotezza + 3 feature morte + 2 false-optional
        assertThat(result.getStatistics().getQueries()).isEqualTo(6);
        assertThat(result.getStatistics().getUnknownCount()).isZero();
        assertThat(result.getFeatureCount()).isEqualTo(3);
    }
}
