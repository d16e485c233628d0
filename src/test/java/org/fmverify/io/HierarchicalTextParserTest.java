package org.fmverify.io;

import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Group;
import org.fmverify.model.GroupKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class HierarchicalTextParserTest {

    private final HierarchicalTextParser parser = new HierarchicalTextParser();

    @Test
    @DisplayName("Albero, gruppi, feature astratte e vincoli ricostruiti")
    void testStructure() throws Exception {
        ParsedModel parsed = parser.parse("""
                namespace Audit

                features
                    Root {abstract}
                        mandatory
                            a
                                alternative
                                    a1
                                    a2
                        optional
                            b
                constraints
                    a1 => b
                    b <=> (a1 | a2)
                    !a2
                    a1 & b => a2
                """);

        FeatureModel model = parsed.model();
        assertThat(model.getNamespace()).isEqualTo("Audit");
        assertThat(model.getRoot()).isEqualTo("Root");
        assertThat(model.getFeature("Root").isAbstract()).isTrue();
        assertThat(model.getFeature("a2").getParent()).isEqualTo("a");
        assertThat(model.getGroupsOf("Root")).extracting(Group::getKind)
                .containsExactly(GroupKind.MANDATORY, GroupKind.OPTIONAL);
        assertThat(model.getGroupsOf("a").get(0).getChildren()).containsExactly("a1", "a2");
        assertThat(model.getConstraints()).extracting(Constraint::getType).containsExactly(
                Constraint.Type.IMPLICATION, Constraint.Type.EQUIVALENCE_OR, Constraint.Type.UNIT, Constraint.Type.RAW);
        assertThat(parsed.diagnostics().isEmpty()).isTrue();
        assertThat(parsed.rootNote()).isNull();
    }

    @Test
    @DisplayName("Commenti e righe vuote ignorati")
    void testComments() throws Exception {
        FeatureModel model = parser.parse("""
                namespace T // modello di prova
                features
                    r
                        # figli opzionali
                        optional
                            a
                constraints
                """).model();

        assertThat(model.getFeatureNames()).containsExactly("r", "a");
        assertThat(model.getNamespace()).isEqualTo("T");
    }

    @Test
    @DisplayName("Vincoli con feature sconosciute scartati come REFERENCE_ERROR")
    void testDanglingConstraintDropped() throws Exception {
        ParsedModel parsed = parser.parse("""
                namespace T
                features
                    r
                        optional
                            a
                constraints
                    a => ghost
                    r => a
                """);

        assertThat(parsed.model().getConstraints()).hasSize(1);
        assertThat(parsed.diagnostics().count(HierarchicalTextParser.REFERENCE_ERROR)).isEqualTo(1);
        assertThat(parsed.diagnostics().examples(HierarchicalTextParser.REFERENCE_ERROR).get(0)).contains("ghost");
    }

    @Test
    @DisplayName("Feature fuori da una keyword di gruppo rifiutata con numero di riga")
    void testFeatureOutsideGroup() {
        assertThatThrownBy(() -> parser.parse("""
                namespace T
                features
                    r
                        a
                """))
                .isInstanceOf(ModelParseException.class)
                .satisfies(e -> assertThat(((ModelParseException) e).getLineNumber()).isEqualTo(4));
    }

    @Test
    @DisplayName("Errori strutturali: seconda radice, feature duplicata, keyword orfana")
    void testStructuralErrors() {
        assertThatThrownBy(() -> parser.parse("features\n    r\n    s\n"))
                .isInstanceOf(ModelParseException.class)
                .hasMessageContaining("radice");

        assertThatThrownBy(() -> parser.parse("features\n    r\n        optional\n            a\n            a\n"))
                .isInstanceOf(ModelParseException.class)
                .hasMessageContaining("più volte");

        assertThatThrownBy(() -> parser.parse("features\n    optional\n"))
                .isInstanceOf(ModelParseException.class);

        assertThatThrownBy(() -> parser.parse("namespace T\n"))
                .isInstanceOf(ModelParseException.class)
                .hasMessageContaining("Nessuna feature");
    }

    @Test
    @DisplayName("Vincolo non riconosciuto dalla grammatica conservato come RAW")
    void testUnparsedConstraintKeptAsRaw() throws Exception {
        ParsedModel parsed = parser.parse("""
                namespace T
                features
                    r
                        optional
                            a
                            b
                constraints
                    a requires b
                    a => b
                """);

        List<Constraint> constraints = parsed.model().getConstraints();
        assertThat(constraints).hasSize(2);
        assertThat(constraints.get(0).getType()).isEqualTo(Constraint.Type.RAW);
        assertThat(constraints.get(0).toHierarchicalText()).isEqualTo("a requires b");
        assertThat(constraints.get(1).getType()).isEqualTo(Constraint.Type.IMPLICATION);
        assertThat(parsed.diagnostics().count(HierarchicalTextParser.UNPARSED_CONSTRAINT)).isEqualTo(1);
        assertThat(parsed.diagnostics().examples(HierarchicalTextParser.UNPARSED_CONSTRAINT))
                .containsExactly("riga 8: 'a requires b'");
    }

    @Test
    @DisplayName("Lettura da file in UTF-8")
    void testParseFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("model.uvl");
        Files.writeString(file, "namespace T\nfeatures\n    r\n        optional\n            a\nconstraints\n    a => r\n");

        ParsedModel parsed = parser.parse(file);

        assertThat(parsed.model().featureCount()).isEqualTo(2);
        assertThat(parsed.model().getImplications()).hasSize(1);
    }
}
