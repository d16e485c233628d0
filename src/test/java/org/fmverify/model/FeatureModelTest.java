package org.fmverify.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FeatureModelTest {

    private static FeatureModel.Builder sample() {
        return new FeatureModel.Builder("T")
                .addFeature("r", true, null)
                .addFeature("a", false, "r")
                .addFeature("b", false, "r")
                .addGroup("r", GroupKind.OPTIONAL, List.of("a", "b"))
                .addConstraint(Constraint.implication(Literal.positive("a"), Literal.positive("b")));
    }

    @Test
    @DisplayName("Modello valido con accessi in ordine di dichiarazione")
    void testValidModel() throws Exception {
        FeatureModel model = sample().build();

        assertThat(model.getRoot()).isEqualTo("r");
        assertThat(model.getFeatureNames()).containsExactly("r", "a", "b");
        assertThat(model.getOptionalChildren()).containsExactly("a", "b");
        assertThat(model.getImplications()).hasSize(1);
        assertThat(model.featureCount()).isEqualTo(3);
        assertThat(model.groupCount()).isEqualTo(1);
        assertThat(model.hasFeature(null)).isFalse();
    }

    @Test
    @DisplayName("Namespace vuoto sostituito dal namespace predefinito")
    void testDefaultNamespace() throws Exception {
        FeatureModel model = new FeatureModel.Builder(" ").addFeature("r", false, null).build();

        assertThat(model.getNamespace()).isEqualTo(AuditVocabulary.DEFAULT_NAMESPACE);
    }

    @Test
    @DisplayName("Violazioni strutturali rifiutate alla costruzione")
    void testStructuralViolations() {
        assertThatThrownBy(() -> new FeatureModel.Builder("T")
                .addFeature("r", false, null).addFeature("s", false, null).build())
                .isInstanceOf(ModelReferenceException.class)
                .hasMessageContaining("esattamente una radice");

        assertThatThrownBy(() -> new FeatureModel.Builder("T")
                .addFeature("r", false, null).addFeature("a", false, "ghost").build())
                .isInstanceOf(ModelReferenceException.class)
                .hasMessageContaining("ghost");

        assertThatThrownBy(() -> new FeatureModel.Builder("T")
                .addFeature("r", false, null).addFeature("a", false, "r").build())
                .isInstanceOf(ModelReferenceException.class)
                .hasMessageContaining("nessun gruppo");

        assertThatThrownBy(() -> sample().addFeature("a", false, "r").build())
                .isInstanceOf(ModelReferenceException.class)
                .hasMessageContaining("più volte");

        assertThatThrownBy(() -> sample().addGroup("r", GroupKind.OR, List.of("a")).build())
                .isInstanceOf(ModelReferenceException.class)
                .hasMessageContaining("più gruppi");

        assertThatThrownBy(() -> sample().addConstraint(Constraint.unit(Literal.negative("zzz"))).build())
                .isInstanceOf(ModelReferenceException.class)
                .hasMessageContaining("zzz");
    }

    @Test
    @DisplayName("Figlio di gruppo con padre diverso dal padre dichiarato")
    void testGroupParentMismatch() {
        assertThatThrownBy(() -> new FeatureModel.Builder("T")
                .addFeature("r", false, null)
                .addFeature("a", false, "r")
                .addFeature("b", false, "a")
                .addGroup("r", GroupKind.MANDATORY, List.of("a", "b"))
                .build())
                .isInstanceOf(ModelReferenceException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    @DisplayName("I vincoli anteposti precedono quelli esistenti e il modello originale non cambia")
    void testPrependedConstraints() throws Exception {
        FeatureModel original = sample().build();
        Constraint extra = Constraint.implication(Literal.positive("r"), Literal.negative("a"));

        FeatureModel extended = original.withPrependedConstraints(List.of(extra));

        assertThat(extended.getConstraints()).hasSize(2);
        assertThat(extended.getConstraints().get(0)).isEqualTo(extra);
        assertThat(original.getConstraints()).hasSize(1);
        assertThat(extended.getFeatureNames()).containsExactlyElementsOf(original.getFeatureNames());
    }
}
