package org.fmverify.io;

import org.fmverify.builder.ModelBuilder;
import org.fmverify.builder.ScopeRule;
import org.fmverify.builder.TabularRow;
import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Group;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Costruzione, formato gerarchico e fatti relazionali devono descrivere lo stesso modello.
 */
class FormatRoundTripTest {

    private static FeatureModel builtModel() throws Exception {
        List<TabularRow> rows = List.of(
                new TabularRow("CatA", "K1", "ItemOne", "Yes", "B1", "planned", "Plan1", 1, 0, 0),
                new TabularRow("CatA", "K1", "ItemOne", "No", "B2", "re_evaluate", "Plan2", 0, 1, 0),
                TabularRow.content("CatB", "K2", "ItemTwo", "Ok", "B2"));
        List<ScopeRule> rules = List.of(
                new ScopeRule("iso_active", ScopeRule.TargetType.CATEGORY, "CatB", ScopeRule.Action.FORBID));
        return new ModelBuilder().build(rows, rules).getModel();
    }

    private static Set<String> groupsAsSets(FeatureModel model) {
        Set<String> result = new HashSet<>();
        for (Group group : model.getGroups()) {
            result.add(group.getParent() + "/" + group.getKind() + "/" + new HashSet<>(group.getChildren()));
        }
        return result;
    }

    private static Set<String> parents(FeatureModel model) {
        return model.getFeatures().values().stream()
                .map(f -> f.getName() + "<-" + f.getParent() + (f.isAbstract() ? "*" : ""))
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("Costruzione → gerarchico → fatti → modello: struttura e implicazioni preservate")
    void testBuildWriteParseConvert() throws Exception {
        FeatureModel built = builtModel();

        String hierarchical = new HierarchicalTextWriter().write(built);
        FeatureModel fromText = new HierarchicalTextParser().parse(hierarchical).model();

        String facts = new RelationalFactWriter().write(fromText);
        ParsedModel fromFacts = new RelationalFactParser().parse(facts);

        for (FeatureModel model : List.of(fromText, fromFacts.model())) {
            assertThat(model.getNamespace()).isEqualTo(built.getNamespace());
            assertThat(model.getFeatureNames()).containsExactlyInAnyOrderElementsOf(built.getFeatureNames());
            assertThat(parents(model)).isEqualTo(parents(built));
            assertThat(groupsAsSets(model)).isEqualTo(groupsAsSets(built));
            assertThat(model.getImplications()).containsExactlyElementsOf(built.getImplications());
        }
        assertThat(fromText.getConstraints()).containsExactlyElementsOf(built.getConstraints());
        assertThat(fromFacts.diagnostics().isEmpty()).isTrue();
        assertThat(fromFacts.rootNote()).isNull();
    }

    @Test
    @DisplayName("Le equivalenze sopravvivono alla scomposizione in fatti equiv_or")
    void testEquivalencesSurviveFacts() throws Exception {
        FeatureModel built = builtModel();

        FeatureModel fromFacts = new RelationalFactParser().parse(new RelationalFactWriter().write(built)).model();

        List<Constraint> expected = built.getConstraints().stream()
                .filter(c -> c.getType() == Constraint.Type.EQUIVALENCE_OR).toList();
        assertThat(fromFacts.getConstraints()).containsAll(expected);
    }

    @Test
    @DisplayName("Scrittura gerarchica stabile dopo una rilettura")
    void testHierarchicalTextIsStable() throws Exception {
        HierarchicalTextWriter writer = new HierarchicalTextWriter();
        String first = writer.write(builtModel());

        String second = writer.write(new HierarchicalTextParser().parse(first).model());

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Conversione su file e lettura per estensione")
    void testConverterAndReader(@TempDir Path tempDir) throws Exception {
        Path uvl = tempDir.resolve("audit_v2.uvl");
        new HierarchicalTextWriter().write(builtModel(), uvl);

        ModelFormatConverter.Conversion conversion = new ModelFormatConverter().convert(uvl, tempDir.resolve("kr"));

        assertThat(conversion.outputFile().getFileName().toString()).isEqualTo("audit_v2.kr.pl");
        assertThat(Files.readString(conversion.outputFile())).startsWith("% namespace: ");

        ModelReader reader = new ModelReader();
        assertThat(reader.read(conversion.outputFile()).model().featureCount())
                .isEqualTo(reader.read(uvl).model().featureCount());

        Path unknown = tempDir.resolve("model.json");
        Files.writeString(unknown, "{}");
        assertThatThrownBy(() -> reader.read(unknown))
                .isInstanceOf(ModelParseException.class)
                .hasMessageContaining("model.json");
    }
}
