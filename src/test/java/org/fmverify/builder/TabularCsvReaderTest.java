package org.fmverify.builder;

import org.fmverify.support.Diagnostics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TabularCsvReaderTest {

    @TempDir
    Path tempDir;

    private final TabularCsvReader reader = new TabularCsvReader();

    @Test
    @DisplayName("Righe lette con valori assenti normalizzati a null e flag decimali")
    void testReadRows() throws Exception {
        Path file = tempDir.resolve("rows.csv");
        Files.writeString(file, "\uFEFF" + """
                category_code,ITEM_KEY,ITEM_FEATURE_NAME,ANSWER_FEATURE_NAME,BRANCH_FEATURE_CODE,MICRO_ACTIVE,AUDIT_TYPE_CODE
                CatA,K1,ItemOne,"Yes, always",B1,1.0,nan

                CatA,K2,ItemTwo,,B2,x,planned
                """);

        List<TabularRow> rows = reader.readRows(file);

        assertThat(rows).hasSize(2);
        TabularRow first = rows.get(0);
        assertThat(first.getCategoryCode()).isEqualTo("CatA");
        assertThat(first.getAnswerFeatureName()).isEqualTo("Yes, always");
        assertThat(first.getAuditTypeCode()).isNull();
        assertThat(first.getAuditPlanCode()).isNull();
        assertThat(first.getCapabilityFlag("micro_active")).isEqualTo(1);
        assertThat(first.getCapabilityFlag("iso_active")).isZero();

        TabularRow second = rows.get(1);
        assertThat(second.getAnswerFeatureName()).isNull();
        assertThat(second.getCapabilityFlag("micro_active")).isZero();
        assertThat(second.getAuditTypeCode()).isEqualTo("planned");
    }

    @Test
    @DisplayName("Colonna obbligatoria mancante: eccezione con l'elenco delle colonne")
    void testMissingColumn() throws Exception {
        Path file = tempDir.resolve("broken.csv");
        Files.writeString(file, "CATEGORY_CODE,ITEM_KEY,ITEM_FEATURE_NAME\nCatA,K1,ItemOne\n");

        assertThatThrownBy(() -> reader.readRows(file))
                .isInstanceOf(MissingRequiredFieldException.class)
                .satisfies(e -> assertThat(((MissingRequiredFieldException) e).getMissingColumns())
                        .containsExactly("ANSWER_FEATURE_NAME", "BRANCH_FEATURE_CODE"))
                .hasMessageContaining("broken.csv");
    }

    @Test
    @DisplayName("Regole di ambito incomplete o con etichette sconosciute scartate nel report")
    void testReadScopeRules() throws Exception {
        Path file = tempDir.resolve("scope_rules.csv");
        Files.writeString(file, """
                CAPABILITY_FLAG,TARGET_TYPE,TARGET_CODE,ACTION
                ISO_ACTIVE,category,CatA,Require
                micro_active,,K2,forbid
                path_active,item,,require
                path_active,module,CatA,require
                path_active,item,K1,explode
                """);
        Diagnostics report = new Diagnostics();

        List<ScopeRule> rules = reader.readScopeRules(file, report);

        assertThat(rules).hasSize(2);
        assertThat(rules.get(0).getCapabilityFlag()).isEqualTo("iso_active");
        assertThat(rules.get(0).getTargetType()).isEqualTo(ScopeRule.TargetType.CATEGORY);
        assertThat(rules.get(0).getAction()).isEqualTo(ScopeRule.Action.REQUIRE);
        assertThat(rules.get(1).getTargetType()).isNull();
        assertThat(report.count("DROP_SCOPE_RULE_INCOMPLETE")).isEqualTo(1);
        assertThat(report.count("DROP_SCOPE_RULE_UNKNOWN_TAG")).isEqualTo(2);
    }

    @Test
    @DisplayName("Interpretazione dei flag 0/1")
    void testParseFlag() {
        assertThat(TabularCsvReader.parseFlag("1")).isEqualTo(1);
        assertThat(TabularCsvReader.parseFlag("1.0")).isEqualTo(1);
        assertThat(TabularCsvReader.parseFlag("0")).isZero();
        assertThat(TabularCsvReader.parseFlag("none")).isZero();
        assertThat(TabularCsvReader.parseFlag("yes")).isZero();
        assertThat(TabularCsvReader.parseFlag(null)).isZero();
    }
}
