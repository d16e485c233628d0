package org.fmverify.support;

import org.fmverify.model.FeatureModel;
import org.fmverify.model.GroupKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CsvSupportTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Campi tra apici con virgole e apici raddoppiati")
    void testSplitQuotedLine() {
        assertThat(CsvSupport.splitLine("a,\"b, c\",\"say \"\"hi\"\"\",")).containsExactly("a", "b, c", "say \"hi\"", "");
    }

    @Test
    @DisplayName("Scrittura e rilettura preservano i valori")
    void testWriteThenRead() throws Exception {
        Path file = tempDir.resolve("out/table.csv");
        CsvSupport.write(file, List.of("Name", "Defects"), List.of(
                List.of("m1", "DF:a; FO:b"),
                List.of("m2", "ERROR:ModelParseException:riga 3, vincolo \"x\"")));

        CsvSupport.Table table = CsvSupport.read(file);

        assertThat(table.header()).containsExactly("Name", "Defects");
        assertThat(table.indexOf(" defects ")).isEqualTo(1);
        assertThat(table.indexOf("Missing")).isEqualTo(-1);
        assertThat(table.rows().get(1).get(1)).isEqualTo("ERROR:ModelParseException:riga 3, vincolo \"x\"");
        assertThat(CsvSupport.Table.cell(table.rows().get(0), 5)).isNull();
    }

    @Test
    @DisplayName("BOM iniziale rimosso dall'intestazione")
    void testByteOrderMark() throws Exception {
        Path file = tempDir.resolve("bom.csv");
        Files.writeString(file, "\uFEFFA,B\n1,2\n");

        assertThat(CsvSupport.read(file).indexOf("A")).isZero();
    }

    @Test
    @DisplayName("File vuoto: intestazione mancante")
    void testEmptyFile() throws Exception {
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, "\n\n");

        assertThatThrownBy(() -> CsvSupport.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("intestazione");
    }

    @Test
    @DisplayName("Tabella riassuntiva con righe di successo e di errore")
    void testSummaryTable() throws Exception {
        FeatureModel model = new FeatureModel.Builder("T")
                .addFeature("r", false, null)
                .addFeature("a", false, "r")
                .addGroup("r", GroupKind.OPTIONAL, List.of("a"))
                .build();
        SummaryTableWriter summary = new SummaryTableWriter("source_csv", "output_uvl");
        summary.addSuccess(Path.of("in.csv"), Path.of("in.uvl"), model);
        summary.addFailure(Path.of("bad.csv"), null, new IllegalStateException("rotto"));

        Path file = tempDir.resolve("summary.csv");
        summary.write(file);
        CsvSupport.Table table = CsvSupport.read(file);

        assertThat(table.header()).containsExactly("source_csv", "output_uvl", "features", "groups", "constraints", "error");
        assertThat(table.rows().get(0)).containsExactly("in.csv", "in.uvl", "2", "1", "0", "");
        assertThat(table.rows().get(1).get(5)).isEqualTo("IllegalStateException: rotto");
        assertThat(summary.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Esito batch e percentuale di successo")
    void testBatchOutcome() {
        BatchOutcome outcome = new BatchOutcome(4);
        outcome.incrementSuccess();
        outcome.incrementSuccess();
        outcome.incrementSuccess();
        outcome.incrementError();

        assertThat(outcome.hasErrors()).isTrue();
        assertThat(outcome.successRate()).isEqualTo(75.0);
        assertThat(new BatchOutcome(0).successRate()).isZero();
    }
}
