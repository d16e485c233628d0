package org.fmverify.harness;

import org.fmverify.analysis.AnalysisResult;
import org.fmverify.analysis.DefectAnalyzer;
import org.fmverify.analysis.SolverUnavailableException;
import org.fmverify.io.ModelReader;
import org.fmverify.io.ParsedModel;
import org.fmverify.model.ModelException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SESSIONE DI VALUTAZIONE - Abbina, analizza e classifica le coppie (pulito, iniettato)
 *
 * Ogni modello pulito viene analizzato una sola volta e contribuisce a FP/TN; ogni coppia
 * viene classificata con {@link InjectionComparator}. Un errore su un file, compresa una query SAT
 * fallita, diventa una riga di fallimento e non interrompe le altre coppie. Solo un backend non
 * disponibile interrompe la valutazione.
 */
public class EvaluationSession {

    private static final Logger LOGGER = Logger.getLogger(EvaluationSession.class.getName());

    public static final List<String> PAIRS_HEADER = List.of(
            "Key", "Clean_File", "Injected_File", "Class", "Clean_Defects", "Injected_Defects",
            "New_Facts", "Removed_Facts", "Missed", "Oracle_Consistent", "Error");

    private final ModelReader reader;
    private final DefectAnalyzer analyzer;
    private final InjectionComparator comparator;

    public EvaluationSession(ModelReader reader, DefectAnalyzer analyzer, InjectionComparator comparator) {
        this.reader = reader;
        this.analyzer = analyzer;
        this.comparator = comparator;
    }

    /**
     * Riga della tabella delle coppie. Esattamente uno tra comparison ed error è non null.
     */
    public record PairRow(ModelKeys.ModelPair pair, String cleanDefects, String injectedDefects,
                          ComparisonResult comparison, String error) {

        public List<String> toCells() {
            return List.of(
                    pair.key(),
                    pair.cleanFile().toString(),
                    pair.injectedFile().toString(),
                    comparison == null ? "ERROR" : comparison.detectionClass().name(),
                    nullToEmpty(cleanDefects),
                    nullToEmpty(injectedDefects),
                    comparison == null ? "" : String.valueOf(comparison.newFacts().size()),
                    comparison == null ? "" : String.valueOf(comparison.removedFacts().size()),
                    comparison == null ? "" : String.join("; ", comparison.missed()),
                    comparison == null || comparison.oracleConsistent() == null ? "" : comparison.oracleConsistent().toString(),
                    nullToEmpty(error));
        }

        private static String nullToEmpty(String value) {
            return value == null ? "" : value;
        }
    }

    /**
     * Esito complessivo della valutazione.
     */
    public record Evaluation(ModelKeys.PairingResult pairing, List<PairRow> rows, AccuracyReport report) {}

    /**
     * Esegue la valutazione.
     *
     * @param cleanFiles modelli puliti
     * @param injectedFiles modelli iniettati
     * @param oracle record dell'oracolo, lista vuota se non disponibile
     */
    public Evaluation evaluate(List<Path> cleanFiles, List<Path> injectedFiles, List<OracleRecord> oracle) {
        ModelKeys.PairingResult pairing = ModelKeys.pair(cleanFiles, injectedFiles);
        AccuracyReport report = new AccuracyReport();

        pairing.ambiguousKeys().forEach((key, files) ->
                report.addFailure("AMBIGUOUS_KEY:" + key + " " + files));
        pairing.unmatchedClean().forEach(f -> report.addFailure("UNMATCHED_CLEAN:" + f.getFileName()));
        pairing.unmatchedInjected().forEach(f -> report.addFailure("UNMATCHED_INJECTED:" + f.getFileName()));

        // FASE 1: analisi dei modelli puliti (FP/TN)
        Map<Path, Analyzed> cleanAnalyses = new LinkedHashMap<>();
        for (Path cleanFile : cleanFiles) {
            Analyzed analyzed = analyzeFile(cleanFile);
            cleanAnalyses.put(cleanFile, analyzed);
            if (analyzed.error() != null) {
                report.addFailure("CLEAN:" + cleanFile.getFileName() + ": " + analyzed.error());
            } else {
                report.addCleanModel(analyzed.result().hasDefects());
            }
        }

        // FASE 2: classificazione delle coppie
        List<PairRow> rows = new ArrayList<>();
        for (ModelKeys.ModelPair pair : pairing.pairs()) {
            Analyzed clean = cleanAnalyses.get(pair.cleanFile());
            Analyzed injected = analyzeFile(pair.injectedFile());
            String cleanDefects = clean.result() == null ? null : clean.result().defectsText();
            String injectedDefects = injected.result() == null ? null : injected.result().defectsText();

            String error = clean.error() != null ? "clean: " + clean.error()
                    : injected.error() != null ? "injected: " + injected.error()
                    : null;
            if (error != null) {
                report.addFailure("PAIR:" + pair.key() + ": " + error);
                rows.add(new PairRow(pair, cleanDefects, injectedDefects, null, error));
                continue;
            }

            OracleRecord record = OracleTable.find(oracle, pair.injectedFile()).orElse(null);
            ComparisonResult comparison = comparator.compare(clean.parsed().model(), injected.parsed().model(),
                    injected.result(), record);
            report.addPair(comparison.detectionClass());
            rows.add(new PairRow(pair, cleanDefects, injectedDefects, comparison, null));
        }

        LOGGER.info("Valutazione completata: " + report);
        return new Evaluation(pairing, rows, report);
    }

    //region ANALISI SINGOLO FILE

    private record Analyzed(ParsedModel parsed, AnalysisResult result, String error) {}

    private Analyzed analyzeFile(Path file) {
        try {
            ParsedModel parsed = reader.read(file);
            AnalysisResult result = analyzer.analyze(parsed.model(), parsed.rootNote());
            if (result.getStatus() == AnalysisResult.Status.UNKNOWN) {
                return new Analyzed(parsed, result, "ANALYSIS_UNKNOWN:timeout");
            }
            return new Analyzed(parsed, result, null);
        } catch (SolverUnavailableException e) {
            throw e;
        } catch (IOException | ModelException | RuntimeException e) {
            LOGGER.warning("Analisi fallita per " + file.getFileName() + ": " + e.getMessage());
            return new Analyzed(null, null, e.getClass().getSimpleName() + ":" + e.getMessage());
        }
    }

    //endregion

    /**
     * @return righe della tabella delle coppie pronte per il CSV
     */
    public static List<List<String>> toCsvRows(Evaluation evaluation) {
        return evaluation.rows().stream().map(PairRow::toCells).toList();
    }
}
