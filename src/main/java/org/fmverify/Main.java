package org.fmverify;

import org.fmverify.analysis.AnalysisOptions;
import org.fmverify.analysis.AnalysisResult;
import org.fmverify.analysis.DefectAnalyzer;
import org.fmverify.analysis.Sat4jBackend;
import org.fmverify.analysis.SolverBackend;
import org.fmverify.analysis.SolverUnavailableException;
import org.fmverify.builder.BuildResult;
import org.fmverify.builder.ModelBuilder;
import org.fmverify.cnf.CompilationPolicy;
import org.fmverify.harness.AccuracyReport;
import org.fmverify.harness.DefectInjector;
import org.fmverify.harness.EvaluationSession;
import org.fmverify.harness.InjectionComparator;
import org.fmverify.harness.InjectionInfeasibleException;
import org.fmverify.harness.OracleRecord;
import org.fmverify.harness.OracleTable;
import org.fmverify.io.HierarchicalTextWriter;
import org.fmverify.io.ModelFormatConverter;
import org.fmverify.io.ModelReader;
import org.fmverify.io.ParsedModel;
import org.fmverify.model.AuditVocabulary;
import org.fmverify.model.FeatureModel;
import org.fmverify.support.BatchOutcome;
import org.fmverify.support.CsvSupport;
import org.fmverify.support.Diagnostics;
import org.fmverify.support.ModelFiles;
import org.fmverify.support.SummaryTableWriter;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.LogManager;

/**
 * VERIFICATORE DI FEATURE MODEL
 *
 * PIPELINE DI ELABORAZIONE COMPLETA:
 * 1. COSTRUZIONE: righe tabellari validate (CSV) -> feature model gerarchico (.uvl)
 * 2. CONVERSIONE: testo gerarchico (.uvl) -> fatti relazionali (.kr.pl)
 * 3. ANALISI: codifica CNF e interrogazioni SAT (Sat4j) per modelli vuoti, feature morte e false-optional
 * 4. INIEZIONE: mutazione controllata dei modelli puliti con oracolo dei difetti attesi
 * 5. VALUTAZIONE: abbinamento pulito/iniettato, classificazione e metriche di accuratezza
 *
 * MODALITÀ OPERATIVE (mutualmente esclusive):
 * - Costruzione (-build): ogni CSV della directory è un modello; scope_rules.csv vale per tutti
 * - Conversione (-convert): tutti i .uvl della directory, ricorsivamente
 * - Analisi (-analyze): tutti i .uvl e .kr.pl della directory, ricorsivamente
 * - Iniezione (-inject): tutti i .uvl della directory, con seme configurabile (-seed)
 * - Valutazione (-evaluate): directory pulita (-clean), iniettata (-injected), oracolo opzionale (-oracle)
 *
 * ORGANIZZAZIONE DEGLI OUTPUT:
 * - build_summary.csv, kr_summary.csv, analysis_results.csv
 * - oracle.csv, injection_summary.csv
 * - evaluation_pairs.csv, evaluation_metrics.csv
 *
 * Ogni errore su un singolo file diventa una riga della tabella riassuntiva e il batch prosegue.
 * Il codice di uscita è 1 se almeno un file è fallito.
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Modalità operative
     * */
    private static final String BUILD_PARAM = "-build";
    private static final String CONVERT_PARAM = "-convert";
    private static final String ANALYZE_PARAM = "-analyze";
    private static final String INJECT_PARAM = "-inject";
    private static final String EVALUATE_PARAM = "-evaluate";

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String THREADS_PARAM = "-j";
    private static final String OPT_PARAM = "-opt=";
    private static final String MAX_CLAUSES_PARAM = "-maxclauses";
    private static final String ROOT_PARAM = "-root";
    private static final String SEED_PARAM = "-seed";
    private static final String NO_ANSWERS_PARAM = "-noanswers";
    private static final String NAMESPACE_PARAM = "-ns";
    private static final String CLEAN_PARAM = "-clean";
    private static final String INJECTED_PARAM = "-injected";
    private static final String ORACLE_PARAM = "-oracle";

    /**
     * Flag opzioni di analisi disponibili
     * */
    private static final String OPT_EQUIVALENCES = "e";
    private static final String OPT_REDUNDANCY = "r";
    private static final String OPT_ALL = "all";

    /**
     * Configurazioni timeout di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    /**
     * Nomi dei file prodotti
     * */
    private static final String SCOPE_RULES_FILE = "scope_rules.csv";
    private static final String BUILD_SUMMARY_FILE = "build_summary.csv";
    private static final String KR_SUMMARY_FILE = "kr_summary.csv";
    private static final String ANALYSIS_RESULTS_FILE = "analysis_results.csv";
    private static final String INJECTION_SUMMARY_FILE = "injection_summary.csv";
    private static final String EVALUATION_PAIRS_FILE = "evaluation_pairs.csv";
    private static final String EVALUATION_METRICS_FILE = "evaluation_metrics.csv";

    private static final List<String> ANALYSIS_HEADER = List.of(
            "Group", "Model", "Root", "NF", "Constraints", "Clauses", "SAT",
            "N_Dead", "N_FalseOptional", "N_Undetermined", "TimeSec", "Defects");

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale del verificatore.
     *
     * FLUSSO ESECUZIONE:
     * 1. Caricamento configurazione di logging
     * 2. Parsing e validazione parametri linea di comando
     * 3. Esecuzione della modalità richiesta
     * 4. Riepilogo batch e codice di uscita
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        System.out.println("---> AVVIO VERIFICATORE FEATURE MODEL <---");
        boolean failures = false;

        try {
            // Validazione input utente
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            loadLoggingConfiguration();

            // Parsing e validazione parametri
            VerifierConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato

            displayConfigurationSummary(config);
            BatchOutcome outcome = executeMainPipeline(config);
            displayBatchSummary(outcome);
            failures = outcome.hasErrors();

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE VERIFICATORE <---");
        }

        if (failures) {
            System.exit(1);
        }
    }

    /**
     * Determina la modalità operativa e delega all'handler corrispondente.
     *
     * @param config configurazione validata
     * @return esito aggregato del batch
     */
    private static BatchOutcome executeMainPipeline(VerifierConfiguration config) throws IOException {
        return switch (config.mode) {
            case BUILD -> {
                System.out.println("[I] Modalità: Costruzione modelli da CSV");
                yield processBuildBatch(config);
            }
            case CONVERT -> {
                System.out.println("[I] Modalità: Conversione in fatti relazionali");
                yield processConvertBatch(config);
            }
            case ANALYZE -> {
                System.out.println("[I] Modalità: Analisi dei difetti");
                yield processAnalyzeBatch(config);
            }
            case INJECT -> {
                System.out.println("[I] Modalità: Iniezione di difetti");
                yield processInjectBatch(config);
            }
            case EVALUATE -> {
                System.out.println("[I] Modalità: Valutazione dell'accuratezza");
                yield processEvaluation(config);
            }
        };
    }

    /**
     * Gestisce errori critici: argomenti non validi, solver non disponibile, I/O sulle directory.
     *
     * @param e eccezione critica che ha causato il fallimento
     */
    private static void handleGlobalError(Exception e) {
        if (e instanceof IllegalArgumentException) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
        } else if (e instanceof SolverUnavailableException) {
            System.out.println("[E] Solver SAT non disponibile: " + e.getMessage());
        } else {
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            System.out.println("Controllare i log per dettagli completi.");
        }
        System.exit(1);
    }

    /**
     * Carica logging.properties dal classpath; in assenza restano i default della JVM.
     */
    private static void loadLoggingConfiguration() {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione di logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    /**
     * @param args array di parametri da processare
     * @return configurazione validata o null se è stato mostrato l'help
     * @throws IllegalArgumentException se i parametri non sono validi
     */
    private static VerifierConfiguration parseAndValidateArguments(String[] args) {
        ArgumentParser parser = new ArgumentParser();
        return parser.parse(args);
    }

    private static void displayConfigurationSummary(VerifierConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE VERIFICATORE <<--");
        System.out.println("Modalità: " + config.mode.name().toLowerCase(Locale.ROOT));

        if (config.mode == Mode.EVALUATE) {
            System.out.println("Modelli puliti: " + config.cleanPath);
            System.out.println("Modelli iniettati: " + config.injectedPath);
            System.out.println("Oracolo: " + (config.oraclePath == null ? "nessuno" : config.oraclePath));
        } else {
            System.out.println("Input: " + config.inputPath);
        }
        System.out.println("Output: " + config.outputPath);

        switch (config.mode) {
            case BUILD -> {
                System.out.println("Namespace: " + config.namespace);
                System.out.println("Risposte obbligatorie: " + (config.requireAnswers ? "sì" : "no"));
            }
            case INJECT -> System.out.println("Seme: " + config.seed);
            case ANALYZE, EVALUATE -> {
                System.out.println("Timeout per query: " + config.timeoutSeconds + " secondi");
                System.out.println("Thread: " + config.threads);
                List<String> activeOpts = buildActiveOptionsList(config);
                System.out.println("Opzioni aggiuntive: " + (activeOpts.isEmpty() ? "Nessuna" : String.join(", ", activeOpts)));
                if (config.fallbackRoot != null) {
                    System.out.println("Radice di ripiego: " + config.fallbackRoot);
                }
            }
            default -> { }
        }
        System.out.println("=========================================\n");
    }

    private static List<String> buildActiveOptionsList(VerifierConfiguration config) {
        List<String> options = new ArrayList<>();
        if (config.compileEquivalences) options.add("Equivalenze");
        if (config.checkRedundancy) options.add("Ridondanza (max " + config.maxRedundancyClauses + " clausole)");
        return options;
    }

    //endregion

    //region COSTRUZIONE MODELLI

    /**
     * Costruisce un modello per ogni CSV della directory; scope_rules.csv vale per tutti.
     */
    private static BatchOutcome processBuildBatch(VerifierConfiguration config) throws IOException {
        Path inputDir = Path.of(config.inputPath);
        Path outputDir = Path.of(config.outputPath);
        Path scopeRules = inputDir.resolve(SCOPE_RULES_FILE);

        List<Path> csvFiles = ModelFiles.findFlat(inputDir, ModelFiles.CSV_EXTENSION).stream()
                .filter(p -> !p.getFileName().toString().equalsIgnoreCase(SCOPE_RULES_FILE))
                .toList();
        System.out.println("Trovati " + csvFiles.size() + " file .csv da elaborare.");
        if (scopeRules.toFile().exists()) {
            System.out.println("[I] Regole di ambito: " + scopeRules);
        }

        ModelBuilder builder = new ModelBuilder(config.namespace, config.requireAnswers);
        HierarchicalTextWriter writer = new HierarchicalTextWriter();
        SummaryTableWriter summary = new SummaryTableWriter("csv_file", "uvl_file");
        BatchOutcome outcome = new BatchOutcome(csvFiles.size());

        for (Path csv : csvFiles) {
            Path output = outputDir.resolve(ModelFiles.stem(csv) + ModelFiles.HIERARCHICAL_EXTENSION);
            try {
                System.out.println("Elaborazione: " + csv.getFileName());
                BuildResult result = builder.buildFromCsv(csv, scopeRules);
                writer.write(result.getModel(), output);
                saveBuildReport(result, outputDir.resolve(ModelFiles.stem(csv) + "_report.txt"));

                summary.addSuccess(csv, output, result.getModel());
                if (!result.getReport().isEmpty()) {
                    System.out.println("[W] Elementi scartati: " + result.getReport().summaryLine());
                }
                System.out.println("[I] Modello scritto: " + output.getFileName());
                outcome.incrementSuccess();

            } catch (Exception e) {
                System.out.println("[E] Errore nel file " + csv.getFileName() + ": " + e.getMessage());
                summary.addFailure(csv, null, e);
                outcome.incrementError();
            }
        }

        summary.write(outputDir.resolve(BUILD_SUMMARY_FILE));
        return outcome;
    }

    private static void saveBuildReport(BuildResult result, Path file) throws IOException {
        try (FileWriter writer = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            writer.write(result.getReport().render("REPORT COSTRUZIONE " + result.getModel().getNamespace(),
                    Diagnostics.DEFAULT_MAX_EXAMPLES));
        }
    }

    //endregion

    //region CONVERSIONE IN FATTI RELAZIONALI

    private static BatchOutcome processConvertBatch(VerifierConfiguration config) throws IOException {
        Path inputDir = Path.of(config.inputPath);
        Path outputDir = Path.of(config.outputPath);

        List<Path> files = ModelFiles.findRecursive(inputDir, ModelFiles.HIERARCHICAL_EXTENSION);
        System.out.println("Trovati " + files.size() + " file .uvl da convertire.");

        ModelFormatConverter converter = new ModelFormatConverter();
        SummaryTableWriter summary = new SummaryTableWriter("uvl_file", "kr_file");
        BatchOutcome outcome = new BatchOutcome(files.size());

        for (Path file : files) {
            try {
                ModelFormatConverter.Conversion conversion = converter.convert(file, outputDir);
                summary.addSuccess(file, conversion.outputFile(), conversion.model());
                reportDiagnostics(file, conversion.parsed());
                outcome.incrementSuccess();
            } catch (Exception e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                summary.addFailure(file, null, e);
                outcome.incrementError();
            }
        }

        summary.write(outputDir.resolve(KR_SUMMARY_FILE));
        return outcome;
    }

    private static void reportDiagnostics(Path file, ParsedModel parsed) {
        if (!parsed.diagnostics().isEmpty()) {
            System.out.println("[W] " + file.getFileName() + ": " + parsed.diagnostics().summaryLine());
        }
    }

    //endregion

    //region ANALISI DEI DIFETTI

    private static BatchOutcome processAnalyzeBatch(VerifierConfiguration config) throws IOException {
        Path inputDir = Path.of(config.inputPath);
        Path outputDir = Path.of(config.outputPath);

        List<Path> files = ModelFiles.findRecursive(inputDir,
                ModelFiles.HIERARCHICAL_EXTENSION, ModelFiles.FACT_EXTENSION);
        System.out.println("Trovati " + files.size() + " modelli da analizzare.");

        SolverBackend backend = createAvailableBackend();
        ModelReader reader = new ModelReader(config.fallbackRoot);
        BatchOutcome outcome = new BatchOutcome(files.size());
        List<List<String>> rows = new ArrayList<>();

        try (DefectAnalyzer analyzer = new DefectAnalyzer(backend, buildAnalysisOptions(config))) {
            for (Path file : files) {
                String group = groupOf(inputDir, file);
                long start = System.nanoTime();
                try {
                    System.out.println("Analisi: " + file.getFileName());
                    ParsedModel parsed = reader.read(file);
                    reportDiagnostics(file, parsed);
                    AnalysisResult result = analyzer.analyze(parsed.model(), parsed.rootNote());
                    rows.add(analysisRow(group, file, parsed.model(), result, elapsedSeconds(start)));
                    System.out.println("[I] " + result.satLabel() + " - " + result.defectsText());
                    outcome.incrementSuccess();

                } catch (SolverUnavailableException e) {
                    throw e;
                } catch (Exception e) {
                    System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                    rows.add(errorRow(group, file, e, elapsedSeconds(start)));
                    outcome.incrementError();
                }
            }
        }

        CsvSupport.write(outputDir.resolve(ANALYSIS_RESULTS_FILE), ANALYSIS_HEADER, rows);
        return outcome;
    }

    private static List<String> analysisRow(String group, Path file, FeatureModel model, AnalysisResult result, String time) {
        boolean perFeature = result.getStatus() == AnalysisResult.Status.CONSISTENT;
        return List.of(
                group,
                file.getFileName().toString(),
                result.getRoot(),
                String.valueOf(result.getFeatureCount()),
                String.valueOf(model.constraintCount()),
                String.valueOf(result.getClauseCount()),
                result.satLabel(),
                perFeature ? String.valueOf(result.getDeadFeatures().size()) : "",
                perFeature ? String.valueOf(result.getFalseOptionalFeatures().size()) : "",
                perFeature ? String.valueOf(result.getUndeterminedFeatures().size()) : "",
                time,
                result.defectsText());
    }

    private static List<String> errorRow(String group, Path file, Exception e, String time) {
        return List.of(group, file.getFileName().toString(), "", "", "", "", "ERROR", "", "", "", time,
                "ERROR:" + e.getClass().getSimpleName() + ":" + e.getMessage());
    }

    /**
     * Gruppo di un modello: la sua directory relativa alla directory di input.
     */
    private static String groupOf(Path inputDir, Path file) {
        Path parent = file.getParent();
        if (parent == null || parent.equals(inputDir)) {
            return inputDir.getFileName() == null ? "" : inputDir.getFileName().toString();
        }
        return inputDir.relativize(parent).toString().replace(File.separatorChar, '/');
    }

    private static String elapsedSeconds(long startNanos) {
        return String.format(Locale.ROOT, "%.6f", (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }

    private static SolverBackend createAvailableBackend() {
        SolverBackend backend = new Sat4jBackend();
        backend.checkAvailable();
        System.out.println("[I] Backend SAT: " + backend.name());
        return backend;
    }

    private static AnalysisOptions buildAnalysisOptions(VerifierConfiguration config) {
        return AnalysisOptions.defaults()
                .withTimeoutMs(config.timeoutSeconds * 1000L)
                .withThreads(config.threads)
                .withPolicy(config.compileEquivalences ? CompilationPolicy.FULL : CompilationPolicy.IMPLICATIONS_ONLY)
                .withRedundancyCheck(config.checkRedundancy)
                .withMaxRedundancyClauses(config.maxRedundancyClauses);
    }

    //endregion

    //region INIEZIONE DI DIFETTI

    private static BatchOutcome processInjectBatch(VerifierConfiguration config) throws IOException {
        Path inputDir = Path.of(config.inputPath);
        Path outputDir = Path.of(config.outputPath);

        List<Path> files = ModelFiles.findRecursive(inputDir, ModelFiles.HIERARCHICAL_EXTENSION);
        System.out.println("Trovati " + files.size() + " file .uvl da iniettare.");

        DefectInjector injector = new DefectInjector(config.seed);
        List<OracleRecord> records = new ArrayList<>();
        List<List<String>> summaryRows = new ArrayList<>();
        BatchOutcome outcome = new BatchOutcome(files.size());

        for (Path file : files) {
            try {
                OracleRecord record = injector.injectFile(file, outputDir);
                records.add(record);
                summaryRows.add(List.of(file.toString(), record.fileName(), "Success", ""));
                System.out.println("[I] " + file.getFileName() + " -> " + record.fileName());
                outcome.incrementSuccess();

            } catch (InjectionInfeasibleException e) {
                // Non fatale: il modello è troppo piccolo per l'iniezione
                System.out.println("[W] " + file.getFileName() + ": " + e.getMessage());
                summaryRows.add(List.of(file.toString(), "", "Skipped", e.getMessage()));
                outcome.incrementSuccess();
            } catch (Exception e) {
                System.out.println("[E] Errore nel file " + file.getFileName() + ": " + e.getMessage());
                summaryRows.add(List.of(file.toString(), "", "Error", e.getClass().getSimpleName() + ": " + e.getMessage()));
                outcome.incrementError();
            }
        }

        OracleTable.write(outputDir.resolve(OracleTable.FILE_NAME), records);
        CsvSupport.write(outputDir.resolve(INJECTION_SUMMARY_FILE),
                List.of("source_file", "injected_file", "status", "error"), summaryRows);
        return outcome;
    }

    //endregion

    //region VALUTAZIONE ACCURATEZZA

    private static BatchOutcome processEvaluation(VerifierConfiguration config) throws IOException {
        Path outputDir = Path.of(config.outputPath);
        List<Path> cleanFiles = ModelFiles.findRecursive(Path.of(config.cleanPath),
                ModelFiles.HIERARCHICAL_EXTENSION, ModelFiles.FACT_EXTENSION);
        List<Path> injectedFiles = ModelFiles.findRecursive(Path.of(config.injectedPath),
                ModelFiles.HIERARCHICAL_EXTENSION, ModelFiles.FACT_EXTENSION);
        List<OracleRecord> oracle = config.oraclePath == null ? List.of() : OracleTable.read(Path.of(config.oraclePath));

        System.out.println("Modelli puliti: " + cleanFiles.size() + ", iniettati: " + injectedFiles.size()
                + ", record oracolo: " + oracle.size());

        SolverBackend backend = createAvailableBackend();
        EvaluationSession.Evaluation evaluation;
        try (DefectAnalyzer analyzer = new DefectAnalyzer(backend, buildAnalysisOptions(config))) {
            EvaluationSession session = new EvaluationSession(new ModelReader(config.fallbackRoot), analyzer,
                    new InjectionComparator());
            evaluation = session.evaluate(cleanFiles, injectedFiles, oracle);
        }

        CsvSupport.write(outputDir.resolve(EVALUATION_PAIRS_FILE), EvaluationSession.PAIRS_HEADER,
                EvaluationSession.toCsvRows(evaluation));
        AccuracyReport report = evaluation.report();
        CsvSupport.write(outputDir.resolve(EVALUATION_METRICS_FILE), List.of("Metric", "Value"), report.toRows());

        System.out.println("\n-->> METRICHE DI ACCURATEZZA <<--");
        System.out.println(report);
        report.getFailures().forEach(f -> System.out.println("[W] " + f));

        BatchOutcome outcome = new BatchOutcome(evaluation.rows().size());
        evaluation.rows().forEach(row -> {
            if (row.error() == null) outcome.incrementSuccess();
            else outcome.incrementError();
        });
        return outcome;
    }

    //endregion

    //region RIEPILOGO

    private static void displayBatchSummary(BatchOutcome result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE <<--");
        System.out.println("Elementi trovati: " + result.getTotalFiles());
        System.out.println("Elaborati con successo: " + result.getSuccessCount());
        System.out.println("Con errori: " + result.getErrorCount());

        if (result.getTotalFiles() > 0) {
            System.out.printf("Tasso di successo: %.1f%%\n", result.successRate());
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> VERIFICATORE DI FEATURE MODEL <<::");
        System.out.println("Costruzione, conversione e analisi SAT di feature model");
        System.out.println("con harness di iniezione dei difetti e metriche di accuratezza\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar verificatore-fm.jar <modalità> [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  -build -d <dirCSV> -o <dir>       Costruisce un .uvl per ogni CSV (scope_rules.csv per tutti)");
        System.out.println("        -noanswers                  Item senza risposte valide costruiti come foglie");
        System.out.println("        -ns <namespace>             Namespace dei modelli (default: " + AuditVocabulary.DEFAULT_NAMESPACE + ")");
        System.out.println("  -convert -d <dirUVL> -o <dir>     Converte ogni .uvl in .kr.pl");
        System.out.println("  -analyze -d <dir> -o <dir>        Analizza ogni .uvl e .kr.pl");
        System.out.println("  -inject -d <dirUVL> -o <dir>      Inietta difetti e scrive l'oracolo");
        System.out.println("        -seed <n>                   Seme base (default: " + DefectInjector.DEFAULT_SEED + ")");
        System.out.println("  -evaluate -clean <dir> -injected <dir> -o <dir> [-oracle <csv>]");
        System.out.println("                                    Abbina, analizza e misura l'accuratezza");
        System.out.println("  -h                                Mostra questa guida\n");

        System.out.println("OPZIONI DI ANALISI:");
        System.out.println("  -t <secondi>      Timeout per query SAT (min: " + MIN_TIMEOUT_SECONDS + ", default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -j <thread>       Query parallele (default: processori disponibili)");
        System.out.println("  -opt=<flags>      e = compila equivalenze e vincoli unitari, r = clausole ridondanti, all = tutte");
        System.out.println("  -maxclauses <n>   Limite clausole per il controllo ridondanza (default: "
                + AnalysisOptions.DEFAULT_MAX_REDUNDANCY_CLAUSES + ")");
        System.out.println("  -root <nome>      Radice esplicita se manca " + AuditVocabulary.CANONICAL_ROOT
                + " e non esiste una radice strutturale\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar verificatore-fm.jar -build -d ./righe/ -o ./uvl/");
        System.out.println("  java -jar verificatore-fm.jar -analyze -d ./uvl/ -o ./risultati/ -t 30 -opt=e");
        System.out.println("  java -jar verificatore-fm.jar -inject -d ./uvl/ -o ./iniettati/ -seed 7");
        System.out.println("  java -jar verificatore-fm.jar -evaluate -clean ./uvl/ -injected ./iniettati/ -o ./eval/ -oracle ./iniettati/oracle.csv\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Le modalità sono mutualmente esclusive");
        System.out.println("  - Un errore su un file non interrompe il batch e diventa una riga del riepilogo");
        System.out.println("  - Codice di uscita 1 se almeno un file è fallito");
        System.out.println("  - Una query in timeout è UNKNOWN, mai SAT o UNSAT\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Modalità operative supportate.
     */
    private enum Mode {
        BUILD,
        CONVERT,
        ANALYZE,
        INJECT,
        EVALUATE
    }

    /**
     * Configurazione validata dell'applicazione, immutabile durante l'elaborazione.
     */
    private static class VerifierConfiguration {
        final Mode mode;
        final String inputPath;
        final String outputPath;
        final int timeoutSeconds;
        final int threads;
        final boolean compileEquivalences;
        final boolean checkRedundancy;
        final int maxRedundancyClauses;
        final String fallbackRoot;
        final long seed;
        final boolean requireAnswers;
        final String namespace;
        final String cleanPath;
        final String injectedPath;
        final String oraclePath;

        VerifierConfiguration(Mode mode, String inputPath, String outputPath, int timeoutSeconds, int threads,
                              boolean compileEquivalences, boolean checkRedundancy, int maxRedundancyClauses,
                              String fallbackRoot, long seed, boolean requireAnswers, String namespace,
                              String cleanPath, String injectedPath, String oraclePath) {
            this.mode = mode;
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.timeoutSeconds = timeoutSeconds;
            this.threads = threads;
            this.compileEquivalences = compileEquivalences;
            this.checkRedundancy = checkRedundancy;
            this.maxRedundancyClauses = maxRedundancyClauses;
            this.fallbackRoot = fallbackRoot;
            this.seed = seed;
            this.requireAnswers = requireAnswers;
            this.namespace = namespace;
            this.cleanPath = cleanPath;
            this.injectedPath = injectedPath;
            this.oraclePath = oraclePath;
        }
    }

    /**
     * Parser dei parametri linea di comando con messaggi di errore informativi.
     */
    private static class ArgumentParser {

        /**
         * @param args parametri da linea di comando
         * @return configurazione validata (null se è stato richiesto l'help)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        public VerifierConfiguration parse(String[] args) {
            Mode mode = null;
            String inputPath = null;
            String outputPath = null;
            String cleanPath = null;
            String injectedPath = null;
            String oraclePath = null;
            String fallbackRoot = null;
            String namespace = AuditVocabulary.DEFAULT_NAMESPACE;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int threads = Runtime.getRuntime().availableProcessors();
            int maxClauses = AnalysisOptions.DEFAULT_MAX_REDUNDANCY_CLAUSES;
            long seed = DefectInjector.DEFAULT_SEED;
            boolean requireAnswers = true;
            AnalysisFlags flags = new AnalysisFlags(false, false);

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case BUILD_PARAM -> mode = selectMode(mode, Mode.BUILD);
                    case CONVERT_PARAM -> mode = selectMode(mode, Mode.CONVERT);
                    case ANALYZE_PARAM -> mode = selectMode(mode, Mode.ANALYZE);
                    case INJECT_PARAM -> mode = selectMode(mode, Mode.INJECT);
                    case EVALUATE_PARAM -> mode = selectMode(mode, Mode.EVALUATE);

                    case DIR_PARAM -> {
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                    }
                    case CLEAN_PARAM -> {
                        cleanPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(cleanPath);
                    }
                    case INJECTED_PARAM -> {
                        injectedPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(injectedPath);
                    }
                    case ORACLE_PARAM -> {
                        oraclePath = getNextArgument(args, ++i, "file");
                        validateFileExists(oraclePath);
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parsePositiveInt(args, ++i, "numero secondi", MIN_TIMEOUT_SECONDS);
                    case THREADS_PARAM -> threads = parsePositiveInt(args, ++i, "numero thread", 1);
                    case MAX_CLAUSES_PARAM -> maxClauses = parsePositiveInt(args, ++i, "numero clausole", 0);
                    case ROOT_PARAM -> fallbackRoot = getNextArgument(args, ++i, "nome radice");
                    case NAMESPACE_PARAM -> namespace = getNextArgument(args, ++i, "namespace");
                    case NO_ANSWERS_PARAM -> requireAnswers = false;
                    case SEED_PARAM -> {
                        String value = getNextArgument(args, ++i, "seme");
                        try {
                            seed = Long.parseLong(value);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Seme non valido: " + value);
                        }
                    }

                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            flags = parseAnalysisFlags(args[i].substring(OPT_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            return validateAndBuildFinalConfiguration(mode, inputPath, outputPath, cleanPath, injectedPath,
                    oraclePath, timeoutSeconds, threads, flags, maxClauses, fallbackRoot, seed,
                    requireAnswers, namespace);
        }

        private Mode selectMode(Mode current, Mode requested) {
            if (current != null && current != requested) {
                throw new IllegalArgumentException("Modalità " + requested.name().toLowerCase(Locale.ROOT)
                        + " non può essere combinata con " + current.name().toLowerCase(Locale.ROOT)
                        + " (le modalità sono mutualmente esclusive)");
            }
            return requested;
        }

        private VerifierConfiguration validateAndBuildFinalConfiguration(Mode mode, String inputPath, String outputPath,
                                                                         String cleanPath, String injectedPath, String oraclePath,
                                                                         int timeoutSeconds, int threads, AnalysisFlags flags,
                                                                         int maxClauses, String fallbackRoot, long seed,
                                                                         boolean requireAnswers, String namespace) {
            if (mode == null) {
                throw new IllegalArgumentException("Specificare una modalità: -build, -convert, -analyze, -inject o -evaluate");
            }
            if (outputPath == null) {
                throw new IllegalArgumentException("Specificare la directory di output con -o");
            }

            if (mode == Mode.EVALUATE) {
                if (cleanPath == null || injectedPath == null) {
                    throw new IllegalArgumentException("Modalità -evaluate richiede -clean <dir> e -injected <dir>");
                }
            } else if (inputPath == null) {
                throw new IllegalArgumentException("Modalità " + mode.name().toLowerCase(Locale.ROOT)
                        + " richiede la directory di input (-d)");
            }

            return new VerifierConfiguration(mode, inputPath, outputPath, timeoutSeconds, threads,
                    flags.equivalences(), flags.redundancy(), maxClauses, fallbackRoot, seed,
                    requireAnswers, namespace, cleanPath, injectedPath, oraclePath);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parsePositiveInt(String[] args, int currentIndex, String argumentType, int minimum) {
            String value = getNextArgument(args, currentIndex, argumentType);
            try {
                int parsed = Integer.parseInt(value);
                if (parsed < minimum) {
                    throw new IllegalArgumentException("Valore minimo per " + args[currentIndex - 1] + ": " + minimum);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non valido per " + args[currentIndex - 1] + ": " + value);
            }
        }

        private AnalysisFlags parseAnalysisFlags(String flagsStr) {
            if (flagsStr == null || flagsStr.trim().isEmpty()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            if (flagsStr.equals(OPT_ALL)) {
                return new AnalysisFlags(true, true);
            }
            for (char c : flagsStr.toCharArray()) {
                if (!OPT_EQUIVALENCES.equals(String.valueOf(c)) && !OPT_REDUNDANCY.equals(String.valueOf(c))) {
                    throw new IllegalArgumentException("Flag -opt sconosciuto: " + c);
                }
            }
            return new AnalysisFlags(flagsStr.contains(OPT_EQUIVALENCES), flagsStr.contains(OPT_REDUNDANCY));
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                System.out.println("Creazione directory output: " + dirPath);
                if (!dir.mkdirs()) {
                    throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
                }
            } else if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
            if (!dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    /**
     * Flag di analisi letti da -opt.
     */
    private record AnalysisFlags(boolean equivalences, boolean redundancy) {}

    //endregion
}
