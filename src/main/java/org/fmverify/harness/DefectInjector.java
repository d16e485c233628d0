package org.fmverify.harness;

import org.fmverify.analysis.RootResolver;
import org.fmverify.io.HierarchicalTextParser;
import org.fmverify.io.HierarchicalTextWriter;
import org.fmverify.io.ModelParseException;
import org.fmverify.model.Constraint;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Literal;
import org.fmverify.model.ModelReferenceException;
import org.fmverify.support.ModelFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * INIETTORE DI DIFETTI - Mutazione controllata di modelli puliti
 *
 * Dal vocabolario delle feature candidate (tutte tranne la radice, ordinate) estrae tre feature
 * distinte {d, f, r} e antepone ai vincoli:
 * • {@code root => !d}  difetto atteso: d morta
 * • {@code root => f}   difetto atteso: f false-optional
 * • {@code r => root}   implicazione ridondante
 *
 * L'estrazione è deterministica per modello: il seme è {@code baseSeed ^ chiave.hashCode()}.
 */
public class DefectInjector {

    private static final Logger LOGGER = Logger.getLogger(DefectInjector.class.getName());

    public static final long DEFAULT_SEED = 42L;
    public static final int MIN_CANDIDATES = 3;
    public static final String INJECTED_SUFFIX = "_injected";

    private final long baseSeed;
    private final HierarchicalTextParser parser = new HierarchicalTextParser();
    private final HierarchicalTextWriter writer = new HierarchicalTextWriter();

    public DefectInjector() {
        this(DEFAULT_SEED);
    }

    public DefectInjector(long baseSeed) {
        this.baseSeed = baseSeed;
    }

    /**
     * Modello iniettato con le feature bersaglio.
     */
    public record Injection(FeatureModel model, String root, String deadFeature,
                            String falseOptionalFeature, String redundantFeature) {

        public OracleRecord toOracleRecord(String fileName, String sourceFile) {
            return new OracleRecord(fileName, sourceFile, deadFeature, falseOptionalFeature, redundantFeature);
        }
    }

    //region INIEZIONE

    /**
     * Inietta i tre vincoli nel modello.
     *
     * @param model modello pulito
     * @param modelKey chiave del modello, usata per derivare il seme
     * @throws InjectionInfeasibleException se le candidate sono meno di tre
     */
    public Injection inject(FeatureModel model, String modelKey) throws InjectionInfeasibleException {
        String root = RootResolver.resolve(model).root();

        List<String> candidates = new ArrayList<>(model.getFeatureNames());
        candidates.remove(root);
        Collections.sort(candidates);

        if (candidates.size() < MIN_CANDIDATES) {
            throw new InjectionInfeasibleException("Feature candidate insufficienti per l'iniezione: "
                    + candidates.size() + " < " + MIN_CANDIDATES, candidates.size());
        }

        Random random = new Random(baseSeed ^ modelKey.hashCode());
        Collections.shuffle(candidates, random);
        String dead = candidates.get(0);
        String falseOptional = candidates.get(1);
        String redundant = candidates.get(2);

        List<Constraint> injected = List.of(
                Constraint.implication(Literal.positive(root), Literal.negative(dead)),
                Constraint.implication(Literal.positive(root), Literal.positive(falseOptional)),
                Constraint.implication(Literal.positive(redundant), Literal.positive(root)));

        FeatureModel mutated;
        try {
            mutated = model.withPrependedConstraints(injected);
        } catch (ModelReferenceException e) {
            // Le feature provengono dal modello stesso
            throw new IllegalStateException("Vincoli iniettati non validi per " + modelKey, e);
        }

        LOGGER.fine(String.format("Iniezione %s: DF=%s FO=%s RE=%s", modelKey, dead, falseOptional, redundant));
        return new Injection(mutated, root, dead, falseOptional, redundant);
    }

    /**
     * Legge un modello gerarchico, lo inietta e scrive {@code <stem>_injected.uvl}.
     *
     * @return record dell'oracolo per il file scritto
     */
    public OracleRecord injectFile(Path cleanFile, Path outputDir)
            throws IOException, ModelParseException, InjectionInfeasibleException {
        FeatureModel model = parser.parse(cleanFile).model();
        Injection injection = inject(model, ModelKeys.deriveKey(cleanFile));

        String outputName = ModelFiles.stem(cleanFile) + INJECTED_SUFFIX + ModelFiles.HIERARCHICAL_EXTENSION;
        writer.write(injection.model(), outputDir.resolve(outputName));

        return injection.toOracleRecord(outputName, cleanFile.getFileName().toString());
    }

    //endregion
}
