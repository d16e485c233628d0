package org.fmverify.io;

import org.fmverify.model.FeatureModel;
import org.fmverify.support.ModelFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Conversione di un modello dal formato gerarchico ai fatti relazionali.
 */
public class ModelFormatConverter {

    private static final Logger LOGGER = Logger.getLogger(ModelFormatConverter.class.getName());

    private final HierarchicalTextParser parser = new HierarchicalTextParser();
    private final RelationalFactWriter writer = new RelationalFactWriter();

    /**
     * Esito di una conversione, con i conteggi per la tabella riassuntiva.
     */
    public record Conversion(Path outputFile, ParsedModel parsed) {
        public FeatureModel model() {
            return parsed.model();
        }
    }

    /**
     * Converte un file gerarchico in {@code <stem>.kr.pl} nella directory di output.
     */
    public Conversion convert(Path hierarchicalFile, Path outputDir) throws IOException, ModelParseException {
        ParsedModel parsed = parser.parse(hierarchicalFile);
        Path output = outputDir.resolve(ModelFiles.stem(hierarchicalFile) + ModelFiles.FACT_EXTENSION);
        writer.write(parsed.model(), output);
        LOGGER.fine("Convertito " + hierarchicalFile + " -> " + output);
        return new Conversion(output, parsed);
    }
}
