package org.fmverify.io;

import org.fmverify.support.ModelFiles;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Legge un modello scegliendo il parser in base all'estensione del file.
 */
public class ModelReader {

    private final HierarchicalTextParser hierarchicalParser = new HierarchicalTextParser();
    private final RelationalFactParser factParser;

    public ModelReader() {
        this(null);
    }

    /**
     * @param fallbackRoot radice esplicita di ripiego per i file di fatti, null se non fornita
     */
    public ModelReader(String fallbackRoot) {
        this.factParser = new RelationalFactParser(fallbackRoot);
    }

    public ParsedModel read(Path file) throws IOException, ModelParseException {
        if (ModelFiles.isFactFile(file)) {
            return factParser.parse(file);
        }
        if (ModelFiles.hasExtension(file, ModelFiles.HIERARCHICAL_EXTENSION)) {
            return hierarchicalParser.parse(file);
        }
        throw new ModelParseException("Formato di modello non riconosciuto: " + file.getFileName());
    }
}
