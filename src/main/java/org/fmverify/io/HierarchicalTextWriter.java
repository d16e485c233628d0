package org.fmverify.io;

import org.fmverify.model.Constraint;
import org.fmverify.model.Feature;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Group;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Serializza un {@link FeatureModel} nel formato gerarchico indentato.
 *
 * Quattro spazi per livello; le keyword di gruppo precedono il blocco dei figli.
 * Righe unite da '\n' senza a capo finale: l'output è stabile byte per byte.
 */
public class HierarchicalTextWriter {

    private static final String INDENT = "    ";

    public String write(FeatureModel model) {
        List<String> lines = new ArrayList<>();
        lines.add("namespace " + model.getNamespace());
        lines.add("");
        lines.add("features");
        writeFeature(model, model.getRoot(), 1, lines);
        lines.add("");
        lines.add("constraints");
        for (Constraint constraint : model.getConstraints()) {
            lines.add(INDENT + constraint.toHierarchicalText());
        }
        return String.join("\n", lines);
    }

    public void write(FeatureModel model, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (FileWriter writer = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            writer.write(write(model));
        }
    }

    private void writeFeature(FeatureModel model, String name, int depth, List<String> lines) {
        Feature feature = model.getFeature(name);
        lines.add(INDENT.repeat(depth) + name + (feature.isAbstract() ? " {abstract}" : ""));

        for (Group group : model.getGroupsOf(name)) {
            lines.add(INDENT.repeat(depth + 1) + group.getKind().getKeyword());
            for (String child : group.getChildren()) {
                writeFeature(model, child, depth + 2, lines);
            }
        }
    }
}
