package org.fmverify.io;

import org.fmverify.model.Constraint;
import org.fmverify.model.Feature;
import org.fmverify.model.FeatureModel;
import org.fmverify.model.Group;
import org.fmverify.model.Literal;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Serializza un {@link FeatureModel} come fatti relazionali in stile Prolog.
 *
 * ORDINE: feature (con eventuale abstract) e archi p/2 ordinati per nome, gruppi ordinati
 * per (padre, tipologia) con figli ordinati, poi i vincoli nell'ordine del modello.
 *
 * Le equivalenze vengono scomposte in un fatto equiv_or per disgiunto: proiezione con
 * perdita documentata, ricomposta per lato sinistro dal parser.
 */
public class RelationalFactWriter {

    public String write(FeatureModel model) {
        List<String> out = new ArrayList<>();
        out.add("% namespace: " + model.getNamespace());

        for (String name : new TreeSet<>(model.getFeatureNames())) {
            out.add("feature(" + name + ").");
            if (model.getFeature(name).isAbstract()) {
                out.add("abstract(" + name + ").");
            }
        }

        for (String name : new TreeSet<>(model.getFeatureNames())) {
            Feature feature = model.getFeature(name);
            if (!feature.isRoot()) {
                out.add("p(" + name + "," + feature.getParent() + ").");
            }
        }

        List<Group> groups = new ArrayList<>(model.getGroups());
        groups.sort(Comparator.comparing(Group::getParent).thenComparing(g -> g.getKind().getKeyword()));
        for (Group group : groups) {
            out.add("group(" + group.getParent() + "," + group.getKind().getKeyword() + ",["
                    + String.join(",", new TreeSet<>(group.getChildren())) + "]).");
        }

        for (Constraint constraint : model.getConstraints()) {
            switch (constraint.getType()) {
                case IMPLICATION -> out.add("imp(" + constraint.getLhs().toFactText() + ","
                        + constraint.getRhs().toFactText() + ").");
                case EQUIVALENCE_OR -> {
                    for (Literal disjunct : constraint.getDisjuncts()) {
                        out.add("equiv_or(" + constraint.getLhs().toFactText() + "," + disjunct.toFactText() + ").");
                    }
                }
                case UNIT -> out.add("unit(" + constraint.getLhs().toFactText() + ").");
                case RAW -> out.add("constraint_raw('" + constraint.getRawText().replace("\\", "\\\\").replace("'", "\\'") + "').");
            }
        }

        return String.join("\n", out) + "\n";
    }

    public void write(FeatureModel model, Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (FileWriter writer = new FileWriter(file.toFile(), StandardCharsets.UTF_8)) {
            writer.write(write(model));
        }
    }
}
