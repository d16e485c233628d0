package org.fmverify.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FEATURE MODEL - Albero di feature con gruppi e vincoli cross-tree
 *
 * Contenitore immutabile costruito tramite {@link Builder}, che verifica gli invarianti
 * strutturali prima di restituire l'istanza:
 * - esattamente una radice
 * - ogni feature non radice ha un padre esistente
 * - ogni nome referenziato da gruppi e vincoli esiste
 * - per ogni padre, l'unione dei figli dei suoi gruppi coincide con l'insieme dei figli,
 *   e nessun figlio appartiene a due gruppi
 *
 * L'ordine di inserimento di feature, gruppi e vincoli viene preservato.
 */
public final class FeatureModel {

    private final String namespace;
    private final String root;
    private final Map<String, Feature> features;
    private final List<Group> groups;
    private final List<Constraint> constraints;

    private FeatureModel(Builder builder) {
        this.namespace = builder.namespace;
        this.root = builder.root;
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(builder.features));
        this.groups = List.copyOf(builder.groups);
        this.constraints = List.copyOf(builder.constraints);
    }

    //region ACCESSO

    public String getNamespace() {
        return namespace;
    }

    public String getRoot() {
        return root;
    }

    public Map<String, Feature> getFeatures() {
        return features;
    }

    public Feature getFeature(String name) {
        return features.get(name);
    }

    public boolean hasFeature(String name) {
        return features.containsKey(name);
    }

    public Set<String> getFeatureNames() {
        return features.keySet();
    }

    public List<Group> getGroups() {
        return groups;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    /**
     * Gruppi di un padre, nell'ordine di dichiarazione.
     */
    public List<Group> getGroupsOf(String parent) {
        return groups.stream().filter(g -> g.getParent().equals(parent)).toList();
    }

    /**
     * Sottoinsieme dei vincoli di tipo IMPLICATION.
     */
    public List<Constraint> getImplications() {
        return constraints.stream().filter(Constraint::isImplication).toList();
    }

    /**
     * Figli di gruppi OPTIONAL, candidati al controllo false-optional.
     */
    public Set<String> getOptionalChildren() {
        Set<String> result = new LinkedHashSet<>();
        for (Group group : groups) {
            if (group.getKind() == GroupKind.OPTIONAL) {
                result.addAll(group.getChildren());
            }
        }
        return result;
    }

    public int featureCount() {
        return features.size();
    }

    public int groupCount() {
        return groups.size();
    }

    public int constraintCount() {
        return constraints.size();
    }

    //endregion

    /**
     * Crea una copia del modello con i vincoli indicati anteposti a quelli esistenti.
     *
     * @throws ModelReferenceException se un vincolo referenzia feature inesistenti
     */
    public FeatureModel withPrependedConstraints(List<Constraint> extra) throws ModelReferenceException {
        Builder builder = toBuilder();
        List<Constraint> merged = new ArrayList<>(extra);
        merged.addAll(constraints);
        builder.constraints.clear();
        builder.constraints.addAll(merged);
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(namespace);
        for (Feature feature : features.values()) {
            builder.addFeature(feature.getName(), feature.isAbstract(), feature.getParent());
        }
        groups.forEach(g -> builder.addGroup(g.getParent(), g.getKind(), g.getChildren()));
        constraints.forEach(builder::addConstraint);
        return builder;
    }

    @Override
    public String toString() {
        return "FeatureModel{namespace=" + namespace + ", root=" + root + ", features=" + features.size()
                + ", groups=" + groups.size() + ", constraints=" + constraints.size() + "}";
    }

    //region BUILDER

    /**
     * Costruttore incrementale con validazione completa in {@link #build()}.
     */
    public static final class Builder {

        private final String namespace;
        private final Map<String, Feature> features = new LinkedHashMap<>();
        private final List<Group> groups = new ArrayList<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private final List<String> duplicates = new ArrayList<>();
        private String root;

        public Builder(String namespace) {
            this.namespace = namespace == null || namespace.isBlank() ? AuditVocabulary.DEFAULT_NAMESPACE : namespace;
        }

        /**
         * Aggiunge una feature. Con parent null la feature è dichiarata radice.
         */
        public Builder addFeature(String name, boolean isAbstract, String parent) {
            if (features.containsKey(name)) {
                duplicates.add(name);
                return this;
            }
            features.put(name, new Feature(name, isAbstract, parent));
            return this;
        }

        public Builder addGroup(String parent, GroupKind kind, List<String> children) {
            groups.add(new Group(parent, kind, children));
            return this;
        }

        public Builder addConstraint(Constraint constraint) {
            constraints.add(constraint);
            return this;
        }

        public boolean hasFeature(String name) {
            return features.containsKey(name);
        }

        /**
         * Valida gli invarianti e restituisce il modello immutabile.
         *
         * @throws ModelReferenceException alla prima violazione strutturale trovata
         */
        public FeatureModel build() throws ModelReferenceException {
            if (!duplicates.isEmpty()) {
                throw new ModelReferenceException("Feature dichiarate più volte: " + duplicates);
            }
            resolveRoot();
            validateParents();
            validateGroups();
            validateConstraints();
            return new FeatureModel(this);
        }

        private void resolveRoot() throws ModelReferenceException {
            List<String> roots = features.values().stream().filter(Feature::isRoot).map(Feature::getName).toList();
            if (roots.size() != 1) {
                throw new ModelReferenceException("Il modello deve avere esattamente una radice, trovate: " + roots);
            }
            root = roots.get(0);
        }

        private void validateParents() throws ModelReferenceException {
            for (Feature feature : features.values()) {
                if (!feature.isRoot() && !features.containsKey(feature.getParent())) {
                    throw new ModelReferenceException("Feature '" + feature.getName()
                            + "' ha padre inesistente: " + feature.getParent());
                }
            }
        }

        private void validateGroups() throws ModelReferenceException {
            Map<String, String> groupOfChild = new HashMap<>();

            for (Group group : groups) {
                if (!features.containsKey(group.getParent())) {
                    throw new ModelReferenceException("Gruppo con padre inesistente: " + group);
                }
                for (String child : group.getChildren()) {
                    Feature feature = features.get(child);
                    if (feature == null) {
                        throw new ModelReferenceException("Gruppo " + group + " referenzia feature inesistente: " + child);
                    }
                    if (!group.getParent().equals(feature.getParent())) {
                        throw new ModelReferenceException("Feature '" + child + "' nel gruppo di '" + group.getParent()
                                + "' ma con padre '" + feature.getParent() + "'");
                    }
                    if (groupOfChild.put(child, group.getParent()) != null) {
                        throw new ModelReferenceException("Feature '" + child + "' appartiene a più gruppi");
                    }
                }
            }

            for (Feature feature : features.values()) {
                if (!feature.isRoot() && !groupOfChild.containsKey(feature.getName())) {
                    throw new ModelReferenceException("Feature '" + feature.getName()
                            + "' non appartiene a nessun gruppo del padre '" + feature.getParent() + "'");
                }
            }
        }

        private void validateConstraints() throws ModelReferenceException {
            for (Constraint constraint : constraints) {
                for (String name : constraint.referencedFeatures()) {
                    if (!features.containsKey(name)) {
                        throw new ModelReferenceException("Vincolo '" + constraint + "' referenzia feature inesistente: " + name);
                    }
                }
            }
        }
    }

    //endregion
}
