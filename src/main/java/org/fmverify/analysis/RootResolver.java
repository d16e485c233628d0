package org.fmverify.analysis;

import org.fmverify.model.FeatureModel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static org.fmverify.model.AuditVocabulary.CANONICAL_ROOT;

/**
 * RISOLUZIONE DELLA RADICE
 *
 * POLITICA (in ordine):
 * 1. la radice canonica, se presente tra le feature, è sempre la radice
 * 2. altrimenti la radice strutturale: padre in qualche arco, mai figlio
 *    (più candidati: vince il primo in ordine di file e l'ambiguità viene annotata)
 * 3. altrimenti la radice esplicita fornita dal chiamante, se è una feature nota
 * 4. altrimenti {@link RootResolutionException}
 *
 * Ogni radice diversa da quella canonica porta con sé una nota diagnostica.
 */
public final class RootResolver {

    private static final Logger LOGGER = Logger.getLogger(RootResolver.class.getName());

    private RootResolver() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Radice scelta con l'eventuale nota (null quando la radice è canonica).
     */
    public record Resolution(String root, String note) {}

    /**
     * Risolve la radice da feature e archi padre-figlio.
     *
     * @param featuresInFileOrder feature nell'ordine di dichiarazione
     * @param parentByChild archi figlio -> padre, nell'ordine di dichiarazione
     * @param fallbackRoot radice esplicita di ripiego, null se non fornita
     * @throws RootResolutionException se nessuna regola individua una radice
     */
    public static Resolution resolve(Collection<String> featuresInFileOrder, List<Map.Entry<String, String>> parentByChild,
                                     String fallbackRoot) throws RootResolutionException {
        if (featuresInFileOrder.contains(CANONICAL_ROOT)) {
            return new Resolution(CANONICAL_ROOT, null);
        }

        String missing = "WARNING:canonical_root_missing(" + CANONICAL_ROOT + ")";

        Set<String> children = new HashSet<>();
        Set<String> parents = new HashSet<>();
        for (Map.Entry<String, String> edge : parentByChild) {
            children.add(edge.getKey());
            parents.add(edge.getValue());
        }

        List<String> candidates = new ArrayList<>();
        for (String feature : featuresInFileOrder) {
            if (parents.contains(feature) && !children.contains(feature)) {
                candidates.add(feature);
            }
        }

        if (candidates.size() == 1) {
            return new Resolution(candidates.get(0), missing);
        }
        if (candidates.size() > 1) {
            LOGGER.warning("Radici strutturali multiple, scelta per ordine di file: " + candidates);
            return new Resolution(candidates.get(0), missing + ";ambiguous_root" + candidates);
        }

        // Modello con una sola feature: la radice è l'unica possibile
        if (featuresInFileOrder.size() == 1 && parentByChild.isEmpty()) {
            return new Resolution(featuresInFileOrder.iterator().next(), missing);
        }

        if (fallbackRoot != null && featuresInFileOrder.contains(fallbackRoot)) {
            return new Resolution(fallbackRoot, missing + ";explicit_root(" + fallbackRoot + ")");
        }

        throw new RootResolutionException("Impossibile determinare la radice: " + CANONICAL_ROOT
                + " assente, nessuna radice strutturale"
                + (fallbackRoot == null ? " e nessuna radice esplicita fornita" : " e radice esplicita sconosciuta: " + fallbackRoot));
    }

    /**
     * Radice di analisi per un modello già validato: canonica se presente, altrimenti la radice del modello.
     */
    public static Resolution resolve(FeatureModel model) {
        if (model.hasFeature(CANONICAL_ROOT)) {
            return new Resolution(CANONICAL_ROOT, null);
        }
        return new Resolution(model.getRoot(), "WARNING:canonical_root_missing(" + CANONICAL_ROOT + ")");
    }
}
