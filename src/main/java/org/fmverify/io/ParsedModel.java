package org.fmverify.io;

import org.fmverify.model.FeatureModel;
import org.fmverify.support.Diagnostics;

/**
 * Modello letto da file con le condizioni recuperabili incontrate durante il parsing.
 *
 * @param model modello validato
 * @param diagnostics riferimenti scartati e altre anomalie non fatali
 * @param rootNote nota sulla risoluzione della radice, null se la radice è canonica o esplicita nel file
 */
public record ParsedModel(FeatureModel model, Diagnostics diagnostics, String rootNote) {
}
