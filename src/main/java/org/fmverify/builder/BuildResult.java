package org.fmverify.builder;

import org.fmverify.model.FeatureModel;
import org.fmverify.support.Diagnostics;

/**
 * Esito della costruzione: modello e report degli elementi scartati.
 */
public final class BuildResult {

    private final FeatureModel model;
    private final Diagnostics report;

    public BuildResult(FeatureModel model, Diagnostics report) {
        this.model = model;
        this.report = report;
    }

    public FeatureModel getModel() {
        return model;
    }

    public Diagnostics getReport() {
        return report;
    }
}
