package com.pricelens.backend.service.attribution;

import java.util.List;
import java.util.Map;

/**
 * Per-feature signed contributions to a single prediction.
 */
public interface ExplainabilityCapability {

    /**
     * Ordered feature names; {@link #explain(Map)} returns one value per name, in this order.
     */
    List<String> featureNames();

    double[] explain(Map<String, Double> inputs);
}
