package com.pricelens.backend.service.pricing;

import com.pricelens.backend.exception.ExplainabilityUnavailableException;
import com.pricelens.backend.model.ModelMetadata;
import com.pricelens.backend.service.attribution.ExplainabilityCapability;

import java.util.List;
import java.util.Map;

/**
 * The pricing predictor. Treated as a black box by the evidence pipeline.
 */
public interface PricingModel {

    List<String> featureNames();

    double predict(Map<String, Double> inputs);

    ModelMetadata metadata();

    /**
     * @throws ExplainabilityUnavailableException when this model cannot explain its predictions
     */
    ExplainabilityCapability explainer();
}
