package com.pricelens.backend.service.pricing;

import com.pricelens.backend.exception.ExplainabilityUnavailableException;
import com.pricelens.backend.model.ModelMetadata;
import com.pricelens.backend.service.attribution.ExplainabilityCapability;
import com.pricelens.backend.util.DecimalUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * price = intercept + sum(coefficient * input), rounded to cents.
 * For a linear model the Shapley value of a feature is exactly coefficient * (input - reference).
 */
public class LinearPricingModel implements PricingModel {

    private final double intercept;
    private final Map<String, Double> coefficients;
    private final Map<String, Double> referenceInputs;
    private final ModelMetadata metadata;

    public LinearPricingModel(double intercept,
                              Map<String, Double> coefficients,
                              Map<String, Double> referenceInputs,
                              ModelMetadata metadata) {
        this.intercept = intercept;
        this.coefficients = coefficients == null ? Map.of() : new LinkedHashMap<>(coefficients);
        this.referenceInputs = referenceInputs == null ? Map.of() : new LinkedHashMap<>(referenceInputs);
        this.metadata = metadata;
    }

    @Override
    public List<String> featureNames() {
        return List.copyOf(coefficients.keySet());
    }

    @Override
    public double predict(Map<String, Double> inputs) {
        double price = intercept;
        for (Map.Entry<String, Double> coefficient : coefficients.entrySet()) {
            price += coefficient.getValue() * valueOf(inputs, coefficient.getKey());
        }
        return DecimalUtils.round2(price);
    }

    @Override
    public ModelMetadata metadata() {
        return metadata;
    }

    @Override
    public ExplainabilityCapability explainer() {
        if (coefficients.isEmpty()) {
            throw new ExplainabilityUnavailableException("Model has no coefficients to explain");
        }
        List<String> missing = new ArrayList<>();
        for (String feature : coefficients.keySet()) {
            if (!referenceInputs.containsKey(feature)) {
                missing.add(feature);
            }
        }
        if (!missing.isEmpty()) {
            throw new ExplainabilityUnavailableException("No reference inputs for " + missing);
        }
        List<String> names = featureNames();
        return new ExplainabilityCapability() {
            @Override
            public List<String> featureNames() {
                return names;
            }

            @Override
            public double[] explain(Map<String, Double> inputs) {
                double[] contributions = new double[names.size()];
                for (int i = 0; i < names.size(); i++) {
                    String name = names.get(i);
                    contributions[i] = coefficients.get(name) * (valueOf(inputs, name) - referenceInputs.get(name));
                }
                return contributions;
            }
        };
    }

    private static double valueOf(Map<String, Double> inputs, String feature) {
        Double value = inputs.get(feature);
        return value == null ? 0.0 : value;
    }
}
