package com.pricelens.backend.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One observed pricing decision: the price and the inputs the model priced it from.
 */
public record PricingState(
        double price,
        Map<String, Double> inputs
) {
    public PricingState {
        inputs = inputs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public double input(String feature) {
        Double value = inputs.get(feature);
        return value == null ? 0.0 : value;
    }
}
