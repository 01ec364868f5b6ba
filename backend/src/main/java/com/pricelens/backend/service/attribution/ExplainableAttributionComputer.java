package com.pricelens.backend.service.attribution;

import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.model.PricingState;
import com.pricelens.backend.util.DecimalUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes the change using the explainer's signed contributions for the new inputs.
 */
public class ExplainableAttributionComputer implements AttributionComputer {

    private final ExplainabilityCapability capability;
    private final double minContribution;

    public ExplainableAttributionComputer(ExplainabilityCapability capability, double minContribution) {
        this.capability = capability;
        this.minContribution = minContribution;
    }

    @Override
    public Mode mode() {
        return Mode.EXPLAINABLE;
    }

    @Override
    public List<FeatureAttribution> compute(PricingState previous, PricingState current) {
        List<String> featureNames = capability.featureNames();
        Map<String, Double> vector = new LinkedHashMap<>();
        for (String name : featureNames) {
            vector.put(name, current.input(name));
        }
        double[] contributions = capability.explain(vector);
        if (contributions == null || contributions.length != featureNames.size()) {
            throw new IllegalStateException("Explainer returned " + (contributions == null ? "no" : contributions.length)
                    + " contributions for " + featureNames.size() + " features");
        }

        List<FeatureAttribution> features = new ArrayList<>();
        for (int i = 0; i < featureNames.size(); i++) {
            String name = featureNames.get(i);
            double contribution = contributions[i];
            if (Math.abs(contribution) <= minContribution) {
                continue;
            }
            double changePct = DecimalUtils.percentChange(previous.input(name), current.input(name));
            features.add(new FeatureAttribution(
                    name,
                    DecimalUtils.round(changePct, 1),
                    Math.abs(contribution),
                    contribution,
                    FeatureCatalog.dataSource(name)
            ));
        }
        return features;
    }
}
