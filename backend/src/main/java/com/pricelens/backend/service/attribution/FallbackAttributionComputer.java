package com.pricelens.backend.service.attribution;

import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.model.PricingState;
import com.pricelens.backend.util.DecimalUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Used when no explainer could be built: a feature's weight is the size of its own relative move.
 */
@Slf4j
public class FallbackAttributionComputer implements AttributionComputer {

    private final double minContribution;

    public FallbackAttributionComputer(double minContribution) {
        this.minContribution = minContribution;
    }

    @Override
    public Mode mode() {
        return Mode.FALLBACK;
    }

    @Override
    public List<FeatureAttribution> compute(PricingState previous, PricingState current) {
        List<FeatureAttribution> features = new ArrayList<>();
        for (String name : previous.inputs().keySet()) {
            Double newValue = current.inputs().get(name);
            if (newValue == null) {
                log.debug("Feature {} missing from current state, skipped", name);
                continue;
            }
            double changePct = DecimalUtils.percentChange(previous.input(name), newValue);
            double magnitude = Math.abs(changePct);
            if (magnitude <= minContribution) {
                continue;
            }
            features.add(new FeatureAttribution(
                    name,
                    DecimalUtils.round(changePct, 1),
                    magnitude,
                    null,
                    FeatureCatalog.dataSource(name)
            ));
        }
        return features;
    }
}
