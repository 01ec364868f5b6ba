package com.pricelens.backend.service.attribution;

import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.util.DecimalUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rescales attribution magnitudes to two-decimal fractions summing to exactly 1.00.
 * <p>
 * Rounding drift is pushed onto the first feature in the list, so that feature can be
 * off by up to a cent relative to its true share. This asymmetry is deterministic and kept as is.
 */
@Component
public class AttributionNormalizer {

    public List<FeatureAttribution> normalize(List<FeatureAttribution> features) {
        if (features == null || features.isEmpty()) {
            return features;
        }
        double total = features.stream().mapToDouble(f -> Math.abs(f.attribution())).sum();
        if (total == 0) {
            return features;
        }

        List<FeatureAttribution> normalized = new ArrayList<>(features.size());
        for (FeatureAttribution feature : features) {
            normalized.add(feature.withAttribution(DecimalUtils.round2(feature.attribution() / total)));
        }

        double sum = normalized.stream().mapToDouble(FeatureAttribution::attribution).sum();
        double diff = DecimalUtils.round2(1.0 - sum);
        if (diff != 0) {
            FeatureAttribution first = normalized.get(0);
            normalized.set(0, first.withAttribution(DecimalUtils.round2(first.attribution() + diff)));
        }
        return List.copyOf(normalized);
    }
}
