package com.pricelens.backend.service.attribution;

import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.model.PricingState;

import java.util.List;

/**
 * Turns a state transition into un-normalized per-feature attribution magnitudes.
 * One variant is chosen at startup by {@link ExplainabilityInitializer} and kept for the process lifetime.
 */
public interface AttributionComputer {

    Mode mode();

    List<FeatureAttribution> compute(PricingState previous, PricingState current);

    enum Mode {
        EXPLAINABLE,
        FALLBACK
    }
}
