package com.pricelens.backend.service.attribution;

import com.pricelens.backend.config.ExplainabilityProperties;
import com.pricelens.backend.service.audit.AuditEventType;
import com.pricelens.backend.service.audit.AuditSink;
import com.pricelens.backend.service.pricing.PricingModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chooses the attribution variant once. A model that cannot explain itself at startup
 * leaves the process on the fallback variant; there is no later retry.
 */
@Slf4j
@RequiredArgsConstructor
public class ExplainabilityInitializer {

    private final ExplainabilityProperties properties;
    private final AuditSink auditSink;

    public AttributionComputer initialize(PricingModel model) {
        AttributionComputer computer = select(model);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attribution_mode", computer.mode().name());
        details.put("model_version", model.metadata().modelVersion());
        details.put("features", model.featureNames());
        auditSink.logEvent(AuditEventType.MODEL_INITIALIZED, details);
        return computer;
    }

    private AttributionComputer select(PricingModel model) {
        double minContribution = properties.getMinContribution();
        if (!properties.isExplainerEnabled()) {
            log.warn("Explainer disabled by configuration, using change-magnitude attribution");
            return new FallbackAttributionComputer(minContribution);
        }
        try {
            ExplainabilityCapability capability = model.explainer();
            log.info("Explainer initialized for {} features", capability.featureNames().size());
            return new ExplainableAttributionComputer(capability, minContribution);
        } catch (RuntimeException e) {
            log.warn("Failed to initialize explainer, using change-magnitude attribution: {}", e.getMessage());
            auditSink.logEvent(AuditEventType.EXPLAINER_UNAVAILABLE, Map.of("reason", String.valueOf(e.getMessage())));
            return new FallbackAttributionComputer(minContribution);
        }
    }
}
