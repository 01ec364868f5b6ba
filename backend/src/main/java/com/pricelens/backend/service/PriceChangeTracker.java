package com.pricelens.backend.service;

import com.pricelens.backend.config.ExplainabilityProperties;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.model.PricingState;
import com.pricelens.backend.service.attribution.AttributionComputer;
import com.pricelens.backend.service.attribution.AttributionNormalizer;
import com.pricelens.backend.service.audit.AuditEventType;
import com.pricelens.backend.service.audit.AuditSink;
import com.pricelens.backend.service.evidence.EvidenceBuilder;
import com.pricelens.backend.service.evidence.EvidenceValidator;
import com.pricelens.backend.service.pricing.PricingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the baseline state and turns each material price move into evidence.
 * <p>
 * The baseline is written only here, once per {@link #observe} call. By default it is replaced
 * at the end of every cycle, including cycles whose attribution was rejected, so a rejected
 * state becomes the reference for the next one. Callers must serialize calls.
 */
@Service
@Slf4j
public class PriceChangeTracker {

    private final AttributionComputer attributionComputer;
    private final AttributionNormalizer normalizer;
    private final EvidenceValidator validator;
    private final EvidenceBuilder evidenceBuilder;
    private final PricingModel pricingModel;
    private final AuditSink auditSink;
    private final ExplainabilityMetrics metrics;
    private final double materialityThreshold;
    private final boolean retainBaselineOnRejection;

    private PricingState baseline;

    public PriceChangeTracker(AttributionComputer attributionComputer,
                              AttributionNormalizer normalizer,
                              EvidenceValidator validator,
                              EvidenceBuilder evidenceBuilder,
                              PricingModel pricingModel,
                              AuditSink auditSink,
                              ExplainabilityMetrics metrics,
                              ExplainabilityProperties properties) {
        this.attributionComputer = attributionComputer;
        this.normalizer = normalizer;
        this.validator = validator;
        this.evidenceBuilder = evidenceBuilder;
        this.pricingModel = pricingModel;
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.materialityThreshold = properties.getMaterialityThreshold();
        this.retainBaselineOnRejection = properties.isRetainBaselineOnRejection();
    }

    public Optional<Evidence> observe(PricingState current) {
        if (baseline == null) {
            baseline = current;
            log.debug("Baseline set at price {}", current.price());
            return Optional.empty();
        }

        PricingState previous = baseline;
        boolean rejected = false;
        try {
            if (Math.abs(current.price() - previous.price()) < materialityThreshold) {
                log.debug("Price move {} -> {} below materiality, skipped", previous.price(), current.price());
                metrics.recordCycleSkipped();
                return Optional.empty();
            }
            Optional<Evidence> evidence = attribute(previous, current);
            rejected = evidence.isEmpty();
            return evidence;
        } catch (RuntimeException e) {
            log.error("Attribution failed for price move {} -> {}", previous.price(), current.price(), e);
            rejected = true;
            metrics.recordEvidenceRejected();
            return Optional.empty();
        } finally {
            if (!(rejected && retainBaselineOnRejection)) {
                baseline = current;
            }
        }
    }

    public Optional<PricingState> baseline() {
        return Optional.ofNullable(baseline);
    }

    public AttributionComputer.Mode attributionMode() {
        return attributionComputer.mode();
    }

    private Optional<Evidence> attribute(PricingState previous, PricingState current) {
        List<FeatureAttribution> features = normalizer.normalize(attributionComputer.compute(previous, current));
        if (!validator.checkAttributionSum(features)) {
            metrics.recordEvidenceRejected();
            return Optional.empty();
        }
        Evidence evidence = evidenceBuilder.build(previous, current, features, pricingModel.metadata());
        auditSink.logEvent(AuditEventType.EVIDENCE_GENERATED, Map.of("evidence", evidence));
        metrics.recordEvidenceGenerated();
        log.info("Evidence {} produced for price move {} -> {} ({} features)",
                evidence.eventId(), previous.price(), current.price(), features.size());
        return Optional.of(evidence);
    }
}
