package com.pricelens.backend.service.explain;

import com.pricelens.backend.exception.EvidenceFormatException;
import com.pricelens.backend.model.Audience;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.model.ExplanationResult;
import com.pricelens.backend.service.ExplainabilityMetrics;
import com.pricelens.backend.service.audit.AuditEventType;
import com.pricelens.backend.service.audit.AuditSink;
import com.pricelens.backend.service.evidence.EvidenceJsonCodec;
import com.pricelens.backend.service.evidence.EvidenceValidator;
import com.pricelens.backend.service.evidence.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Produces the customer and regulator explanations for one evidence record.
 * Never throws: anything that prevents both texts from being produced yields the fixed refusal.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExplanationService {

    static final String RENDERING_FAILED = "Rendering Failed";
    static final String UNREADABLE_EVIDENCE = "Unreadable Evidence";

    private final EvidenceValidator validator;
    private final ExplanationRenderer renderer;
    private final SafetyFilter safetyFilter;
    private final EvidenceJsonCodec codec;
    private final AuditSink auditSink;
    private final ExplainabilityMetrics metrics;

    public ExplanationResult generateExplanations(Evidence evidence) {
        return explain(evidence, validator.check(evidence));
    }

    private ExplanationResult explain(Evidence evidence, ValidationResult validation) {
        if (!validation.valid() || !validator.checkAttributionSum(evidence.featuresUsed())) {
            metrics.recordExplanationRefused();
            return ExplanationResult.refused(ExplanationResult.VALIDATION_FAILED);
        }

        ExplanationResult result;
        try {
            String customer = safetyFilter.filter(renderer.render(evidence, Audience.CUSTOMER),
                    evidence.safetyFlags(), evidence.currency());
            String regulator = safetyFilter.filter(renderer.render(evidence, Audience.REGULATOR),
                    evidence.safetyFlags(), evidence.currency());
            result = ExplanationResult.generated(customer, regulator, evidence.eventId());
        } catch (RuntimeException e) {
            log.error("Failed to render explanations for evidence {}", evidence.eventId(), e);
            metrics.recordExplanationRefused();
            return ExplanationResult.refused(RENDERING_FAILED);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("customer_text", result.customerText());
        details.put("regulator_text", result.regulatorText());
        details.put("evidence_used", result.evidenceUsed());
        auditSink.logEvent(AuditEventType.TEXT_GENERATED, details);
        metrics.recordExplanationGenerated();
        log.info("Generated explanations for evidence {}", evidence.eventId());
        return result;
    }

    /**
     * Accepts evidence in its JSON wire form, e.g. from another process.
     */
    public ExplanationResult generateExplanations(String evidenceJson) {
        EvidenceJsonCodec.WireEvidence wire;
        try {
            wire = codec.readWire(evidenceJson);
        } catch (EvidenceFormatException e) {
            log.warn("Refusing explanation: {}", e.getMessage());
            auditSink.logEvent(AuditEventType.GENERATION_REFUSED, Map.of("reason", String.valueOf(e.getMessage())));
            metrics.recordExplanationRefused();
            return ExplanationResult.refused(UNREADABLE_EVIDENCE);
        }
        return explain(wire.evidence(), validator.check(wire.evidence(), wire.presentFields()));
    }
}
