package com.pricelens.backend.service.evidence;

import com.pricelens.backend.config.ExplainabilityProperties;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.service.audit.AuditEventType;
import com.pricelens.backend.service.audit.AuditSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Enforces the evidence data contract. Every rejection is written to the audit sink before returning.
 */
@Component
@Slf4j
public class EvidenceValidator {

    static final String CONFIDENCE_SCORE = "confidence_score";

    // Checked in this order; the first missing field is the one reported.
    private static final Map<String, Function<Evidence, Object>> REQUIRED_FIELDS = requiredFields();

    private final AuditSink auditSink;
    private final String acceptedMethod;
    private final double sumTolerance;

    public EvidenceValidator(AuditSink auditSink, ExplainabilityProperties properties) {
        this.auditSink = auditSink;
        this.acceptedMethod = properties.getAcceptedMethod();
        this.sumTolerance = properties.getSumTolerance();
    }

    public boolean validate(Evidence evidence) {
        return check(evidence).valid();
    }

    /**
     * Checks a typed record, where a null field counts as absent.
     */
    public ValidationResult check(Evidence evidence) {
        return check(evidence, presentFields(evidence));
    }

    /**
     * Checks evidence read from the wire. {@code presentFields} are the keys the payload carried,
     * so a {@code confidence_score} sent as null is told apart from one left out.
     */
    public ValidationResult check(Evidence evidence, Set<String> presentFields) {
        if (evidence == null) {
            return refuse(ValidationFailure.MISSING_FIELD, "Missing evidence");
        }
        for (Map.Entry<String, Function<Evidence, Object>> field : REQUIRED_FIELDS.entrySet()) {
            String name = field.getKey();
            boolean nullable = CONFIDENCE_SCORE.equals(name);
            if (!presentFields.contains(name) || (!nullable && field.getValue().apply(evidence) == null)) {
                return refuse(ValidationFailure.MISSING_FIELD, "Missing field: " + name);
            }
        }
        if (evidence.confidenceScore() == null) {
            return refuse(ValidationFailure.MISSING_CONFIDENCE, "Missing confidence score");
        }
        if (!acceptedMethod.equals(evidence.xaiMethod())) {
            return refuse(ValidationFailure.INVALID_XAI_METHOD,
                    "Invalid XAI method (must be " + acceptedMethod + ")");
        }
        return ValidationResult.ok();
    }

    public boolean checkAttributionSum(List<FeatureAttribution> features) {
        return checkSum(features).valid();
    }

    public ValidationResult checkSum(List<FeatureAttribution> features) {
        if (features == null || features.isEmpty()) {
            return ValidationResult.ok();
        }
        double total = features.stream().mapToDouble(FeatureAttribution::attribution).sum();
        if (Math.abs(total - 1.0) <= sumTolerance) {
            return ValidationResult.ok();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("total", total);
        details.put("features", features);
        auditSink.logEvent(AuditEventType.ATTRIBUTION_VALIDATION_FAILED, details);
        log.warn("Attribution sum {} outside 1.0 +/- {}", total, sumTolerance);
        return ValidationResult.rejected(ValidationFailure.ATTRIBUTION_SUM_MISMATCH,
                "Attribution sum " + total + " is not 1.0");
    }

    private ValidationResult refuse(ValidationFailure failure, String reason) {
        auditSink.logEvent(AuditEventType.GENERATION_REFUSED, Map.of("reason", reason));
        log.warn("Evidence refused: {}", reason);
        return ValidationResult.rejected(failure, reason);
    }

    private static Set<String> presentFields(Evidence evidence) {
        Set<String> present = new HashSet<>();
        if (evidence != null) {
            REQUIRED_FIELDS.forEach((name, accessor) -> {
                if (accessor.apply(evidence) != null) {
                    present.add(name);
                }
            });
        }
        return present;
    }

    private static Map<String, Function<Evidence, Object>> requiredFields() {
        Map<String, Function<Evidence, Object>> fields = new LinkedHashMap<>();
        fields.put("old_price", Evidence::oldPrice);
        fields.put("new_price", Evidence::newPrice);
        fields.put("currency", Evidence::currency);
        fields.put("model_version", Evidence::modelVersion);
        fields.put("xai_method", Evidence::xaiMethod);
        fields.put("time_window", Evidence::timeWindow);
        fields.put("features_used", Evidence::featuresUsed);
        fields.put(CONFIDENCE_SCORE, Evidence::confidenceScore);
        fields.put("safety_flags", Evidence::safetyFlags);
        return fields;
    }
}
