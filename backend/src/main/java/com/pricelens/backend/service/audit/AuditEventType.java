package com.pricelens.backend.service.audit;

public enum AuditEventType {
    MODEL_INITIALIZED,
    EXPLAINER_UNAVAILABLE,
    EVIDENCE_GENERATED,
    ATTRIBUTION_VALIDATION_FAILED,
    GENERATION_REFUSED,
    TEXT_GENERATED
}
