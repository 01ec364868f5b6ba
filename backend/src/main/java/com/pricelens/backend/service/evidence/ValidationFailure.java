package com.pricelens.backend.service.evidence;

public enum ValidationFailure {
    MISSING_FIELD,
    MISSING_CONFIDENCE,
    INVALID_XAI_METHOD,
    ATTRIBUTION_SUM_MISMATCH
}
