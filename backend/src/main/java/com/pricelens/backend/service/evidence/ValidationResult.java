package com.pricelens.backend.service.evidence;

public record ValidationResult(
        boolean valid,
        ValidationFailure failure,
        String reason
) {
    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult rejected(ValidationFailure failure, String reason) {
        return new ValidationResult(false, failure, reason);
    }
}
