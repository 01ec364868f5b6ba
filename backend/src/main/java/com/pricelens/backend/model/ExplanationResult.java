package com.pricelens.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExplanationResult(
        @JsonProperty("customer_text") String customerText,
        @JsonProperty("regulator_text") String regulatorText,
        @JsonProperty("evidence_used") UUID evidenceUsed,
        @JsonProperty("error") String error
) {
    public static final String REFUSAL_TEXT = "Explanation unavailable due to data validation failure.";
    public static final String VALIDATION_FAILED = "Validation Failed";

    public static ExplanationResult generated(String customerText, String regulatorText, UUID evidenceUsed) {
        return new ExplanationResult(customerText, regulatorText, evidenceUsed, null);
    }

    public static ExplanationResult refused(String error) {
        return new ExplanationResult(REFUSAL_TEXT, REFUSAL_TEXT, null, error);
    }

    public boolean isRefused() {
        return error != null;
    }
}
