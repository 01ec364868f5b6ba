package com.pricelens.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Frozen record of why a price moved. Fields are nullable only so that
 * externally supplied payloads can be represented and refused by the validator;
 * {@code EvidenceBuilder} always fills every field.
 */
public record Evidence(
        @JsonProperty("event_id") UUID eventId,
        @JsonProperty("product_id") String productId,
        @JsonProperty("old_price") Double oldPrice,
        @JsonProperty("new_price") Double newPrice,
        @JsonProperty("currency") String currency,
        @JsonProperty("event_time") Instant eventTime,
        @JsonProperty("model_version") String modelVersion,
        @JsonProperty("xai_method") String xaiMethod,
        @JsonProperty("time_window") TimeWindow timeWindow,
        @JsonProperty("features_used") List<FeatureAttribution> featuresUsed,
        @JsonProperty("confidence_score") Double confidenceScore,
        @JsonProperty("safety_flags") SafetyFlags safetyFlags
) {
    public Evidence {
        featuresUsed = featuresUsed == null ? null : List.copyOf(featuresUsed);
    }

    public record TimeWindow(
            @JsonProperty("from") LocalDate from,
            @JsonProperty("to") LocalDate to
    ) {}

    public record SafetyFlags(
            @JsonProperty("hide_exact_costs") boolean hideExactCosts,
            @JsonProperty("hide_supplier_names") boolean hideSupplierNames
    ) {
        public static final SafetyFlags NONE = new SafetyFlags(false, false);
    }
}
