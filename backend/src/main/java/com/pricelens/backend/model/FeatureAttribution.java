package com.pricelens.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeatureAttribution(
        @JsonProperty("name") String name,
        @JsonProperty("value_change_pct") double valueChangePct,
        @JsonProperty("attribution") double attribution,
        @JsonProperty("raw_signed_value") Double rawSignedValue,
        @JsonProperty("data_source") String dataSource
) {

    public FeatureAttribution withAttribution(double newAttribution) {
        return new FeatureAttribution(name, valueChangePct, newAttribution, rawSignedValue, dataSource);
    }
}
