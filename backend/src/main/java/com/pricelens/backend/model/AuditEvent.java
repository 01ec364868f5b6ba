package com.pricelens.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record AuditEvent(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("details") Map<String, Object> details
) {}
