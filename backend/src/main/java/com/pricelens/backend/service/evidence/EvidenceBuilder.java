package com.pricelens.backend.service.evidence;

import com.pricelens.backend.config.ExplainabilityProperties;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.model.ModelMetadata;
import com.pricelens.backend.model.PricingState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Assembles the frozen evidence record. Only called once the attribution sum check has passed.
 * <p>
 * The time window is always the trailing {@code windowDays} ending now; it is not derived from
 * when the two states were observed.
 */
@Component
public class EvidenceBuilder {

    private final ExplainabilityProperties properties;
    private final Clock clock;

    public EvidenceBuilder(ExplainabilityProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Evidence build(PricingState previous,
                          PricingState current,
                          List<FeatureAttribution> features,
                          ModelMetadata metadata) {
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        Instant windowStart = now.minus(Duration.ofDays(properties.getWindowDays()));
        ExplainabilityProperties.Safety safety = properties.getSafety();

        return new Evidence(
                UUID.randomUUID(),
                properties.getProductId(),
                previous.price(),
                current.price(),
                properties.getCurrency(),
                now,
                metadata.modelVersion(),
                properties.getAcceptedMethod(),
                new Evidence.TimeWindow(
                        LocalDate.ofInstant(windowStart, ZoneOffset.UTC),
                        LocalDate.ofInstant(now, ZoneOffset.UTC)),
                features,
                metadata.confidenceScore(),
                new Evidence.SafetyFlags(safety.isHideExactCosts(), safety.isHideSupplierNames())
        );
    }
}
