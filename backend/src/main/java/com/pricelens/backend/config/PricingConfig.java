package com.pricelens.backend.config;

import com.pricelens.backend.model.ModelMetadata;
import com.pricelens.backend.service.attribution.AttributionComputer;
import com.pricelens.backend.service.attribution.ExplainabilityInitializer;
import com.pricelens.backend.service.audit.AuditSink;
import com.pricelens.backend.service.pricing.LinearPricingModel;
import com.pricelens.backend.service.pricing.MarketSimulator;
import com.pricelens.backend.service.pricing.PricingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

@Configuration
public class PricingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PricingModel pricingModel(PricingProperties properties) {
        return new LinearPricingModel(
                properties.getIntercept(),
                properties.getCoefficients(),
                properties.getReferenceInputs(),
                new ModelMetadata(properties.getModelVersion(), properties.getConfidenceScore())
        );
    }

    /**
     * Resolved once; a model that cannot explain itself here keeps the fallback for the process lifetime.
     */
    @Bean
    public AttributionComputer attributionComputer(PricingModel pricingModel,
                                                   ExplainabilityProperties explainabilityProperties,
                                                   AuditSink auditSink) {
        return new ExplainabilityInitializer(explainabilityProperties, auditSink).initialize(pricingModel);
    }

    @Bean
    public MarketSimulator marketSimulator(PricingModel pricingModel, PricingProperties properties) {
        Long seed = properties.getMonitor().getSeed();
        Random random = seed == null ? new Random() : new Random(seed);
        return new MarketSimulator(pricingModel, properties.getInitialInputs(), random);
    }
}
