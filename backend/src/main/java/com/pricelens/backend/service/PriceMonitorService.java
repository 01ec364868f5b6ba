package com.pricelens.backend.service;

import com.pricelens.backend.config.PricingProperties;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.model.ExplanationResult;
import com.pricelens.backend.model.PricingState;
import com.pricelens.backend.service.audit.AuditSink;
import com.pricelens.backend.service.explain.ExplanationService;
import com.pricelens.backend.service.pricing.MarketSimulator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one observe-and-explain cycle per call against the simulated market.
 */
@Service
@Slf4j
public class PriceMonitorService {

    private final MarketSimulator marketSimulator;
    private final PriceChangeTracker tracker;
    private final ExplanationService explanationService;
    private final int maxCycles;
    private final AtomicInteger cycles = new AtomicInteger();

    public PriceMonitorService(MarketSimulator marketSimulator,
                               PriceChangeTracker tracker,
                               ExplanationService explanationService,
                               PricingProperties pricingProperties) {
        this.marketSimulator = marketSimulator;
        this.tracker = tracker;
        this.explanationService = explanationService;
        this.maxCycles = pricingProperties.getMonitor().getMaxCycles();
    }

    public synchronized Optional<ExplanationResult> runCycle() {
        if (maxCycles > 0 && cycles.get() >= maxCycles) {
            return Optional.empty();
        }
        // Every audit event of one cycle carries the same correlation id; a caller's own id wins.
        boolean ownsCorrelationId = MDC.get(AuditSink.CORRELATION_ID) == null;
        if (ownsCorrelationId) {
            MDC.put(AuditSink.CORRELATION_ID, UUID.randomUUID().toString());
        }
        try {
            return observeAndExplain();
        } finally {
            if (ownsCorrelationId) {
                MDC.remove(AuditSink.CORRELATION_ID);
            }
        }
    }

    private Optional<ExplanationResult> observeAndExplain() {
        if (tracker.baseline().isEmpty()) {
            tracker.observe(marketSimulator.currentState());
            log.info("Price monitor started in {} mode", tracker.attributionMode());
        }
        int cycle = cycles.incrementAndGet();
        PricingState state = marketSimulator.step();
        Optional<Evidence> evidence = tracker.observe(state);
        if (evidence.isEmpty()) {
            log.info("[Cycle {}] No explainable change detected (price {})", cycle, state.price());
            return Optional.empty();
        }

        ExplanationResult result = explanationService.generateExplanations(evidence.get());
        if (result.isRefused()) {
            log.warn("[Cycle {}] Explanation refused: {}", cycle, result.error());
        } else {
            log.info("[Cycle {}] Customer version:\n{}", cycle, result.customerText());
            log.info("[Cycle {}] Regulator version:\n{}", cycle, result.regulatorText());
        }
        if (maxCycles > 0 && cycle >= maxCycles) {
            log.info("Price monitor reached {} cycles, stopping", maxCycles);
        }
        return Optional.of(result);
    }

    public int completedCycles() {
        return cycles.get();
    }
}
