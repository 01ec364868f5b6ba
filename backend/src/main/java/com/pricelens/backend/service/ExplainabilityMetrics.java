package com.pricelens.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

@Service
public class ExplainabilityMetrics {

    private final Counter evidenceGenerated;
    private final Counter evidenceRejected;
    private final Counter cyclesSkipped;
    private final Counter explanationsGenerated;
    private final Counter explanationsRefused;

    public ExplainabilityMetrics(MeterRegistry meterRegistry) {
        evidenceGenerated = Counter.builder("evidence_generated_total").register(meterRegistry);
        evidenceRejected = Counter.builder("evidence_rejected_total").register(meterRegistry);
        cyclesSkipped = Counter.builder("cycles_skipped_total").register(meterRegistry);
        explanationsGenerated = Counter.builder("explanations_generated_total").register(meterRegistry);
        explanationsRefused = Counter.builder("explanations_refused_total").register(meterRegistry);
    }

    public void recordEvidenceGenerated() {
        evidenceGenerated.increment();
    }

    public void recordEvidenceRejected() {
        evidenceRejected.increment();
    }

    public void recordCycleSkipped() {
        cyclesSkipped.increment();
    }

    public void recordExplanationGenerated() {
        explanationsGenerated.increment();
    }

    public void recordExplanationRefused() {
        explanationsRefused.increment();
    }
}
