package com.pricelens.backend.service.explain;

import com.pricelens.backend.config.ExplainabilityProperties;
import com.pricelens.backend.config.JacksonConfig;
import com.pricelens.backend.model.Audience;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.model.ExplanationResult;
import com.pricelens.backend.service.ExplainabilityMetrics;
import com.pricelens.backend.service.audit.AuditEventType;
import com.pricelens.backend.service.audit.AuditSink;
import com.pricelens.backend.service.evidence.EvidenceJsonCodec;
import com.pricelens.backend.service.evidence.EvidenceValidator;
import com.pricelens.backend.util.TestEvidenceFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExplanationServiceTest {

    private static final Pattern UNREDACTED_AMOUNT =
            Pattern.compile("([₹$€£¥]|(INR|USD|EUR|GBP|JPY|CHF))\\s?\\d");

    @Mock
    private AuditSink auditSink;

    private SimpleMeterRegistry meterRegistry;
    private EvidenceValidator validator;
    private EvidenceJsonCodec codec;
    private ExplanationService service;

    @BeforeEach
    void setUp() {
        ExplainabilityProperties properties = new ExplainabilityProperties();
        meterRegistry = new SimpleMeterRegistry();
        validator = new EvidenceValidator(auditSink, properties);
        codec = new EvidenceJsonCodec(new JacksonConfig().objectMapper());
        service = new ExplanationService(validator, new ExplanationRenderer(validator), new SafetyFilter(properties),
                codec, auditSink, new ExplainabilityMetrics(meterRegistry));
    }

    @Test
    void producesBothAudiencesForValidEvidence() {
        ExplanationResult result = service.generateExplanations(TestEvidenceFactory.valid());

        assertThat(result.isRefused()).isFalse();
        assertThat(result.evidenceUsed()).isEqualTo(TestEvidenceFactory.EVENT_ID);
        assertThat(result.customerText()).contains("(Customer Summary)");
        assertThat(result.regulatorText()).contains("(Regulatory Audit)");
        verify(auditSink).logEvent(eq(AuditEventType.TEXT_GENERATED), anyMap());
        assertThat(meterRegistry.counter("explanations_generated_total").count()).isEqualTo(1.0);
    }

    @Test
    void hidesExactCostsInBothAudiences() {
        Evidence evidence = TestEvidenceFactory.withSafetyFlags(TestEvidenceFactory.valid(),
                new Evidence.SafetyFlags(true, true));

        ExplanationResult result = service.generateExplanations(evidence);

        assertThat(result.customerText()).contains("₹~1000.00 → ₹~1200.00");
        assertThat(UNREDACTED_AMOUNT.matcher(result.customerText()).find()).isFalse();
        assertThat(UNREDACTED_AMOUNT.matcher(result.regulatorText()).find()).isFalse();
    }

    @Test
    void hidesAmountsInACurrencyWithoutAGlyph() {
        Evidence evidence = TestEvidenceFactory.withCurrency(TestEvidenceFactory.withSafetyFlags(
                TestEvidenceFactory.valid(), new Evidence.SafetyFlags(true, false)), "CHF");

        ExplanationResult result = service.generateExplanations(evidence);

        assertThat(result.customerText()).contains("CHF~1000.00 → CHF~1200.00");
        assertThat(UNREDACTED_AMOUNT.matcher(result.customerText()).find()).isFalse();
        assertThat(UNREDACTED_AMOUNT.matcher(result.regulatorText()).find()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"old_price", "new_price", "currency", "model_version", "xai_method",
            "time_window", "features_used", "confidence_score", "safety_flags"})
    void refusesEvidenceMissingAnyRequiredField(String field) {
        ExplanationResult result = service.generateExplanations(TestEvidenceFactory.without(field));

        assertThat(result.customerText()).isEqualTo(ExplanationResult.REFUSAL_TEXT);
        assertThat(result.regulatorText()).isEqualTo(ExplanationResult.REFUSAL_TEXT);
        assertThat(result.error()).isEqualTo(ExplanationResult.VALIDATION_FAILED);
        assertThat(result.evidenceUsed()).isNull();
        verify(auditSink).logEvent(eq(AuditEventType.GENERATION_REFUSED), anyMap());
        verify(auditSink, never()).logEvent(eq(AuditEventType.TEXT_GENERATED), anyMap());
    }

    @Test
    void refusesWrongExplainabilityMethodEvenWhenOtherwiseWellFormed() {
        ExplanationResult result = service.generateExplanations(
                TestEvidenceFactory.withXaiMethod(TestEvidenceFactory.valid(), "LIME"));

        assertThat(result.isRefused()).isTrue();
        assertThat(result.customerText()).isEqualTo(ExplanationResult.REFUSAL_TEXT);
        assertThat(meterRegistry.counter("explanations_refused_total").count()).isEqualTo(1.0);
    }

    @Test
    void refusesTamperedJsonWithoutMethodTag() {
        String tampered = """
                {
                  "old_price": 100,
                  "new_price": 110,
                  "currency": "INR",
                  "model_version": "v1",
                  "time_window": {"from": "2024-01-01", "to": "2024-01-02"},
                  "features_used": [{"name": "cost", "attribution": 1.0, "value_change_pct": 10}],
                  "confidence_score": 0.9,
                  "safety_flags": {}
                }
                """;

        ExplanationResult result = service.generateExplanations(tampered);

        assertThat(result.error()).isEqualTo(ExplanationResult.VALIDATION_FAILED);
        assertThat(result.regulatorText()).isEqualTo(ExplanationResult.REFUSAL_TEXT);
    }

    @Test
    void refusesJsonCarryingNullConfidence() {
        String json = codec.toJson(TestEvidenceFactory.withConfidence(TestEvidenceFactory.valid(), null));
        assertThat(json).contains("\"confidence_score\":null");

        ExplanationResult result = service.generateExplanations(json);

        assertThat(result.error()).isEqualTo(ExplanationResult.VALIDATION_FAILED);
        verify(auditSink).logEvent(AuditEventType.GENERATION_REFUSED, Map.of("reason", "Missing confidence score"));
    }

    @Test
    void acceptsWellFormedJson() {
        ExplanationResult result = service.generateExplanations(codec.toJson(TestEvidenceFactory.valid()));

        assertThat(result.isRefused()).isFalse();
        assertThat(result.evidenceUsed()).isEqualTo(TestEvidenceFactory.EVENT_ID);
    }

    @Test
    void refusesUnreadableJson() {
        ExplanationResult result = service.generateExplanations("{\"old_price\": ");

        assertThat(result.error()).isEqualTo(ExplanationService.UNREADABLE_EVIDENCE);
        assertThat(result.customerText()).isEqualTo(ExplanationResult.REFUSAL_TEXT);
    }

    @Test
    void renderingFailureDegradesToRefusalForBothAudiences() {
        ExplanationRenderer failingRenderer = mock(ExplanationRenderer.class);
        when(failingRenderer.render(any(Evidence.class), eq(Audience.CUSTOMER))).thenReturn("customer");
        when(failingRenderer.render(any(Evidence.class), eq(Audience.REGULATOR)))
                .thenThrow(new IllegalStateException("boom"));
        ExplanationService failing = new ExplanationService(validator, failingRenderer,
                new SafetyFilter(new ExplainabilityProperties()), codec, auditSink,
                new ExplainabilityMetrics(meterRegistry));

        ExplanationResult result = failing.generateExplanations(TestEvidenceFactory.valid());

        assertThat(result.customerText()).isEqualTo(ExplanationResult.REFUSAL_TEXT);
        assertThat(result.regulatorText()).isEqualTo(ExplanationResult.REFUSAL_TEXT);
        assertThat(result.error()).isEqualTo(ExplanationService.RENDERING_FAILED);
    }

    @Test
    void regeneratingFromTheSameEvidenceGivesTheSameTexts() {
        Evidence evidence = TestEvidenceFactory.valid();

        ExplanationResult first = service.generateExplanations(evidence);
        ExplanationResult second = service.generateExplanations(evidence);

        assertThat(second).isEqualTo(first);
    }
}
