package com.pricelens.backend.service.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricelens.backend.config.JacksonConfig;
import com.pricelens.backend.exception.EvidenceFormatException;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.util.TestEvidenceFactory;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvidenceJsonCodecTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final EvidenceJsonCodec codec = new EvidenceJsonCodec(objectMapper);

    @Test
    void writesWireContractFieldNamesAndFormats() throws Exception {
        JsonNode json = objectMapper.readTree(codec.toJson(TestEvidenceFactory.valid()));

        assertThat(json.get("event_id").asText()).isEqualTo(TestEvidenceFactory.EVENT_ID.toString());
        assertThat(json.get("event_time").asText()).isEqualTo("2024-03-15T10:30:45Z");
        assertThat(json.get("time_window").get("from").asText()).isEqualTo("2024-03-08");
        assertThat(json.get("time_window").get("to").asText()).isEqualTo("2024-03-15");
        assertThat(json.get("xai_method").asText()).isEqualTo("SHAP");
        assertThat(json.get("safety_flags").get("hide_exact_costs").asBoolean()).isFalse();
        JsonNode first = json.get("features_used").get(0);
        assertThat(first.get("name").asText()).isEqualTo("raw_material_cost");
        assertThat(first.get("value_change_pct").asDouble()).isEqualTo(50.0);
        assertThat(first.get("raw_signed_value").asDouble()).isEqualTo(42.0);
        assertThat(first.get("data_source").asText()).isEqualTo("supplier_invoices");
    }

    @Test
    void readsBackWhatItWrites() {
        Evidence evidence = TestEvidenceFactory.valid();

        assertThat(codec.fromJson(codec.toJson(evidence))).isEqualTo(evidence);
    }

    @Test
    void absentFieldsReadAsNull() {
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

        Evidence evidence = codec.fromJson(tampered);

        assertThat(evidence.xaiMethod()).isNull();
        assertThat(evidence.eventId()).isNull();
        assertThat(evidence.timeWindow().from()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(evidence.featuresUsed().get(0).rawSignedValue()).isNull();
        assertThat(evidence.safetyFlags().hideExactCosts()).isFalse();
    }

    @Test
    void wireReadKeepsKeysSentAsNull() {
        EvidenceJsonCodec.WireEvidence wire = codec.readWire("""
                {"old_price": 100, "confidence_score": null}
                """);

        assertThat(wire.presentFields()).containsExactlyInAnyOrder("old_price", "confidence_score");
        assertThat(wire.evidence().confidenceScore()).isNull();
        assertThat(wire.evidence().oldPrice()).isEqualTo(100.0);
    }

    @Test
    void rejectsPayloadThatIsNotAnObject() {
        assertThatThrownBy(() -> codec.readWire("[1, 2]")).isInstanceOf(EvidenceFormatException.class);
    }

    @Test
    void rejectsUnreadablePayload() {
        assertThatThrownBy(() -> codec.fromJson("{not json")).isInstanceOf(EvidenceFormatException.class);
        assertThatThrownBy(() -> codec.fromJson(" ")).isInstanceOf(EvidenceFormatException.class);
    }
}
