package com.pricelens.backend.service.evidence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricelens.backend.exception.EvidenceFormatException;
import com.pricelens.backend.model.Evidence;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Evidence wire form. Absent fields read back as null so the validator can refuse them.
 */
@Component
@RequiredArgsConstructor
public class EvidenceJsonCodec {

    private final ObjectMapper objectMapper;

    public String toJson(Evidence evidence) {
        try {
            return objectMapper.writeValueAsString(evidence);
        } catch (JsonProcessingException e) {
            throw new EvidenceFormatException("Failed to serialize evidence " + evidence.eventId(), e);
        }
    }

    public Evidence fromJson(String json) {
        return fromTree(readTree(json));
    }

    /**
     * Reads a payload together with the top-level keys it actually carried, null-valued ones included.
     */
    public WireEvidence readWire(String json) {
        JsonNode tree = readTree(json);
        Set<String> keys = new HashSet<>();
        tree.fieldNames().forEachRemaining(keys::add);
        return new WireEvidence(fromTree(tree), Set.copyOf(keys));
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            throw new EvidenceFormatException("Empty evidence payload", null);
        }
        try {
            JsonNode tree = objectMapper.readTree(json);
            if (tree == null || !tree.isObject()) {
                throw new EvidenceFormatException("Evidence payload is not a JSON object", null);
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new EvidenceFormatException("Unreadable evidence payload: " + e.getOriginalMessage(), e);
        }
    }

    private Evidence fromTree(JsonNode tree) {
        try {
            return objectMapper.treeToValue(tree, Evidence.class);
        } catch (JsonProcessingException e) {
            throw new EvidenceFormatException("Unreadable evidence payload: " + e.getOriginalMessage(), e);
        }
    }

    public record WireEvidence(Evidence evidence, Set<String> presentFields) {
    }
}
