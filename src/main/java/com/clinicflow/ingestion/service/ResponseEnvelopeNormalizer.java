package com.clinicflow.ingestion.service;

import com.clinicflow.ingestion.exception.TransportFormatException;
import com.clinicflow.ingestion.model.ProviderEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Unwraps the transport shape the provider answered with:
 * <ul>
 *   <li>{@code {"text": "...```json {...}```..."}}</li>
 *   <li>{@code [{"text": "..."}, ...]} or {@code [{"primary_diagnosis": "...", ...}, ...]}</li>
 *   <li>{@code {"primary_diagnosis": "...", ...}}</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResponseEnvelopeNormalizer {

    static final String TEXT_FIELD = "text";
    static final String PRIMARY_DIAGNOSIS_FIELD = "primary_diagnosis";

    private final ObjectMapper objectMapper;

    public ProviderEnvelope normalize(@Nullable String body) {
        if (!StringUtils.hasText(body)) {
            throw new TransportFormatException("Provider returned an empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new TransportFormatException("Provider response body is not JSON", ex);
        }
        return normalize(root);
    }

    public ProviderEnvelope normalize(@Nullable JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new TransportFormatException("Provider returned an empty response");
        }
        if (root.isObject()) {
            ProviderEnvelope envelope = fromObject((ObjectNode) root);
            if (envelope != null) {
                return envelope;
            }
            throw new TransportFormatException("Unrecognized provider response object with fields " + fieldNames(root));
        }
        if (root.isArray()) {
            if (root.isEmpty()) {
                throw new TransportFormatException("Provider returned an empty array");
            }
            JsonNode first = root.get(0);
            if (first != null && first.isObject()) {
                ProviderEnvelope envelope = fromObject((ObjectNode) first);
                if (envelope != null) {
                    log.debug("Unwrapped {} envelope from array of {} items.", envelope.shape(), root.size());
                    return envelope;
                }
                throw new TransportFormatException("Unrecognized provider response array item with fields " + fieldNames(first));
            }
            throw new TransportFormatException("Unrecognized provider response array item of type " + first.getNodeType());
        }
        throw new TransportFormatException("Unrecognized provider response of type " + root.getNodeType());
    }

    private @Nullable ProviderEnvelope fromObject(ObjectNode node) {
        JsonNode text = node.get(TEXT_FIELD);
        if (text != null && text.isTextual() && StringUtils.hasText(text.asText())) {
            return ProviderEnvelope.embeddedText(text.asText());
        }
        if (node.hasNonNull(PRIMARY_DIAGNOSIS_FIELD)) {
            return ProviderEnvelope.diagnosisObject(node);
        }
        return null;
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
