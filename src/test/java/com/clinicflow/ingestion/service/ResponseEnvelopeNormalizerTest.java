package com.clinicflow.ingestion.service;

import com.clinicflow.ingestion.exception.TransportFormatException;
import com.clinicflow.ingestion.model.ProviderEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseEnvelopeNormalizerTest {

    private final ResponseEnvelopeNormalizer normalizer = new ResponseEnvelopeNormalizer(new ObjectMapper());

    @Test
    void testTextObject() {
        ProviderEnvelope envelope = normalizer.normalize("{\"text\": \"Result: ```json {\\\"primary_diagnosis\\\": \\\"Flu\\\"} ```\"}");
        assertEquals(ProviderEnvelope.Shape.EMBEDDED_TEXT, envelope.shape());
        assertTrue(envelope.text().contains("primary_diagnosis"));
        assertNull(envelope.diagnosis());
    }

    @Test
    void testArrayOfTextObjects() {
        ProviderEnvelope envelope = normalizer.normalize("[{\"text\": \"first\"}, {\"text\": \"second\"}]");
        assertEquals(ProviderEnvelope.Shape.EMBEDDED_TEXT, envelope.shape());
        assertEquals("first", envelope.text());
    }

    @Test
    void testArrayOfDiagnosisObjects() {
        ProviderEnvelope envelope = normalizer.normalize("[{\"primary_diagnosis\": \"Migraine\", \"confidence_score\": 0.7}]");
        assertEquals(ProviderEnvelope.Shape.DIAGNOSIS_OBJECT, envelope.shape());
        assertEquals("Migraine", envelope.diagnosis().get("primary_diagnosis").asText());
    }

    @Test
    void testDiagnosisObject() {
        ProviderEnvelope envelope = normalizer.normalize("{\"primary_diagnosis\": \"Migraine\"}");
        assertEquals(ProviderEnvelope.Shape.DIAGNOSIS_OBJECT, envelope.shape());
        assertNull(envelope.text());
    }

    @Test
    void testUnrecognizedShapesAreRejected() {
        assertThrows(TransportFormatException.class, () -> normalizer.normalize("[]"));
        assertThrows(TransportFormatException.class, () -> normalizer.normalize("{\"answer\": \"Flu\"}"));
        assertThrows(TransportFormatException.class, () -> normalizer.normalize("[\"Flu\"]"));
        assertThrows(TransportFormatException.class, () -> normalizer.normalize("\"Flu\""));
        assertThrows(TransportFormatException.class, () -> normalizer.normalize("{\"text\": \"  \"}"));
        assertThrows(TransportFormatException.class, () -> normalizer.normalize("not json at all"));
        assertThrows(TransportFormatException.class, () -> normalizer.normalize(""));
    }
}
