package com.clinicflow.ingestion.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.lang.Nullable;

/**
 * Provider response after transport unwrapping. Exactly one of {@code text} and {@code diagnosis}
 * is set, as indicated by {@link Shape}.
 */
public record ProviderEnvelope(Shape shape, @Nullable String text, @Nullable ObjectNode diagnosis) {

    public enum Shape {
        /** Free text (usually markdown) with an embedded JSON document. */
        EMBEDDED_TEXT,
        /** The diagnosis object itself. */
        DIAGNOSIS_OBJECT
    }

    public static ProviderEnvelope embeddedText(String text) {
        return new ProviderEnvelope(Shape.EMBEDDED_TEXT, text, null);
    }

    public static ProviderEnvelope diagnosisObject(ObjectNode diagnosis) {
        return new ProviderEnvelope(Shape.DIAGNOSIS_OBJECT, null, diagnosis);
    }
}
