package com.clinicflow.ingestion.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.util.Locale;

public enum SeverityLevel {
    CRITICAL, HIGH, MODERATE, LOW;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a provider-supplied level, or {@code null} when the value names no known level.
     */
    @JsonCreator
    public static @Nullable SeverityLevel fromValue(@Nullable String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (SeverityLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return null;
    }
}
