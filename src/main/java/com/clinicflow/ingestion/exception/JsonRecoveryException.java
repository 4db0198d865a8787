package com.clinicflow.ingestion.exception;

/**
 * No parseable JSON object could be extracted or repaired from the provider text.
 */
public class JsonRecoveryException extends DiagnosisIngestionException {

    private final String snippet;

    public JsonRecoveryException(String message, String snippet) {
        super(message);
        this.snippet = snippet;
    }

    public JsonRecoveryException(String message, String snippet, Throwable cause) {
        super(message, cause);
        this.snippet = snippet;
    }

    /**
     * Offending text, truncated for logging.
     */
    public String getSnippet() {
        return snippet;
    }
}
