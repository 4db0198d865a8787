package com.clinicflow.ingestion.exception;

/**
 * The provider could not be reached, failed, or did not answer within the configured timeout.
 */
public class ProviderUnavailableException extends DiagnosisIngestionException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
