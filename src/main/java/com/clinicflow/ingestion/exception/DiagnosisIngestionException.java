package com.clinicflow.ingestion.exception;

/**
 * Base type for failures that abort a diagnosis ingestion. Nothing is persisted when one is thrown.
 */
public abstract class DiagnosisIngestionException extends RuntimeException {

    protected DiagnosisIngestionException(String message) {
        super(message);
    }

    protected DiagnosisIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
