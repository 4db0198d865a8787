package com.clinicflow.ingestion.exception;

/**
 * The provider response matched none of the accepted envelope shapes.
 */
public class TransportFormatException extends DiagnosisIngestionException {

    public TransportFormatException(String message) {
        super(message);
    }

    public TransportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
