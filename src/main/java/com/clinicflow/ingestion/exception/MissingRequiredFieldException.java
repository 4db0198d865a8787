package com.clinicflow.ingestion.exception;

public class MissingRequiredFieldException extends DiagnosisIngestionException {

    private final String field;

    public MissingRequiredFieldException(String field) {
        super("Provider response is missing required field '" + field + "'");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
