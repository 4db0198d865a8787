package com.clinicflow.api;

import com.clinicflow.ingestion.exception.JsonRecoveryException;
import com.clinicflow.ingestion.exception.MissingRequiredFieldException;
import com.clinicflow.ingestion.exception.ProviderUnavailableException;
import com.clinicflow.ingestion.exception.TransportFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ingestion failures to problem responses. Nothing was stored when any of these is raised.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(TransportFormatException.class)
    public ProblemDetail handleTransportFormat(TransportFormatException ex) {
        log.warn("Rejected provider response: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Unrecognized provider response", ex.getMessage());
    }

    @ExceptionHandler(JsonRecoveryException.class)
    public ProblemDetail handleJsonRecovery(JsonRecoveryException ex) {
        log.warn("Could not recover provider JSON: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Unreadable provider JSON", ex.getMessage());
        problem.setProperty("snippet", ex.getSnippet());
        return problem;
    }

    @ExceptionHandler(MissingRequiredFieldException.class)
    public ProblemDetail handleMissingField(MissingRequiredFieldException ex) {
        log.warn(ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Incomplete provider response", ex.getMessage());
        problem.setProperty("field", ex.getField());
        return problem;
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ProblemDetail handleProviderUnavailable(ProviderUnavailableException ex) {
        log.warn("Provider unavailable: {}", ex.getMessage());
        return problem(HttpStatus.GATEWAY_TIMEOUT, "Diagnosis provider unavailable", ex.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
