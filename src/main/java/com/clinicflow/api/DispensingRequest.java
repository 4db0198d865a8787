package com.clinicflow.api;

/**
 * Optional body of a diagnosis dispensing call.
 */
public record DispensingRequest(String idempotencyKey) {
}
