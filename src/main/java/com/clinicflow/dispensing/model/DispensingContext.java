package com.clinicflow.dispensing.model;

import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * Who and what a dispensing batch is for. {@code diagnosisId} is null for manual dispensing.
 */
public record DispensingContext(
        String ownerId,
        @Nullable UUID diagnosisId,
        @Nullable String complaint,
        @Nullable String patientId,
        @Nullable String patientName,
        @Nullable String primaryDiagnosis
) {
}
