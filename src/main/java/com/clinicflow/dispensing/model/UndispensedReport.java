package com.clinicflow.dispensing.model;

import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Diagnoses of one owner whose recommended inventory drugs have not all been dispensed.
 */
public record UndispensedReport(List<Entry> diagnoses, int totalDiagnoses, int totalDrugs) {

    public record Entry(
            UUID diagnosisId,
            @Nullable String patientId,
            @Nullable String patientName,
            String complaint,
            String primaryDiagnosis,
            @Nullable OffsetDateTime diagnosedAt,
            List<Drug> drugs
    ) {
    }

    public record Drug(int drugIndex, String drugName, @Nullable String dosage, int quantity) {
    }
}
