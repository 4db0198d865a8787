package com.clinicflow.ingestion.model;

import jakarta.validation.constraints.NotBlank;
import org.springframework.lang.Nullable;

/**
 * Clinician input for one diagnosis request. Only {@code ownerId} and {@code complaint} are required.
 */
public record DiagnosisRequest(
        @NotBlank String ownerId,
        @NotBlank String complaint,
        @Nullable Integer patientAge,
        @Nullable String patientGender,
        @Nullable String symptoms,
        @Nullable String patientName,
        @Nullable String patientSurname,
        @Nullable String patientId,
        @Nullable String dateOfBirth,
        @Nullable Vitals vitals,
        @Nullable History history,
        @Nullable String complaintDuration,
        @Nullable Integer painScale,
        @Nullable String symptomOnset,
        @Nullable String associatedSymptoms
) {

    public record Vitals(
            @Nullable Integer bloodPressureSystolic,
            @Nullable Integer bloodPressureDiastolic,
            @Nullable Integer heartRate,
            @Nullable Double temperature,
            @Nullable Integer respiratoryRate,
            @Nullable Integer oxygenSaturation,
            @Nullable Double weight,
            @Nullable Double height
    ) {
    }

    public record History(
            @Nullable String allergies,
            @Nullable String currentMedications,
            @Nullable String chronicConditions,
            @Nullable String previousSurgeries,
            @Nullable String previousInjuries
    ) {
    }

    public static DiagnosisRequest of(String ownerId, String complaint) {
        return new DiagnosisRequest(ownerId, complaint, null, null, null, null, null, null, null,
                null, null, null, null, null, null);
    }

    /**
     * Complaint and symptoms joined, as scanned for relevance and language.
     */
    public String searchText() {
        return symptoms == null ? complaint : complaint + " " + symptoms;
    }
}
