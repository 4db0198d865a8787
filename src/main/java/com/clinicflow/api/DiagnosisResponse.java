package com.clinicflow.api;

import com.clinicflow.entity.Diagnosis;
import com.clinicflow.ingestion.model.CanonicalDiagnosis;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DiagnosisResponse(
        UUID id,
        String ownerId,
        String patientId,
        String patientName,
        Integer patientAge,
        String patientGender,
        String complaint,
        String symptoms,
        CanonicalDiagnosis diagnosis,
        OffsetDateTime createdAt
) {

    public static DiagnosisResponse from(Diagnosis entity) {
        CanonicalDiagnosis diagnosis = new CanonicalDiagnosis(
                entity.getPrimaryDiagnosis(),
                entity.getDifferentialDiagnoses(),
                entity.getRecommendedActions(),
                entity.getTreatment(),
                entity.getDrugSuggestions(),
                entity.getInventoryDrugs(),
                entity.getAdditionalTherapy(),
                entity.getSeverityLevel(),
                entity.getConfidenceScore(),
                entity.getImprovedPatientHistory(),
                entity.getClinicalAssessment(),
                entity.getMonitoringPlan());
        return new DiagnosisResponse(
                entity.getId(),
                entity.getOwnerId(),
                entity.getPatientId(),
                entity.getPatientName(),
                entity.getPatientAge(),
                entity.getPatientGender(),
                entity.getComplaint(),
                entity.getSymptoms(),
                diagnosis,
                entity.getCreatedAt());
    }
}
