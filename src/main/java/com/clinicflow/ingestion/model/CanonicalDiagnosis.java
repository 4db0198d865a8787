package com.clinicflow.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Uniformly shaped diagnosis recovered from a provider response. Lists are never null.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CanonicalDiagnosis(
        String primaryDiagnosis,
        List<String> differentialDiagnoses,
        List<String> recommendedActions,
        List<String> treatment,
        List<PrescribedDrug> drugSuggestions,
        List<PrescribedDrug> inventoryDrugs,
        List<PrescribedDrug> additionalTherapy,
        SeverityLevel severityLevel,
        double confidenceScore,
        @Nullable String improvedPatientHistory,
        @Nullable ClinicalAssessment clinicalAssessment,
        @Nullable MonitoringPlan monitoringPlan
) {
    public CanonicalDiagnosis {
        Objects.requireNonNull(primaryDiagnosis, "primaryDiagnosis");
        Objects.requireNonNull(severityLevel, "severityLevel");
        differentialDiagnoses = copy(differentialDiagnoses);
        recommendedActions = copy(recommendedActions);
        treatment = copy(treatment);
        drugSuggestions = copy(drugSuggestions);
        inventoryDrugs = copy(inventoryDrugs);
        additionalTherapy = copy(additionalTherapy);
    }

    private static <T> List<T> copy(@Nullable List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
