package com.clinicflow.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClinicalAssessment(
        @Nullable String summary,
        @Nullable String vitalSignsInterpretation,
        @Nullable String severityAssessment,
        @Nullable String riskStratification,
        List<String> redFlags,
        List<String> clinicalPearls
) {
    public ClinicalAssessment {
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
        clinicalPearls = clinicalPearls == null ? List.of() : List.copyOf(clinicalPearls);
    }

    public static ClinicalAssessment ofSummary(String summary) {
        return new ClinicalAssessment(summary, null, null, null, List.of(), List.of());
    }
}
