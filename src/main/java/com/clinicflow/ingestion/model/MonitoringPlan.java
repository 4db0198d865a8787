package com.clinicflow.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.lang.Nullable;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MonitoringPlan(
        @Nullable String summary,
        List<String> immediate,
        List<String> shortTerm,
        List<String> longTerm,
        List<String> successMetrics,
        List<String> warningSigns
) {
    public MonitoringPlan {
        immediate = immediate == null ? List.of() : List.copyOf(immediate);
        shortTerm = shortTerm == null ? List.of() : List.copyOf(shortTerm);
        longTerm = longTerm == null ? List.of() : List.copyOf(longTerm);
        successMetrics = successMetrics == null ? List.of() : List.copyOf(successMetrics);
        warningSigns = warningSigns == null ? List.of() : List.copyOf(warningSigns);
    }

    public static MonitoringPlan ofSummary(String summary) {
        return new MonitoringPlan(summary, List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
