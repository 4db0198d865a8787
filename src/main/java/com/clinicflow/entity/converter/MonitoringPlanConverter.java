package com.clinicflow.entity.converter;

import com.clinicflow.ingestion.model.MonitoringPlan;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class MonitoringPlanConverter extends JsonAttributeConverter<MonitoringPlan> {

    public MonitoringPlanConverter() {
        super(new TypeReference<>() {});
    }
}
