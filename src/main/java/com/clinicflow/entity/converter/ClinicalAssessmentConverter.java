package com.clinicflow.entity.converter;

import com.clinicflow.ingestion.model.ClinicalAssessment;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ClinicalAssessmentConverter extends JsonAttributeConverter<ClinicalAssessment> {

    public ClinicalAssessmentConverter() {
        super(new TypeReference<>() {});
    }
}
