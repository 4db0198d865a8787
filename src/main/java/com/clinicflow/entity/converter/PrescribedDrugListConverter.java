package com.clinicflow.entity.converter;

import com.clinicflow.ingestion.model.PrescribedDrug;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class PrescribedDrugListConverter extends JsonAttributeConverter<List<PrescribedDrug>> {

    public PrescribedDrugListConverter() {
        super(new TypeReference<>() {});
    }

    @Override
    protected List<PrescribedDrug> emptyValue() {
        return new ArrayList<>();
    }
}
