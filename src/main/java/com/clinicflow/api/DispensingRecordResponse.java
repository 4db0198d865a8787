package com.clinicflow.api;

import com.clinicflow.entity.DispensingRecord;

import java.time.OffsetDateTime;
import java.util.UUID;

public record DispensingRecordResponse(
        UUID id,
        UUID inventoryDrugId,
        String drugName,
        int quantity,
        String note,
        Integer drugIndex,
        UUID batchId,
        String patientId,
        String patientName,
        OffsetDateTime dispensedAt
) {

    public static DispensingRecordResponse from(DispensingRecord record) {
        return new DispensingRecordResponse(record.getId(), record.getInventoryDrugId(), record.getDrugName(),
                record.getQuantity(), record.getNote(), record.getDrugIndex(), record.getBatchId(),
                record.getPatientId(), record.getPatientName(), record.getDispensedAt());
    }
}
