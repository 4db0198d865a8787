package com.clinicflow.api;

import com.clinicflow.dispensing.model.DispensingContext;
import com.clinicflow.ingestion.model.PrescribedDrug;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Drugs handed out by a clinician without a stored diagnosis.
 */
public record ManualDispensingRequest(
        @NotBlank String ownerId,
        String patientId,
        String patientName,
        String complaint,
        @NotEmpty List<PrescribedDrug> drugs,
        String idempotencyKey
) {

    public DispensingContext context() {
        return new DispensingContext(ownerId, null, complaint, patientId, patientName, null);
    }
}
