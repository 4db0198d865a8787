package com.clinicflow.dispensing;

import com.clinicflow.dispensing.model.DispensingBatchResult;
import com.clinicflow.dispensing.model.DispensingContext;
import com.clinicflow.dispensing.model.MatchResult;
import com.clinicflow.entity.Diagnosis;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.ingestion.service.DiagnosisPersistenceService;
import com.clinicflow.inventory.InventoryItem;
import com.clinicflow.inventory.InventoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Reconciles a drug list against the owner's inventory and records the result as one batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispensingService {

    private final DiagnosisPersistenceService diagnosisPersistenceService;
    private final InventoryService inventoryService;
    private final DrugReconciler reconciler;
    private final DispensingRecorder recorder;

    /**
     * Dispenses the inventory drugs a stored diagnosis recommended. Without an explicit key the
     * diagnosis id guards against recording the same diagnosis twice.
     */
    public DispensingBatchResult dispenseDiagnosis(UUID diagnosisId, @Nullable String idempotencyKey) {
        Diagnosis diagnosis = diagnosisPersistenceService.get(diagnosisId);
        DispensingContext context = new DispensingContext(diagnosis.getOwnerId(), diagnosis.getId(),
                diagnosis.getComplaint(), diagnosis.getPatientId(), diagnosis.getPatientName(),
                diagnosis.getPrimaryDiagnosis());
        return dispense(context, diagnosis.getInventoryDrugs(), idempotencyKey);
    }

    public DispensingBatchResult dispense(DispensingContext context, List<PrescribedDrug> drugs,
                                          @Nullable String idempotencyKey) {
        List<InventoryItem> inventory = inventoryService.snapshot(context.ownerId());
        List<MatchResult> matches = reconciler.reconcile(drugs, inventory);
        return recorder.record(context, matches, idempotencyKey);
    }
}
