package com.clinicflow.dispensing;

import com.clinicflow.entity.DispensingRecord;
import com.clinicflow.entity.InventoryDrug;
import com.clinicflow.repository.DispensingRecordRepository;
import com.clinicflow.repository.InventoryDrugRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Stores dispensing records together with their stock effect.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispensingPersistenceService {

    private final DispensingRecordRepository recordRepository;
    private final InventoryDrugRepository inventoryDrugRepository;

    /**
     * Saves the record and, when it references an inventory record, takes its quantity out of stock
     * (never below zero) in the same transaction. The amount actually taken is kept on the record.
     */
    @Transactional
    public DispensingRecord create(DispensingRecord record) {
        record.setStockDeducted(0);
        if (record.getInventoryDrugId() != null) {
            Optional<InventoryDrug> drug = inventoryDrugRepository.findForUpdate(record.getInventoryDrugId());
            if (drug.isPresent()) {
                record.setStockDeducted(Math.min(Math.max(drug.get().getStockQuantity(), 0), record.getQuantity()));
            } else {
                log.warn("Inventory record {} vanished while dispensing '{}'.", record.getInventoryDrugId(), record.getDrugName());
            }
        }
        DispensingRecord saved = recordRepository.save(record);
        if (saved.getStockDeducted() > 0) {
            inventoryDrugRepository.decrementStock(saved.getInventoryDrugId(), saved.getStockDeducted());
        }
        return saved;
    }

    /**
     * Deletes the record and puts the stock it consumed back.
     */
    @Transactional
    public void delete(UUID recordId) {
        DispensingRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Dispensing record " + recordId + " not found"));
        if (record.getInventoryDrugId() != null && record.getStockDeducted() > 0) {
            inventoryDrugRepository.incrementStock(record.getInventoryDrugId(), record.getStockDeducted());
        }
        recordRepository.delete(record);
        log.info("Deleted dispensing record {} ({} x '{}', {} back in stock).", recordId, record.getQuantity(),
                record.getDrugName(), record.getStockDeducted());
    }

    @Transactional(readOnly = true)
    public List<DispensingRecord> history(UUID diagnosisId) {
        return recordRepository.findByDiagnosisIdOrderByDispensedAtAsc(diagnosisId);
    }

    @Transactional(readOnly = true)
    public List<DispensingRecord> byBatch(UUID batchId) {
        return recordRepository.findByBatchId(batchId);
    }
}
