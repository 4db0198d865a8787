package com.clinicflow.inventory;

import com.clinicflow.config.ClinicFlowProperties;
import com.clinicflow.entity.InventoryDrug;
import com.clinicflow.repository.InventoryDrugRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side of an owner's drug inventory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryService {

    private final InventoryDrugRepository inventoryDrugRepository;
    private final RelevanceSelector relevanceSelector;
    private final ClinicFlowProperties properties;

    /**
     * Active records of the owner, as immutable items. Out-of-stock records are included; selection and
     * reconciliation decide for themselves what to do with them.
     */
    @Transactional(readOnly = true)
    public List<InventoryItem> snapshot(String ownerId) {
        List<InventoryItem> items = inventoryDrugRepository.findByOwnerIdAndActiveTrueOrderByDrugNameAsc(ownerId)
                .stream()
                .map(InventoryItem::from)
                .toList();
        log.debug("Loaded {} inventory records for owner {}.", items.size(), ownerId);
        return items;
    }

    @Transactional(readOnly = true)
    public List<RelevanceSelector.ScoredDrug> relevant(String ownerId, String complaint) {
        List<RelevanceSelector.ScoredDrug> ranked = relevanceSelector.rank(snapshot(ownerId), complaint);
        int max = Math.max(0, properties.getRelevance().getMaxItems());
        return ranked.size() <= max ? ranked : ranked.subList(0, max);
    }

    @Transactional(readOnly = true)
    public List<InventoryDrug> lowStock(String ownerId) {
        return inventoryDrugRepository.findByOwnerIdAndActiveTrueAndStockQuantityLessThanEqualOrderByStockQuantityAsc(
                ownerId, properties.getInventory().getLowStockThreshold());
    }
}
