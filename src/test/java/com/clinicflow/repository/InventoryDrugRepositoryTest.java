package com.clinicflow.repository;

import com.clinicflow.entity.InventoryDrug;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InventoryDrugRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private InventoryDrugRepository inventoryDrugRepository;

    @Test
    void testDecrementStockNeverGoesBelowZero() {
        InventoryDrug drug = inventoryDrugRepository.save(drug("Paracetamol 500mg", 3, true));

        assertEquals(1, inventoryDrugRepository.decrementStock(drug.getId(), 2));
        assertEquals(1, inventoryDrugRepository.findById(drug.getId()).orElseThrow().getStockQuantity());

        assertEquals(1, inventoryDrugRepository.decrementStock(drug.getId(), 5));
        assertEquals(0, inventoryDrugRepository.findById(drug.getId()).orElseThrow().getStockQuantity());
    }

    @Test
    void testIncrementStock() {
        InventoryDrug drug = inventoryDrugRepository.save(drug("Ibuprofen 400mg", 0, true));

        inventoryDrugRepository.incrementStock(drug.getId(), 4);

        assertEquals(4, inventoryDrugRepository.findById(drug.getId()).orElseThrow().getStockQuantity());
    }

    @Test
    void testActiveAndLowStockFinders() {
        inventoryDrugRepository.save(drug("Loratadine 10mg", 2, true));
        inventoryDrugRepository.save(drug("Amoxicillin 500mg", 40, true));
        inventoryDrugRepository.save(drug("Aspirin 100mg", 1, false));

        List<InventoryDrug> active = inventoryDrugRepository.findByOwnerIdAndActiveTrueOrderByDrugNameAsc("owner-1");
        assertEquals(List.of("Amoxicillin 500mg", "Loratadine 10mg"),
                active.stream().map(InventoryDrug::getDrugName).toList());

        List<InventoryDrug> low = inventoryDrugRepository
                .findByOwnerIdAndActiveTrueAndStockQuantityLessThanEqualOrderByStockQuantityAsc("owner-1", 5);
        assertEquals(1, low.size());
        assertEquals("Loratadine 10mg", low.get(0).getDrugName());
    }

    private static InventoryDrug drug(String name, int stock, boolean active) {
        return InventoryDrug.builder()
                .ownerId("owner-1")
                .drugName(name)
                .stockQuantity(stock)
                .active(active)
                .build();
    }
}
