package com.clinicflow.dispensing;

import com.clinicflow.dispensing.model.MatchResult;
import com.clinicflow.dispensing.model.MatchTier;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.inventory.DrugNameNormalizer;
import com.clinicflow.inventory.InventoryItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DrugReconcilerTest {

    private final DrugReconciler reconciler = new DrugReconciler(new DrugNameNormalizer());

    @Test
    void testExactNameIgnoresCaseAndSpacing() {
        InventoryItem item = item("a", "Paracetamol 500mg");
        MatchResult result = reconciler.match(0, PrescribedDrug.named("paracetamol   500MG", null, null), List.of(item));
        assertEquals(MatchTier.EXACT_NAME, result.tier());
        assertSame(item, result.inventoryItem());
    }

    @Test
    void testNormalizedNameMatch() {
        InventoryItem item = item("a", "Ibuprofen 400mg N20 tabletes");
        MatchResult result = reconciler.match(0, PrescribedDrug.named("Ibuprofen 400mg", "1 tablet", null), List.of(item));
        assertEquals(MatchTier.NORMALIZED_NAME, result.tier());
        assertSame(item, result.inventoryItem());
    }

    @Test
    void testHigherTierWinsOverEarlierRecord() {
        InventoryItem packaged = item("a", "Ibuprofen 400mg N20 tabletes");
        InventoryItem plain = item("b", "Ibuprofen 400mg");
        MatchResult result = reconciler.match(0, PrescribedDrug.named("Ibuprofen 400mg", null, null), List.of(packaged, plain));
        assertEquals(MatchTier.EXACT_NAME, result.tier());
        assertSame(plain, result.inventoryItem());
    }

    @Test
    void testFirstRecordWinsWithinTier() {
        InventoryItem first = item("a", "Amoxicillin 500mg N14");
        InventoryItem second = item("b", "Amoxicillin 500 mg tabletes");
        MatchResult result = reconciler.match(0, PrescribedDrug.named("Amoxicillin 500mg", null, null), List.of(first, second));
        assertEquals(MatchTier.NORMALIZED_NAME, result.tier());
        assertSame(first, result.inventoryItem());
    }

    @Test
    void testContainmentNeedsMoreThanFiveCharacters() {
        InventoryItem item = item("a", "Amoxicillin 500mg");
        assertEquals(MatchTier.CONTAINMENT,
                reconciler.match(0, PrescribedDrug.named("Amoxicillin", null, null), List.of(item)).tier());

        InventoryItem folic = item("f", "Folic Acid");
        MatchResult acid = reconciler.match(0, PrescribedDrug.named("Acid", null, null), List.of(folic));
        assertEquals(MatchTier.NONE, acid.tier());
        assertFalse(acid.matched());
    }

    @Test
    void testIdentifierMatch() {
        InventoryItem folic = item("f-1", "Folic Acid");
        PrescribedDrug byDrugId = new PrescribedDrug("Acid", null, null, null, "inventory", null, null, "f-1", null);
        PrescribedDrug byId = new PrescribedDrug("Something else", null, null, null, null, null, "f-1", null, null);

        assertEquals(MatchTier.IDENTIFIER, reconciler.match(0, byDrugId, List.of(folic)).tier());
        assertEquals(MatchTier.IDENTIFIER, reconciler.match(0, byId, List.of(folic)).tier());
    }

    @Test
    void testReconcileKeepsPositionsAndUnmatchedEntries() {
        List<InventoryItem> inventory = List.of(item("a", "Paracetamol 500mg"), item("b", "Ibuprofen 400mg"));
        List<MatchResult> results = reconciler.reconcile(List.of(
                PrescribedDrug.named("Paracetamol 500mg", null, null),
                PrescribedDrug.named("Oseltamivir 75mg", null, null),
                PrescribedDrug.named("Ibuprofen 400 mg", null, null)), inventory);

        assertEquals(3, results.size());
        assertEquals(List.of(0, 1, 2), results.stream().map(MatchResult::position).toList());
        assertEquals(List.of(MatchTier.EXACT_NAME, MatchTier.NONE, MatchTier.NORMALIZED_NAME),
                results.stream().map(MatchResult::tier).toList());
    }

    private static InventoryItem item(String id, String name) {
        return new InventoryItem(id, name, null, null, "tablet", null, null, null, 10);
    }
}
