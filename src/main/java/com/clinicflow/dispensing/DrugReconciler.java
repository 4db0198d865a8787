package com.clinicflow.dispensing;

import com.clinicflow.dispensing.model.MatchResult;
import com.clinicflow.dispensing.model.MatchTier;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.inventory.DrugNameNormalizer;
import com.clinicflow.inventory.InventoryItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Ties prescribed entries to inventory records. Tiers are tried strictly in order; within a tier the
 * first inventory record wins. An entry matching nothing is reported, never rejected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrugReconciler {

    static final int MIN_CONTAINED_LENGTH = 6;

    private final DrugNameNormalizer normalizer;

    public List<MatchResult> reconcile(List<PrescribedDrug> prescribed, List<InventoryItem> inventory) {
        List<MatchResult> results = new ArrayList<>(prescribed.size());
        for (int i = 0; i < prescribed.size(); i++) {
            results.add(match(i, prescribed.get(i), inventory));
        }
        long matched = results.stream().filter(MatchResult::matched).count();
        log.info("Reconciled {} prescribed drugs against {} inventory records: {} matched.",
                prescribed.size(), inventory.size(), matched);
        return results;
    }

    public MatchResult match(int position, PrescribedDrug drug, List<InventoryItem> inventory) {
        String exact = normalizer.collapse(drug.drugName());
        String normalized = normalizer.normalize(drug.drugName());

        List<Tier> tiers = List.of(
                new Tier(MatchTier.EXACT_NAME, (d, item) ->
                        !exact.isEmpty() && exact.equals(normalizer.collapse(item.drugName()))),
                new Tier(MatchTier.NORMALIZED_NAME, (d, item) ->
                        !normalized.isEmpty() && normalized.equals(normalizer.normalize(item.drugName()))),
                new Tier(MatchTier.CONTAINMENT, (d, item) ->
                        contains(normalizer.normalize(item.drugName()), normalized)),
                new Tier(MatchTier.IDENTIFIER, (d, item) -> item.id() != null
                        && (Objects.equals(item.id(), d.id()) || Objects.equals(item.id(), d.drugId()))));

        for (Tier tier : tiers) {
            for (InventoryItem item : inventory) {
                if (tier.test().test(drug, item)) {
                    log.debug("'{}' matched '{}' by {}.", drug.drugName(), item.drugName(), tier.tier());
                    return new MatchResult(position, drug, item, tier.tier());
                }
            }
        }
        log.debug("'{}' has no inventory match.", drug.drugName());
        return MatchResult.unmatched(position, drug);
    }

    private static boolean contains(String inventoryName, String prescribedName) {
        if (inventoryName.isEmpty() || prescribedName.isEmpty()) {
            return false;
        }
        return (prescribedName.length() >= MIN_CONTAINED_LENGTH && inventoryName.contains(prescribedName))
                || (inventoryName.length() >= MIN_CONTAINED_LENGTH && prescribedName.contains(inventoryName));
    }

    private record Tier(MatchTier tier, BiPredicate<PrescribedDrug, InventoryItem> test) {
    }
}
