package com.clinicflow.inventory;

import com.clinicflow.config.ClinicFlowProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks in-stock inventory against complaint/symptom text and bounds how much of it is sent to the
 * provider.
 */
@Service
@Slf4j
public class RelevanceSelector {

    static final double CONDITION_MATCH_SCORE = 10;
    static final double COMMON_DRUG_SCORE = 2;
    static final double PREFERRED_FORM_SCORE = 1;
    static final double FLOOR_SCORE = 1;
    static final double CATEGORY_BONUS = 0.5;
    static final double NEAR_TIE_WINDOW = 2;

    private final RelevanceVocabulary vocabulary;
    private final DrugNameNormalizer normalizer;
    private final int maxItems;

    @Autowired
    public RelevanceSelector(ClinicFlowProperties properties, DrugNameNormalizer normalizer) {
        this(RelevanceVocabulary.from(properties.getRelevance()), normalizer, properties.getRelevance().getMaxItems());
    }

    public RelevanceSelector(RelevanceVocabulary vocabulary, DrugNameNormalizer normalizer, int maxItems) {
        this.vocabulary = vocabulary;
        this.normalizer = normalizer;
        this.maxItems = maxItems;
    }

    public record ScoredDrug(InventoryItem item, double score) {
    }

    /**
     * In-stock items ranked by relevance and truncated to the configured cap.
     */
    public List<InventoryItem> select(List<InventoryItem> inventory, @Nullable String searchText) {
        List<ScoredDrug> ranked = rank(inventory, searchText);
        List<InventoryItem> selected = ranked.stream()
                .limit(Math.max(0, maxItems))
                .map(ScoredDrug::item)
                .toList();
        log.info("Selected {} of {} inventory drugs ({} in stock) for provider request.",
                selected.size(), inventory.size(), ranked.size());
        if (log.isDebugEnabled()) {
            ranked.stream().limit(10).forEach(d ->
                    log.debug("  {} -> {}", d.item().drugName(), d.score()));
        }
        return selected;
    }

    /**
     * Every in-stock item with its score, best first. Items whose scores lie within
     * {@link #NEAR_TIE_WINDOW} of a cluster's top score are ordered by category name instead.
     */
    public List<ScoredDrug> rank(List<InventoryItem> inventory, @Nullable String searchText) {
        String text = searchText == null ? "" : searchText.toLowerCase(Locale.ROOT);
        List<RelevanceVocabulary.Rule> activeRules = vocabulary.rules().stream()
                .filter(rule -> rule.appliesTo(text))
                .toList();

        List<ScoredDrug> scored = new ArrayList<>();
        for (InventoryItem item : inventory) {
            if (item == null || !item.inStock()) {
                continue;
            }
            scored.add(new ScoredDrug(item, score(item, activeRules)));
        }
        scored.sort(Comparator.comparingDouble(ScoredDrug::score).reversed());
        return diversify(scored);
    }

    double score(InventoryItem item, List<RelevanceVocabulary.Rule> activeRules) {
        String drugName = normalizer.normalize(item.drugName());
        String genericName = lower(item.genericName());
        String activeIngredient = lower(item.activeIngredient());

        double score = 0;
        for (RelevanceVocabulary.Rule rule : activeRules) {
            for (String keyword : rule.drugKeywords()) {
                if (drugName.contains(keyword) || genericName.contains(keyword) || activeIngredient.contains(keyword)) {
                    score += CONDITION_MATCH_SCORE;
                    break;
                }
            }
        }
        if (vocabulary.commonDrugs().stream().anyMatch(drugName::contains)) {
            score += COMMON_DRUG_SCORE;
        }
        String form = lower(item.dosageForm());
        if (vocabulary.preferredDosageForms().contains(form)) {
            score += PREFERRED_FORM_SCORE;
        }
        if (score == 0) {
            score = FLOOR_SCORE;
        }
        if (item.hasCategory()) {
            score += CATEGORY_BONUS;
        }
        return score;
    }

    private List<ScoredDrug> diversify(List<ScoredDrug> byScore) {
        List<ScoredDrug> result = new ArrayList<>(byScore.size());
        int start = 0;
        while (start < byScore.size()) {
            double top = byScore.get(start).score();
            int end = start;
            while (end < byScore.size() && top - byScore.get(end).score() < NEAR_TIE_WINDOW) {
                end++;
            }
            List<ScoredDrug> cluster = new ArrayList<>(byScore.subList(start, end));
            cluster.sort(Comparator.comparing(d -> categoryKey(d.item())));
            result.addAll(cluster);
            start = end;
        }
        return result;
    }

    private static String categoryKey(InventoryItem item) {
        return item.category() == null ? "" : item.category().toLowerCase(Locale.ROOT);
    }

    private static String lower(@Nullable String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
