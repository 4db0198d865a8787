package com.clinicflow.inventory;

import com.clinicflow.config.ClinicFlowProperties;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Condition-to-drug-class vocabulary used for relevance scoring. Pure data; the scoring engine knows
 * nothing about any particular language.
 */
public record RelevanceVocabulary(
        List<Rule> rules,
        List<String> commonDrugs,
        List<String> preferredDosageForms
) {

    public record Rule(String name, Pattern conditions, List<String> drugKeywords) {

        public Rule {
            drugKeywords = drugKeywords.stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        }

        public static Rule of(String name, String conditionRegex, List<String> drugKeywords) {
            return new Rule(name,
                    Pattern.compile(conditionRegex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    drugKeywords);
        }

        public boolean appliesTo(String searchText) {
            return conditions.matcher(searchText).find();
        }
    }

    public RelevanceVocabulary {
        rules = List.copyOf(rules);
        commonDrugs = commonDrugs.stream().map(c -> c.toLowerCase(Locale.ROOT)).toList();
        preferredDosageForms = preferredDosageForms.stream().map(f -> f.toLowerCase(Locale.ROOT)).toList();
    }

    public static RelevanceVocabulary from(ClinicFlowProperties.RelevanceConfig config) {
        List<Rule> rules = new ArrayList<>();
        for (ClinicFlowProperties.RelevanceRuleConfig rule : config.getRules()) {
            if (!StringUtils.hasText(rule.getConditions()) || rule.getDrugKeywords().isEmpty()) {
                continue;
            }
            String name = StringUtils.hasText(rule.getName()) ? rule.getName() : "rule-" + (rules.size() + 1);
            rules.add(Rule.of(name, rule.getConditions(), rule.getDrugKeywords()));
        }
        return new RelevanceVocabulary(rules, config.getCommonDrugs(), config.getPreferredDosageForms());
    }
}
