package com.clinicflow.ingestion.service;

import com.clinicflow.ingestion.exception.MissingRequiredFieldException;
import com.clinicflow.ingestion.model.CanonicalDiagnosis;
import com.clinicflow.ingestion.model.ClinicalAssessment;
import com.clinicflow.ingestion.model.MonitoringPlan;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.ingestion.model.SeverityLevel;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps the loosely typed diagnosis object onto {@link CanonicalDiagnosis}. Providers disagree on
 * encodings (lists as arrays or delimited strings, confidences as fractions or percentages, drugs as
 * objects or bare names); all of them are accepted. The only fatal condition is a missing
 * {@code primary_diagnosis}.
 */
@Service
@Slf4j
public class DiagnosisFieldParser {

    static final double DEFAULT_CONFIDENCE = 0.85;

    private static final Pattern LIST_DELIMITER = Pattern.compile("[,\\n]");
    private static final Pattern CRITICAL_WORDS = Pattern.compile("\\b(critical|emergency|immediate)");
    private static final Pattern HIGH_WORDS = Pattern.compile("\\b(severe|urgent)");
    private static final Pattern LOW_WORDS = Pattern.compile("\\b(mild|minor)");

    public CanonicalDiagnosis parse(ObjectNode node) {
        String primaryDiagnosis = text(node.get("primary_diagnosis"));
        if (!StringUtils.hasText(primaryDiagnosis)) {
            throw new MissingRequiredFieldException("primary_diagnosis");
        }

        List<PrescribedDrug> suggestions = drugList(node.get("drug_suggestions"));
        List<PrescribedDrug> inventoryDrugs;
        List<PrescribedDrug> additionalTherapy;
        if (isAbsent(node.get("inventory_drugs")) && isAbsent(node.get("additional_therapy"))) {
            inventoryDrugs = suggestions.stream().filter(PrescribedDrug::fromInventory).toList();
            additionalTherapy = suggestions.stream().filter(d -> !d.fromInventory()).toList();
        } else {
            inventoryDrugs = drugList(node.get("inventory_drugs"));
            additionalTherapy = drugList(node.get("additional_therapy"));
        }

        CanonicalDiagnosis diagnosis = new CanonicalDiagnosis(
                primaryDiagnosis.trim(),
                stringList(node.get("differential_diagnoses")),
                stringList(node.get("recommended_actions")),
                stringList(node.get("treatment")),
                suggestions,
                inventoryDrugs,
                additionalTherapy,
                severity(node),
                confidence(node.get("confidence_score")),
                text(node.get("improved_patient_history")),
                clinicalAssessment(node.get("clinical_assessment")),
                monitoringPlan(node.get("monitoring_plan")));
        log.debug("Parsed diagnosis '{}' ({} inventory drugs, {} additional, severity {}).",
                diagnosis.primaryDiagnosis(), inventoryDrugs.size(), additionalTherapy.size(),
                diagnosis.severityLevel());
        return diagnosis;
    }

    /**
     * Arrays keep one entry per element; strings are split on commas and newlines. Blank entries are
     * dropped.
     */
    List<String> stringList(@Nullable JsonNode node) {
        List<String> values = new ArrayList<>();
        if (isAbsent(node)) {
            return values;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element == null || element.isNull()) {
                    continue;
                }
                String value = element.isValueNode() ? element.asText() : element.toString();
                if (StringUtils.hasText(value)) {
                    values.add(value.trim());
                }
            }
            return values;
        }
        String raw = node.isValueNode() ? node.asText() : node.toString();
        for (String part : LIST_DELIMITER.split(raw)) {
            if (StringUtils.hasText(part)) {
                values.add(part.trim());
            }
        }
        return values;
    }

    /**
     * Values above 1 are read as percentages. Missing, unreadable and zero values fall back to the
     * default.
     */
    double confidence(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return DEFAULT_CONFIDENCE;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            String raw = node.asText().replace("%", "").trim();
            try {
                value = Double.parseDouble(raw);
            } catch (NumberFormatException ex) {
                log.debug("Unreadable confidence score '{}', using default.", node.asText());
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value) || value == 0) {
            return DEFAULT_CONFIDENCE;
        }
        if (value > 1) {
            value = value / 100;
        }
        return Math.max(0, Math.min(1, value));
    }

    /**
     * Explicit level when it names one; otherwise inferred from the wording of the response values.
     */
    SeverityLevel severity(ObjectNode node) {
        JsonNode explicit = node.get("severity_level");
        if (explicit != null && explicit.isTextual()) {
            SeverityLevel level = SeverityLevel.fromValue(explicit.asText());
            if (level != null) {
                return level;
            }
        }
        StringBuilder words = new StringBuilder();
        collectText(node, words);
        String text = words.toString().toLowerCase(Locale.ROOT);
        if (CRITICAL_WORDS.matcher(text).find()) {
            return SeverityLevel.CRITICAL;
        }
        if (HIGH_WORDS.matcher(text).find()) {
            return SeverityLevel.HIGH;
        }
        if (LOW_WORDS.matcher(text).find()) {
            return SeverityLevel.LOW;
        }
        return SeverityLevel.MODERATE;
    }

    List<PrescribedDrug> drugList(@Nullable JsonNode node) {
        List<PrescribedDrug> drugs = new ArrayList<>();
        if (isAbsent(node)) {
            return drugs;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                PrescribedDrug drug = drug(element);
                if (drug != null) {
                    drugs.add(drug);
                }
            }
            return drugs;
        }
        if (node.isObject()) {
            PrescribedDrug drug = drug(node);
            if (drug != null) {
                drugs.add(drug);
            }
            return drugs;
        }
        for (String name : stringList(node)) {
            drugs.add(PrescribedDrug.named(name, null, null));
        }
        return drugs;
    }

    private @Nullable PrescribedDrug drug(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isObject()) {
            String name = node.asText();
            return StringUtils.hasText(name) ? PrescribedDrug.named(name.trim(), null, null) : null;
        }
        String name = firstText(node, "drug_name", "name", "drug");
        if (!StringUtils.hasText(name)) {
            return null;
        }
        return new PrescribedDrug(
                name.trim(),
                text(node.get("dosage")),
                text(node.get("duration")),
                text(node.get("instructions")),
                text(node.get("source")),
                bool(node.get("prescription_required")),
                text(node.get("id")),
                text(node.get("drug_id")),
                integer(node.get("dispense_quantity")));
    }

    private @Nullable ClinicalAssessment clinicalAssessment(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isObject()) {
            String summary = text(node);
            return StringUtils.hasText(summary) ? ClinicalAssessment.ofSummary(summary) : null;
        }
        return new ClinicalAssessment(
                text(node.get("summary")),
                text(node.get("vital_signs_interpretation")),
                text(node.get("severity_assessment")),
                text(node.get("risk_stratification")),
                stringList(node.get("red_flags")),
                stringList(node.get("clinical_pearls")));
    }

    private @Nullable MonitoringPlan monitoringPlan(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (!node.isObject()) {
            String summary = text(node);
            return StringUtils.hasText(summary) ? MonitoringPlan.ofSummary(summary) : null;
        }
        return new MonitoringPlan(
                text(node.get("summary")),
                stringList(node.get("immediate")),
                stringList(node.get("short_term")),
                stringList(node.get("long_term")),
                stringList(node.get("success_metrics")),
                stringList(node.get("warning_signs")));
    }

    private static void collectText(JsonNode node, StringBuilder out) {
        if (node.isTextual()) {
            out.append(node.asText()).append(' ');
        } else if (node.isContainerNode()) {
            for (JsonNode child : node) {
                collectText(child, out);
            }
        }
    }

    private static @Nullable String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node.get(field));
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private static @Nullable String text(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static @Nullable Boolean bool(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return Boolean.parseBoolean(node.asText().trim());
    }

    private static @Nullable Integer integer(@Nullable JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        try {
            return Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static boolean isAbsent(@Nullable JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
