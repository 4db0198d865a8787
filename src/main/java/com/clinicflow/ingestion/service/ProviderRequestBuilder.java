package com.clinicflow.ingestion.service;

import com.clinicflow.config.ClinicFlowProperties;
import com.clinicflow.ingestion.model.DiagnosisRequest;
import com.clinicflow.inventory.InventoryItem;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembles the JSON payload sent to the clinical-analysis provider. Optional patient fields are only
 * written when present, to keep the payload small.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderRequestBuilder {

    static final String INVENTORY_THERAPY_EXPLANATION = "IMPORTANT DUAL REQUIREMENT: 1) For 'inventory_drugs' "
            + "field: ONLY recommend drugs with exact names matching the user_drug_inventory list provided. Use "
            + "exact drug names from inventory. 2) For 'additional_therapy' field: Provide 5-8 comprehensive "
            + "external treatment options including both prescription and over-the-counter medications that would "
            + "be ideal for this condition, regardless of inventory availability.";
    static final String GENERAL_THERAPY_EXPLANATION = "Please provide comprehensive therapy recommendations in "
            + "the 'additional_therapy' field. Provide at least 5 diverse therapy options including both "
            + "prescription and over-the-counter medications that represent best medical practice for this "
            + "condition.";

    private final ObjectMapper objectMapper;
    private final LanguageDetector languageDetector;
    private final ClinicFlowProperties properties;

    public ObjectNode build(DiagnosisRequest request, List<InventoryItem> relevantInventory) {
        String inventorySummary = summarizeInventory(relevantInventory);
        boolean hasInventory = inventorySummary != null;

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("complaint", request.complaint());
        payload.put("age", request.patientAge());
        payload.put("gender", request.patientGender());
        if (StringUtils.hasText(request.symptoms())) {
            payload.putArray("symptoms").add(request.symptoms());
        } else {
            payload.putNull("symptoms");
        }
        payload.put("timestamp", Instant.now().toString());
        payload.put("detected_language", languageDetector.detect(request.searchText()).value());
        payload.put("user_drug_inventory", inventorySummary);
        payload.put("has_drug_inventory", hasInventory);
        payload.put("request_comprehensive_therapy", true);
        payload.put("minimum_additional_therapy_count", properties.getProvider().getMinimumAdditionalTherapyCount());
        payload.put("include_alternative_treatments", true);
        payload.put("include_otc_medications", true);
        payload.put("therapy_explanation", hasInventory ? INVENTORY_THERAPY_EXPLANATION : GENERAL_THERAPY_EXPLANATION);

        putIfPresent(payload, "patient_name", request.patientName());
        putIfPresent(payload, "patient_surname", request.patientSurname());
        putIfPresent(payload, "patient_id", request.patientId());
        putIfPresent(payload, "date_of_birth", request.dateOfBirth());

        DiagnosisRequest.History history = request.history();
        if (history != null) {
            putIfPresent(payload, "allergies", history.allergies());
            putIfPresent(payload, "current_medications", history.currentMedications());
            putIfPresent(payload, "chronic_conditions", history.chronicConditions());
            putIfPresent(payload, "previous_surgeries", history.previousSurgeries());
            putIfPresent(payload, "previous_injuries", history.previousInjuries());
        }

        DiagnosisRequest.Vitals vitals = request.vitals();
        if (vitals != null) {
            putIfPresent(payload, "blood_pressure_systolic", vitals.bloodPressureSystolic());
            putIfPresent(payload, "blood_pressure_diastolic", vitals.bloodPressureDiastolic());
            putIfPresent(payload, "heart_rate", vitals.heartRate());
            putIfPresent(payload, "temperature", vitals.temperature());
            putIfPresent(payload, "respiratory_rate", vitals.respiratoryRate());
            putIfPresent(payload, "oxygen_saturation", vitals.oxygenSaturation());
            putIfPresent(payload, "weight", vitals.weight());
            putIfPresent(payload, "height", vitals.height());
        }

        putIfPresent(payload, "complaint_duration", request.complaintDuration());
        putIfPresent(payload, "pain_scale", request.painScale());
        putIfPresent(payload, "symptom_onset", request.symptomOnset());
        putIfPresent(payload, "associated_symptoms", request.associatedSymptoms());

        log.debug("Built provider request: {} fields, {} inventory drugs, language {}.",
                payload.size(), relevantInventory.size(), payload.get("detected_language").asText());
        return payload;
    }

    /**
     * One line per drug, or {@code null} when there is nothing to offer.
     */
    @Nullable String summarizeInventory(List<InventoryItem> items) {
        if (items.isEmpty()) {
            return null;
        }
        return items.stream().map(ProviderRequestBuilder::summarize).collect(Collectors.joining("\n"));
    }

    static String summarize(InventoryItem item) {
        StringBuilder line = new StringBuilder("Drug: ").append(item.drugName());
        if (StringUtils.hasText(item.genericName())) {
            line.append(" (").append(item.genericName()).append(')');
        }
        line.append(", Form: ").append(orDefault(item.dosageForm(), "N/A"))
                .append(", Strength: ").append(orDefault(item.strength(), "N/A"))
                .append(", Stock: ").append(item.stockQuantity())
                .append(", Category: ").append(orDefault(item.category(), "Uncategorized"));
        if (StringUtils.hasText(item.dosageAdults())) {
            line.append(", Adult Dosage: ").append(item.dosageAdults());
        }
        return line.toString();
    }

    private static String orDefault(@Nullable String value, String fallback) {
        return StringUtils.hasText(value) ? value : fallback;
    }

    private static void putIfPresent(ObjectNode payload, String field, @Nullable String value) {
        if (StringUtils.hasText(value)) {
            payload.put(field, value);
        }
    }

    private static void putIfPresent(ObjectNode payload, String field, @Nullable Integer value) {
        if (value != null) {
            payload.put(field, value);
        }
    }

    private static void putIfPresent(ObjectNode payload, String field, @Nullable Double value) {
        if (value != null) {
            payload.put(field, value);
        }
    }
}
