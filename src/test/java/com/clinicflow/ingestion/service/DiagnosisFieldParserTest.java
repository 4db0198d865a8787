package com.clinicflow.ingestion.service;

import com.clinicflow.ingestion.exception.MissingRequiredFieldException;
import com.clinicflow.ingestion.model.CanonicalDiagnosis;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.ingestion.model.SeverityLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosisFieldParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DiagnosisFieldParser parser = new DiagnosisFieldParser();

    @Test
    void testConfidenceScoreEncodings() {
        assertEquals(0.87, parse("{\"primary_diagnosis\": \"Flu\", \"confidence_score\": 87}").confidenceScore(), 1e-9);
        assertEquals(0.62, parse("{\"primary_diagnosis\": \"Flu\", \"confidence_score\": 0.62}").confidenceScore(), 1e-9);
        assertEquals(0.75, parse("{\"primary_diagnosis\": \"Flu\", \"confidence_score\": \"75%\"}").confidenceScore(), 1e-9);
        assertEquals(0.85, parse("{\"primary_diagnosis\": \"Flu\"}").confidenceScore(), 1e-9);
        assertEquals(0.85, parse("{\"primary_diagnosis\": \"Flu\", \"confidence_score\": 0}").confidenceScore(), 1e-9);
        assertEquals(0.85, parse("{\"primary_diagnosis\": \"Flu\", \"confidence_score\": null}").confidenceScore(), 1e-9);
        assertEquals(1.0, parse("{\"primary_diagnosis\": \"Flu\", \"confidence_score\": 150}").confidenceScore(), 1e-9);
        assertEquals(0.0, parse("{\"primary_diagnosis\": \"Flu\", \"confidence_score\": -3}").confidenceScore(), 1e-9);
    }

    @Test
    void testExplicitSeverityWins() {
        CanonicalDiagnosis diagnosis = parse("{\"primary_diagnosis\": \"Mild rhinitis\", \"severity_level\": \"HIGH\"}");
        assertEquals(SeverityLevel.HIGH, diagnosis.severityLevel());
    }

    @Test
    void testSeverityIsInferredFromWording() {
        assertEquals(SeverityLevel.CRITICAL,
                parse("{\"primary_diagnosis\": \"Chest pain\", \"recommended_actions\": [\"Emergency referral\"]}").severityLevel());
        assertEquals(SeverityLevel.HIGH,
                parse("{\"primary_diagnosis\": \"Severe migraine\", \"severity_level\": \"unknown\"}").severityLevel());
        assertEquals(SeverityLevel.LOW,
                parse("{\"primary_diagnosis\": \"Mild sunburn\"}").severityLevel());
        assertEquals(SeverityLevel.MODERATE,
                parse("{\"primary_diagnosis\": \"Otitis media\"}").severityLevel());
    }

    @Test
    void testSeverityInferenceIgnoresFieldNames() {
        CanonicalDiagnosis diagnosis = parse("""
                {"primary_diagnosis": "Tension headache",
                 "monitoring_plan": {"immediate": ["rest"], "warning_signs": ["minor dizziness"]}}""");
        assertEquals(SeverityLevel.LOW, diagnosis.severityLevel());
        assertEquals(List.of("rest"), diagnosis.monitoringPlan().immediate());
    }

    @Test
    void testListFieldsAcceptArraysAndStrings() {
        CanonicalDiagnosis diagnosis = parse("""
                {"primary_diagnosis": "Flu",
                 "differential_diagnoses": "flu, cold, allergy",
                 "recommended_actions": ["Rest", " ", "Fluids"],
                 "treatment": "Rest\\nFluids,"}""");
        assertEquals(List.of("flu", "cold", "allergy"), diagnosis.differentialDiagnoses());
        assertEquals(List.of("Rest", "Fluids"), diagnosis.recommendedActions());
        assertEquals(List.of("Rest", "Fluids"), diagnosis.treatment());
    }

    @Test
    void testSplitDrugListsAreDerivedFromLegacySuggestions() {
        CanonicalDiagnosis diagnosis = parse("""
                {"primary_diagnosis": "Flu",
                 "drug_suggestions": [
                   {"drug_name": "Paracetamol 500mg", "source": "inventory", "dosage": "2 tablets", "drug_id": "abc"},
                   {"name": "Oseltamivir", "source": "external", "prescription_required": "true"},
                   "Vitamin C",
                   {"dosage": "no name"}
                 ]}""");
        assertEquals(3, diagnosis.drugSuggestions().size());
        assertEquals(1, diagnosis.inventoryDrugs().size());
        PrescribedDrug paracetamol = diagnosis.inventoryDrugs().get(0);
        assertEquals("Paracetamol 500mg", paracetamol.drugName());
        assertEquals("abc", paracetamol.drugId());
        assertEquals(List.of("Oseltamivir", "Vitamin C"),
                diagnosis.additionalTherapy().stream().map(PrescribedDrug::drugName).toList());
        assertEquals(Boolean.TRUE, diagnosis.additionalTherapy().get(0).prescriptionRequired());
    }

    @Test
    void testSplitDrugListsArePreservedWhenPresent() {
        CanonicalDiagnosis diagnosis = parse("""
                {"primary_diagnosis": "Flu",
                 "drug_suggestions": [{"drug_name": "Aspirin", "source": "inventory"}],
                 "inventory_drugs": "Paracetamol, Ibuprofen",
                 "additional_therapy": [{"drug_name": "Oseltamivir", "dispense_quantity": "2"}]}""");
        assertEquals(List.of("Paracetamol", "Ibuprofen"),
                diagnosis.inventoryDrugs().stream().map(PrescribedDrug::drugName).toList());
        assertEquals(2, diagnosis.additionalTherapy().get(0).dispenseQuantity());
        assertEquals("Aspirin", diagnosis.drugSuggestions().get(0).drugName());
    }

    @Test
    void testStructuredTextFields() {
        CanonicalDiagnosis diagnosis = parse("""
                {"primary_diagnosis": "Flu",
                 "clinical_assessment": "Stable patient",
                 "monitoring_plan": {"short_term": "Recheck in 3 days", "success_metrics": ["No fever"]},
                 "improved_patient_history": "Two days of fever."}""");
        assertEquals("Stable patient", diagnosis.clinicalAssessment().summary());
        assertEquals(List.of("Recheck in 3 days"), diagnosis.monitoringPlan().shortTerm());
        assertEquals(List.of("No fever"), diagnosis.monitoringPlan().successMetrics());
        assertEquals("Two days of fever.", diagnosis.improvedPatientHistory());
    }

    @Test
    void testMissingListsAreEmpty() {
        CanonicalDiagnosis diagnosis = parse("{\"primary_diagnosis\": \"Flu\"}");
        assertTrue(diagnosis.differentialDiagnoses().isEmpty());
        assertTrue(diagnosis.inventoryDrugs().isEmpty());
        assertTrue(diagnosis.additionalTherapy().isEmpty());
        assertNull(diagnosis.clinicalAssessment());
    }

    @Test
    void testMissingPrimaryDiagnosisIsFatal() {
        MissingRequiredFieldException ex = assertThrows(MissingRequiredFieldException.class,
                () -> parse("{\"differential_diagnoses\": [\"Flu\"]}"));
        assertEquals("primary_diagnosis", ex.getField());
        assertThrows(MissingRequiredFieldException.class, () -> parse("{\"primary_diagnosis\": \"  \"}"));
    }

    private CanonicalDiagnosis parse(String json) {
        try {
            return parser.parse((ObjectNode) objectMapper.readTree(json));
        } catch (com.fasterxml.jackson.core.JsonProcessingException ex) {
            throw new IllegalArgumentException(ex);
        }
    }
}
