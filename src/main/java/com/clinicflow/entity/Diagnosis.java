package com.clinicflow.entity;

import com.clinicflow.entity.converter.ClinicalAssessmentConverter;
import com.clinicflow.entity.converter.MonitoringPlanConverter;
import com.clinicflow.entity.converter.PrescribedDrugListConverter;
import com.clinicflow.entity.converter.StringListConverter;
import com.clinicflow.ingestion.model.ClinicalAssessment;
import com.clinicflow.ingestion.model.MonitoringPlan;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.ingestion.model.SeverityLevel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "diagnosis", indexes = @Index(name = "idx_diagnosis_owner", columnList = "owner_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Diagnosis {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", length = 100, nullable = false)
    private String ownerId;

    @Column(name = "patient_id", length = 100)
    private String patientId;

    @Column(name = "patient_name")
    private String patientName;

    @Column(name = "patient_age")
    private Integer patientAge;

    @Column(name = "patient_gender", length = 20)
    private String patientGender;

    @Column(name = "complaint", nullable = false, columnDefinition = "TEXT")
    private String complaint;

    @Column(name = "symptoms", columnDefinition = "TEXT")
    private String symptoms;

    @Column(name = "primary_diagnosis", nullable = false, columnDefinition = "TEXT")
    private String primaryDiagnosis;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "differential_diagnoses", columnDefinition = "TEXT")
    private List<String> differentialDiagnoses = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "recommended_actions", columnDefinition = "TEXT")
    private List<String> recommendedActions = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(name = "treatment", columnDefinition = "TEXT")
    private List<String> treatment = new ArrayList<>();

    @Builder.Default
    @Convert(converter = PrescribedDrugListConverter.class)
    @Column(name = "drug_suggestions", columnDefinition = "TEXT")
    private List<PrescribedDrug> drugSuggestions = new ArrayList<>();

    @Builder.Default
    @Convert(converter = PrescribedDrugListConverter.class)
    @Column(name = "inventory_drugs", columnDefinition = "TEXT")
    private List<PrescribedDrug> inventoryDrugs = new ArrayList<>();

    @Builder.Default
    @Convert(converter = PrescribedDrugListConverter.class)
    @Column(name = "additional_therapy", columnDefinition = "TEXT")
    private List<PrescribedDrug> additionalTherapy = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "severity_level", length = 20, nullable = false)
    private SeverityLevel severityLevel;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @Column(name = "improved_patient_history", columnDefinition = "TEXT")
    private String improvedPatientHistory;

    @Convert(converter = ClinicalAssessmentConverter.class)
    @Column(name = "clinical_assessment", columnDefinition = "TEXT")
    private ClinicalAssessment clinicalAssessment;

    @Convert(converter = MonitoringPlanConverter.class)
    @Column(name = "monitoring_plan", columnDefinition = "TEXT")
    private MonitoringPlan monitoringPlan;

    @Column(name = "provider_response", columnDefinition = "TEXT")
    private String providerResponse;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
