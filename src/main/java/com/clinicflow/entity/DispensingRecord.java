package com.clinicflow.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One audited dispensing event. Never updated; deleting it restores the stock it actually consumed.
 */
@Entity
@Table(name = "dispensing_record", indexes = {
        @Index(name = "idx_dispensing_record_diagnosis", columnList = "diagnosis_id"),
        @Index(name = "idx_dispensing_record_owner", columnList = "owner_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DispensingRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", length = 100, nullable = false, updatable = false)
    private String ownerId;

    @Column(name = "inventory_drug_id", updatable = false)
    private UUID inventoryDrugId;

    @Column(name = "drug_name", nullable = false, updatable = false)
    private String drugName;

    @Column(name = "quantity", nullable = false, updatable = false)
    private int quantity;

    @Column(name = "stock_deducted", nullable = false, updatable = false)
    private int stockDeducted;

    @Column(name = "note", columnDefinition = "TEXT", updatable = false)
    private String note;

    @Column(name = "diagnosis_id", updatable = false)
    private UUID diagnosisId;

    @Column(name = "drug_index", updatable = false)
    private Integer drugIndex;

    @Column(name = "batch_id", updatable = false)
    private UUID batchId;

    @Column(name = "patient_id", length = 100, updatable = false)
    private String patientId;

    @Column(name = "patient_name", updatable = false)
    private String patientName;

    @Column(name = "primary_diagnosis", columnDefinition = "TEXT", updatable = false)
    private String primaryDiagnosis;

    @CreationTimestamp
    @Column(name = "dispensed_at", nullable = false, updatable = false)
    private OffsetDateTime dispensedAt;
}
