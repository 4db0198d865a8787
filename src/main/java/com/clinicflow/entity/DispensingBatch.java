package com.clinicflow.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Idempotency record for one dispensing batch, keyed by a caller-supplied or diagnosis-derived key.
 */
@Entity
@Table(name = "dispensing_batch",
        uniqueConstraints = @UniqueConstraint(name = "uk_dispensing_batch_key", columnNames = "idempotency_key"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DispensingBatch {

    public enum Status {
        IN_PROGRESS, COMPLETED, PARTIAL, FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "idempotency_key", nullable = false, length = 200)
    private String idempotencyKey;

    @Column(name = "owner_id", length = 100, nullable = false)
    private String ownerId;

    @Column(name = "diagnosis_id")
    private UUID diagnosisId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private Status status;

    @Column(name = "item_count", nullable = false)
    private int itemCount;

    @Column(name = "success_count", nullable = false)
    private int successCount;

    @Column(name = "failure_count", nullable = false)
    private int failureCount;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
