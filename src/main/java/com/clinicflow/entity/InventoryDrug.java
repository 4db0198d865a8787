package com.clinicflow.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "inventory_drug", indexes = @Index(name = "idx_inventory_drug_owner", columnList = "owner_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryDrug {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", length = 100, nullable = false)
    private String ownerId;

    @Column(name = "drug_name", nullable = false)
    private String drugName;

    @Column(name = "generic_name")
    private String genericName;

    @Column(name = "active_ingredient")
    private String activeIngredient;

    @Column(name = "dosage_form", length = 50)
    private String dosageForm;

    @Column(name = "strength", length = 100)
    private String strength;

    @Column(name = "dosage_adults", columnDefinition = "TEXT")
    private String dosageAdults;

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "stock_quantity", nullable = false)
    private int stockQuantity;

    @Column(name = "prescription_only", nullable = false)
    private boolean prescriptionOnly;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
