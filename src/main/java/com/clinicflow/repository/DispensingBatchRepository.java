package com.clinicflow.repository;

import com.clinicflow.entity.DispensingBatch;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link DispensingBatch} entities.
 */
public interface DispensingBatchRepository extends JpaRepository<DispensingBatch, UUID> {

    Optional<DispensingBatch> findByIdempotencyKey(String idempotencyKey);
}
