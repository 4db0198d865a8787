package com.clinicflow.repository;

import com.clinicflow.entity.DispensingRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link DispensingRecord} entities.
 */
public interface DispensingRecordRepository extends JpaRepository<DispensingRecord, UUID> {

    List<DispensingRecord> findByDiagnosisIdOrderByDispensedAtAsc(UUID diagnosisId);

    List<DispensingRecord> findByDiagnosisIdIn(Collection<UUID> diagnosisIds);

    List<DispensingRecord> findByBatchId(UUID batchId);
}
