package com.clinicflow.repository;

import com.clinicflow.entity.Diagnosis;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link Diagnosis} entities.
 */
public interface DiagnosisRepository extends JpaRepository<Diagnosis, UUID> {

    List<Diagnosis> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}
