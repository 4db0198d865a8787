package com.clinicflow.ingestion.service;

import com.clinicflow.entity.Diagnosis;
import com.clinicflow.ingestion.model.CanonicalDiagnosis;
import com.clinicflow.ingestion.model.DiagnosisRequest;
import com.clinicflow.repository.DiagnosisRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class DiagnosisPersistenceService {

    private final DiagnosisRepository diagnosisRepository;

    @Transactional
    public Diagnosis create(DiagnosisRequest request, CanonicalDiagnosis canonical, @Nullable String providerResponse) {
        Diagnosis diagnosis = Diagnosis.builder()
                .ownerId(request.ownerId())
                .patientId(request.patientId())
                .patientName(fullName(request.patientName(), request.patientSurname()))
                .patientAge(request.patientAge())
                .patientGender(request.patientGender())
                .complaint(request.complaint())
                .symptoms(request.symptoms())
                .primaryDiagnosis(canonical.primaryDiagnosis())
                .differentialDiagnoses(new ArrayList<>(canonical.differentialDiagnoses()))
                .recommendedActions(new ArrayList<>(canonical.recommendedActions()))
                .treatment(new ArrayList<>(canonical.treatment()))
                .drugSuggestions(new ArrayList<>(canonical.drugSuggestions()))
                .inventoryDrugs(new ArrayList<>(canonical.inventoryDrugs()))
                .additionalTherapy(new ArrayList<>(canonical.additionalTherapy()))
                .severityLevel(canonical.severityLevel())
                .confidenceScore(canonical.confidenceScore())
                .improvedPatientHistory(canonical.improvedPatientHistory())
                .clinicalAssessment(canonical.clinicalAssessment())
                .monitoringPlan(canonical.monitoringPlan())
                .providerResponse(providerResponse)
                .build();
        Diagnosis saved = diagnosisRepository.save(diagnosis);
        log.info("Stored diagnosis {} for owner {}.", saved.getId(), saved.getOwnerId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Diagnosis get(UUID id) {
        return diagnosisRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Diagnosis " + id + " not found"));
    }

    @Transactional(readOnly = true)
    public List<Diagnosis> findByOwner(String ownerId) {
        return diagnosisRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    /**
     * Removes the diagnosis only; dispensing records referencing it stay as the audit trail.
     */
    @Transactional
    public void delete(UUID id) {
        Diagnosis diagnosis = get(id);
        diagnosisRepository.delete(diagnosis);
        log.info("Deleted diagnosis {}.", id);
    }

    private static @Nullable String fullName(@Nullable String name, @Nullable String surname) {
        if (!StringUtils.hasText(name)) {
            return StringUtils.hasText(surname) ? surname.trim() : null;
        }
        return StringUtils.hasText(surname) ? name.trim() + " " + surname.trim() : name.trim();
    }
}
