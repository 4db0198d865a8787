package com.clinicflow.dispensing;

import com.clinicflow.dispensing.model.UndispensedReport;
import com.clinicflow.entity.Diagnosis;
import com.clinicflow.entity.DispensingRecord;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.repository.DiagnosisRepository;
import com.clinicflow.repository.DispensingRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class UndispensedMedicationService {

    private final DiagnosisRepository diagnosisRepository;
    private final DispensingRecordRepository recordRepository;

    /**
     * A drug counts as dispensed once a record exists for the same diagnosis and list position.
     */
    @Transactional(readOnly = true)
    public UndispensedReport report(String ownerId) {
        List<Diagnosis> diagnoses = diagnosisRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .filter(d -> d.getInventoryDrugs() != null && !d.getInventoryDrugs().isEmpty())
                .toList();
        if (diagnoses.isEmpty()) {
            return new UndispensedReport(List.of(), 0, 0);
        }

        Map<UUID, Set<Integer>> dispensed = new HashMap<>();
        List<UUID> ids = diagnoses.stream().map(Diagnosis::getId).toList();
        for (DispensingRecord record : recordRepository.findByDiagnosisIdIn(ids)) {
            if (record.getDrugIndex() != null) {
                dispensed.computeIfAbsent(record.getDiagnosisId(), k -> new HashSet<>()).add(record.getDrugIndex());
            }
        }

        List<UndispensedReport.Entry> entries = new ArrayList<>();
        int totalDrugs = 0;
        for (Diagnosis diagnosis : diagnoses) {
            Set<Integer> done = dispensed.getOrDefault(diagnosis.getId(), Set.of());
            List<UndispensedReport.Drug> pending = new ArrayList<>();
            List<PrescribedDrug> drugs = diagnosis.getInventoryDrugs();
            for (int i = 0; i < drugs.size(); i++) {
                if (done.contains(i)) {
                    continue;
                }
                PrescribedDrug drug = drugs.get(i);
                int quantity = drug.dispenseQuantity() != null && drug.dispenseQuantity() > 0 ? drug.dispenseQuantity() : 1;
                pending.add(new UndispensedReport.Drug(i, drug.drugName(), drug.dosage(), quantity));
            }
            if (!pending.isEmpty()) {
                entries.add(new UndispensedReport.Entry(diagnosis.getId(), diagnosis.getPatientId(),
                        diagnosis.getPatientName(), diagnosis.getComplaint(), diagnosis.getPrimaryDiagnosis(),
                        diagnosis.getCreatedAt(), List.copyOf(pending)));
                totalDrugs += pending.size();
            }
        }
        log.debug("Owner {} has {} undispensed drugs across {} diagnoses.", ownerId, totalDrugs, entries.size());
        return new UndispensedReport(List.copyOf(entries), entries.size(), totalDrugs);
    }
}
