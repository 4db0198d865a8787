package com.clinicflow.api;

import com.clinicflow.dispensing.DispensingPersistenceService;
import com.clinicflow.dispensing.DispensingService;
import com.clinicflow.dispensing.model.DispensingBatchResult;
import com.clinicflow.ingestion.model.CanonicalDiagnosis;
import com.clinicflow.ingestion.model.DiagnosisRequest;
import com.clinicflow.ingestion.service.DiagnosisIngestionService;
import com.clinicflow.ingestion.service.DiagnosisPersistenceService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/diagnoses")
public class DiagnosisController {

    private final DiagnosisIngestionService ingestionService;
    private final DiagnosisPersistenceService persistenceService;
    private final DispensingService dispensingService;
    private final DispensingPersistenceService dispensingPersistenceService;

    public DiagnosisController(DiagnosisIngestionService ingestionService,
                               DiagnosisPersistenceService persistenceService,
                               DispensingService dispensingService,
                               DispensingPersistenceService dispensingPersistenceService) {
        this.ingestionService = ingestionService;
        this.persistenceService = persistenceService;
        this.dispensingService = dispensingService;
        this.dispensingPersistenceService = dispensingPersistenceService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DiagnosisResponse diagnose(@Valid @RequestBody DiagnosisRequest request) {
        return DiagnosisResponse.from(ingestionService.diagnose(request));
    }

    @GetMapping
    public List<DiagnosisResponse> list(@RequestParam String ownerId) {
        return persistenceService.findByOwner(ownerId).stream()
                .map(DiagnosisResponse::from)
                .toList();
    }

    /**
     * Parses a raw provider response without calling the provider or storing anything.
     */
    @PostMapping("/ingest")
    public CanonicalDiagnosis ingest(@RequestBody String rawBody) {
        return ingestionService.ingest(rawBody);
    }

    @GetMapping("/{id}")
    public DiagnosisResponse get(@PathVariable UUID id) {
        return DiagnosisResponse.from(persistenceService.get(id));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        persistenceService.delete(id);
    }

    @GetMapping("/{id}/dispensing")
    public List<DispensingRecordResponse> dispensingHistory(@PathVariable UUID id) {
        return dispensingPersistenceService.history(id).stream()
                .map(DispensingRecordResponse::from)
                .toList();
    }

    @PostMapping("/{id}/dispensing")
    public DispensingBatchResult dispense(@PathVariable UUID id,
                                          @RequestBody(required = false) DispensingRequest request) {
        return dispensingService.dispenseDiagnosis(id, request == null ? null : request.idempotencyKey());
    }
}
