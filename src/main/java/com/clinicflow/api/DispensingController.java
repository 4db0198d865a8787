package com.clinicflow.api;

import com.clinicflow.dispensing.DispensingPersistenceService;
import com.clinicflow.dispensing.DispensingService;
import com.clinicflow.dispensing.UndispensedMedicationService;
import com.clinicflow.dispensing.model.DispensingBatchResult;
import com.clinicflow.dispensing.model.UndispensedReport;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/dispensing")
public class DispensingController {

    private final DispensingService dispensingService;
    private final DispensingPersistenceService persistenceService;
    private final UndispensedMedicationService undispensedService;

    public DispensingController(DispensingService dispensingService,
                                DispensingPersistenceService persistenceService,
                                UndispensedMedicationService undispensedService) {
        this.dispensingService = dispensingService;
        this.persistenceService = persistenceService;
        this.undispensedService = undispensedService;
    }

    @PostMapping("/manual")
    public DispensingBatchResult dispenseManual(@Valid @RequestBody ManualDispensingRequest request) {
        return dispensingService.dispense(request.context(), request.drugs(), request.idempotencyKey());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        persistenceService.delete(id);
    }

    @GetMapping("/undispensed")
    public UndispensedReport undispensed(@RequestParam String ownerId) {
        return undispensedService.report(ownerId);
    }
}
