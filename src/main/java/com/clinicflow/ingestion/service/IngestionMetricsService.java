package com.clinicflow.ingestion.service;

import com.clinicflow.ingestion.model.ProviderEnvelope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class IngestionMetricsService {

    private final AtomicLong providerRequestCount = new AtomicLong();
    private final AtomicLong embeddedTextCount = new AtomicLong();
    private final AtomicLong diagnosisObjectCount = new AtomicLong();
    private final AtomicLong parsedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public void recordProviderRequest(String mode, int inventoryDrugs) {
        long count = providerRequestCount.incrementAndGet();
        log.info("Provider request #{} sent (mode={}, inventoryDrugs={}).", count, mode, inventoryDrugs);
    }

    public void recordEnvelope(ProviderEnvelope.Shape shape) {
        long count = switch (shape) {
            case EMBEDDED_TEXT -> embeddedTextCount.incrementAndGet();
            case DIAGNOSIS_OBJECT -> diagnosisObjectCount.incrementAndGet();
        };
        log.debug("Envelope {} received. Total of this shape={}.", shape, count);
    }

    public void recordParsed(String primaryDiagnosis) {
        long count = parsedCount.incrementAndGet();
        log.info("Diagnosis #{} parsed: '{}'. Total parsed={}, total failed={}.",
                count, primaryDiagnosis, count, failedCount.get());
    }

    public void recordFailure(RuntimeException failure) {
        long count = failedCount.incrementAndGet();
        log.warn("Ingestion failed ({}): {}. Total failed={}.", failure.getClass().getSimpleName(),
                failure.getMessage(), count);
    }

    public void logSummary() {
        log.info("Ingestion stats: providerRequests={}, embeddedText={}, diagnosisObject={}, parsed={}, failed={}.",
                providerRequestCount.get(), embeddedTextCount.get(), diagnosisObjectCount.get(),
                parsedCount.get(), failedCount.get());
    }
}
