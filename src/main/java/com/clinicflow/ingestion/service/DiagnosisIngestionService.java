package com.clinicflow.ingestion.service;

import com.clinicflow.config.ClinicFlowProperties;
import com.clinicflow.entity.Diagnosis;
import com.clinicflow.ingestion.exception.DiagnosisIngestionException;
import com.clinicflow.ingestion.exception.ProviderUnavailableException;
import com.clinicflow.ingestion.model.CanonicalDiagnosis;
import com.clinicflow.ingestion.model.DiagnosisRequest;
import com.clinicflow.ingestion.model.ProviderEnvelope;
import com.clinicflow.ingestion.provider.DiagnosisProviderClient;
import com.clinicflow.inventory.InventoryItem;
import com.clinicflow.inventory.InventoryService;
import com.clinicflow.inventory.RelevanceSelector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one diagnosis end to end: inventory selection, provider call, response recovery, persistence.
 * Any {@link DiagnosisIngestionException} aborts the run before anything is stored.
 */
@Service
@Slf4j
public class DiagnosisIngestionService {

    private final InventoryService inventoryService;
    private final RelevanceSelector relevanceSelector;
    private final ProviderRequestBuilder requestBuilder;
    private final Map<ClinicFlowProperties.ProviderMode, DiagnosisProviderClient> providerClients;
    private final ResponseEnvelopeNormalizer envelopeNormalizer;
    private final JsonRecoveryService jsonRecoveryService;
    private final DiagnosisFieldParser fieldParser;
    private final DiagnosisPersistenceService persistenceService;
    private final IngestionMetricsService metricsService;
    private final ClinicFlowProperties properties;
    private final ExecutorService providerExecutor;

    public DiagnosisIngestionService(
            InventoryService inventoryService,
            RelevanceSelector relevanceSelector,
            ProviderRequestBuilder requestBuilder,
            List<DiagnosisProviderClient> providerClients,
            ResponseEnvelopeNormalizer envelopeNormalizer,
            JsonRecoveryService jsonRecoveryService,
            DiagnosisFieldParser fieldParser,
            DiagnosisPersistenceService persistenceService,
            IngestionMetricsService metricsService,
            ClinicFlowProperties properties,
            @Qualifier("providerExecutor") ExecutorService providerExecutor) {
        this.inventoryService = inventoryService;
        this.relevanceSelector = relevanceSelector;
        this.requestBuilder = requestBuilder;
        this.providerClients = new EnumMap<>(ClinicFlowProperties.ProviderMode.class);
        for (DiagnosisProviderClient client : providerClients) {
            this.providerClients.put(client.mode(), client);
        }
        this.envelopeNormalizer = envelopeNormalizer;
        this.jsonRecoveryService = jsonRecoveryService;
        this.fieldParser = fieldParser;
        this.persistenceService = persistenceService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.providerExecutor = providerExecutor;
    }

    public Diagnosis diagnose(DiagnosisRequest request) {
        List<InventoryItem> inventory = inventoryService.snapshot(request.ownerId());
        List<InventoryItem> relevant = relevanceSelector.select(inventory, request.searchText());
        ObjectNode payload = requestBuilder.build(request, relevant);

        try {
            JsonNode raw = callProvider(payload, relevant.size());
            CanonicalDiagnosis canonical = ingest(raw);
            Diagnosis saved = persistenceService.create(request, canonical, jsonRecoveryService.toJson(raw));
            metricsService.logSummary();
            return saved;
        } catch (DiagnosisIngestionException ex) {
            metricsService.recordFailure(ex);
            throw ex;
        }
    }

    /**
     * Inbound path for a response body as received, which may not even be JSON.
     */
    public CanonicalDiagnosis ingest(String rawBody) {
        return parseEnvelope(envelopeNormalizer.normalize(rawBody));
    }

    /**
     * Inbound path only: envelope, recovery and parsing. Nothing is stored.
     */
    public CanonicalDiagnosis ingest(JsonNode rawEnvelope) {
        return parseEnvelope(envelopeNormalizer.normalize(rawEnvelope));
    }

    private CanonicalDiagnosis parseEnvelope(ProviderEnvelope envelope) {
        metricsService.recordEnvelope(envelope.shape());
        ObjectNode diagnosisNode = jsonRecoveryService.resolve(envelope);
        CanonicalDiagnosis canonical = fieldParser.parse(diagnosisNode);
        metricsService.recordParsed(canonical.primaryDiagnosis());
        return canonical;
    }

    private JsonNode callProvider(ObjectNode payload, int inventoryDrugs) {
        ClinicFlowProperties.ProviderMode mode = properties.getProvider().getMode();
        DiagnosisProviderClient client = providerClients.get(mode);
        if (client == null) {
            throw new ProviderUnavailableException("No provider client registered for mode " + mode);
        }
        metricsService.recordProviderRequest(mode.name(), inventoryDrugs);
        Duration timeout = properties.getProvider().getTimeout();
        Future<JsonNode> future = providerExecutor.submit(() -> client.requestDiagnosis(payload));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new ProviderUnavailableException("Provider did not answer within " + timeout.toSeconds() + "s", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted while waiting for the provider", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof DiagnosisIngestionException ingestionException) {
                throw ingestionException;
            }
            throw new ProviderUnavailableException("Provider call failed: " + cause.getMessage(), cause);
        }
    }
}
