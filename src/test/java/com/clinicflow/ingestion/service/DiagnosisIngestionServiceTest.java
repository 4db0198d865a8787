package com.clinicflow.ingestion.service;

import com.clinicflow.config.ClinicFlowProperties;
import com.clinicflow.entity.Diagnosis;
import com.clinicflow.ingestion.exception.MissingRequiredFieldException;
import com.clinicflow.ingestion.exception.ProviderUnavailableException;
import com.clinicflow.ingestion.exception.TransportFormatException;
import com.clinicflow.ingestion.model.CanonicalDiagnosis;
import com.clinicflow.ingestion.model.DiagnosisRequest;
import com.clinicflow.ingestion.model.SeverityLevel;
import com.clinicflow.ingestion.provider.DiagnosisProviderClient;
import com.clinicflow.inventory.InventoryItem;
import com.clinicflow.inventory.InventoryService;
import com.clinicflow.inventory.RelevanceSelector;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DiagnosisIngestionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService providerExecutor = Executors.newCachedThreadPool();

    private InventoryService inventoryService;
    private RelevanceSelector relevanceSelector;
    private ProviderRequestBuilder requestBuilder;
    private DiagnosisProviderClient providerClient;
    private DiagnosisPersistenceService persistenceService;
    private ClinicFlowProperties properties;
    private DiagnosisIngestionService service;

    @BeforeEach
    void setUp() {
        inventoryService = mock(InventoryService.class);
        relevanceSelector = mock(RelevanceSelector.class);
        requestBuilder = mock(ProviderRequestBuilder.class);
        providerClient = mock(DiagnosisProviderClient.class);
        persistenceService = mock(DiagnosisPersistenceService.class);
        properties = new ClinicFlowProperties();
        properties.getProvider().setTimeout(Duration.ofMillis(300));

        List<InventoryItem> inventory = List.of(
                new InventoryItem("1", "Paracetamol 500mg", null, null, "tablet", null, null, null, 4));
        when(inventoryService.snapshot("owner-1")).thenReturn(inventory);
        when(relevanceSelector.select(eq(inventory), anyString())).thenReturn(inventory);
        when(requestBuilder.build(any(), anyList())).thenReturn(objectMapper.createObjectNode().put("complaint", "cough"));
        when(providerClient.mode()).thenReturn(ClinicFlowProperties.ProviderMode.WEBHOOK);

        service = new DiagnosisIngestionService(
                inventoryService,
                relevanceSelector,
                requestBuilder,
                List.of(providerClient),
                new ResponseEnvelopeNormalizer(objectMapper),
                new JsonRecoveryService(objectMapper),
                new DiagnosisFieldParser(),
                persistenceService,
                new IngestionMetricsService(),
                properties,
                providerExecutor);
    }

    @AfterEach
    void tearDown() {
        providerExecutor.shutdownNow();
    }

    @Test
    void testDiagnosePersistsParsedResponse() {
        ObjectNode envelope = objectMapper.createObjectNode()
                .put("text", "```json\n{\"primary_diagnosis\": \"Acute bronchitis\", \"confidence_score\": 80}\n```");
        when(providerClient.requestDiagnosis(any())).thenReturn(envelope);
        Diagnosis stored = Diagnosis.builder().primaryDiagnosis("Acute bronchitis").build();
        when(persistenceService.create(any(), any(), anyString())).thenReturn(stored);

        Diagnosis result = service.diagnose(DiagnosisRequest.of("owner-1", "cough"));

        assertSame(stored, result);
        ArgumentCaptor<CanonicalDiagnosis> captor = ArgumentCaptor.forClass(CanonicalDiagnosis.class);
        verify(persistenceService).create(any(), captor.capture(), contains("Acute bronchitis"));
        assertEquals("Acute bronchitis", captor.getValue().primaryDiagnosis());
        assertEquals(0.8, captor.getValue().confidenceScore(), 1e-9);
        assertEquals(SeverityLevel.MODERATE, captor.getValue().severityLevel());
    }

    @Test
    void testProviderTimeoutAbortsWithoutPersisting() {
        when(providerClient.requestDiagnosis(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return objectMapper.createObjectNode().put("primary_diagnosis", "Too late");
        });

        assertThrows(ProviderUnavailableException.class,
                () -> service.diagnose(DiagnosisRequest.of("owner-1", "cough")));
        verifyNoInteractions(persistenceService);
    }

    @Test
    void testProviderFailureKeepsItsType() {
        when(providerClient.requestDiagnosis(any()))
                .thenThrow(new TransportFormatException("Provider webhook returned a body that is not JSON"));

        assertThrows(TransportFormatException.class,
                () -> service.diagnose(DiagnosisRequest.of("owner-1", "cough")));
        verifyNoInteractions(persistenceService);
    }

    @Test
    void testUnexpectedProviderErrorBecomesUnavailable() {
        when(providerClient.requestDiagnosis(any())).thenThrow(new IllegalStateException("boom"));

        assertThrows(ProviderUnavailableException.class,
                () -> service.diagnose(DiagnosisRequest.of("owner-1", "cough")));
    }

    @Test
    void testMissingClientForModeIsUnavailable() {
        properties.getProvider().setMode(ClinicFlowProperties.ProviderMode.CHAT_MODEL);

        assertThrows(ProviderUnavailableException.class,
                () -> service.diagnose(DiagnosisRequest.of("owner-1", "cough")));
        verify(providerClient, never()).requestDiagnosis(any());
    }

    @Test
    void testIncompleteResponseIsNotPersisted() {
        when(providerClient.requestDiagnosis(any()))
                .thenReturn(objectMapper.createObjectNode().put("text", "{\"differential_diagnoses\": [\"Flu\"]}"));

        assertThrows(MissingRequiredFieldException.class,
                () -> service.diagnose(DiagnosisRequest.of("owner-1", "cough")));
        verifyNoInteractions(persistenceService);
    }

    @Test
    void testIngestParsesWithoutCallingProvider() throws Exception {
        JsonNode raw = objectMapper.readTree("[{\"primary_diagnosis\": \"Migraine\", \"severity_level\": \"low\"}]");

        CanonicalDiagnosis diagnosis = service.ingest(raw);

        assertEquals("Migraine", diagnosis.primaryDiagnosis());
        assertEquals(SeverityLevel.LOW, diagnosis.severityLevel());
        verifyNoInteractions(providerClient, persistenceService);
    }

    @Test
    void testIngestRawBodyRejectsNonJson() {
        assertThrows(TransportFormatException.class, () -> service.ingest("Service temporarily unavailable"));

        CanonicalDiagnosis diagnosis = service.ingest("{\"text\": \"```json\\n{\\\"primary_diagnosis\\\": \\\"Otitis media\\\"}\\n```\"}");
        assertEquals("Otitis media", diagnosis.primaryDiagnosis());
    }
}
