package com.clinicflow.dispensing;

import com.clinicflow.dispensing.model.DispensingBatchResult;
import com.clinicflow.dispensing.model.DispensingContext;
import com.clinicflow.dispensing.model.DispensingItemOutcome;
import com.clinicflow.dispensing.model.MatchResult;
import com.clinicflow.dispensing.model.MatchTier;
import com.clinicflow.entity.DispensingBatch;
import com.clinicflow.entity.DispensingRecord;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.inventory.InventoryItem;
import com.clinicflow.repository.DispensingBatchRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DispensingRecorderTest {

    private final UUID diagnosisId = UUID.randomUUID();
    private final UUID paracetamolId = UUID.randomUUID();
    private final UUID ibuprofenId = UUID.randomUUID();
    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final DispensingContext context =
            new DispensingContext("owner-1", diagnosisId, "Fever and cough", "P-1", "Anna Berzina", "Influenza");

    private DispensingPersistenceService persistenceService;
    private DispensingBatchRepository batchRepository;
    private DispensingRecorder recorder;

    @BeforeEach
    void setUp() {
        persistenceService = mock(DispensingPersistenceService.class);
        batchRepository = mock(DispensingBatchRepository.class);
        when(batchRepository.findByIdempotencyKey(anyString())).thenReturn(Optional.empty());
        when(batchRepository.saveAndFlush(any(DispensingBatch.class))).thenAnswer(invocation -> {
            DispensingBatch batch = invocation.getArgument(0);
            if (batch.getId() == null) {
                batch.setId(UUID.randomUUID());
            }
            return batch;
        });
        when(batchRepository.save(any(DispensingBatch.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(persistenceService.create(any(DispensingRecord.class))).thenAnswer(invocation -> {
            DispensingRecord record = invocation.getArgument(0);
            if ("Broken".equals(record.getDrugName())) {
                throw new DataAccessResourceFailureException("connection lost");
            }
            record.setId(UUID.randomUUID());
            return record;
        });
        recorder = new DispensingRecorder(persistenceService, batchRepository, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testEveryMatchResultYieldsARecord() {
        List<MatchResult> matches = List.of(
                matched(0, PrescribedDrug.named("Paracetamol 500mg", "2 tablets every 6 hours", "5 days"), paracetamolId),
                MatchResult.unmatched(1, PrescribedDrug.named("Oseltamivir 75mg", "1 capsule twice daily", null)),
                matched(2, PrescribedDrug.named("Ibuprofen 400mg", null, "3 days"), ibuprofenId));

        DispensingBatchResult result = recorder.record(context, matches, null);

        assertEquals("diagnosis:" + diagnosisId, result.idempotencyKey());
        assertEquals(DispensingBatch.Status.COMPLETED, result.status());
        assertFalse(result.replay());
        assertEquals(3, result.successCount());

        ArgumentCaptor<DispensingRecord> captor = ArgumentCaptor.forClass(DispensingRecord.class);
        verify(persistenceService, times(3)).create(captor.capture());
        List<DispensingRecord> records = captor.getAllValues().stream()
                .sorted(Comparator.comparing(DispensingRecord::getDrugIndex))
                .toList();

        assertEquals(paracetamolId, records.get(0).getInventoryDrugId());
        assertEquals(2, records.get(0).getQuantity());
        assertEquals("Prescribed for: Fever and cough. Duration: 5 days", records.get(0).getNote());
        assertEquals("Influenza", records.get(0).getPrimaryDiagnosis());
        assertEquals(diagnosisId, records.get(0).getDiagnosisId());

        assertNull(records.get(1).getInventoryDrugId());
        assertEquals("Oseltamivir 75mg", records.get(1).getDrugName());
        assertEquals("Prescribed for: Fever and cough. Duration: Not specified. "
                + DispensingRecorder.NOT_IN_INVENTORY_NOTE, records.get(1).getNote());

        assertEquals(ibuprofenId, records.get(2).getInventoryDrugId());
        assertEquals(1, records.get(2).getQuantity());
        assertEquals(result.batchId(), records.get(2).getBatchId());
    }

    @Test
    void testFailedWriteIsReportedPerItem() {
        List<MatchResult> matches = List.of(
                matched(0, PrescribedDrug.named("Paracetamol 500mg", "1 tablet", null), paracetamolId),
                MatchResult.unmatched(1, PrescribedDrug.named("Broken", null, null)),
                matched(2, PrescribedDrug.named("Ibuprofen 400mg", "1 tablet", null), ibuprofenId));

        DispensingBatchResult result = recorder.record(context, matches, "visit-42");

        assertEquals(DispensingBatch.Status.PARTIAL, result.status());
        assertEquals(2, result.successCount());
        assertEquals(1, result.failureCount());
        DispensingItemOutcome broken = result.items().get(1);
        assertFalse(broken.succeeded());
        assertEquals("connection lost", broken.error());
        assertTrue(result.items().get(0).succeeded());
        assertTrue(result.items().get(2).succeeded());

        ArgumentCaptor<DispensingBatch> batch = ArgumentCaptor.forClass(DispensingBatch.class);
        verify(batchRepository).save(batch.capture());
        assertEquals("visit-42", batch.getValue().getIdempotencyKey());
        assertEquals(2, batch.getValue().getSuccessCount());
        assertEquals(1, batch.getValue().getFailureCount());
    }

    @Test
    void testAllWritesFailingMarksBatchFailed() {
        DispensingBatchResult result = recorder.record(context,
                List.of(MatchResult.unmatched(0, PrescribedDrug.named("Broken", null, null))), null);
        assertEquals(DispensingBatch.Status.FAILED, result.status());
    }

    @Test
    void testCompletedKeyIsReplayedWithoutWriting() {
        UUID batchId = UUID.randomUUID();
        DispensingBatch done = DispensingBatch.builder()
                .id(batchId)
                .idempotencyKey("diagnosis:" + diagnosisId)
                .ownerId("owner-1")
                .status(DispensingBatch.Status.COMPLETED)
                .build();
        when(batchRepository.findByIdempotencyKey("diagnosis:" + diagnosisId)).thenReturn(Optional.of(done));
        DispensingRecord previous = DispensingRecord.builder()
                .id(UUID.randomUUID())
                .drugName("Paracetamol 500mg")
                .inventoryDrugId(paracetamolId)
                .quantity(2)
                .drugIndex(0)
                .batchId(batchId)
                .build();
        when(persistenceService.byBatch(batchId)).thenReturn(List.of(previous));

        DispensingBatchResult result = recorder.record(context,
                List.of(matched(0, PrescribedDrug.named("Paracetamol 500mg", "2 tablets", null), paracetamolId)), null);

        assertTrue(result.replay());
        assertEquals(batchId, result.batchId());
        assertEquals(1, result.items().size());
        assertEquals(previous.getId(), result.items().get(0).recordId());
        verify(persistenceService, never()).create(any());
        verify(batchRepository, never()).saveAndFlush(any());
    }

    @Test
    void testFailedKeyIsRetried() {
        DispensingBatch failed = DispensingBatch.builder()
                .id(UUID.randomUUID())
                .idempotencyKey("visit-7")
                .ownerId("owner-1")
                .status(DispensingBatch.Status.FAILED)
                .failureCount(1)
                .build();
        when(batchRepository.findByIdempotencyKey("visit-7")).thenReturn(Optional.of(failed));

        DispensingBatchResult result = recorder.record(context,
                List.of(matched(0, PrescribedDrug.named("Paracetamol 500mg", null, null), paracetamolId)), "visit-7");

        assertFalse(result.replay());
        assertEquals(failed.getId(), result.batchId());
        assertEquals(DispensingBatch.Status.COMPLETED, result.status());
        verify(persistenceService).create(any());
    }

    @Test
    void testPartialBatchIsResumedForMissingPositionsOnly() {
        AtomicBoolean ibuprofenFails = new AtomicBoolean(true);
        List<DispensingRecord> stored = new CopyOnWriteArrayList<>();
        AtomicReference<DispensingBatch> savedBatch = new AtomicReference<>();
        doAnswer(invocation -> {
            DispensingRecord record = invocation.getArgument(0);
            if ("Ibuprofen 400mg".equals(record.getDrugName()) && ibuprofenFails.get()) {
                throw new DataAccessResourceFailureException("connection lost");
            }
            record.setId(UUID.randomUUID());
            stored.add(record);
            return record;
        }).when(persistenceService).create(any(DispensingRecord.class));
        doAnswer(invocation -> stored.stream()
                .filter(r -> invocation.getArgument(0).equals(r.getBatchId()))
                .toList()).when(persistenceService).byBatch(any());
        doAnswer(invocation -> {
            savedBatch.set(invocation.getArgument(0));
            return invocation.getArgument(0);
        }).when(batchRepository).save(any(DispensingBatch.class));
        doAnswer(invocation -> Optional.ofNullable(savedBatch.get()))
                .when(batchRepository).findByIdempotencyKey("diagnosis:" + diagnosisId);
        List<MatchResult> matches = List.of(
                matched(0, PrescribedDrug.named("Paracetamol 500mg", "1 tablet", null), paracetamolId),
                matched(1, PrescribedDrug.named("Ibuprofen 400mg", "1 tablet", null), ibuprofenId));

        DispensingBatchResult first = recorder.record(context, matches, null);
        assertEquals(DispensingBatch.Status.PARTIAL, first.status());

        ibuprofenFails.set(false);
        DispensingBatchResult second = recorder.record(context, matches, null);

        assertFalse(second.replay());
        assertEquals(first.batchId(), second.batchId());
        assertEquals(DispensingBatch.Status.COMPLETED, second.status());
        assertEquals(2, second.successCount());
        assertEquals(List.of(0, 1), second.items().stream().map(DispensingItemOutcome::drugIndex).toList());
        assertEquals(2, savedBatch.get().getSuccessCount());
        assertEquals(0, savedBatch.get().getFailureCount());
        assertEquals(2, stored.size());
        verify(persistenceService, times(1)).create(argThat(r -> "Paracetamol 500mg".equals(r.getDrugName())));
        verify(persistenceService, times(2)).create(argThat(r -> "Ibuprofen 400mg".equals(r.getDrugName())));

        DispensingBatchResult third = recorder.record(context, matches, null);
        assertTrue(third.replay());
        assertEquals(2, third.items().size());
        verify(persistenceService, times(3)).create(any());
    }

    @Test
    void testPartialBatchWithEveryPositionRecordedIsReplayed() {
        UUID batchId = UUID.randomUUID();
        DispensingBatch partial = DispensingBatch.builder()
                .id(batchId)
                .idempotencyKey("visit-9")
                .ownerId("owner-1")
                .status(DispensingBatch.Status.PARTIAL)
                .build();
        when(batchRepository.findByIdempotencyKey("visit-9")).thenReturn(Optional.of(partial));
        when(persistenceService.byBatch(batchId)).thenReturn(List.of(DispensingRecord.builder()
                .id(UUID.randomUUID())
                .drugName("Paracetamol 500mg")
                .quantity(1)
                .drugIndex(0)
                .batchId(batchId)
                .build()));

        DispensingBatchResult result = recorder.record(context,
                List.of(matched(0, PrescribedDrug.named("Paracetamol 500mg", null, null), paracetamolId)), "visit-9");

        assertTrue(result.replay());
        verify(persistenceService, never()).create(any());
        verify(batchRepository, never()).saveAndFlush(any());
    }

    @Test
    void testRejectedSubmissionLeavesBatchFailed() {
        ExecutorService stopped = Executors.newSingleThreadExecutor();
        stopped.shutdown();
        DispensingRecorder stoppedRecorder = new DispensingRecorder(persistenceService, batchRepository, stopped);

        assertThrows(RejectedExecutionException.class, () -> stoppedRecorder.record(context,
                List.of(matched(0, PrescribedDrug.named("Paracetamol 500mg", null, null), paracetamolId)), "visit-10"));

        ArgumentCaptor<DispensingBatch> batch = ArgumentCaptor.forClass(DispensingBatch.class);
        verify(batchRepository).save(batch.capture());
        assertEquals("visit-10", batch.getValue().getIdempotencyKey());
        assertEquals(DispensingBatch.Status.FAILED, batch.getValue().getStatus());
    }

    @Test
    void testFailingBatchSaveLeavesBatchFailed() {
        List<DispensingBatch.Status> savedStatuses = new ArrayList<>();
        doAnswer(invocation -> {
            DispensingBatch batch = invocation.getArgument(0);
            savedStatuses.add(batch.getStatus());
            if (savedStatuses.size() == 1) {
                throw new DataAccessResourceFailureException("database unavailable");
            }
            return batch;
        }).when(batchRepository).save(any(DispensingBatch.class));

        assertThrows(DataAccessResourceFailureException.class, () -> recorder.record(context,
                List.of(matched(0, PrescribedDrug.named("Paracetamol 500mg", null, null), paracetamolId)), "visit-11"));

        assertEquals(List.of(DispensingBatch.Status.COMPLETED, DispensingBatch.Status.FAILED), savedStatuses);
    }

    @Test
    void testInProgressKeyIsRejected() {
        DispensingBatch running = DispensingBatch.builder()
                .id(UUID.randomUUID())
                .idempotencyKey("visit-8")
                .status(DispensingBatch.Status.IN_PROGRESS)
                .build();
        when(batchRepository.findByIdempotencyKey("visit-8")).thenReturn(Optional.of(running));

        assertThrows(ResponseStatusException.class, () -> recorder.record(context, List.of(), "visit-8"));
        verify(persistenceService, never()).create(any());
    }

    @Test
    void testQuantityFromDosage() {
        assertEquals(2, DispensingRecorder.quantityFrom("2 tablets 3 times a day"));
        assertEquals(10, DispensingRecorder.quantityFrom("Take 10 ml"));
        assertEquals(1, DispensingRecorder.quantityFrom("one tablet"));
        assertEquals(1, DispensingRecorder.quantityFrom("0 tablets"));
        assertEquals(1, DispensingRecorder.quantityFrom(null));
    }

    private static MatchResult matched(int position, PrescribedDrug drug, UUID inventoryId) {
        InventoryItem item = new InventoryItem(inventoryId.toString(), drug.drugName(), null, null, "tablet",
                null, null, null, 10);
        return new MatchResult(position, drug, item, MatchTier.EXACT_NAME);
    }
}
