package com.clinicflow.dispensing;

import com.clinicflow.dispensing.model.DispensingBatchResult;
import com.clinicflow.dispensing.model.DispensingContext;
import com.clinicflow.dispensing.model.DispensingItemOutcome;
import com.clinicflow.dispensing.model.MatchResult;
import com.clinicflow.entity.DispensingBatch;
import com.clinicflow.entity.DispensingRecord;
import com.clinicflow.ingestion.model.PrescribedDrug;
import com.clinicflow.repository.DispensingBatchRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns reconciliation results into dispensing records, one batch per idempotency key.
 * <p>
 * Every match result yields a record, matched or not. Items are written independently on the
 * dispensing executor; a failing write is reported for that item and does not stop the others.
 * Calling again with the key of a partial or failed batch writes only the positions still missing.
 */
@Service
@Slf4j
public class DispensingRecorder {

    static final String NOT_IN_INVENTORY_NOTE = "Note: Drug not found in current inventory.";
    private static final Pattern FIRST_INTEGER = Pattern.compile("\\d+");

    private final DispensingPersistenceService persistenceService;
    private final DispensingBatchRepository batchRepository;
    private final ExecutorService dispensingExecutor;

    public DispensingRecorder(DispensingPersistenceService persistenceService,
                              DispensingBatchRepository batchRepository,
                              @Qualifier("dispensingExecutor") ExecutorService dispensingExecutor) {
        this.persistenceService = persistenceService;
        this.batchRepository = batchRepository;
        this.dispensingExecutor = dispensingExecutor;
    }

    public DispensingBatchResult record(DispensingContext context, List<MatchResult> matches,
                                        @Nullable String idempotencyKey) {
        String key = resolveKey(context, idempotencyKey);
        Optional<DispensingBatch> existing = batchRepository.findByIdempotencyKey(key);
        List<DispensingRecord> recorded = List.of();
        if (existing.isPresent()) {
            DispensingBatch batch = existing.get();
            switch (batch.getStatus()) {
                case COMPLETED -> {
                    log.info("Dispensing batch '{}' already recorded; replaying.", key);
                    return replay(batch);
                }
                case PARTIAL, FAILED -> {
                    recorded = persistenceService.byBatch(batch.getId());
                    if (batch.getStatus() == DispensingBatch.Status.PARTIAL && pending(matches, recorded).isEmpty()) {
                        log.info("Dispensing batch '{}' has nothing left to record; replaying.", key);
                        return replay(batch);
                    }
                    log.info("Resuming {} dispensing batch '{}' with {} items already recorded.",
                            batch.getStatus(), key, recorded.size());
                }
                case IN_PROGRESS -> throw new ResponseStatusException(HttpStatus.CONFLICT,
                        "Dispensing batch '" + key + "' is still in progress");
            }
        }
        List<MatchResult> pending = pending(matches, recorded);
        DispensingBatch batch = begin(existing.orElse(null), key, context, matches.size());
        try {
            List<CompletableFuture<DispensingItemOutcome>> futures = new ArrayList<>(pending.size());
            for (MatchResult match : pending) {
                futures.add(CompletableFuture
                        .supplyAsync(() -> write(context, batch.getId(), match), dispensingExecutor)
                        .handle((outcome, error) -> outcome != null ? outcome : failed(match, error)));
            }
            List<DispensingItemOutcome> outcomes = new ArrayList<>(recorded.size() + pending.size());
            recorded.forEach(r -> outcomes.add(outcomeOf(r)));
            futures.forEach(f -> outcomes.add(f.join()));
            outcomes.sort(Comparator.comparingInt(DispensingItemOutcome::drugIndex));

            int successes = (int) outcomes.stream().filter(DispensingItemOutcome::succeeded).count();
            batch.setItemCount(outcomes.size());
            batch.setSuccessCount(successes);
            batch.setFailureCount(outcomes.size() - successes);
            batch.setStatus(statusFor(successes, outcomes.size()));
            batchRepository.save(batch);
            log.info("Dispensing batch '{}' finished {}: {} of {} items recorded.",
                    key, batch.getStatus(), successes, outcomes.size());
            return new DispensingBatchResult(batch.getId(), key, batch.getStatus(), false, outcomes);
        } catch (RuntimeException ex) {
            markFailed(batch, ex);
            throw ex;
        }
    }

    /**
     * First integer in the dosage text, at least 1.
     */
    static int quantityFrom(@Nullable String dosage) {
        if (!StringUtils.hasText(dosage)) {
            return 1;
        }
        Matcher matcher = FIRST_INTEGER.matcher(dosage);
        if (!matcher.find()) {
            return 1;
        }
        try {
            return Math.max(1, Integer.parseInt(matcher.group()));
        } catch (NumberFormatException ex) {
            return 1;
        }
    }

    static String noteFor(@Nullable String complaint, PrescribedDrug drug, boolean matched) {
        String duration = StringUtils.hasText(drug.duration()) ? drug.duration() : "Not specified";
        String note = "Prescribed for: " + (complaint == null ? "" : complaint) + ". Duration: " + duration;
        return matched ? note : note + ". " + NOT_IN_INVENTORY_NOTE;
    }

    private DispensingItemOutcome write(DispensingContext context, UUID batchId, MatchResult match) {
        PrescribedDrug drug = match.prescribed();
        UUID inventoryDrugId = match.matched() ? UUID.fromString(match.inventoryItem().id()) : null;
        int quantity = quantityFrom(drug.dosage());
        DispensingRecord saved = persistenceService.create(DispensingRecord.builder()
                .ownerId(context.ownerId())
                .inventoryDrugId(inventoryDrugId)
                .drugName(drug.drugName())
                .quantity(quantity)
                .note(noteFor(context.complaint(), drug, match.matched()))
                .diagnosisId(context.diagnosisId())
                .drugIndex(match.position())
                .batchId(batchId)
                .patientId(context.patientId())
                .patientName(context.patientName())
                .primaryDiagnosis(context.primaryDiagnosis())
                .build());
        return new DispensingItemOutcome(match.position(), drug.drugName(), match.tier(), inventoryDrugId,
                quantity, saved.getId(), null);
    }

    private DispensingItemOutcome failed(MatchResult match, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.warn("Failed to record dispensing of '{}': {}", match.prescribed().drugName(), cause.getMessage());
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new DispensingItemOutcome(match.position(), match.prescribed().drugName(), match.tier(), null,
                quantityFrom(match.prescribed().dosage()), null, message);
    }

    private DispensingBatch begin(@Nullable DispensingBatch previous, String key, DispensingContext context,
                                  int itemCount) {
        DispensingBatch batch = previous != null ? previous : DispensingBatch.builder()
                .idempotencyKey(key)
                .ownerId(context.ownerId())
                .diagnosisId(context.diagnosisId())
                .build();
        batch.setStatus(DispensingBatch.Status.IN_PROGRESS);
        batch.setItemCount(itemCount);
        batch.setSuccessCount(0);
        batch.setFailureCount(0);
        try {
            return batchRepository.saveAndFlush(batch);
        } catch (DataIntegrityViolationException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT,
                    "Dispensing batch '" + key + "' was started concurrently", ex);
        }
    }

    /**
     * Leaves the batch retryable when something outside the per-item writes fails.
     */
    private void markFailed(DispensingBatch batch, RuntimeException cause) {
        log.error("Dispensing batch '{}' aborted: {}", batch.getIdempotencyKey(), cause.getMessage());
        batch.setStatus(DispensingBatch.Status.FAILED);
        try {
            batchRepository.save(batch);
        } catch (RuntimeException ex) {
            cause.addSuppressed(ex);
        }
    }

    private DispensingBatchResult replay(DispensingBatch batch) {
        List<DispensingItemOutcome> items = persistenceService.byBatch(batch.getId()).stream()
                .sorted(Comparator.comparing(DispensingRecord::getDrugIndex,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .map(DispensingRecorder::outcomeOf)
                .toList();
        return new DispensingBatchResult(batch.getId(), batch.getIdempotencyKey(), batch.getStatus(), true, items);
    }

    private static DispensingItemOutcome outcomeOf(DispensingRecord record) {
        return new DispensingItemOutcome(record.getDrugIndex() == null ? -1 : record.getDrugIndex(),
                record.getDrugName(), null, record.getInventoryDrugId(), record.getQuantity(), record.getId(), null);
    }

    /**
     * Match results whose position has no record in the batch yet.
     */
    private static List<MatchResult> pending(List<MatchResult> matches, List<DispensingRecord> recorded) {
        Set<Integer> done = recorded.stream()
                .map(DispensingRecord::getDrugIndex)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return matches.stream().filter(m -> !done.contains(m.position())).toList();
    }

    private static String resolveKey(DispensingContext context, @Nullable String idempotencyKey) {
        if (StringUtils.hasText(idempotencyKey)) {
            return idempotencyKey.trim();
        }
        if (context.diagnosisId() != null) {
            return "diagnosis:" + context.diagnosisId();
        }
        return "manual:" + UUID.randomUUID();
    }

    private static DispensingBatch.Status statusFor(int successes, int total) {
        if (successes == total) {
            return DispensingBatch.Status.COMPLETED;
        }
        return successes == 0 ? DispensingBatch.Status.FAILED : DispensingBatch.Status.PARTIAL;
    }
}
