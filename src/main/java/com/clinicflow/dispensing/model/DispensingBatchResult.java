package com.clinicflow.dispensing.model;

import com.clinicflow.entity.DispensingBatch;

import java.util.List;
import java.util.UUID;

/**
 * Per-item outcome of a dispensing batch. {@code replay} is set when the idempotency key had already
 * been processed and nothing new was written.
 */
public record DispensingBatchResult(
        UUID batchId,
        String idempotencyKey,
        DispensingBatch.Status status,
        boolean replay,
        List<DispensingItemOutcome> items
) {

    public DispensingBatchResult {
        items = List.copyOf(items);
    }

    public long successCount() {
        return items.stream().filter(DispensingItemOutcome::succeeded).count();
    }

    public long failureCount() {
        return items.size() - successCount();
    }
}
