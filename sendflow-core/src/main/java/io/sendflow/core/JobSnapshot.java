package io.sendflow.core;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, consistent view of a bulk-send job.
 *
 * <p>{@code progress == sent + failedCount == results.size() <= total} holds for every snapshot.
 *
 * @param error set only when the job was aborted by a system failure
 */
public record JobSnapshot(
        String id,
        JobStatus status,
        int total,
        int progress,
        int sent,
        int failedCount,
        List<RecipientResult> results,
        Instant startedAt,
        Instant completedAt,
        String error
) {
    public JobSnapshot {
        results = List.copyOf(results);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
