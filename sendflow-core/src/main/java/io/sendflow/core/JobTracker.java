package io.sendflow.core;

/**
 * Record of in-flight and finished bulk-send jobs.
 *
 * <p>Writers for one job are serialized; readers always get a snapshot in which counters and
 * results agree. A job is never mutated after it became terminal.
 */
public interface JobTracker {

    /**
     * Allocates a RUNNING job with zero counters.
     *
     * @throws io.sendflow.core.exception.InvalidInputException if {@code total < 0}
     */
    JobSnapshot create(int total);

    /**
     * Appends one result and bumps {@code progress} plus {@code sent} or {@code failedCount}.
     */
    JobSnapshot recordResult(String jobId, RecipientResult result);

    /**
     * COMPLETED when no recipient failed, FAILED otherwise.
     */
    JobSnapshot finalize(String jobId);

    /**
     * Terminates a job as FAILED because the dispatch path broke, keeping results recorded so far.
     */
    JobSnapshot abort(String jobId, String reason);

    JobSnapshot get(String jobId);
}
