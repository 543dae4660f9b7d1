package io.sendflow.core;

import java.time.Instant;

/**
 * What happened when the runner fired a schedule.
 *
 * @param retires   true when the schedule is finished and moves to DONE
 * @param nextRunAt next occurrence of a recurring schedule; null leaves it without one
 * @param jobId     bulk job started by a GROUP schedule, null otherwise
 * @param error     reason the send failed, null on success
 */
public record FireOutcome(
        Instant firedAt,
        boolean retires,
        Instant nextRunAt,
        String jobId,
        String error
) {
    public static FireOutcome retired(Instant firedAt, String jobId, String error) {
        return new FireOutcome(firedAt, true, null, jobId, error);
    }

    public static FireOutcome advanced(Instant firedAt, Instant nextRunAt, String jobId, String error) {
        return new FireOutcome(firedAt, false, nextRunAt, jobId, error);
    }
}
