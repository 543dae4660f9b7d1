package io.sendflow.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence seam for schedules.
 *
 * <p>Every mutating method is a single conditional write: callers pass the states they expect
 * and get {@link Optional#empty()} when the stored schedule is missing or in another state.
 */
public interface ScheduleStore {

    /**
     * Persists a new schedule and returns it with its generated id.
     */
    Schedule insert(Schedule schedule);

    Optional<Schedule> findById(String id);

    /**
     * All schedules in creation order.
     */
    List<Schedule> findAll();

    /**
     * Moves a schedule to {@code to} if its current status is in {@code allowedFrom}.
     *
     * @param nextRunAt new next occurrence; null clears it
     */
    Optional<Schedule> transition(String id, Set<ScheduleStatus> allowedFrom, ScheduleStatus to,
                                  Instant nextRunAt, Instant now);

    /**
     * Rewrites payload and timing if the current status is in {@code allowedFrom}.
     */
    Optional<Schedule> update(String id, Set<ScheduleStatus> allowedFrom, ScheduleChanges changes, Instant now);

    /**
     * Atomically claims (locks) at most {@code limit} ACTIVE schedules with {@code nextRunAt <= now}
     * that are unlocked or whose lock expired.
     */
    List<Schedule> claimDue(Instant now, int limit, Duration lockLifetime, String workerId);

    /**
     * Current state of a schedule {@code workerId} still holds the claim on.
     *
     * @return empty when the schedule is gone or its claim is held by someone else or expired
     */
    Optional<Schedule> findClaimed(String id, String workerId, Instant now);

    /**
     * Records a firing and releases the claim. Ignored when {@code workerId} no longer holds the lock.
     *
     * @return true if the write was applied
     */
    boolean markFired(String id, String workerId, FireOutcome outcome);

    /**
     * Releases a claim without recording a firing.
     */
    void release(String id, String workerId);
}
