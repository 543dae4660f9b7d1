package io.sendflow.internal;

import io.sendflow.core.FireOutcome;
import io.sendflow.core.Recipient;
import io.sendflow.core.Schedule;
import io.sendflow.core.ScheduleChanges;
import io.sendflow.core.ScheduleStatus;
import io.sendflow.core.ScheduleStore;
import io.sendflow.core.ScheduleType;
import io.sendflow.core.TargetType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Process-local {@link ScheduleStore} for single-instance deployments and tests.
 *
 * <p>All methods synchronize on the store, which makes each conditional write atomic. Claims use
 * the same lock fields as the MongoDB store so the runner behaves identically on both.
 */
public class InMemoryScheduleStore implements ScheduleStore {

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private static final class Entry {
        private String id;
        private TargetType targetType;
        private ScheduleType scheduleType;
        private Recipient recipient;
        private String groupId;
        private String message;
        private Instant runAt;
        private String cronExpression;
        private String timezone;
        private Instant nextRunAt;
        private ScheduleStatus status;
        private Instant lastRunAt;
        private String lastError;
        private String lastJobId;
        private Instant createdAt;
        private Instant updatedAt;

        private Instant lockUntil;
        private String lockedBy;

        private Schedule toSchedule() {
            return new Schedule(id, targetType, scheduleType, recipient, groupId, message,
                    runAt, cronExpression, timezone, nextRunAt, status,
                    lastRunAt, lastError, lastJobId, createdAt, updatedAt);
        }

        private boolean heldBy(String workerId) {
            return lockedBy != null && lockedBy.equals(workerId);
        }

        private boolean heldBy(String workerId, Instant now) {
            return heldBy(workerId) && lockUntil != null && lockUntil.isAfter(now);
        }

        private void unlock() {
            lockUntil = null;
            lockedBy = null;
        }
    }

    @Override
    public synchronized Schedule insert(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Entry e = new Entry();
        e.id = UUID.randomUUID().toString();
        e.targetType = schedule.targetType();
        e.scheduleType = schedule.scheduleType();
        e.recipient = schedule.recipient();
        e.groupId = schedule.groupId();
        e.message = schedule.message();
        e.runAt = schedule.runAt();
        e.cronExpression = schedule.cronExpression();
        e.timezone = schedule.timezone();
        e.nextRunAt = schedule.nextRunAt();
        e.status = schedule.status();
        e.createdAt = schedule.createdAt();
        e.updatedAt = schedule.updatedAt();
        entries.put(e.id, e);
        return e.toSchedule();
    }

    @Override
    public synchronized Optional<Schedule> findById(String id) {
        Entry e = id == null ? null : entries.get(id);
        return Optional.ofNullable(e).map(Entry::toSchedule);
    }

    @Override
    public synchronized List<Schedule> findAll() {
        List<Schedule> all = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) {
            all.add(e.toSchedule());
        }
        return all;
    }

    @Override
    public synchronized Optional<Schedule> transition(String id, Set<ScheduleStatus> allowedFrom, ScheduleStatus to,
                                                      Instant nextRunAt, Instant now) {
        Entry e = entries.get(id);
        if (e == null || !allowedFrom.contains(e.status)) {
            return Optional.empty();
        }
        e.status = to;
        e.nextRunAt = nextRunAt;
        e.updatedAt = now;
        return Optional.of(e.toSchedule());
    }

    @Override
    public synchronized Optional<Schedule> update(String id, Set<ScheduleStatus> allowedFrom, ScheduleChanges changes, Instant now) {
        Entry e = entries.get(id);
        if (e == null || !allowedFrom.contains(e.status)) {
            return Optional.empty();
        }
        e.message = changes.message();
        if (changes.timingChanged()) {
            e.scheduleType = changes.scheduleType();
            e.runAt = changes.runAt();
            e.cronExpression = changes.cronExpression();
            e.timezone = changes.timezone();
            e.nextRunAt = changes.nextRunAt();
        }
        e.updatedAt = now;
        return Optional.of(e.toSchedule());
    }

    @Override
    public synchronized List<Schedule> claimDue(Instant now, int limit, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (limit <= 0) {
            return List.of();
        }

        List<Entry> due = new ArrayList<>();
        for (Entry e : entries.values()) {
            boolean unlocked = e.lockUntil == null || !e.lockUntil.isAfter(now);
            if (e.status == ScheduleStatus.ACTIVE && e.nextRunAt != null && !e.nextRunAt.isAfter(now) && unlocked) {
                due.add(e);
            }
        }
        due.sort(Comparator.comparing((Entry e) -> e.nextRunAt));

        List<Schedule> claimed = new ArrayList<>(Math.min(limit, due.size()));
        for (Entry e : due) {
            if (claimed.size() >= limit) {
                break;
            }
            e.lockUntil = now.plus(lockLifetime);
            e.lockedBy = workerId;
            claimed.add(e.toSchedule());
        }
        return claimed;
    }

    @Override
    public synchronized Optional<Schedule> findClaimed(String id, String workerId, Instant now) {
        Entry e = id == null ? null : entries.get(id);
        if (e == null || !e.heldBy(workerId, now)) {
            return Optional.empty();
        }
        return Optional.of(e.toSchedule());
    }

    @Override
    public synchronized boolean markFired(String id, String workerId, FireOutcome outcome) {
        Entry e = entries.get(id);
        if (e == null || !e.heldBy(workerId)) {
            return false;
        }
        e.lastRunAt = outcome.firedAt();
        e.lastError = outcome.error();
        if (outcome.jobId() != null) {
            e.lastJobId = outcome.jobId();
        }
        if (outcome.retires()) {
            if (e.status != ScheduleStatus.CANCELLED) {
                e.status = ScheduleStatus.DONE;
                e.nextRunAt = null;
            }
        } else if (e.status == ScheduleStatus.ACTIVE) {
            e.nextRunAt = outcome.nextRunAt();
        }
        e.updatedAt = outcome.firedAt();
        e.unlock();
        return true;
    }

    @Override
    public synchronized void release(String id, String workerId) {
        Entry e = entries.get(id);
        if (e != null && e.heldBy(workerId)) {
            e.unlock();
        }
    }
}
