package io.sendflow.internal;

import io.sendflow.ScheduleRequest;
import io.sendflow.ScheduleUpdate;
import io.sendflow.config.SendFlowProperties;
import io.sendflow.core.Schedule;
import io.sendflow.core.ScheduleChanges;
import io.sendflow.core.ScheduleStatus;
import io.sendflow.core.ScheduleStore;
import io.sendflow.core.ScheduleType;
import io.sendflow.core.exception.InvalidInputException;
import io.sendflow.core.exception.InvalidStateException;
import io.sendflow.core.exception.NotFoundException;
import io.sendflow.utils.CronSchedules;
import io.sendflow.utils.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Schedule lifecycle operations: create, pause, resume, cancel, edit, list.
 *
 * <p>Each mutation is a conditional store write, so a request that fails validation or hits an
 * illegal transition leaves the schedule untouched.
 */
public class ScheduleService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private static final Set<ScheduleStatus> EDITABLE = EnumSet.of(ScheduleStatus.ACTIVE, ScheduleStatus.PAUSED);
    private static final Set<ScheduleStatus> CANCELLABLE = EnumSet.of(ScheduleStatus.ACTIVE, ScheduleStatus.PAUSED, ScheduleStatus.DONE);
    private static final int CANCEL_ATTEMPTS = 3;

    private final ScheduleStore store;
    private final Clock clock;
    private final ZoneId defaultZone;
    private final Duration maxRunAtLag;

    public ScheduleService(SendFlowProperties props, ScheduleStore store, Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultZone = Timestamps.zone(props.getDefaultTimezone(), clock.getZone());
        this.maxRunAtLag = props.getMaxRunAtLag() != null ? props.getMaxRunAtLag() : Duration.ZERO;
    }

    public Schedule create(ScheduleRequest request) {
        if (request == null) {
            throw new InvalidInputException("request", "Schedule request must not be null");
        }
        Instant now = clock.instant();
        ZoneId zone = Timestamps.zone(request.timezone(), defaultZone);

        Instant runAt = null;
        Instant nextRunAt;
        if (request.scheduleType() == ScheduleType.ONCE) {
            runAt = parseRunAt(request.runAt(), zone, now);
            nextRunAt = runAt;
        } else {
            nextRunAt = firstOccurrence(request.cronExpression(), zone, now);
        }

        Schedule schedule = store.insert(new Schedule(
                null,
                request.targetType(),
                request.scheduleType(),
                request.recipient(),
                request.groupId(),
                request.message(),
                runAt,
                request.cronExpression(),
                zone.getId(),
                nextRunAt,
                ScheduleStatus.ACTIVE,
                null,
                null,
                null,
                now,
                now
        ));
        log.info("sendflow schedule created id={} target={} type={} nextRunAt={}",
                schedule.id(), schedule.targetType(), schedule.scheduleType(), schedule.nextRunAt());
        return schedule;
    }

    public Schedule pause(String id) {
        Schedule current = get(id);
        if (current.status() != ScheduleStatus.ACTIVE) {
            throw new InvalidStateException("Schedule " + id + " is " + current.status() + ", only ACTIVE schedules can be paused");
        }
        Schedule paused = store.transition(id, EnumSet.of(ScheduleStatus.ACTIVE), ScheduleStatus.PAUSED, null, clock.instant())
                .orElseThrow(() -> staleState(id, "paused"));
        log.info("sendflow schedule paused id={}", id);
        return paused;
    }

    /**
     * Reactivates a paused schedule. Occurrences that fell due while paused are not replayed: the
     * next run is computed from the resume time.
     */
    public Schedule resume(String id) {
        Schedule current = get(id);
        if (current.status() != ScheduleStatus.PAUSED) {
            throw new InvalidStateException("Schedule " + id + " is " + current.status() + ", only PAUSED schedules can be resumed");
        }
        Instant now = clock.instant();
        Instant nextRunAt = current.scheduleType().isRecurring()
                ? firstOccurrence(current.cronExpression(), zoneOf(current), now)
                : Timestamps.laterOf(current.runAt(), now);

        Schedule resumed = store.transition(id, EnumSet.of(ScheduleStatus.PAUSED), ScheduleStatus.ACTIVE, nextRunAt, now)
                .orElseThrow(() -> staleState(id, "resumed"));
        log.info("sendflow schedule resumed id={} nextRunAt={}", id, nextRunAt);
        return resumed;
    }

    /**
     * Idempotent: cancelling a cancelled schedule returns it unchanged.
     */
    public Schedule cancel(String id) {
        for (int attempt = 0; attempt < CANCEL_ATTEMPTS; attempt++) {
            Schedule current = get(id);
            if (current.status() == ScheduleStatus.CANCELLED) {
                return current;
            }
            Optional<Schedule> cancelled = store.transition(id, CANCELLABLE, ScheduleStatus.CANCELLED, null, clock.instant());
            if (cancelled.isPresent()) {
                log.info("sendflow schedule cancelled id={}", id);
                return cancelled.get();
            }
        }
        throw staleState(id, "cancelled");
    }

    public Schedule update(String id, ScheduleUpdate update) {
        if (update == null) {
            throw new InvalidInputException("update", "Schedule update must not be null");
        }
        Schedule current = get(id);
        if (!EDITABLE.contains(current.status())) {
            throw new InvalidStateException("Schedule " + id + " is " + current.status() + " and can no longer be edited");
        }

        String message = update.message() != null ? update.message() : current.message();
        ScheduleChanges changes;
        if (!update.changesTiming()) {
            changes = ScheduleChanges.messageOnly(message);
        } else {
            Instant now = clock.instant();
            ZoneId zone = Timestamps.zone(update.timezone() != null ? update.timezone() : current.timezone(), defaultZone);

            ScheduleType type = current.scheduleType();
            Instant runAt = current.runAt();
            String cron = current.cronExpression();
            if (update.runAt() != null) {
                type = ScheduleType.ONCE;
                runAt = parseRunAt(update.runAt(), zone, now);
                cron = null;
            } else if (update.cronExpression() != null) {
                type = ScheduleType.CRON;
                runAt = null;
                cron = update.cronExpression();
            }

            Instant nextRunAt = null;
            if (type.isRecurring()) {
                Instant first = firstOccurrence(cron, zone, now);
                nextRunAt = current.status() == ScheduleStatus.ACTIVE ? first : null;
            } else if (current.status() == ScheduleStatus.ACTIVE) {
                nextRunAt = runAt;
            }
            changes = new ScheduleChanges(message, true, type, runAt, cron, zone.getId(), nextRunAt);
        }

        Schedule updated = store.update(id, EnumSet.of(current.status()), changes, clock.instant())
                .orElseThrow(() -> staleState(id, "updated"));
        log.info("sendflow schedule updated id={} type={} nextRunAt={}", id, updated.scheduleType(), updated.nextRunAt());
        return updated;
    }

    public Schedule get(String id) {
        if (id == null || id.isBlank()) {
            throw new NotFoundException("schedule", id);
        }
        return store.findById(id).orElseThrow(() -> new NotFoundException("schedule", id));
    }

    public List<Schedule> list() {
        return store.findAll();
    }

    ZoneId zoneOf(Schedule schedule) {
        return Timestamps.zone(schedule.timezone(), defaultZone);
    }

    private Instant parseRunAt(String text, ZoneId zone, Instant now) {
        Instant runAt = Timestamps.parse(text, zone);
        if (runAt.isBefore(now.minus(maxRunAtLag))) {
            throw new InvalidInputException("runAt", "runAt is in the past: " + text);
        }
        return runAt;
    }

    private static Instant firstOccurrence(String cron, ZoneId zone, Instant now) {
        Instant next;
        try {
            next = CronSchedules.nextAfter(cron, zone, now);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("cron", e.getMessage());
        }
        if (next == null) {
            throw new InvalidInputException("cron", "Cron expression never fires: " + cron);
        }
        return next;
    }

    private InvalidStateException staleState(String id, String action) {
        Schedule latest = get(id);
        return new InvalidStateException("Schedule " + id + " changed to " + latest.status() + " and could not be " + action);
    }
}
