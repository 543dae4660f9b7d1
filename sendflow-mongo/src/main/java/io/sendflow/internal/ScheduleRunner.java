package io.sendflow.internal;

import io.sendflow.config.SendFlowProperties;
import io.sendflow.core.BulkDispatcher;
import io.sendflow.core.DeliveryResult;
import io.sendflow.core.FireOutcome;
import io.sendflow.core.Schedule;
import io.sendflow.core.ScheduleStatus;
import io.sendflow.core.ScheduleStore;
import io.sendflow.utils.CronSchedules;
import io.sendflow.utils.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recurring evaluator that fires due schedules.
 *
 * <p>One poller thread ticks every {@code sendflow.processEvery}. Each tick claims due schedules
 * through the store (the claim lock keeps two runner instances from firing the same occurrence),
 * re-reads each claimed schedule right before firing it, fires the ones still ACTIVE and due, and
 * records the outcome:
 * <ul>
 *   <li>ONCE schedules retire to DONE whatever the send outcome</li>
 *   <li>CRON schedules advance along their rule from the previous occurrence</li>
 * </ul>
 * A schedule that throws is logged and recorded; the rest of the tick carries on.
 */
public class ScheduleRunner {
    private static final Logger log = LoggerFactory.getLogger(ScheduleRunner.class);

    private static final int MAX_SYSTEM_ERRORS = 30;

    private final SendFlowProperties props;
    private final ScheduleStore store;
    private final IndividualDispatcher individualDispatcher;
    private final BulkDispatcher bulkDispatcher;
    private final Clock clock;
    private final ZoneId defaultZone;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public ScheduleRunner(SendFlowProperties props,
                          ScheduleStore store,
                          IndividualDispatcher individualDispatcher,
                          BulkDispatcher bulkDispatcher,
                          Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.individualDispatcher = Objects.requireNonNull(individualDispatcher, "individualDispatcher must not be null");
        this.bulkDispatcher = Objects.requireNonNull(bulkDispatcher, "bulkDispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultZone = Timestamps.zone(props.getDefaultTimezone(), clock.getZone());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Start the poller thread. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "sendflow.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("sendflow.processEvery must be a positive duration");
        }
        Duration lockLifetime = Objects.requireNonNull(props.getLockLifetime(), "sendflow.lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("sendflow.lockLifetime must be a positive duration");
        }

        log.info("ScheduleRunner starting with processEvery={}, lockLifetime={}, workerId={}, batchSize={}",
                props.getProcessEvery(),
                props.getLockLifetime(),
                workerId,
                props.getBatchSize());

        systemErrorCount = 0;
        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("sendflow.runner");
        pollerThread.setDaemon(true);
        pollerThread.start();
    }

    /**
     * Stop polling and interrupt the poller thread. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("ScheduleRunner stopping...");
        Thread t = pollerThread;
        pollerThread = null;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
        }
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Evaluate due schedules once.
     *
     * @return number of schedules fired
     */
    public int tick() {
        Instant now = clock.instant();
        List<Schedule> due = store.claimDue(now, Math.max(1, props.getBatchSize()), props.getLockLifetime(), workerId);
        log.debug("ScheduleRunner claimed schedules count={} now={}", due.size(), now);

        int fired = 0;
        for (Schedule claimed : due) {
            if (Thread.currentThread().isInterrupted()) {
                // stopping: hand unfired claims back instead of waiting for their locks to expire
                store.release(claimed.id(), workerId);
                continue;
            }

            // the claimed snapshot may be stale by now; fire from the stored state
            Schedule current = store.findClaimed(claimed.id(), workerId, clock.instant()).orElse(null);
            if (current == null) {
                log.warn("sendflow lost claim before firing id={} workerId={}", claimed.id(), workerId);
                continue;
            }
            if (!isDue(current, now)) {
                log.info("sendflow schedule changed after claim; skipping id={} status={} nextRunAt={}",
                        current.id(), current.status(), current.nextRunAt());
                store.release(current.id(), workerId);
                continue;
            }

            fire(current, now);
            fired++;
        }
        return fired;
    }

    private static boolean isDue(Schedule schedule, Instant tickAt) {
        return schedule.status() == ScheduleStatus.ACTIVE
                && schedule.nextRunAt() != null
                && !schedule.nextRunAt().isAfter(tickAt);
    }

    private void fire(Schedule schedule, Instant tickAt) {
        Instant firedAt = clock.instant();
        String jobId = null;
        String error = null;

        try {
            switch (schedule.targetType()) {
                case INDIVIDUAL -> {
                    DeliveryResult result = individualDispatcher.send(schedule.recipient(), schedule.message());
                    if (!result.success()) {
                        error = result.error();
                    }
                }
                case GROUP -> jobId = bulkDispatcher.dispatch(schedule.groupId(), schedule.message());
            }
            log.info("sendflow schedule fired id={} target={} jobId={} error={}",
                    schedule.id(), schedule.targetType(), jobId, error);
        } catch (Exception e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("sendflow schedule failed id={} target={} msg={}", schedule.id(), schedule.targetType(), error, e);
        }

        FireOutcome outcome;
        if (schedule.scheduleType().isRecurring()) {
            Instant nextRunAt = null;
            try {
                nextRunAt = CronSchedules.computeNextRunAt(
                        schedule.cronExpression(),
                        Timestamps.zone(schedule.timezone(), defaultZone),
                        schedule.nextRunAt(),
                        tickAt
                );
            } catch (Exception e) {
                log.error("sendflow could not compute next run id={} cron={} msg={}",
                        schedule.id(), schedule.cronExpression(), e.getMessage(), e);
            }
            if (nextRunAt == null) {
                // stays ACTIVE without a next run until the rule is edited or the schedule is resumed
                log.warn("sendflow recurring schedule has no further occurrences id={}", schedule.id());
                if (error == null) {
                    error = "Cron expression has no further occurrences";
                }
            }
            outcome = FireOutcome.advanced(firedAt, nextRunAt, jobId, error);
        } else {
            outcome = FireOutcome.retired(firedAt, jobId, error);
        }

        try {
            boolean applied = store.markFired(schedule.id(), workerId, outcome);
            if (!applied) {
                log.warn("sendflow lost claim before recording firing id={} workerId={}", schedule.id(), workerId);
            }
        } catch (Exception e) {
            log.error("sendflow markFired failed id={} msg={}", schedule.id(), e.getMessage(), e);
        }
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                tick();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("sendflow tick failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= MAX_SYSTEM_ERRORS) {
                    log.error("ScheduleRunner stopped due to repeated system failures...");
                    stop();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                Thread.sleep(props.getProcessEvery().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated tick failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "sendflow";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("sendflow could not resolve host name msg={}", e.getMessage());
        }

        String pid = Long.toString(ProcessHandle.current().pid());
        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
