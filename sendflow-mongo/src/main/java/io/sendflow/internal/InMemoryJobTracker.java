package io.sendflow.internal;

import io.sendflow.core.JobSnapshot;
import io.sendflow.core.JobStatus;
import io.sendflow.core.JobTracker;
import io.sendflow.core.RecipientResult;
import io.sendflow.core.exception.InvalidInputException;
import io.sendflow.core.exception.InvalidStateException;
import io.sendflow.core.exception.NotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link JobTracker}.
 *
 * <p>Each job is guarded by its own monitor: writers serialize on it and readers copy the
 * counters and results under it, so a snapshot never shows a count without its result entry.
 * Finished jobs keep returning the same terminal snapshot. Without a retention they are kept for
 * the life of the process; with one, jobs finished longer than the retention ago are dropped when
 * a new job is created.
 */
public class InMemoryJobTracker implements JobTracker {

    private final ConcurrentHashMap<String, JobState> jobs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public InMemoryJobTracker(Clock clock) {
        this(clock, null);
    }

    /**
     * @param retention how long finished jobs stay readable; null keeps them forever
     */
    public InMemoryJobTracker(Clock clock, Duration retention) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (retention != null && (retention.isZero() || retention.isNegative())) {
            throw new IllegalArgumentException("sendflow.dispatch.jobRetention must be a positive duration");
        }
        this.retention = retention;
    }

    private static final class JobState {
        private final String id;
        private final int total;
        private final Instant startedAt;
        private final List<RecipientResult> results = new ArrayList<>();

        private JobStatus status = JobStatus.RUNNING;
        private int sent;
        private int failedCount;
        private Instant completedAt;
        private String error;
        private JobSnapshot terminal;

        private JobState(String id, int total, Instant startedAt) {
            this.id = id;
            this.total = total;
            this.startedAt = startedAt;
        }

        private JobSnapshot snapshot() {
            if (terminal != null) {
                return terminal;
            }
            return new JobSnapshot(id, status, total, results.size(), sent, failedCount,
                    results, startedAt, completedAt, error);
        }

        private void requireOpen() {
            if (status.isTerminal()) {
                throw new InvalidStateException("Job " + id + " is already " + status);
            }
        }

        private synchronized boolean finishedBefore(Instant cutoff) {
            return terminal != null && completedAt.isBefore(cutoff);
        }

        private JobSnapshot close(JobStatus finalStatus, Instant at, String reason) {
            status = finalStatus;
            completedAt = at;
            error = reason;
            terminal = snapshot();
            return terminal;
        }
    }

    @Override
    public JobSnapshot create(int total) {
        if (total < 0) {
            throw new InvalidInputException("total", "total must not be negative: " + total);
        }
        Instant now = clock.instant();
        evictFinished(now);
        JobState state = new JobState(UUID.randomUUID().toString(), total, now);
        jobs.put(state.id, state);
        synchronized (state) {
            return state.snapshot();
        }
    }

    @Override
    public JobSnapshot recordResult(String jobId, RecipientResult result) {
        Objects.requireNonNull(result, "result must not be null");
        JobState state = require(jobId);
        synchronized (state) {
            state.requireOpen();
            if (state.results.size() >= state.total) {
                throw new InvalidStateException("Job " + jobId + " already holds all " + state.total + " results");
            }
            state.results.add(result);
            if (result.success()) {
                state.sent++;
            } else {
                state.failedCount++;
            }
            return state.snapshot();
        }
    }

    @Override
    public JobSnapshot finalize(String jobId) {
        JobState state = require(jobId);
        synchronized (state) {
            state.requireOpen();
            // any failed recipient fails the whole job
            JobStatus outcome = state.failedCount == 0 ? JobStatus.COMPLETED : JobStatus.FAILED;
            return state.close(outcome, clock.instant(), null);
        }
    }

    @Override
    public JobSnapshot abort(String jobId, String reason) {
        JobState state = require(jobId);
        synchronized (state) {
            state.requireOpen();
            return state.close(JobStatus.FAILED, clock.instant(), reason == null ? "aborted" : reason);
        }
    }

    @Override
    public JobSnapshot get(String jobId) {
        JobState state = require(jobId);
        synchronized (state) {
            return state.snapshot();
        }
    }

    private void evictFinished(Instant now) {
        if (retention == null) {
            return;
        }
        Instant cutoff = now.minus(retention);
        jobs.values().removeIf(state -> state.finishedBefore(cutoff));
    }

    private JobState require(String jobId) {
        JobState state = jobId == null ? null : jobs.get(jobId);
        if (state == null) {
            throw new NotFoundException("job", jobId);
        }
        return state;
    }
}
