package io.sendflow.internal;

import io.sendflow.ContactDirectory;
import io.sendflow.config.SendFlowProperties;
import io.sendflow.core.BulkDispatcher;
import io.sendflow.core.Contact;
import io.sendflow.core.DeliveryResult;
import io.sendflow.core.JobSnapshot;
import io.sendflow.core.JobTracker;
import io.sendflow.core.MessageLog;
import io.sendflow.core.RecipientResult;
import io.sendflow.core.exception.InvalidInputException;
import io.sendflow.core.exception.NotFoundException;
import io.sendflow.core.exception.SendFlowException;
import io.sendflow.core.exception.SystemFailureException;
import io.sendflow.utils.MessageTexts;
import io.sendflow.utils.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Executes group sends as tracked jobs.
 *
 * <p>Every job runs on one worker of a bounded pool and walks its recipients sequentially in the
 * order the {@link ContactDirectory} returned them, so {@code results} follow recipient order.
 * A failed recipient is recorded and the batch continues; there are no retries inside a job.
 */
public class DefaultBulkDispatcher implements BulkDispatcher {
    private static final Logger log = LoggerFactory.getLogger(DefaultBulkDispatcher.class);

    private final ContactDirectory directory;
    private final BoundedMessageSender sender;
    private final JobTracker tracker;
    private final Duration delayBetweenSends;
    private final int maxConcurrentJobs;
    private final Duration shutdownGrace;
    private final String defaultCountryCode;
    private final MessageHistory history;

    private volatile ExecutorService workerPool;

    public DefaultBulkDispatcher(SendFlowProperties props,
                                 ContactDirectory directory,
                                 BoundedMessageSender sender,
                                 JobTracker tracker,
                                 MessageLog messageLog,
                                 Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");

        SendFlowProperties.Dispatch dispatch = props.getDispatch();
        this.delayBetweenSends = dispatch.getDelayBetweenSends() != null ? dispatch.getDelayBetweenSends() : Duration.ZERO;
        if (delayBetweenSends.isNegative()) {
            throw new IllegalArgumentException("sendflow.dispatch.delayBetweenSends must not be negative");
        }
        if (dispatch.getMaxConcurrentJobs() <= 0) {
            throw new IllegalArgumentException("sendflow.dispatch.maxConcurrentJobs must be positive");
        }
        this.maxConcurrentJobs = dispatch.getMaxConcurrentJobs();
        this.shutdownGrace = dispatch.getSendTimeout();
        this.defaultCountryCode = props.getDefaultCountryCode();
        this.history = new MessageHistory(messageLog, clock);
    }

    public synchronized void start() {
        if (workerPool != null) {
            return;
        }
        workerPool = Executors.newFixedThreadPool(maxConcurrentJobs, r -> {
            Thread t = new Thread(r);
            t.setName("sendflow.dispatcher");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Waits for running jobs up to the send timeout, then interrupts them. Interrupted jobs end as FAILED.
     */
    public synchronized void stop() {
        ExecutorService pool = workerPool;
        if (pool == null) {
            return;
        }
        workerPool = null;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    @Override
    public String dispatch(String groupId, String message) {
        if (groupId == null || groupId.isBlank()) {
            throw new InvalidInputException("groupId", "Group ID is required for bulk sending");
        }
        MessageTexts.requireValid(message);

        ExecutorService pool = workerPool;
        if (pool == null) {
            throw new SystemFailureException("Bulk dispatcher is not started");
        }

        if (!directory.groupExists(groupId)) {
            throw new NotFoundException("group", groupId);
        }
        List<Contact> found = directory.listContactsByGroup(groupId);
        List<Contact> contacts = found == null ? List.of() : List.copyOf(found);

        JobSnapshot job = tracker.create(contacts.size());
        log.info("sendflow bulk job created id={} groupId={} total={}", job.id(), groupId, contacts.size());

        if (contacts.isEmpty()) {
            tracker.finalize(job.id());
            return job.id();
        }

        try {
            pool.execute(() -> runJob(job.id(), contacts, message));
        } catch (RejectedExecutionException e) {
            abortQuietly(job.id(), "Bulk dispatcher is shutting down");
            throw new SystemFailureException("Bulk dispatcher rejected job " + job.id(), e);
        }
        return job.id();
    }

    private void runJob(String jobId, List<Contact> contacts, String message) {
        int total = contacts.size();
        try {
            for (int i = 0; i < total; i++) {
                Contact contact = contacts.get(i);
                log.debug("sendflow sending job={} recipient={}/{} name={}", jobId, i + 1, total, contact.name());

                tracker.recordResult(jobId, deliver(jobId, contact, message));

                if (i < total - 1 && !delayBetweenSends.isZero()) {
                    Thread.sleep(delayBetweenSends.toMillis());
                }
            }

            JobSnapshot done = tracker.finalize(jobId);
            log.info("sendflow bulk job finished id={} status={} sent={} failed={}",
                    jobId, done.status(), done.sent(), done.failedCount());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("sendflow bulk job interrupted id={}", jobId);
            abortQuietly(jobId, "Dispatch interrupted");
        } catch (Exception e) {
            log.error("sendflow bulk job failed id={} msg={}", jobId, e.getMessage(), e);
            abortQuietly(jobId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private RecipientResult deliver(String jobId, Contact contact, String message) {
        String destination;
        try {
            destination = PhoneNumbers.normalize(contact.phone(), defaultCountryCode);
        } catch (InvalidInputException e) {
            log.warn("sendflow recipient skipped job={} contactId={} msg={}", jobId, contact.id(), e.getMessage());
            return RecipientResult.failed(contact, e.getMessage());
        }

        DeliveryResult result = sender.send(destination, message);
        history.record(contact.id(), destination, message, jobId, result);
        if (result.success()) {
            return RecipientResult.delivered(contact);
        }
        log.warn("sendflow recipient failed job={} contactId={} msg={}", jobId, contact.id(), result.error());
        return RecipientResult.failed(contact, result.error());
    }

    private void abortQuietly(String jobId, String reason) {
        try {
            tracker.abort(jobId, reason);
        } catch (SendFlowException e) {
            log.warn("sendflow could not abort job id={} msg={}", jobId, e.getMessage());
        }
    }
}
