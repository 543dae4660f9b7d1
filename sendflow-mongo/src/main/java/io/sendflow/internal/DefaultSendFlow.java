package io.sendflow.internal;

import io.sendflow.ContactDirectory;
import io.sendflow.MessageSender;
import io.sendflow.ScheduleRequest;
import io.sendflow.ScheduleUpdate;
import io.sendflow.SendFlow;
import io.sendflow.config.SendFlowProperties;
import io.sendflow.core.DeliveryResult;
import io.sendflow.core.JobSnapshot;
import io.sendflow.core.JobTracker;
import io.sendflow.core.MessageLog;
import io.sendflow.core.MessageRecord;
import io.sendflow.core.MessageStatus;
import io.sendflow.core.Recipient;
import io.sendflow.core.Schedule;
import io.sendflow.core.ScheduleStore;
import io.sendflow.core.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link SendFlow} wiring: in-memory job tracking, pooled dispatch and a schedule runner
 * on top of the given {@link ScheduleStore} and {@link MessageLog}.
 *
 * <p>Send operations need {@link #start()} to have been called; schedule management does not.
 */
public class DefaultSendFlow implements SendFlow {
    private static final Logger log = LoggerFactory.getLogger(DefaultSendFlow.class);

    private final BoundedMessageSender sender;
    private final JobTracker jobTracker;
    private final MessageLog messageLog;
    private final DefaultBulkDispatcher bulkDispatcher;
    private final IndividualDispatcher individualDispatcher;
    private final ScheduleService scheduleService;
    private final ScheduleRunner scheduleRunner;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public DefaultSendFlow(SendFlowProperties props,
                           ScheduleStore scheduleStore,
                           ContactDirectory directory,
                           MessageSender messageSender,
                           Clock clock) {
        this(props, scheduleStore, new InMemoryMessageLog(props.getMessageLogCapacity()), directory, messageSender, clock);
    }

    public DefaultSendFlow(SendFlowProperties props,
                           ScheduleStore scheduleStore,
                           MessageLog messageLog,
                           ContactDirectory directory,
                           MessageSender messageSender,
                           Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.messageLog = Objects.requireNonNull(messageLog, "messageLog must not be null");
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(messageSender, "messageSender must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        this.sender = new BoundedMessageSender(
                messageSender,
                props.getDispatch().getSendTimeout(),
                props.getDispatch().getSenderThreads()
        );
        this.jobTracker = new InMemoryJobTracker(clock, props.getDispatch().getJobRetention());
        this.bulkDispatcher = new DefaultBulkDispatcher(props, directory, sender, jobTracker, messageLog, clock);
        this.individualDispatcher = new IndividualDispatcher(directory, sender, messageLog, clock, props.getDefaultCountryCode());
        this.scheduleService = new ScheduleService(props, scheduleStore, clock);
        this.scheduleRunner = new ScheduleRunner(props, scheduleStore, individualDispatcher, bulkDispatcher, clock);
    }

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        sender.start();
        bulkDispatcher.start();
        scheduleRunner.start();
        log.info("SendFlow started successfully.");
    }

    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("SendFlow stopping...");
        scheduleRunner.stop();
        bulkDispatcher.stop();
        sender.stop();
        log.info("SendFlow stopped successfully.");
    }

    @Override
    public DeliveryResult send(Recipient recipient, String message) {
        return individualDispatcher.send(recipient, message);
    }

    @Override
    public String sendBulk(String groupId, String message) {
        return bulkDispatcher.dispatch(groupId, message);
    }

    @Override
    public JobSnapshot job(String jobId) {
        return jobTracker.get(jobId);
    }

    @Override
    public Schedule schedule(ScheduleRequest request) {
        return scheduleService.create(request);
    }

    @Override
    public List<Schedule> schedules() {
        return scheduleService.list();
    }

    @Override
    public Schedule getSchedule(String scheduleId) {
        return scheduleService.get(scheduleId);
    }

    @Override
    public Schedule pause(String scheduleId) {
        return scheduleService.pause(scheduleId);
    }

    @Override
    public Schedule resume(String scheduleId) {
        return scheduleService.resume(scheduleId);
    }

    @Override
    public Schedule cancel(String scheduleId) {
        return scheduleService.cancel(scheduleId);
    }

    @Override
    public Schedule update(String scheduleId, ScheduleUpdate update) {
        return scheduleService.update(scheduleId, update);
    }

    @Override
    public List<MessageRecord> messages(MessageStatus status, String contactId, int limit) {
        if (limit <= 0) {
            throw new InvalidInputException("limit", "limit must be positive: " + limit);
        }
        return messageLog.find(status, contactId, limit);
    }
}
