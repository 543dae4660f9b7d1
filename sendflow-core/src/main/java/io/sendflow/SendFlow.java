package io.sendflow;

import io.sendflow.core.DeliveryResult;
import io.sendflow.core.JobSnapshot;
import io.sendflow.core.MessageRecord;
import io.sendflow.core.MessageStatus;
import io.sendflow.core.Recipient;
import io.sendflow.core.Schedule;

import java.util.List;

/**
 * Main messaging API.
 *
 * <p>Supports three delivery styles:
 * <ul>
 *   <li>Immediate individual send, answered synchronously</li>
 *   <li>Immediate bulk send to a group, tracked as a job that callers poll</li>
 *   <li>Deferred sends: once at an absolute time or recurring by cron expression</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * sendFlow.start();
 *
 * String jobId = sendFlow.sendBulk("group-42", "Meeting moved to 10:00");
 * JobSnapshot job = sendFlow.job(jobId);
 *
 * sendFlow.schedule(ScheduleRequest.builder()
 *         .group("group-42")
 *         .message("Weekly reminder")
 *         .cron("0 9 * * MON")
 *         .build());
 * sendFlow.stop();
 * }</pre>
 */
public interface SendFlow {

    /**
     * Start the schedule runner. Idempotent.
     */
    void start();

    /**
     * Stop the schedule runner and the dispatch pools. Idempotent.
     */
    void stop();

    DeliveryResult send(Recipient recipient, String message);

    /**
     * @return job id; sending continues in the background
     */
    String sendBulk(String groupId, String message);

    JobSnapshot job(String jobId);

    Schedule schedule(ScheduleRequest request);

    /**
     * All schedules in creation order.
     */
    List<Schedule> schedules();

    Schedule getSchedule(String scheduleId);

    Schedule pause(String scheduleId);

    Schedule resume(String scheduleId);

    Schedule cancel(String scheduleId);

    Schedule update(String scheduleId, ScheduleUpdate update);

    /**
     * Send history, most recent first. Every individual send and every bulk recipient that reached
     * the provider leaves one record.
     *
     * @param status    filter by outcome; null for any
     * @param contactId filter by contact; null for any
     */
    List<MessageRecord> messages(MessageStatus status, String contactId, int limit);

    default List<MessageRecord> messages(int limit) {
        return messages(null, null, limit);
    }
}
