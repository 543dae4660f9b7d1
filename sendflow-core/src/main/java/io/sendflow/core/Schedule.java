package io.sendflow.core;

import java.time.Instant;

/**
 * Immutable view of a persisted send intent.
 */
public record Schedule(

        // identity
        String id,
        TargetType targetType,
        ScheduleType scheduleType,

        // target: recipient for INDIVIDUAL, groupId for GROUP
        Recipient recipient,
        String groupId,

        // payload
        String message,

        // timing
        Instant runAt,
        String cronExpression,
        String timezone,
        Instant nextRunAt,

        // lifecycle
        ScheduleStatus status,
        Instant lastRunAt,
        String lastError,
        String lastJobId,
        Instant createdAt,
        Instant updatedAt
) {
}
