package io.sendflow.core;

import java.time.Instant;

/**
 * Fully resolved payload and timing fields written by {@link ScheduleStore#update}.
 *
 * <p>When {@code timingChanged} is false only {@code message} is written, so an edit never
 * overwrites a {@code nextRunAt} the runner advanced in the meantime.
 *
 * @param nextRunAt null leaves the schedule without a pending occurrence (PAUSED schedules)
 */
public record ScheduleChanges(
        String message,
        boolean timingChanged,
        ScheduleType scheduleType,
        Instant runAt,
        String cronExpression,
        String timezone,
        Instant nextRunAt
) {
    public static ScheduleChanges messageOnly(String message) {
        return new ScheduleChanges(message, false, null, null, null, null, null);
    }
}
