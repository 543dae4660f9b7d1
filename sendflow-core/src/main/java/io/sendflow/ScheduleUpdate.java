package io.sendflow;

import io.sendflow.core.exception.InvalidInputException;
import io.sendflow.utils.CronSchedules;
import io.sendflow.utils.MessageTexts;
import io.sendflow.utils.Timestamps;

import java.time.Instant;

/**
 * Partial edit of a schedule's message or timing. Null fields are left unchanged.
 *
 * <p>Setting {@code runAt} turns the schedule into a one-time schedule, setting {@code cron} into a
 * recurring one. The target of a schedule cannot be edited.
 */
public final class ScheduleUpdate {

    private final String message;
    private final String runAt;
    private final String cronExpression;
    private final String timezone;

    private ScheduleUpdate(String message, String runAt, String cronExpression, String timezone) {
        this.message = message;
        this.runAt = runAt;
        this.cronExpression = cronExpression;
        this.timezone = timezone;
    }

    public String message() {
        return message;
    }

    public String runAt() {
        return runAt;
    }

    public String cronExpression() {
        return cronExpression;
    }

    public String timezone() {
        return timezone;
    }

    public boolean changesTiming() {
        return runAt != null || cronExpression != null || timezone != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String message;
        private String runAt;
        private String cron;
        private String timezone;

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder runAt(String runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder runAt(Instant runAt) {
            this.runAt = runAt == null ? null : runAt.toString();
            return this;
        }

        public Builder cron(String cronExpression) {
            this.cron = cronExpression;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public ScheduleUpdate build() {
            if (message == null && runAt == null && cron == null && timezone == null) {
                throw new InvalidInputException("ScheduleUpdate must change at least one of message, runAt, cron or timezone");
            }
            if (runAt != null && cron != null) {
                throw new InvalidInputException("schedule", "Provide at most one of runAt or cron");
            }
            if (message != null) {
                MessageTexts.requireValid(message);
            }
            if (cron != null && !CronSchedules.isValid(cron)) {
                throw new InvalidInputException("cron", "Invalid cron expression: " + cron);
            }
            if (runAt != null && runAt.isBlank()) {
                throw new InvalidInputException("runAt", "runAt must not be blank");
            }
            if (timezone != null) {
                Timestamps.zone(timezone, null);
            }
            return new ScheduleUpdate(message, runAt, cron, timezone);
        }
    }
}
