package io.sendflow;

import io.sendflow.core.Recipient;
import io.sendflow.core.ScheduleType;
import io.sendflow.core.TargetType;
import io.sendflow.core.exception.InvalidInputException;
import io.sendflow.utils.CronSchedules;
import io.sendflow.utils.MessageTexts;
import io.sendflow.utils.Timestamps;

import java.time.Instant;

/**
 * ScheduleRequest describes a deferred or recurring send.
 *
 * <p>This is an API-layer object. Structural rules (exactly one target, exactly one timing rule,
 * cron syntax, message text) are checked by {@link Builder#build()}; rules that depend on the
 * clock, such as how far in the past {@code runAt} may be, are checked when the schedule is created.
 */
public final class ScheduleRequest {

    private final TargetType targetType;
    private final ScheduleType scheduleType;
    private final Recipient recipient;
    private final String groupId;
    private final String message;
    private final String runAt;
    private final String cronExpression;
    private final String timezone;

    private ScheduleRequest(Builder b, TargetType targetType, ScheduleType scheduleType, Recipient recipient) {
        this.targetType = targetType;
        this.scheduleType = scheduleType;
        this.recipient = recipient;
        this.groupId = b.groupId;
        this.message = b.message;
        this.runAt = b.runAt;
        this.cronExpression = b.cron;
        this.timezone = b.timezone;
    }

    public TargetType targetType() {
        return targetType;
    }

    public ScheduleType scheduleType() {
        return scheduleType;
    }

    /**
     * Set for INDIVIDUAL requests.
     */
    public Recipient recipient() {
        return recipient;
    }

    /**
     * Set for GROUP requests.
     */
    public String groupId() {
        return groupId;
    }

    public String message() {
        return message;
    }

    /**
     * Raw ISO date-time for ONCE requests; local date-times are read in {@link #timezone()}.
     */
    public String runAt() {
        return runAt;
    }

    public String cronExpression() {
        return cronExpression;
    }

    /**
     * IANA zone id, or null for the configured default.
     */
    public String timezone() {
        return timezone;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String contactId;
        private String phone;
        private String groupId;
        private String message;
        private String runAt;
        private String cron;
        private String timezone;

        public Builder contact(String contactId) {
            this.contactId = contactId;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder recipient(Recipient recipient) {
            if (recipient == null) {
                throw new InvalidInputException("recipient", "recipient must not be null");
            }
            if (recipient instanceof Recipient.ByContact c) {
                this.contactId = c.contactId();
            } else {
                this.phone = ((Recipient.ByPhone) recipient).phone();
            }
            return this;
        }

        public Builder group(String groupId) {
            this.groupId = groupId;
            return this;
        }

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

        public ScheduleRequest build() {
            boolean hasContact = !isBlank(contactId);
            boolean hasPhone = !isBlank(phone);
            boolean hasGroup = !isBlank(groupId);

            if (hasContact && hasPhone) {
                throw new InvalidInputException("recipient", "Provide either contactId or phone, not both");
            }
            if ((hasContact || hasPhone) && hasGroup) {
                throw new InvalidInputException("target", "A schedule targets either one recipient or one group");
            }
            if (!hasContact && !hasPhone && !hasGroup) {
                throw new InvalidInputException("target", "For individual type, provide contactId or phone; for group type, provide groupId");
            }

            boolean hasRunAt = !isBlank(runAt);
            boolean hasCron = !isBlank(cron);
            if (hasRunAt == hasCron) {
                throw new InvalidInputException("schedule", "Provide exactly one of runAt (one-time) or cron (recurring)");
            }
            if (hasCron && !CronSchedules.isValid(cron)) {
                throw new InvalidInputException("cron", "Invalid cron expression: " + cron);
            }
            if (!isBlank(timezone)) {
                Timestamps.zone(timezone, null);
            }
            MessageTexts.requireValid(message);

            Recipient recipient = hasContact ? Recipient.contact(contactId)
                    : hasPhone ? Recipient.phone(phone)
                    : null;
            return new ScheduleRequest(
                    this,
                    hasGroup ? TargetType.GROUP : TargetType.INDIVIDUAL,
                    hasCron ? ScheduleType.CRON : ScheduleType.ONCE,
                    recipient
            );
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }
}
