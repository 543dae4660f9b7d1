package io.sendflow.internal;

import io.sendflow.core.DeliveryResult;
import io.sendflow.core.MessageLog;
import io.sendflow.core.MessageRecord;
import io.sendflow.utils.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Writes delivery attempts to the {@link MessageLog}.
 *
 * <p>A failed write is logged; it never changes the delivery result returned to the caller.
 */
class MessageHistory {
    private static final Logger log = LoggerFactory.getLogger(MessageHistory.class);

    private final MessageLog messageLog;
    private final Clock clock;

    MessageHistory(MessageLog messageLog, Clock clock) {
        this.messageLog = Objects.requireNonNull(messageLog, "messageLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    void record(String contactId, String destination, String message, String jobId, DeliveryResult result) {
        try {
            messageLog.append(MessageRecord.of(contactId, destination, message, jobId, result, clock.instant()));
        } catch (RuntimeException e) {
            log.error("sendflow could not record message destination={} jobId={} msg={}",
                    PhoneNumbers.mask(destination), jobId, e.getMessage(), e);
        }
    }
}
