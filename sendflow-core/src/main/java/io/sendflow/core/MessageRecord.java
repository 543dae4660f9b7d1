package io.sendflow.core;

import java.time.Instant;

/**
 * One entry of the send history: a single delivery attempt to one destination.
 *
 * @param contactId         contact the message went to, null for raw phone sends
 * @param phone             normalized destination the provider was called with
 * @param jobId             bulk job the send belonged to, null for individual sends
 * @param providerMessageId id the provider assigned, null when it gave none or the send failed
 */
public record MessageRecord(
        String id,
        String contactId,
        String phone,
        String message,
        MessageStatus status,
        String providerMessageId,
        String error,
        String jobId,
        Instant createdAt
) {
    public static MessageRecord of(String contactId, String phone, String message, String jobId,
                                   DeliveryResult result, Instant createdAt) {
        return new MessageRecord(
                null,
                contactId,
                phone,
                message,
                result.success() ? MessageStatus.SENT : MessageStatus.FAILED,
                result.providerMessageId(),
                result.error(),
                jobId,
                createdAt
        );
    }
}
