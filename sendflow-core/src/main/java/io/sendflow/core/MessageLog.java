package io.sendflow.core;

import java.util.List;

/**
 * Persistence seam for the send history.
 */
public interface MessageLog {

    /**
     * Stores a record and returns it with its generated id.
     */
    MessageRecord append(MessageRecord record);

    /**
     * Most recent records first.
     *
     * @param status    only records with this status; null for any
     * @param contactId only records sent to this contact; null for any
     * @param limit     maximum number of records returned
     */
    List<MessageRecord> find(MessageStatus status, String contactId, int limit);
}
