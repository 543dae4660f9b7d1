package io.sendflow.internal;

import io.sendflow.core.MessageLog;
import io.sendflow.core.MessageRecord;
import io.sendflow.core.MessageStatus;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Process-local {@link MessageLog} holding the most recent {@code capacity} records.
 */
public class InMemoryMessageLog implements MessageLog {

    private final Deque<MessageRecord> records = new ArrayDeque<>();
    private final int capacity;

    public InMemoryMessageLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized MessageRecord append(MessageRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        MessageRecord stored = new MessageRecord(
                UUID.randomUUID().toString(),
                record.contactId(),
                record.phone(),
                record.message(),
                record.status(),
                record.providerMessageId(),
                record.error(),
                record.jobId(),
                record.createdAt()
        );
        records.addFirst(stored);
        while (records.size() > capacity) {
            records.removeLast();
        }
        return stored;
    }

    @Override
    public synchronized List<MessageRecord> find(MessageStatus status, String contactId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<MessageRecord> found = new ArrayList<>(Math.min(limit, records.size()));
        Iterator<MessageRecord> it = records.iterator();
        while (it.hasNext() && found.size() < limit) {
            MessageRecord r = it.next();
            if ((status == null || r.status() == status) && (contactId == null || contactId.equals(r.contactId()))) {
                found.add(r);
            }
        }
        return found;
    }
}
