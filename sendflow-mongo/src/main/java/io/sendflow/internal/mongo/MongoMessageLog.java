package io.sendflow.internal.mongo;

import io.sendflow.core.MessageLog;
import io.sendflow.core.MessageRecord;
import io.sendflow.core.MessageStatus;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MongoDB persistence layer for the send history (collection {@code messages}).
 */
public class MongoMessageLog implements MessageLog {

    private final MongoTemplate mongoTemplate;

    public MongoMessageLog(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public MessageRecord append(MessageRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        MessageDocument doc = new MessageDocument();
        doc.setContactId(record.contactId());
        doc.setPhone(record.phone());
        doc.setContent(record.message());
        doc.setStatus(record.status());
        doc.setProviderMessageId(record.providerMessageId());
        doc.setError(record.error());
        doc.setJobId(record.jobId());
        doc.setCreatedAt(record.createdAt());
        return toRecord(mongoTemplate.insert(doc));
    }

    @Override
    public List<MessageRecord> find(MessageStatus status, String contactId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query();
        if (status != null) {
            q.addCriteria(Criteria.where("status").is(status));
        }
        if (contactId != null) {
            q.addCriteria(Criteria.where("contactId").is(contactId));
        }
        q.with(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("_id"))).limit(limit);

        List<MessageDocument> docs = mongoTemplate.find(q, MessageDocument.class);
        List<MessageRecord> found = new ArrayList<>(docs.size());
        for (MessageDocument d : docs) {
            found.add(toRecord(d));
        }
        return found;
    }

    static MessageRecord toRecord(MessageDocument doc) {
        return new MessageRecord(
                doc.getId(),
                doc.getContactId(),
                doc.getPhone(),
                doc.getContent(),
                doc.getStatus(),
                doc.getProviderMessageId(),
                doc.getError(),
                doc.getJobId(),
                doc.getCreatedAt()
        );
    }
}
