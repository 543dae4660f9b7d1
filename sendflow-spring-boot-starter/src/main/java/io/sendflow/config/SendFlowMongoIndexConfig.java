package io.sendflow.config;

import io.sendflow.internal.mongo.MessageDocument;
import io.sendflow.internal.mongo.ScheduleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;

/**
 * MongoDB index definitions for the schedule and send history collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code sendflow.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Required indexes (collection: {@code scheduled_messages})</h3>
 * <ul>
 *   <li><b>idx_due_claim</b>: { status: 1, nextRunAt: 1, lockUntil: 1 }
 *       <br/>Used by the runner to claim due ACTIVE schedules.</li>
 *   <li><b>idx_created</b>: { createdAt: 1, _id: 1 }
 *       <br/>Used by listing in creation order.</li>
 * </ul>
 *
 * <h3>Required indexes (collection: {@code messages})</h3>
 * <ul>
 *   <li><b>idx_message_history</b>: { createdAt: -1, _id: -1 }
 *       <br/>Used by the send history, most recent first.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_messages.createIndex({ status: 1, nextRunAt: 1, lockUntil: 1 }, { name: "idx_due_claim" });
 * db.scheduled_messages.createIndex({ createdAt: 1, _id: 1 }, { name: "idx_created" });
 * db.messages.createIndex({ createdAt: -1, _id: -1 }, { name: "idx_message_history" });
 * </pre>
 */
public class SendFlowMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_CREATED = "idx_created";
    public static final String IDX_MESSAGE_HISTORY = "idx_message_history";

    private final MongoTemplate mongoTemplate;

    public SendFlowMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        IndexOperations ops = mongoTemplate.indexOps(ScheduleDocument.class);
        ops.ensureIndex(dueClaimIndex());
        ops.ensureIndex(createdIndex());
        mongoTemplate.indexOps(MessageDocument.class).ensureIndex(messageHistoryIndex());
    }

    /**
     * Keys: status ASC, nextRunAt ASC, lockUntil ASC
     */
    public static Index dueClaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    /**
     * Keys: createdAt ASC, _id ASC
     */
    public static Index createdIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .on("_id", Sort.Direction.ASC)
                .named(IDX_CREATED);
    }

    /**
     * Keys: createdAt DESC, _id DESC
     */
    public static Index messageHistoryIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.DESC)
                .on("_id", Sort.Direction.DESC)
                .named(IDX_MESSAGE_HISTORY);
    }
}
