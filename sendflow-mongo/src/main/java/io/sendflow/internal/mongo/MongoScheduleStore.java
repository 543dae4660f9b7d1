package io.sendflow.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.sendflow.core.FireOutcome;
import io.sendflow.core.Recipient;
import io.sendflow.core.Schedule;
import io.sendflow.core.ScheduleChanges;
import io.sendflow.core.ScheduleStatus;
import io.sendflow.core.ScheduleStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB persistence layer for schedules.
 *
 * <p>Every state change is a single conditional write ({@code findAndModify} or {@code updateFirst}
 * with the expected status in the filter), so concurrent callers and runners on other hosts never
 * observe or produce a half-applied transition.
 */
public class MongoScheduleStore implements ScheduleStore {

    private final MongoTemplate mongoTemplate;

    public MongoScheduleStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Schedule insert(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        ScheduleDocument saved = mongoTemplate.insert(toDocument(schedule));
        return toSchedule(saved);
    }

    @Override
    public Optional<Schedule> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, ScheduleDocument.class)).map(MongoScheduleStore::toSchedule);
    }

    @Override
    public List<Schedule> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        List<ScheduleDocument> docs = mongoTemplate.find(q, ScheduleDocument.class);
        List<Schedule> all = new ArrayList<>(docs.size());
        for (ScheduleDocument d : docs) {
            all.add(toSchedule(d));
        }
        return all;
    }

    @Override
    public Optional<Schedule> transition(String id, Set<ScheduleStatus> allowedFrom, ScheduleStatus to,
                                         Instant nextRunAt, Instant now) {
        Objects.requireNonNull(to, "to must not be null");
        Update u = new Update()
                .set("status", to)
                .set("updatedAt", now);
        if (nextRunAt != null) {
            u.set("nextRunAt", nextRunAt);
        } else {
            u.unset("nextRunAt");
        }
        return modifyIfIn(id, allowedFrom, u);
    }

    @Override
    public Optional<Schedule> update(String id, Set<ScheduleStatus> allowedFrom, ScheduleChanges changes, Instant now) {
        Objects.requireNonNull(changes, "changes must not be null");
        Update u = new Update()
                .set("message", changes.message())
                .set("updatedAt", now);
        if (changes.timingChanged()) {
            u.set("scheduleType", changes.scheduleType());
            setOrUnset(u, "runAt", changes.runAt());
            setOrUnset(u, "cronExpression", changes.cronExpression());
            setOrUnset(u, "timezone", changes.timezone());
            setOrUnset(u, "nextRunAt", changes.nextRunAt());
        }
        return modifyIfIn(id, allowedFrom, u);
    }

    private Optional<Schedule> modifyIfIn(String id, Set<ScheduleStatus> allowedFrom, Update u) {
        if (id == null || allowedFrom == null || allowedFrom.isEmpty()) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("_id").is(id).and("status").in(allowedFrom));
        ScheduleDocument doc = mongoTemplate.findAndModify(q, u, FindAndModifyOptions.options().returnNew(true), ScheduleDocument.class);
        return Optional.ofNullable(doc).map(MongoScheduleStore::toSchedule);
    }

    /**
     * Atomically claims (locks) at most {@code limit} due schedules.
     *
     * <p>A schedule is due when it is ACTIVE, {@code nextRunAt <= now}, and it is not locked or its
     * lock expired. Each claim is its own {@code findAndModify}, which keeps it safe when several
     * runners poll the same collection.
     */
    @Override
    public List<Schedule> claimDue(Instant now, int limit, Duration lockLifetime, String workerId) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query baseQuery = new Query(
                Criteria.where("status").is(ScheduleStatus.ACTIVE)
                        .and("nextRunAt").ne(null).lte(now)
                        .andOperator(
                                new Criteria().orOperator(
                                        Criteria.where("lockUntil").is(null),
                                        Criteria.where("lockUntil").lte(now)
                                )
                        )
        );
        baseQuery.with(Sort.by(Sort.Order.asc("nextRunAt")));

        Update lockUpdate = new Update()
                .set("lockedAt", now)
                .set("lockUntil", now.plus(lockLifetime))
                .set("lockedBy", workerId);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<Schedule> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            ScheduleDocument doc = mongoTemplate.findAndModify(baseQuery, lockUpdate, options, ScheduleDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toSchedule(doc));
        }
        return claimed;
    }

    @Override
    public Optional<Schedule> findClaimed(String id, String workerId, Instant now) {
        if (id == null || workerId == null) {
            return Optional.empty();
        }
        Query q = new Query(Criteria.where("_id").is(id)
                .and("lockedBy").is(workerId)
                .and("lockUntil").gt(now));
        return Optional.ofNullable(mongoTemplate.findOne(q, ScheduleDocument.class)).map(MongoScheduleStore::toSchedule);
    }

    /**
     * Two conditional writes: the first also moves the schedule (retire to DONE, or advance
     * {@code nextRunAt}) and only matches while the status still allows it. If a pause or cancel won
     * the race, the second write records the run and releases the lock without touching status.
     */
    @Override
    public boolean markFired(String id, String workerId, FireOutcome outcome) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");

        Criteria held = Criteria.where("_id").is(id)
                // Prevent stale write-back if another worker already re-claimed this schedule.
                .and("lockedBy").is(workerId);

        Update advance = firedUpdate(outcome);
        Query advanceQuery;
        if (outcome.retires()) {
            advanceQuery = new Query(Criteria.where("_id").is(id).and("lockedBy").is(workerId)
                    .and("status").ne(ScheduleStatus.CANCELLED));
            advance.set("status", ScheduleStatus.DONE).unset("nextRunAt");
        } else {
            advanceQuery = new Query(Criteria.where("_id").is(id).and("lockedBy").is(workerId)
                    .and("status").is(ScheduleStatus.ACTIVE));
            setOrUnset(advance, "nextRunAt", outcome.nextRunAt());
        }

        UpdateResult r = mongoTemplate.updateFirst(advanceQuery, advance, ScheduleDocument.class);
        if (r.getMatchedCount() > 0) {
            return true;
        }
        r = mongoTemplate.updateFirst(new Query(held), firedUpdate(outcome), ScheduleDocument.class);
        return r.getMatchedCount() > 0;
    }

    private static Update firedUpdate(FireOutcome outcome) {
        Update u = new Update()
                .set("lastRunAt", outcome.firedAt())
                .set("updatedAt", outcome.firedAt())
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
        setOrUnset(u, "lastError", outcome.error());
        if (outcome.jobId() != null) {
            u.set("lastJobId", outcome.jobId());
        }
        return u;
    }

    @Override
    public void release(String id, String workerId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("lockedBy").is(workerId));
        Update u = new Update()
                .unset("lockedAt")
                .unset("lockUntil")
                .unset("lockedBy");
        mongoTemplate.updateFirst(q, u, ScheduleDocument.class);
    }

    private static void setOrUnset(Update u, String key, Object value) {
        if (value != null) {
            u.set(key, value);
        } else {
            u.unset(key);
        }
    }

    static ScheduleDocument toDocument(Schedule s) {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setTargetType(s.targetType());
        doc.setScheduleType(s.scheduleType());
        if (s.recipient() instanceof Recipient.ByContact c) {
            doc.setContactId(c.contactId());
        } else if (s.recipient() instanceof Recipient.ByPhone p) {
            doc.setPhone(p.phone());
        }
        doc.setGroupId(s.groupId());
        doc.setMessage(s.message());
        doc.setRunAt(s.runAt());
        doc.setCronExpression(s.cronExpression());
        doc.setTimezone(s.timezone());
        doc.setNextRunAt(s.nextRunAt());
        doc.setStatus(s.status());
        doc.setLastRunAt(s.lastRunAt());
        doc.setLastError(s.lastError());
        doc.setLastJobId(s.lastJobId());
        doc.setCreatedAt(s.createdAt());
        doc.setUpdatedAt(s.updatedAt());
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Schedule)}; lock fields stay in the store.
     */
    static Schedule toSchedule(ScheduleDocument doc) {
        Recipient recipient = null;
        if (doc.getContactId() != null) {
            recipient = Recipient.contact(doc.getContactId());
        } else if (doc.getPhone() != null) {
            recipient = Recipient.phone(doc.getPhone());
        }
        return new Schedule(
                doc.getId(),
                doc.getTargetType(),
                doc.getScheduleType(),
                recipient,
                doc.getGroupId(),
                doc.getMessage(),
                doc.getRunAt(),
                doc.getCronExpression(),
                doc.getTimezone(),
                doc.getNextRunAt(),
                doc.getStatus(),
                doc.getLastRunAt(),
                doc.getLastError(),
                doc.getLastJobId(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }
}
