package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Field-level updates to subscriptions made by the scheduler and the workers. Each one bumps the
 * document version, so a user edit saved from a stale copy fails instead of overwriting counters.
 * The scheduler's own claim is guarded on schedule fields rather than the version, so outcome
 * bookkeeping never invalidates a firing.
 */
@Component
public class SubscriptionStateStore {

    private final MongoTemplate mongoTemplate;

    public SubscriptionStateStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Claims the fire scheduled at {@code dueAt} and moves the schedule forward. False means another
     * scan already claimed it, or the subscription was rescheduled, disabled or deleted meanwhile.
     */
    public boolean advanceSchedule(String subscriptionId, Instant dueAt, Instant nextExecutionTime,
                                   boolean enabled, Instant now) {
        Query query = byId(subscriptionId)
                .addCriteria(Criteria.where("nextExecutionTime").is(dueAt))
                .addCriteria(Criteria.where("enabled").is(true))
                .addCriteria(Criteria.where("deleted").is(false));
        Update update = new Update()
                .set("nextExecutionTime", nextExecutionTime)
                .set("enabled", enabled)
                .set("updatedAt", now)
                .inc("scheduledRunCount", 1)
                .inc("version", 1);
        return mongoTemplate.updateFirst(query, update, SubscriptionDocument.class).getModifiedCount() > 0;
    }

    /** Only COMPLETED and FAILED count; silent completions leave the statistics untouched. */
    public boolean recordOutcome(String subscriptionId, ExecutionStatus status, Instant now) {
        if (status != ExecutionStatus.COMPLETED && status != ExecutionStatus.FAILED) {
            return false;
        }
        Update update = new Update()
                .set("lastExecutionTime", now)
                .set("lastExecutionStatus", status)
                .inc("executionCount", 1)
                .inc(status == ExecutionStatus.COMPLETED ? "successCount" : "failureCount", 1)
                .set("updatedAt", now)
                .inc("version", 1);
        return mongoTemplate.updateFirst(byId(subscriptionId), update, SubscriptionDocument.class)
                .getModifiedCount() > 0;
    }

    private Query byId(String subscriptionId) {
        return new Query().addCriteria(Criteria.where("subscriptionId").is(subscriptionId));
    }
}
