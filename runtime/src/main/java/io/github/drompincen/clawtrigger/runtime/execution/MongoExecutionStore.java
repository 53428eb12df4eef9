package io.github.drompincen.clawtrigger.runtime.execution;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

@Component
public class MongoExecutionStore implements ExecutionStore {

    private final MongoTemplate mongoTemplate;

    public MongoExecutionStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public BackgroundExecutionDocument insert(BackgroundExecutionDocument execution) {
        return mongoTemplate.insert(execution);
    }

    @Override
    public Optional<BackgroundExecutionDocument> findById(String executionId) {
        return Optional.ofNullable(mongoTemplate.findById(executionId, BackgroundExecutionDocument.class));
    }

    @Override
    public Optional<BackgroundExecutionDocument> compareAndSet(String executionId, long expectedVersion,
                                                               ExecutionStatus expectedStatus, ExecutionStatus next,
                                                               ExecutionMutation mutation, Instant now) {
        Query query = new Query()
                .addCriteria(Criteria.where("executionId").is(executionId))
                .addCriteria(Criteria.where("version").is(expectedVersion))
                .addCriteria(Criteria.where("status").is(expectedStatus));

        Update update = new Update()
                .set("status", next)
                .set("updatedAt", now)
                .inc("version", 1);
        if (next == ExecutionStatus.RUNNING) {
            update.set("startedAt", now);
        }
        if (next.isTerminal()) {
            update.set("completedAt", now);
        }
        if (mutation.resultSummary() != null) {
            update.set("resultSummary", mutation.resultSummary());
        }
        if (mutation.errorMessage() != null) {
            update.set("errorMessage", mutation.errorMessage());
        }
        if (mutation.retryAttempt() != null) {
            update.set("retryAttempt", mutation.retryAttempt());
        }
        if (mutation.taskId() != null) {
            update.set("taskId", mutation.taskId());
        }

        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), BackgroundExecutionDocument.class));
    }
}
