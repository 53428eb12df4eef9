package io.github.drompincen.clawtrigger.persistence.repository;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface BackgroundExecutionRepository extends MongoRepository<BackgroundExecutionDocument, String> {
    List<BackgroundExecutionDocument> findByStatusAndTaskIdAndCreatedAtLessThanOrderByCreatedAtAsc(
            ExecutionStatus status, long taskId, Instant threshold, Pageable page);
    List<BackgroundExecutionDocument> findByStatusAndUpdatedAtLessThan(ExecutionStatus status, Instant threshold);
    List<BackgroundExecutionDocument> findBySubscriptionIdOrderByCreatedAtDesc(String subscriptionId);
    long countByStatus(ExecutionStatus status);
}
