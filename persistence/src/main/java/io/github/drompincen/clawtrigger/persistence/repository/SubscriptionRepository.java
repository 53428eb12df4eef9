package io.github.drompincen.clawtrigger.persistence.repository;

import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface SubscriptionRepository extends MongoRepository<SubscriptionDocument, String> {
    List<SubscriptionDocument>
            findByEnabledTrueAndDeletedFalseAndTriggerTypeInAndNextExecutionTimeLessThanEqualAndSubscriptionIdGreaterThanOrderBySubscriptionIdAsc(
            Collection<TriggerType> types, Instant now, String afterId, Pageable page);
    List<SubscriptionDocument> findByEnabledTrueAndDeletedFalseAndTriggerType(TriggerType type);
    List<SubscriptionDocument> findByUserIdAndDeletedFalse(String userId);
}
