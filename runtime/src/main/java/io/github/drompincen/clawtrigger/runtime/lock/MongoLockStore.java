package io.github.drompincen.clawtrigger.runtime.lock;

import io.github.drompincen.clawtrigger.persistence.document.LockDocument;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Lock store over the {@code locks} collection. The document id is the lock key, so a concurrent
 * insert of the same key fails with a duplicate key error. Expired documents that the TTL monitor
 * has not swept yet are taken over with a conditional update.
 */
@Component
@ConditionalOnProperty(name = "clawtrigger.lock.store", havingValue = "mongo", matchIfMissing = true)
public class MongoLockStore implements LockStore {

    private final MongoTemplate mongoTemplate;

    public MongoLockStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Instant now = Instant.now();
        LockDocument lock = new LockDocument();
        lock.setLockKey(key);
        lock.setHolder(value);
        lock.setAcquiredAt(now);
        lock.setExpiresAt(now.plus(ttl));
        try {
            mongoTemplate.insert(lock);
            return true;
        } catch (DuplicateKeyException e) {
            return takeOverExpired(key, value, ttl, now);
        } catch (DataAccessException e) {
            throw new LockStoreException("Insert failed for " + key, e);
        }
    }

    private boolean takeOverExpired(String key, String value, Duration ttl, Instant now) {
        Query expired = new Query()
                .addCriteria(Criteria.where("lockKey").is(key))
                .addCriteria(Criteria.where("expiresAt").lte(now));
        Update update = new Update()
                .set("holder", value)
                .set("acquiredAt", now)
                .set("expiresAt", now.plus(ttl));
        try {
            return mongoTemplate.updateFirst(expired, update, LockDocument.class).getModifiedCount() > 0;
        } catch (DataAccessException e) {
            throw new LockStoreException("Takeover failed for " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return mongoTemplate.remove(byKey(key), LockDocument.class).getDeletedCount() > 0;
        } catch (DataAccessException e) {
            throw new LockStoreException("Delete failed for " + key, e);
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        Instant now = Instant.now();
        Query live = byKey(key).addCriteria(Criteria.where("expiresAt").gt(now));
        try {
            return mongoTemplate.updateFirst(live, new Update().set("expiresAt", now.plus(ttl)), LockDocument.class)
                    .getModifiedCount() > 0;
        } catch (DataAccessException e) {
            throw new LockStoreException("Expire failed for " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        Query live = byKey(key).addCriteria(Criteria.where("expiresAt").gt(Instant.now()));
        try {
            return mongoTemplate.exists(live, LockDocument.class);
        } catch (DataAccessException e) {
            throw new LockStoreException("Exists failed for " + key, e);
        }
    }

    private Query byKey(String key) {
        return new Query().addCriteria(Criteria.where("lockKey").is(key));
    }
}
