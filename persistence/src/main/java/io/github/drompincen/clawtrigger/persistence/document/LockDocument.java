package io.github.drompincen.clawtrigger.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "locks")
public class LockDocument {

    @Id
    private String lockKey;
    private String holder;

    // Mongo's TTL monitor only sweeps about once a minute, so readers still compare against now.
    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;
    private Instant acquiredAt;

    public LockDocument() {}

    public String getLockKey() { return lockKey; }
    public void setLockKey(String lockKey) { this.lockKey = lockKey; }

    public String getHolder() { return holder; }
    public void setHolder(String holder) { this.holder = holder; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public Instant getAcquiredAt() { return acquiredAt; }
    public void setAcquiredAt(Instant acquiredAt) { this.acquiredAt = acquiredAt; }
}
