package io.github.drompincen.clawtrigger.runtime.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Best-effort named lease over a {@link LockStore}. There is no ownership token: release deletes the
 * key unconditionally, so a holder whose lease already expired can delete a successor's key.
 *
 * <p>Acquire is fail-open. When the store is unreachable the caller is told it holds the lock and
 * runs without exclusivity.
 */
@Component
public class DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(DistributedLock.class);
    public static final String KEY_PREFIX = "clawtrigger:lock:";

    private final LockStore store;
    private final String holderId;

    public DistributedLock(LockStore store) {
        this.store = store;
        this.holderId = ManagementFactory.getRuntimeMXBean().getName();
    }

    public boolean acquire(String name, Duration ttl) {
        String key = KEY_PREFIX + name;
        try {
            boolean acquired = store.setIfAbsent(key, holderId, ttl);
            if (acquired) {
                log.debug("Acquired lock {} for {}s", name, ttl.toSeconds());
            } else {
                log.debug("Lock {} is held by another instance", name);
            }
            return acquired;
        } catch (LockStoreException e) {
            log.warn("Lock store unavailable acquiring {}, proceeding without lock: {}", name, e.getMessage());
            return true;
        }
    }

    public boolean release(String name) {
        try {
            boolean deleted = store.delete(KEY_PREFIX + name);
            log.debug("Released lock {} (existed={})", name, deleted);
            return deleted;
        } catch (LockStoreException e) {
            log.warn("Failed to release lock {}: {}", name, e.getMessage());
            return false;
        }
    }

    public boolean extend(String name, Duration ttl) {
        try {
            boolean extended = store.expire(KEY_PREFIX + name, ttl);
            if (!extended) {
                log.warn("Could not extend lock {}, it is no longer held", name);
            }
            return extended;
        } catch (LockStoreException e) {
            log.warn("Failed to extend lock {}: {}", name, e.getMessage());
            return false;
        }
    }

    public boolean isLocked(String name) {
        try {
            return store.exists(KEY_PREFIX + name);
        } catch (LockStoreException e) {
            log.warn("Failed to check lock {}: {}", name, e.getMessage());
            return false;
        }
    }

    public LockLease tryLease(String name, Duration ttl) {
        return new LockLease(this, name, acquire(name, ttl));
    }
}
