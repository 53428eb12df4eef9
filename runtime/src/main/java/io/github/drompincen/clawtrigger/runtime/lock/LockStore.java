package io.github.drompincen.clawtrigger.runtime.lock;

import java.time.Duration;

/**
 * Minimal key/value contract the distributed lock needs: SETNX-with-expiry, DEL, EXPIRE and EXISTS.
 * Implementations throw {@link LockStoreException} when the backing store cannot be reached.
 */
public interface LockStore {

    boolean setIfAbsent(String key, String value, Duration ttl);

    boolean delete(String key);

    boolean expire(String key, Duration ttl);

    boolean exists(String key);
}
