package io.github.drompincen.clawtrigger.runtime.lock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConditionalOnProperty(name = "clawtrigger.lock.store", havingValue = "redis")
public class RedisLockStore implements LockStore {

    private final StringRedisTemplate redisTemplate;

    public RedisLockStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        try {
            return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
        } catch (DataAccessException e) {
            throw new LockStoreException("SET NX failed for " + key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.delete(key));
        } catch (DataAccessException e) {
            throw new LockStoreException("DEL failed for " + key, e);
        }
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        try {
            return Boolean.TRUE.equals(redisTemplate.expire(key, ttl));
        } catch (DataAccessException e) {
            throw new LockStoreException("EXPIRE failed for " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key));
        } catch (DataAccessException e) {
            throw new LockStoreException("EXISTS failed for " + key, e);
        }
    }
}
