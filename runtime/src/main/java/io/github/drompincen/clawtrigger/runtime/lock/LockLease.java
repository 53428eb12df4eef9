package io.github.drompincen.clawtrigger.runtime.lock;

import java.time.Duration;

public final class LockLease implements AutoCloseable {

    private final DistributedLock lock;
    private final String name;
    private final boolean acquired;
    private boolean released;

    LockLease(DistributedLock lock, String name, boolean acquired) {
        this.lock = lock;
        this.name = name;
        this.acquired = acquired;
    }

    public String name() {
        return name;
    }

    public boolean acquired() {
        return acquired;
    }

    public boolean extend(Duration ttl) {
        return acquired && !released && lock.extend(name, ttl);
    }

    @Override
    public void close() {
        if (acquired && !released) {
            released = true;
            lock.release(name);
        }
    }
}
