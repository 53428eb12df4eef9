package io.github.drompincen.clawtrigger.runtime.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DistributedLockTest {

    private InMemoryLockStore store;
    private DistributedLock lock;

    @BeforeEach
    void setUp() {
        store = new InMemoryLockStore();
        lock = new DistributedLock(store);
    }

    @Test
    void acquireSucceedsWhenFree() {
        assertThat(lock.acquire("job", Duration.ofSeconds(30))).isTrue();
        assertThat(lock.isLocked("job")).isTrue();
        assertThat(store.values).containsKey(DistributedLock.KEY_PREFIX + "job");
    }

    @Test
    void secondAcquireFailsWhileHeld() {
        lock.acquire("job", Duration.ofSeconds(30));

        assertThat(lock.acquire("job", Duration.ofSeconds(30))).isFalse();
    }

    @Test
    void releaseFreesTheLock() {
        lock.acquire("job", Duration.ofSeconds(30));

        assertThat(lock.release("job")).isTrue();
        assertThat(lock.isLocked("job")).isFalse();
        assertThat(lock.acquire("job", Duration.ofSeconds(30))).isTrue();
    }

    @Test
    void releaseOfUnheldLockReturnsFalse() {
        assertThat(lock.release("nothing")).isFalse();
    }

    @Test
    void extendOnlyWorksWhileHeld() {
        assertThat(lock.extend("job", Duration.ofSeconds(10))).isFalse();

        lock.acquire("job", Duration.ofSeconds(30));

        assertThat(lock.extend("job", Duration.ofSeconds(10))).isTrue();
    }

    @Test
    void acquireFailsOpenWhenStoreIsDown() {
        store.down = true;

        assertThat(lock.acquire("job", Duration.ofSeconds(30))).isTrue();
        assertThat(lock.acquire("job", Duration.ofSeconds(30))).isTrue();
    }

    @Test
    void otherOperationsReportFalseWhenStoreIsDown() {
        store.down = true;

        assertThat(lock.release("job")).isFalse();
        assertThat(lock.extend("job", Duration.ofSeconds(5))).isFalse();
        assertThat(lock.isLocked("job")).isFalse();
    }

    @Test
    void leaseReleasesOnlyWhenAcquired() {
        lock.acquire("job", Duration.ofSeconds(30));

        try (LockLease lease = lock.tryLease("job", Duration.ofSeconds(30))) {
            assertThat(lease.acquired()).isFalse();
            assertThat(lease.extend(Duration.ofSeconds(30))).isFalse();
        }

        assertThat(lock.isLocked("job")).isTrue();
    }

    @Test
    void leaseReleasesOnClose() {
        try (LockLease lease = lock.tryLease("job", Duration.ofSeconds(30))) {
            assertThat(lease.acquired()).isTrue();
            assertThat(lease.name()).isEqualTo("job");
        }

        assertThat(lock.isLocked("job")).isFalse();
    }

    @Test
    void exactlyOneConcurrentContenderWins() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            DistributedLock instance = new DistributedLock(store);
            results.add(pool.submit(() -> {
                start.await();
                return instance.acquire("check_due_subscriptions", Duration.ofSeconds(60));
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) winners++;
        }
        pool.shutdownNow();

        assertThat(winners).isEqualTo(1);
    }
}
