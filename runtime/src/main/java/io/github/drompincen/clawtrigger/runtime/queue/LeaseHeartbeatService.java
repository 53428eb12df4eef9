package io.github.drompincen.clawtrigger.runtime.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

@Service
public class LeaseHeartbeatService {

    private static final Logger log = LoggerFactory.getLogger(LeaseHeartbeatService.class);
    private static final long HEARTBEAT_INTERVAL_MS = 30_000;

    private final ExecutionQueue queue;
    private final Duration lease;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "lease-heartbeat");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, ScheduledFuture<?>> activeHeartbeats = new ConcurrentHashMap<>();

    public LeaseHeartbeatService(ExecutionQueue queue,
                                 @Value("${clawtrigger.queue.lease-seconds:90}") long leaseSeconds) {
        this.queue = queue;
        this.lease = Duration.ofSeconds(leaseSeconds);
    }

    public void startHeartbeat(QueuedJob job) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            try {
                if (!queue.extendLease(job, lease)) {
                    log.warn("Lease of job {} was lost, it may be redelivered", job.jobId());
                }
            } catch (Exception e) {
                log.warn("Heartbeat failed for job {}: {}", job.jobId(), e.getMessage());
            }
        }, HEARTBEAT_INTERVAL_MS, HEARTBEAT_INTERVAL_MS, TimeUnit.MILLISECONDS);

        activeHeartbeats.put(job.jobId(), future);
        log.debug("Started heartbeat for job {}", job.jobId());
    }

    public void stopHeartbeat(QueuedJob job) {
        ScheduledFuture<?> future = activeHeartbeats.remove(job.jobId());
        if (future != null) {
            future.cancel(false);
            log.debug("Stopped heartbeat for job {}", job.jobId());
        }
    }

    public void shutdown() {
        activeHeartbeats.values().forEach(f -> f.cancel(false));
        activeHeartbeats.clear();
        scheduler.shutdown();
    }
}
