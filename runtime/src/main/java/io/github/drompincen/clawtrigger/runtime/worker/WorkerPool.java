package io.github.drompincen.clawtrigger.runtime.worker;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.queue.LeaseHeartbeatService;
import io.github.drompincen.clawtrigger.runtime.queue.QueuedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of poll loops over the shared queue. Each loop claims a job, hands it to the handler
 * for its kind while a heartbeat keeps the lease alive, then acks it or requeues it on failure.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    static final Duration CRASH_REQUEUE_DELAY = Duration.ofSeconds(30);

    private final ExecutionQueue queue;
    private final Map<QueuedJobDocument.Kind, QueuedJobHandler> handlers = new EnumMap<>(QueuedJobDocument.Kind.class);
    private final LeaseHeartbeatService heartbeat;
    private final int concurrency;
    private final long pollIntervalMs;
    private final String consumerPrefix = ManagementFactory.getRuntimeMXBean().getName();

    private volatile boolean running;
    private volatile CountDownLatch stopSignal = new CountDownLatch(0);
    private ExecutorService loops;

    public WorkerPool(ExecutionQueue queue,
                      List<QueuedJobHandler> handlers,
                      LeaseHeartbeatService heartbeat,
                      @Value("${clawtrigger.worker.concurrency:2}") int concurrency,
                      @Value("${clawtrigger.worker.poll-interval-ms:1000}") long pollIntervalMs) {
        this.queue = queue;
        handlers.forEach(h -> this.handlers.put(h.kind(), h));
        this.heartbeat = heartbeat;
        this.concurrency = concurrency;
        this.pollIntervalMs = pollIntervalMs;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        stopSignal = new CountDownLatch(1);
        AtomicInteger counter = new AtomicInteger();
        loops = Executors.newFixedThreadPool(concurrency, r -> new Thread(r, "clawtrigger-worker-" + counter.incrementAndGet()));
        running = true;
        for (int i = 1; i <= concurrency; i++) {
            String consumerId = consumerPrefix + "-w" + i;
            loops.execute(() -> loop(consumerId));
        }
        log.info("Worker pool started with {} loop(s)", concurrency);
    }

    /** Signals every loop to stop and waits up to {@code timeout}; returns false if loops were interrupted. */
    public synchronized boolean stop(Duration timeout) {
        if (!running) {
            return true;
        }
        running = false;
        stopSignal.countDown();
        loops.shutdown();
        try {
            if (loops.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Worker pool stopped");
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.warn("Worker pool did not stop within {}s, interrupting", timeout.getSeconds());
        loops.shutdownNow();
        return false;
    }

    public boolean isRunning() {
        return running;
    }

    private void loop(String consumerId) {
        log.debug("Worker loop {} started", consumerId);
        while (running) {
            try {
                Optional<QueuedJob> job = queue.poll(consumerId);
                if (job.isPresent()) {
                    processOne(job.get());
                } else {
                    idle();
                }
            } catch (Exception e) {
                log.error("Worker loop {} failed to poll", consumerId, e);
                idle();
            }
        }
        log.debug("Worker loop {} stopped", consumerId);
    }

    void processOne(QueuedJob job) {
        QueuedJobHandler handler = handlers.get(job.kind());
        if (handler == null) {
            queue.reject(job, false, Duration.ZERO, "No handler for job kind " + job.kind());
            return;
        }
        heartbeat.startHeartbeat(job);
        try {
            handler.handle(job);
            queue.ack(job);
        } catch (Exception e) {
            log.error("Job {} ({}) failed on delivery {}", job.jobId(), job.kind(), job.deliveries(), e);
            queue.reject(job, true, CRASH_REQUEUE_DELAY, e.getMessage() != null ? e.getMessage() : e.toString());
        } finally {
            heartbeat.stopHeartbeat(job);
        }
    }

    private void idle() {
        try {
            stopSignal.await(pollIntervalMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
