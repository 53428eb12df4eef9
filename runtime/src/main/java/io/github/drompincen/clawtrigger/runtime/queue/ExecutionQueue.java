package io.github.drompincen.clawtrigger.runtime.queue;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.protocol.api.QueueStats;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared work queue with at-least-once delivery. A claimed job is leased to one consumer; it is
 * removed on {@link #ack}, and becomes visible again when rejected with requeue or when its lease
 * runs out. Jobs delivered too many times are parked as dead letters.
 */
public interface ExecutionQueue {

    void enqueue(String jobId, QueuedJobDocument.Kind kind, String payload, Duration delay);

    default String enqueueExecution(String executionId, Duration delay) {
        String jobId = UUID.randomUUID().toString();
        enqueue(jobId, QueuedJobDocument.Kind.EXECUTION, executionId, delay);
        return jobId;
    }

    Optional<QueuedJob> poll(String consumerId);

    /** True while a READY or CLAIMED job carries {@code payload}. */
    boolean hasOutstanding(String payload);

    void ack(QueuedJob job);

    void reject(QueuedJob job, boolean requeue, Duration delay, String error);

    boolean extendLease(QueuedJob job, Duration lease);

    int recoverExpiredLeases();

    QueueStats stats();

    List<QueuedJob> listDeadLetters();

    boolean requeueDeadLetter(String jobId);

    long purgeDeadLetters();
}
