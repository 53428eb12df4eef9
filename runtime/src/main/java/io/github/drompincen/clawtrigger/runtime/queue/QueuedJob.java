package io.github.drompincen.clawtrigger.runtime.queue;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;

import java.time.Instant;

public record QueuedJob(
        String jobId,
        QueuedJobDocument.Kind kind,
        String payload,
        int deliveries,
        int maxDeliveries,
        String consumer,
        String lastError,
        Instant createdAt
) {
    static QueuedJob from(QueuedJobDocument doc) {
        return new QueuedJob(doc.getJobId(), doc.getKind(), doc.getPayload(), doc.getDeliveries(),
                doc.getMaxDeliveries(), doc.getConsumer(), doc.getLastError(), doc.getCreatedAt());
    }

    public boolean redelivered() {
        return deliveries > 1;
    }
}
