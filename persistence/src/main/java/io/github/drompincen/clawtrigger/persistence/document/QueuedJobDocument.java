package io.github.drompincen.clawtrigger.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "execution_queue")
@CompoundIndex(name = "queue_pickup_idx", def = "{'state': 1, 'availableAt': 1}")
@CompoundIndex(name = "queue_lease_idx", def = "{'state': 1, 'leaseUntil': 1}")
public class QueuedJobDocument {

    public enum State { READY, CLAIMED, DEAD }

    /** What the consumer should do with the job: run an execution, or fire a scheduler tick. */
    public enum Kind { EXECUTION, SCHEDULER_TICK }

    @Id
    private String jobId;
    private Kind kind = Kind.EXECUTION;
    private String payload;
    private State state = State.READY;
    private int deliveries;
    private int maxDeliveries = 5;
    private Instant availableAt;
    private String consumer;
    private Instant leaseUntil;
    private String lastError;
    private Instant createdAt;
    private Instant updatedAt;

    public QueuedJobDocument() {}

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public Kind getKind() { return kind; }
    public void setKind(Kind kind) { this.kind = kind; }
    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }
    public State getState() { return state; }
    public void setState(State state) { this.state = state; }
    public int getDeliveries() { return deliveries; }
    public void setDeliveries(int deliveries) { this.deliveries = deliveries; }
    public int getMaxDeliveries() { return maxDeliveries; }
    public void setMaxDeliveries(int maxDeliveries) { this.maxDeliveries = maxDeliveries; }
    public Instant getAvailableAt() { return availableAt; }
    public void setAvailableAt(Instant availableAt) { this.availableAt = availableAt; }
    public String getConsumer() { return consumer; }
    public void setConsumer(String consumer) { this.consumer = consumer; }
    public Instant getLeaseUntil() { return leaseUntil; }
    public void setLeaseUntil(Instant leaseUntil) { this.leaseUntil = leaseUntil; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
