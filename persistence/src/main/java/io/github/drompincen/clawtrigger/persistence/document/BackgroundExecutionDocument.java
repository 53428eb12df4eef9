package io.github.drompincen.clawtrigger.persistence.document;

import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One firing of a subscription. {@code version} is managed explicitly by the execution store
 * (compare-and-set on every mutation) rather than through Spring Data's {@code @Version}.
 */
@Document(collection = "background_executions")
@CompoundIndex(name = "status_created_idx", def = "{'status': 1, 'createdAt': 1}")
public class BackgroundExecutionDocument {

    @Id
    private String executionId;
    @Indexed
    private String subscriptionId;
    private String userId;
    private long taskId;
    private TriggerType triggerType;
    private String triggerReason;
    private String prompt;
    private ExecutionStatus status = ExecutionStatus.PENDING;
    private String resultSummary;
    private String errorMessage;
    private int retryAttempt;
    private long version;
    private Instant startedAt;
    private Instant completedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public BackgroundExecutionDocument() {}

    public String getExecutionId() { return executionId; }
    public void setExecutionId(String executionId) { this.executionId = executionId; }
    public String getSubscriptionId() { return subscriptionId; }
    public void setSubscriptionId(String subscriptionId) { this.subscriptionId = subscriptionId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public long getTaskId() { return taskId; }
    public void setTaskId(long taskId) { this.taskId = taskId; }
    public TriggerType getTriggerType() { return triggerType; }
    public void setTriggerType(TriggerType triggerType) { this.triggerType = triggerType; }
    public String getTriggerReason() { return triggerReason; }
    public void setTriggerReason(String triggerReason) { this.triggerReason = triggerReason; }
    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = prompt; }
    public ExecutionStatus getStatus() { return status; }
    public void setStatus(ExecutionStatus status) { this.status = status; }
    public String getResultSummary() { return resultSummary; }
    public void setResultSummary(String resultSummary) { this.resultSummary = resultSummary; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public int getRetryAttempt() { return retryAttempt; }
    public void setRetryAttempt(int retryAttempt) { this.retryAttempt = retryAttempt; }
    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
