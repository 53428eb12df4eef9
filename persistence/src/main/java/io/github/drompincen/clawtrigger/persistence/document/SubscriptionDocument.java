package io.github.drompincen.clawtrigger.persistence.document;

import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Document(collection = "subscriptions")
@CompoundIndex(name = "due_scan_idx", def = "{'enabled': 1, 'deleted': 1, 'triggerType': 1, 'nextExecutionTime': 1}")
public class SubscriptionDocument {

    @Id
    private String subscriptionId;
    @Indexed
    private String userId;
    private String name;
    private String description;
    private TriggerType triggerType;
    private TriggerConfig triggerConfig;
    private String promptTemplate;
    private Map<String, Object> promptVariables;
    private int retryCount = 1;
    private int timeoutSeconds = 600;
    private boolean enabled = true;
    private boolean deleted;
    private Instant nextExecutionTime;
    private Instant lastExecutionTime;
    private ExecutionStatus lastExecutionStatus;
    private long executionCount;
    private long successCount;
    private long failureCount;
    private long scheduledRunCount;
    @Version
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public SubscriptionDocument() {}

    public String getSubscriptionId() { return subscriptionId; }
    public void setSubscriptionId(String subscriptionId) { this.subscriptionId = subscriptionId; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public TriggerType getTriggerType() { return triggerType; }
    public void setTriggerType(TriggerType triggerType) { this.triggerType = triggerType; }
    public TriggerConfig getTriggerConfig() { return triggerConfig; }
    public void setTriggerConfig(TriggerConfig triggerConfig) { this.triggerConfig = triggerConfig; }
    public String getPromptTemplate() { return promptTemplate; }
    public void setPromptTemplate(String promptTemplate) { this.promptTemplate = promptTemplate; }
    public Map<String, Object> getPromptVariables() { return promptVariables; }
    public void setPromptVariables(Map<String, Object> promptVariables) { this.promptVariables = promptVariables; }
    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }
    public Instant getNextExecutionTime() { return nextExecutionTime; }
    public void setNextExecutionTime(Instant nextExecutionTime) { this.nextExecutionTime = nextExecutionTime; }
    public Instant getLastExecutionTime() { return lastExecutionTime; }
    public void setLastExecutionTime(Instant lastExecutionTime) { this.lastExecutionTime = lastExecutionTime; }
    public ExecutionStatus getLastExecutionStatus() { return lastExecutionStatus; }
    public void setLastExecutionStatus(ExecutionStatus lastExecutionStatus) { this.lastExecutionStatus = lastExecutionStatus; }
    public long getExecutionCount() { return executionCount; }
    public void setExecutionCount(long executionCount) { this.executionCount = executionCount; }
    public long getSuccessCount() { return successCount; }
    public void setSuccessCount(long successCount) { this.successCount = successCount; }
    public long getFailureCount() { return failureCount; }
    public void setFailureCount(long failureCount) { this.failureCount = failureCount; }
    public long getScheduledRunCount() { return scheduledRunCount; }
    public void setScheduledRunCount(long scheduledRunCount) { this.scheduledRunCount = scheduledRunCount; }
    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
