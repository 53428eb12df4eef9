package io.github.drompincen.clawtrigger.runtime.event;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import io.github.drompincen.clawtrigger.protocol.event.ExecutionUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ExecutionEventEmitter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventEmitter.class);

    private final List<ExecutionEventPublisher> publishers;

    public ExecutionEventEmitter(List<ExecutionEventPublisher> publishers) {
        this.publishers = publishers;
    }

    public void emit(BackgroundExecutionDocument execution) {
        if (execution.getUserId() == null) {
            log.debug("Execution {} has no owner, skipping update", execution.getExecutionId());
            return;
        }
        ExecutionUpdateEvent event = toEvent(execution);
        for (ExecutionEventPublisher publisher : publishers) {
            try {
                publisher.publish(event.topic(), event);
            } catch (Exception e) {
                log.warn("Failed to publish update for execution {} via {}: {}",
                        execution.getExecutionId(), publisher.getClass().getSimpleName(), e.getMessage());
            }
        }
        log.debug("Emitted {} for execution {} status={}",
                ExecutionUpdateEvent.EVENT_NAME, execution.getExecutionId(), execution.getStatus());
    }

    static ExecutionUpdateEvent toEvent(BackgroundExecutionDocument execution) {
        return new ExecutionUpdateEvent(
                execution.getExecutionId(),
                execution.getSubscriptionId(),
                execution.getUserId(),
                execution.getStatus(),
                execution.getStatus() == ExecutionStatus.COMPLETED_SILENT,
                execution.getTaskId(),
                execution.getPrompt(),
                execution.getResultSummary(),
                execution.getErrorMessage(),
                execution.getTriggerReason(),
                execution.getCreatedAt(),
                execution.getUpdatedAt());
    }
}
