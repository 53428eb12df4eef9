package io.github.drompincen.clawtrigger.runtime.trigger;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.runtime.execution.BackgroundExecutionService;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.subscription.PromptTemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

@Component
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final PromptTemplateResolver promptResolver;
    private final BackgroundExecutionService executionService;
    private final ExecutionQueue queue;

    public ExecutionDispatcher(PromptTemplateResolver promptResolver,
                               BackgroundExecutionService executionService,
                               ExecutionQueue queue) {
        this.promptResolver = promptResolver;
        this.executionService = executionService;
        this.queue = queue;
    }

    public BackgroundExecutionDocument createExecution(SubscriptionDocument subscription, String triggerReason,
                                                       Map<String, ?> extraVariables) {
        String prompt = promptResolver.resolve(subscription, extraVariables);
        return executionService.create(subscription, triggerReason, prompt);
    }

    public void enqueue(BackgroundExecutionDocument execution) {
        String jobId = queue.enqueueExecution(execution.getExecutionId(), Duration.ZERO);
        log.debug("Dispatched execution {} as job {}", execution.getExecutionId(), jobId);
    }

    public BackgroundExecutionDocument dispatch(SubscriptionDocument subscription, String triggerReason,
                                                Map<String, ?> extraVariables) {
        BackgroundExecutionDocument execution = createExecution(subscription, triggerReason, extraVariables);
        enqueue(execution);
        return execution;
    }
}
