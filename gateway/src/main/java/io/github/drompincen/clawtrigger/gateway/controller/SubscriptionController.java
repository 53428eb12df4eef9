package io.github.drompincen.clawtrigger.gateway.controller;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.protocol.api.CreateSubscriptionRequest;
import io.github.drompincen.clawtrigger.runtime.execution.BackgroundExecutionService;
import io.github.drompincen.clawtrigger.runtime.execution.ExecutionNotFoundException;
import io.github.drompincen.clawtrigger.runtime.execution.InvalidStateTransitionException;
import io.github.drompincen.clawtrigger.runtime.subscription.InvalidTriggerConfigException;
import io.github.drompincen.clawtrigger.runtime.subscription.SubscriptionNotFoundException;
import io.github.drompincen.clawtrigger.runtime.subscription.SubscriptionService;
import io.github.drompincen.clawtrigger.runtime.subscription.SubscriptionTriggerService;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final SubscriptionTriggerService triggerService;
    private final BackgroundExecutionService executionService;

    public SubscriptionController(SubscriptionService subscriptionService,
                                  SubscriptionTriggerService triggerService,
                                  BackgroundExecutionService executionService) {
        this.subscriptionService = subscriptionService;
        this.triggerService = triggerService;
        this.executionService = executionService;
    }

    // --- Subscriptions ---

    @PostMapping("/subscriptions")
    public ResponseEntity<?> create(@RequestBody CreateSubscriptionRequest req) {
        return handle(() -> ResponseEntity.status(HttpStatus.CREATED).body(subscriptionService.create(req)));
    }

    @GetMapping("/subscriptions")
    public List<SubscriptionDocument> list(@RequestParam String userId) {
        return subscriptionService.listByUser(userId);
    }

    @GetMapping("/subscriptions/{subscriptionId}")
    public ResponseEntity<?> get(@PathVariable String subscriptionId) {
        return handle(() -> ResponseEntity.ok(subscriptionService.get(subscriptionId)));
    }

    @PutMapping("/subscriptions/{subscriptionId}")
    public ResponseEntity<?> update(@PathVariable String subscriptionId, @RequestBody CreateSubscriptionRequest changes) {
        return handle(() -> ResponseEntity.ok(subscriptionService.update(subscriptionId, changes)));
    }

    @PostMapping("/subscriptions/{subscriptionId}/enable")
    public ResponseEntity<?> enable(@PathVariable String subscriptionId) {
        return handle(() -> ResponseEntity.ok(subscriptionService.enable(subscriptionId)));
    }

    @PostMapping("/subscriptions/{subscriptionId}/disable")
    public ResponseEntity<?> disable(@PathVariable String subscriptionId) {
        return handle(() -> ResponseEntity.ok(subscriptionService.disable(subscriptionId)));
    }

    @DeleteMapping("/subscriptions/{subscriptionId}")
    public ResponseEntity<?> delete(@PathVariable String subscriptionId) {
        return handle(() -> {
            subscriptionService.softDelete(subscriptionId);
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/subscriptions/{subscriptionId}/trigger")
    public ResponseEntity<?> trigger(@PathVariable String subscriptionId) {
        return handle(() -> ResponseEntity.accepted().body(triggerService.triggerNow(subscriptionId)));
    }

    @GetMapping("/subscriptions/{subscriptionId}/executions")
    public ResponseEntity<?> executions(@PathVariable String subscriptionId) {
        return handle(() -> {
            subscriptionService.get(subscriptionId);
            return ResponseEntity.ok(executionService.listBySubscription(subscriptionId));
        });
    }

    // --- Executions ---

    @GetMapping("/executions/{executionId}")
    public ResponseEntity<BackgroundExecutionDocument> getExecution(@PathVariable String executionId) {
        return executionService.findById(executionId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/executions/{executionId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String executionId) {
        return handle(() -> ResponseEntity.ok(executionService.cancel(executionId)));
    }

    // --- Events ---

    @PostMapping("/events/{eventType}")
    public Map<String, Object> fireEvent(@PathVariable String eventType,
                                         @RequestBody(required = false) Map<String, Object> payload) {
        List<BackgroundExecutionDocument> fired = triggerService.fireEvent(eventType, payload != null ? payload : Map.of());
        return Map.of("eventType", eventType,
                "executions", fired.stream().map(BackgroundExecutionDocument::getExecutionId).toList());
    }

    private ResponseEntity<?> handle(Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (SubscriptionNotFoundException | ExecutionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (InvalidTriggerConfigException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (InvalidStateTransitionException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (OptimisticLockingFailureException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Subscription was modified concurrently, retry the request"));
        }
    }
}
