package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.persistence.repository.SubscriptionRepository;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.trigger.ExecutionDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class SubscriptionTriggerService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTriggerService.class);

    private final SubscriptionService subscriptionService;
    private final SubscriptionRepository subscriptionRepository;
    private final ExecutionDispatcher dispatcher;

    public SubscriptionTriggerService(SubscriptionService subscriptionService,
                                      SubscriptionRepository subscriptionRepository,
                                      ExecutionDispatcher dispatcher) {
        this.subscriptionService = subscriptionService;
        this.subscriptionRepository = subscriptionRepository;
        this.dispatcher = dispatcher;
    }

    public BackgroundExecutionDocument triggerNow(String subscriptionId) {
        SubscriptionDocument subscription = subscriptionService.get(subscriptionId);
        BackgroundExecutionDocument execution = dispatcher.dispatch(subscription, TriggerReasons.MANUAL, Map.of());
        log.info("Manually triggered subscription {} as execution {}", subscriptionId, execution.getExecutionId());
        return execution;
    }

    /**
     * Fires every enabled event subscription listening for {@code eventType}. The payload is exposed
     * to prompt templates as {@code {{event_data}}} and, for git pushes, filtered on
     * {@code repository}/{@code branch} when the subscription sets them.
     */
    public List<BackgroundExecutionDocument> fireEvent(String eventType, Map<String, Object> payload) {
        Map<String, Object> data = payload != null ? payload : Map.of();
        List<BackgroundExecutionDocument> fired = new ArrayList<>();
        for (SubscriptionDocument subscription : subscriptionRepository.findByEnabledTrueAndDeletedFalseAndTriggerType(TriggerType.EVENT)) {
            TriggerConfig config = subscription.getTriggerConfig();
            if (config == null || !eventType.equals(config.eventType()) || !matchesGitFilters(config, data)) {
                continue;
            }
            try {
                fired.add(dispatcher.dispatch(subscription, TriggerReasons.event(eventType), Map.of("event_data", data)));
            } catch (Exception e) {
                log.error("Failed to fire subscription {} for event {}", subscription.getSubscriptionId(), eventType, e);
            }
        }
        log.info("Event {} fired {} subscription(s)", eventType, fired.size());
        return fired;
    }

    private boolean matchesGitFilters(TriggerConfig config, Map<String, Object> payload) {
        if (!"git_push".equals(config.eventType())) {
            return true;
        }
        if (config.repository() != null && !config.repository().equals(payload.get("repository"))) {
            return false;
        }
        return config.branch() == null || config.branch().equals(payload.get("branch"));
    }
}
