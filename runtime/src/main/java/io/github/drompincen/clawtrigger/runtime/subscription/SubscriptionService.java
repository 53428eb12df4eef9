package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.persistence.repository.SubscriptionRepository;
import io.github.drompincen.clawtrigger.protocol.api.CreateSubscriptionRequest;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

@Service
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);
    static final int MAX_SAVE_ATTEMPTS = 3;

    private final SubscriptionRepository subscriptionRepository;
    private final TriggerConfigValidator validator;
    private final NextExecutionTimeCalculator calculator;

    public SubscriptionService(SubscriptionRepository subscriptionRepository,
                               TriggerConfigValidator validator,
                               NextExecutionTimeCalculator calculator) {
        this.subscriptionRepository = subscriptionRepository;
        this.validator = validator;
        this.calculator = calculator;
    }

    public SubscriptionDocument create(CreateSubscriptionRequest request) {
        TriggerConfig config = request.triggerConfig() != null ? request.triggerConfig() : TriggerConfig.empty();
        validator.validate(request.triggerType(), config);

        Instant now = Instant.now();
        SubscriptionDocument doc = new SubscriptionDocument();
        doc.setSubscriptionId(UUID.randomUUID().toString());
        doc.setUserId(request.userId());
        doc.setName(request.name());
        doc.setDescription(request.description());
        doc.setTriggerType(request.triggerType());
        doc.setTriggerConfig(config);
        doc.setPromptTemplate(request.promptTemplate());
        doc.setPromptVariables(request.promptVariables() != null ? new HashMap<>(request.promptVariables()) : null);
        if (request.retryCount() != null) doc.setRetryCount(request.retryCount());
        if (request.timeoutSeconds() != null) doc.setTimeoutSeconds(request.timeoutSeconds());
        if (request.enabled() != null) doc.setEnabled(request.enabled());
        doc.setNextExecutionTime(calculator.firstExecutionTime(request.triggerType(), config, now));
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        SubscriptionDocument saved = subscriptionRepository.save(doc);
        log.info("Created {} subscription {} for user {} (next run {})",
                saved.getTriggerType().wireName(), saved.getSubscriptionId(), saved.getUserId(), saved.getNextExecutionTime());
        return saved;
    }

    /** Applies the non-null fields of {@code changes}; a changed trigger resets the schedule. */
    public SubscriptionDocument update(String subscriptionId, CreateSubscriptionRequest changes) {
        return modify(subscriptionId, doc -> {
            if (changes.name() != null) doc.setName(changes.name());
            if (changes.description() != null) doc.setDescription(changes.description());
            if (changes.promptTemplate() != null) doc.setPromptTemplate(changes.promptTemplate());
            if (changes.promptVariables() != null) doc.setPromptVariables(new HashMap<>(changes.promptVariables()));
            if (changes.retryCount() != null) doc.setRetryCount(changes.retryCount());
            if (changes.timeoutSeconds() != null) doc.setTimeoutSeconds(changes.timeoutSeconds());

            Instant now = Instant.now();
            if (changes.triggerType() != null || changes.triggerConfig() != null) {
                TriggerType type = changes.triggerType() != null ? changes.triggerType() : doc.getTriggerType();
                TriggerConfig config = changes.triggerConfig() != null ? changes.triggerConfig() : doc.getTriggerConfig();
                validator.validate(type, config);
                doc.setTriggerType(type);
                doc.setTriggerConfig(config);
                doc.setNextExecutionTime(calculator.firstExecutionTime(type, config, now));
                doc.setScheduledRunCount(0);
            }
            if (changes.enabled() != null) {
                applyEnabled(doc, changes.enabled(), now);
            }
            doc.setUpdatedAt(now);
        });
    }

    public SubscriptionDocument enable(String subscriptionId) {
        SubscriptionDocument saved = modify(subscriptionId, doc -> {
            applyEnabled(doc, true, Instant.now());
            doc.setUpdatedAt(Instant.now());
        });
        log.info("Enabled subscription {}", subscriptionId);
        return saved;
    }

    public SubscriptionDocument disable(String subscriptionId) {
        SubscriptionDocument saved = modify(subscriptionId, doc -> {
            doc.setEnabled(false);
            doc.setUpdatedAt(Instant.now());
        });
        log.info("Disabled subscription {}", subscriptionId);
        return saved;
    }

    public void softDelete(String subscriptionId) {
        modify(subscriptionId, doc -> {
            doc.setDeleted(true);
            doc.setEnabled(false);
            doc.setUpdatedAt(Instant.now());
        });
        log.info("Deleted subscription {}", subscriptionId);
    }

    public SubscriptionDocument get(String subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .filter(s -> !s.isDeleted())
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
    }

    public List<SubscriptionDocument> listByUser(String userId) {
        return subscriptionRepository.findByUserIdAndDeletedFalse(userId);
    }

    // The scheduler and workers bump the version underneath user edits, so re-read and re-apply.
    private SubscriptionDocument modify(String subscriptionId, Consumer<SubscriptionDocument> change) {
        for (int attempt = 1; ; attempt++) {
            SubscriptionDocument doc = get(subscriptionId);
            change.accept(doc);
            try {
                return subscriptionRepository.save(doc);
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= MAX_SAVE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Subscription {} changed while saving, retrying (attempt {})", subscriptionId, attempt);
            }
        }
    }

    // Re-enabling a schedule whose next run already passed would fire a burst of missed runs.
    private void applyEnabled(SubscriptionDocument doc, boolean enabled, Instant now) {
        if (enabled && !doc.isEnabled() && doc.getTriggerType() != TriggerType.EVENT
                && (doc.getNextExecutionTime() == null || doc.getNextExecutionTime().isBefore(now))) {
            if (doc.getTriggerType() == TriggerType.ONE_TIME) {
                validator.validate(doc.getTriggerType(), doc.getTriggerConfig());
            }
            doc.setNextExecutionTime(calculator.firstExecutionTime(doc.getTriggerType(), doc.getTriggerConfig(), now));
        }
        doc.setEnabled(enabled);
    }
}
