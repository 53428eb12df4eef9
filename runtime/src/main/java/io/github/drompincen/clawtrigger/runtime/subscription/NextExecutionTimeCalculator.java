package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;

@Component
public class NextExecutionTimeCalculator {

    private static final Logger log = LoggerFactory.getLogger(NextExecutionTimeCalculator.class);

    /** First fire time of a newly created or re-triggered subscription; null for event triggers. */
    public Instant firstExecutionTime(TriggerType type, TriggerConfig triggerConfig, Instant now) {
        TriggerConfig config = triggerConfig != null ? triggerConfig : TriggerConfig.empty();
        return switch (type) {
            case CRON -> nextCronTime(config, now);
            case INTERVAL -> now.plus(config.intervalDuration());
            case ONE_TIME -> config.executeAt();
            case EVENT -> null;
        };
    }

    /**
     * Schedule after a firing. {@code executionsSoFar} counts scheduled fires including this one and
     * caps interval subscriptions that declare {@code maxExecutions}.
     */
    public ScheduleAdvance advance(SubscriptionDocument subscription, Instant now, long executionsSoFar) {
        TriggerConfig config = subscription.getTriggerConfig() != null
                ? subscription.getTriggerConfig() : TriggerConfig.empty();
        return switch (subscription.getTriggerType()) {
            case CRON -> new ScheduleAdvance(nextCronTime(config, now), true);
            case INTERVAL -> {
                Integer max = config.maxExecutions();
                if (max != null && executionsSoFar >= max) {
                    log.info("Subscription {} reached maxExecutions={}, disabling", subscription.getSubscriptionId(), max);
                    yield ScheduleAdvance.finished();
                }
                yield new ScheduleAdvance(now.plus(config.intervalDuration()), true);
            }
            case ONE_TIME -> ScheduleAdvance.finished();
            case EVENT -> new ScheduleAdvance(subscription.getNextExecutionTime(), subscription.isEnabled());
        };
    }

    private Instant nextCronTime(TriggerConfig config, Instant now) {
        CronExpression cron = CronExpressions.parse(config.cronExpressionOrDefault());
        ZonedDateTime next = cron.next(now.atZone(CronExpressions.zoneOrUtc(config.timezoneOrDefault())));
        return next != null ? next.toInstant() : null;
    }
}
