package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.protocol.api.IntervalUnit;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class NextExecutionTimeCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-04-01T12:00:30Z");

    private final NextExecutionTimeCalculator calculator = new NextExecutionTimeCalculator();

    @Test
    void cronHonoursTimezone() {
        Instant next = calculator.firstExecutionTime(TriggerType.CRON,
                TriggerConfig.cron("0 9 * * *", "America/New_York"), NOW);

        // 09:00 EDT is 13:00 UTC
        assertThat(next).isEqualTo(Instant.parse("2026-04-01T13:00:00Z"));
    }

    @Test
    void cronDefaultsToNineUtcDaily() {
        Instant next = calculator.firstExecutionTime(TriggerType.CRON, null, NOW);

        assertThat(next).isEqualTo(Instant.parse("2026-04-02T09:00:00Z"));
    }

    @Test
    void intervalAddsDurationToNow() {
        assertThat(calculator.firstExecutionTime(TriggerType.INTERVAL,
                TriggerConfig.interval(1, IntervalUnit.MINUTES), NOW))
                .isEqualTo(NOW.plusSeconds(60));
        assertThat(calculator.firstExecutionTime(TriggerType.INTERVAL, TriggerConfig.empty(), NOW))
                .isEqualTo(NOW.plusSeconds(3600));
    }

    @Test
    void oneTimeUsesExecuteAtAndEventHasNoSchedule() {
        Instant at = NOW.plusSeconds(600);

        assertThat(calculator.firstExecutionTime(TriggerType.ONE_TIME, TriggerConfig.oneTime(at), NOW)).isEqualTo(at);
        assertThat(calculator.firstExecutionTime(TriggerType.EVENT, TriggerConfig.event("webhook"), NOW)).isNull();
    }

    @Test
    void intervalAdvanceDisablesAtMaxExecutions() {
        SubscriptionDocument sub = subscription(TriggerType.INTERVAL, TriggerConfig.interval(5, IntervalUnit.MINUTES, 3));

        assertThat(calculator.advance(sub, NOW, 2)).isEqualTo(new ScheduleAdvance(NOW.plusSeconds(300), true));
        assertThat(calculator.advance(sub, NOW, 3)).isEqualTo(ScheduleAdvance.finished());
    }

    @Test
    void oneTimeAdvanceFinishes() {
        SubscriptionDocument sub = subscription(TriggerType.ONE_TIME, TriggerConfig.oneTime(NOW));

        ScheduleAdvance advance = calculator.advance(sub, NOW, 1);

        assertThat(advance.enabled()).isFalse();
        assertThat(advance.nextExecutionTime()).isNull();
    }

    @Test
    void cronAdvanceMovesPastNow() {
        SubscriptionDocument sub = subscription(TriggerType.CRON, TriggerConfig.cron("*/5 * * * *", "UTC"));

        assertThat(calculator.advance(sub, NOW, 10).nextExecutionTime()).isEqualTo(Instant.parse("2026-04-01T12:05:00Z"));
    }

    private static SubscriptionDocument subscription(TriggerType type, TriggerConfig config) {
        SubscriptionDocument sub = new SubscriptionDocument();
        sub.setSubscriptionId("s1");
        sub.setTriggerType(type);
        sub.setTriggerConfig(config);
        return sub;
    }
}
