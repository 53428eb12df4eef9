package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.persistence.repository.SubscriptionRepository;
import io.github.drompincen.clawtrigger.protocol.api.CreateSubscriptionRequest;
import io.github.drompincen.clawtrigger.protocol.api.IntervalUnit;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SubscriptionServiceTest {

    @Mock
    private SubscriptionRepository repository;

    private SubscriptionService service;

    @BeforeEach
    void setUp() {
        service = new SubscriptionService(repository, new TriggerConfigValidator(), new NextExecutionTimeCalculator());
        when(repository.save(any(SubscriptionDocument.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createComputesFirstRun() {
        SubscriptionDocument created = service.create(request(TriggerType.INTERVAL,
                TriggerConfig.interval(1, IntervalUnit.MINUTES), null));

        assertThat(created.getSubscriptionId()).isNotBlank();
        assertThat(created.isEnabled()).isTrue();
        assertThat(created.getRetryCount()).isEqualTo(1);
        assertThat(created.getTimeoutSeconds()).isEqualTo(600);
        assertThat(created.getNextExecutionTime())
                .isCloseTo(Instant.now().plusSeconds(60), within(5, java.time.temporal.ChronoUnit.SECONDS));
    }

    @Test
    void createRejectsInvalidTrigger() {
        assertThatThrownBy(() -> service.create(request(TriggerType.EVENT, TriggerConfig.event("fax"), null)))
                .isInstanceOf(InvalidTriggerConfigException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void updateWithNewTriggerResetsSchedule() {
        SubscriptionDocument existing = stored(TriggerType.INTERVAL, TriggerConfig.interval(1, IntervalUnit.DAYS));
        existing.setNextExecutionTime(Instant.now().plusSeconds(86_000));

        SubscriptionDocument updated = service.update("s1", new CreateSubscriptionRequest(null, "renamed", null,
                null, TriggerConfig.interval(10, IntervalUnit.SECONDS), null, null, null, null, null));

        assertThat(updated.getName()).isEqualTo("renamed");
        assertThat(updated.getNextExecutionTime()).isBefore(Instant.now().plusSeconds(20));
        assertThat(updated.getPromptTemplate()).isEqualTo("Do it");
    }

    @Test
    void enablingStaleScheduleRecomputesNextRun() {
        SubscriptionDocument existing = stored(TriggerType.INTERVAL, TriggerConfig.interval(1, IntervalUnit.HOURS));
        existing.setEnabled(false);
        existing.setNextExecutionTime(Instant.now().minusSeconds(7200));

        SubscriptionDocument enabled = service.enable("s1");

        assertThat(enabled.isEnabled()).isTrue();
        assertThat(enabled.getNextExecutionTime()).isAfter(Instant.now().plusSeconds(3500));
    }

    @Test
    void enablingExpiredOneTimeIsRejected() {
        SubscriptionDocument existing = stored(TriggerType.ONE_TIME, TriggerConfig.oneTime(Instant.now().minusSeconds(60)));
        existing.setEnabled(false);
        existing.setNextExecutionTime(null);

        assertThatThrownBy(() -> service.enable("s1")).isInstanceOf(InvalidTriggerConfigException.class);
    }

    @Test
    void disableKeepsSchedule() {
        SubscriptionDocument existing = stored(TriggerType.CRON, TriggerConfig.cron("0 9 * * *", "UTC"));
        Instant next = existing.getNextExecutionTime();

        SubscriptionDocument disabled = service.disable("s1");

        assertThat(disabled.isEnabled()).isFalse();
        assertThat(disabled.getNextExecutionTime()).isEqualTo(next);
    }

    @Test
    void softDeleteHidesSubscription() {
        SubscriptionDocument existing = stored(TriggerType.CRON, TriggerConfig.empty());

        service.softDelete("s1");

        assertThat(existing.isDeleted()).isTrue();
        assertThat(existing.isEnabled()).isFalse();
        assertThatThrownBy(() -> service.get("s1")).isInstanceOf(SubscriptionNotFoundException.class);
    }

    @Test
    void saveConflictIsRetriedOnAFreshCopy() {
        stored(TriggerType.CRON, TriggerConfig.cron("0 9 * * *", "UTC"));
        when(repository.save(any(SubscriptionDocument.class)))
                .thenThrow(new OptimisticLockingFailureException("stale"))
                .thenAnswer(inv -> inv.getArgument(0));

        SubscriptionDocument disabled = service.disable("s1");

        assertThat(disabled.isEnabled()).isFalse();
        verify(repository, times(2)).findById("s1");
        verify(repository, times(2)).save(any(SubscriptionDocument.class));
    }

    @Test
    void persistentConflictIsRethrown() {
        stored(TriggerType.CRON, TriggerConfig.cron("0 9 * * *", "UTC"));
        when(repository.save(any(SubscriptionDocument.class))).thenThrow(new OptimisticLockingFailureException("stale"));

        assertThatThrownBy(() -> service.softDelete("s1")).isInstanceOf(OptimisticLockingFailureException.class);
        verify(repository, times(SubscriptionService.MAX_SAVE_ATTEMPTS)).save(any(SubscriptionDocument.class));
    }

    @Test
    void changingTheTriggerRestartsTheRunCount() {
        SubscriptionDocument existing = stored(TriggerType.INTERVAL, TriggerConfig.interval(1, IntervalUnit.HOURS));
        existing.setScheduledRunCount(4);

        SubscriptionDocument updated = service.update("s1", new CreateSubscriptionRequest(null, null, null,
                null, TriggerConfig.interval(2, IntervalUnit.HOURS), null, null, null, null, null));

        assertThat(updated.getScheduledRunCount()).isZero();
    }

    @Test
    void getUnknownThrows() {
        when(repository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get("nope"))
                .isInstanceOf(SubscriptionNotFoundException.class)
                .hasMessageContaining("nope");
    }

    private SubscriptionDocument stored(TriggerType type, TriggerConfig config) {
        SubscriptionDocument doc = new SubscriptionDocument();
        doc.setSubscriptionId("s1");
        doc.setUserId("u1");
        doc.setTriggerType(type);
        doc.setTriggerConfig(config);
        doc.setPromptTemplate("Do it");
        doc.setNextExecutionTime(Instant.now().plusSeconds(3600));
        when(repository.findById("s1")).thenReturn(Optional.of(doc));
        return doc;
    }

    private static CreateSubscriptionRequest request(TriggerType type, TriggerConfig config, Boolean enabled) {
        return new CreateSubscriptionRequest("u1", "digest", null, type, config, "Summarize {{date}}",
                Map.of(), null, null, enabled);
    }
}
