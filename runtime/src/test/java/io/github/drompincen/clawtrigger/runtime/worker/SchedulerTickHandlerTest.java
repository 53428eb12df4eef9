package io.github.drompincen.clawtrigger.runtime.worker;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.queue.InMemoryExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.queue.QueuedJob;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import io.github.drompincen.clawtrigger.runtime.scheduler.queue.QueueSchedulerBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SchedulerTickHandlerTest {

    private SchedulerBackendRegistry registry;
    private SchedulerTickHandler handler;

    @BeforeEach
    void setUp() {
        registry = new SchedulerBackendRegistry("queue");
        handler = new SchedulerTickHandler(registry);
    }

    @Test
    void tickRunsTaskOfActiveQueueBackend() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        QueueSchedulerBackend backend = new QueueSchedulerBackend(new InMemoryExecutionQueue(), Duration.ofSeconds(5));
        backend.scheduleJob("scan", "Scan", runs::incrementAndGet, TriggerType.CRON,
                TriggerConfig.cron("0 9 * * *", "UTC"), false);
        registry.setActive(backend);

        handler.handle(tick("scan"));

        assertThat(runs).hasValue(1);
        assertThat(handler.kind()).isEqualTo(QueuedJobDocument.Kind.SCHEDULER_TICK);
    }

    @Test
    void tickForUnknownJobIsDropped() {
        registry.setActive(new QueueSchedulerBackend(new InMemoryExecutionQueue(), Duration.ofSeconds(5)));

        assertThatCode(() -> handler.handle(tick("removed"))).doesNotThrowAnyException();
    }

    @Test
    void tickIsDroppedWhenAnotherBackendIsActive() {
        SchedulerBackend local = mock(SchedulerBackend.class);
        when(local.backendType()).thenReturn("local");
        registry.setActive(local);

        assertThatCode(() -> handler.handle(tick("scan"))).doesNotThrowAnyException();
    }

    @Test
    void workerOnlyProcessRunsTicksOnItsUnstartedBackend() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        QueueSchedulerBackend backend = new QueueSchedulerBackend(new InMemoryExecutionQueue(), Duration.ofSeconds(5));
        backend.scheduleJob("scan", "Scan", runs::incrementAndGet, TriggerType.CRON,
                TriggerConfig.cron("0 9 * * *", "UTC"), false);
        registry.setJobHost(backend);

        handler.handle(tick("scan"));

        assertThat(runs).hasValue(1);
        assertThat(registry.getActive()).isEmpty();
    }

    @Test
    void tickBeforeStartupIsRequeued() {
        assertThatThrownBy(() -> handler.handle(tick("scan")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No scheduler backend registered yet");
    }

    private static QueuedJob tick(String jobId) {
        return new QueuedJob("t-1", QueuedJobDocument.Kind.SCHEDULER_TICK, jobId, 1, 5, "c1", null, Instant.now());
    }
}
