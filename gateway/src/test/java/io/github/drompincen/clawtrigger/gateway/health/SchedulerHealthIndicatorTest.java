package io.github.drompincen.clawtrigger.gateway.health;

import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerState;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SchedulerHealthIndicatorTest {

    @Mock private SchedulerBackend backend;

    private SchedulerBackendRegistry registry;
    private SchedulerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        registry = new SchedulerBackendRegistry("queue");
        when(backend.backendType()).thenReturn("queue");
        indicator = new SchedulerHealthIndicator(registry);
    }

    @Test
    void unknownWithoutActiveBackend() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails()).containsEntry("backend", "none active");
    }

    @Test
    void workerOnlyProcessIsUpWithItsUnstartedBackend() {
        when(backend.healthCheck()).thenReturn(new SchedulerHealth(false, "queue", SchedulerState.STOPPED, 1, Map.of()));
        registry.setJobHost(backend);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("backend", "queue")
                .containsEntry("role", "worker-only");
    }

    @Test
    void upWithBackendDetails() {
        registry.setActive(backend);
        when(backend.healthCheck()).thenReturn(new SchedulerHealth(true, "queue", SchedulerState.RUNNING, 1,
                Map.of("ready", 0L, "claimed", 2L, "dead", 0L)));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("backend", "queue")
                .containsEntry("state", SchedulerState.RUNNING)
                .containsEntry("jobs", 1)
                .containsEntry("claimed", 2L);
    }

    @Test
    void downWhenBackendUnhealthy() {
        registry.setActive(backend);
        when(backend.healthCheck()).thenReturn(
                SchedulerHealth.unhealthy("queue", SchedulerState.RUNNING, 1, "Timed out after 30000 ms"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "Timed out after 30000 ms");
    }
}
