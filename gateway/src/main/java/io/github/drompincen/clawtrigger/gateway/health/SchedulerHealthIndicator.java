package io.github.drompincen.clawtrigger.gateway.health;

import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class SchedulerHealthIndicator implements HealthIndicator {

    private final SchedulerBackendRegistry registry;

    public SchedulerHealthIndicator(SchedulerBackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        return registry.getActive()
                .map(backend -> {
                    SchedulerHealth status = backend.healthCheck();
                    Health.Builder builder = status.healthy() ? Health.up() : Health.down();
                    return builder
                            .withDetail("backend", status.backendType())
                            .withDetail("state", status.state())
                            .withDetail("jobs", status.jobsCount())
                            .withDetails(status.details())
                            .build();
                })
                .orElseGet(() -> registry.getJobHost()
                        .map(host -> Health.up()
                                .withDetail("backend", host.backendType())
                                .withDetail("role", "worker-only")
                                .build())
                        .orElseGet(() -> Health.unknown().withDetail("backend", "none active").build()));
    }
}
