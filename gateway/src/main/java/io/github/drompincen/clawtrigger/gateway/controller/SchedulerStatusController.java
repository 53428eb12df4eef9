package io.github.drompincen.clawtrigger.gateway.controller;

import io.github.drompincen.clawtrigger.protocol.api.ScheduledJobResponse;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobHandle;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobNotFoundException;
import io.github.drompincen.clawtrigger.runtime.scheduler.ScheduledJob;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import io.github.drompincen.clawtrigger.runtime.scheduler.UnsupportedSchedulerOperationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerStatusController {

    private final SchedulerBackendRegistry registry;

    public SchedulerStatusController(SchedulerBackendRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        Optional<SchedulerBackend> active = registry.getActive();
        if (active.isEmpty()) {
            return noActiveBackend();
        }
        SchedulerHealth health = active.get().healthCheck();
        return ResponseEntity.status(health.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    @GetMapping("/backends")
    public Map<String, Object> backends() {
        return Map.of(
                "available", registry.listBackends(),
                "default", registry.defaultBackend(),
                "active", registry.getActive().map(SchedulerBackend::backendType).orElse("none"));
    }

    @GetMapping("/jobs")
    public ResponseEntity<?> listJobs() {
        return withBackend(backend -> {
            List<ScheduledJobResponse> jobs = backend.getJobs().stream().map(ScheduledJob::toResponse).toList();
            return ResponseEntity.ok(jobs);
        });
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getJob(@PathVariable String jobId) {
        return withBackend(backend -> backend.getJob(jobId)
                .<ResponseEntity<?>>map(job -> ResponseEntity.ok(job.toResponse()))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping("/jobs/{jobId}/run")
    public ResponseEntity<?> runJob(@PathVariable String jobId) {
        return withBackend(backend -> {
            JobHandle handle = backend.executeJobNow(jobId);
            return ResponseEntity.accepted().body(handle);
        });
    }

    @PostMapping("/jobs/{jobId}/pause")
    public ResponseEntity<?> pauseJob(@PathVariable String jobId) {
        return withBackend(backend -> {
            backend.pauseJob(jobId);
            return ResponseEntity.ok(Map.of("jobId", jobId, "paused", true));
        });
    }

    @PostMapping("/jobs/{jobId}/resume")
    public ResponseEntity<?> resumeJob(@PathVariable String jobId) {
        return withBackend(backend -> {
            backend.resumeJob(jobId);
            return ResponseEntity.ok(Map.of("jobId", jobId, "paused", false));
        });
    }

    @PostMapping("/pause")
    public ResponseEntity<?> pause() {
        return withBackend(backend -> {
            backend.pause();
            return ResponseEntity.ok(Map.of("state", backend.state()));
        });
    }

    @PostMapping("/resume")
    public ResponseEntity<?> resume() {
        return withBackend(backend -> {
            backend.resume();
            return ResponseEntity.ok(Map.of("state", backend.state()));
        });
    }

    private ResponseEntity<?> withBackend(Function<SchedulerBackend, ResponseEntity<?>> action) {
        Optional<SchedulerBackend> active = registry.getActive();
        if (active.isEmpty()) {
            return noActiveBackend();
        }
        try {
            return action.apply(active.get());
        } catch (JobNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (UnsupportedSchedulerOperationException e) {
            return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).body(Map.of("error", e.getMessage()));
        }
    }

    private static ResponseEntity<?> noActiveBackend() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "No scheduler backend is active in this process"));
    }
}
