package io.github.drompincen.clawtrigger.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import io.github.drompincen.clawtrigger.runtime.scheduler.xxljob.XxlJobAdminClient;
import io.github.drompincen.clawtrigger.runtime.scheduler.xxljob.XxlJobSchedulerBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executor side of the XXL-JOB protocol. The admin posts here to trigger jobs it owns the schedule for;
 * {@code executorParams} carries the local job id.
 */
@RestController
@ConditionalOnProperty(name = "clawtrigger.scheduler.backend", havingValue = "xxljob")
public class XxlJobExecutorController {

    private static final Logger log = LoggerFactory.getLogger(XxlJobExecutorController.class);

    static final int SUCCESS = 200;
    static final int FAIL = 500;

    private final SchedulerBackendRegistry registry;

    public XxlJobExecutorController(SchedulerBackendRegistry registry) {
        this.registry = registry;
    }

    @PostMapping("/beat")
    public Map<String, Object> beat(@RequestHeader(value = XxlJobAdminClient.ACCESS_TOKEN_HEADER, required = false) String token) {
        Optional<XxlJobSchedulerBackend> backend = backend();
        if (backend.isEmpty()) return fail("Executor not active");
        if (!tokenMatches(backend.get(), token)) return fail("The access token is wrong.");
        return ok();
    }

    @PostMapping("/idleBeat")
    public Map<String, Object> idleBeat(@RequestHeader(value = XxlJobAdminClient.ACCESS_TOKEN_HEADER, required = false) String token,
                                        @RequestBody JsonNode body) {
        Optional<XxlJobSchedulerBackend> backend = backend();
        if (backend.isEmpty()) return fail("Executor not active");
        if (!tokenMatches(backend.get(), token)) return fail("The access token is wrong.");
        String jobId = body.path("jobId").asText();
        return backend.get().isRunning(jobId) ? fail("job thread is running or has trigger queue.") : ok();
    }

    @PostMapping("/run")
    public Map<String, Object> run(@RequestHeader(value = XxlJobAdminClient.ACCESS_TOKEN_HEADER, required = false) String token,
                                   @RequestBody JsonNode body) {
        Optional<XxlJobSchedulerBackend> backend = backend();
        if (backend.isEmpty()) return fail("Executor not active");
        if (!tokenMatches(backend.get(), token)) return fail("The access token is wrong.");

        String handler = body.path("executorHandler").asText();
        if (!XxlJobSchedulerBackend.EXECUTOR_HANDLER.equals(handler)) {
            return fail("job handler [" + handler + "] not found.");
        }
        String jobId = body.path("executorParams").asText();
        long logId = body.path("logId").asLong();
        long logDateTime = body.path("logDateTime").asLong();
        if (!backend.get().runJob(jobId, logId, logDateTime)) {
            log.info("Rejected XXL-JOB trigger for {} (log {})", jobId, logId);
            return fail("job [" + jobId + "] is unknown or already running");
        }
        return ok();
    }

    @PostMapping("/kill")
    public Map<String, Object> kill() {
        // Jobs only enqueue work and return quickly; there is nothing to interrupt.
        return fail("kill is not supported by this executor");
    }

    private Optional<XxlJobSchedulerBackend> backend() {
        return registry.getActive()
                .filter(XxlJobSchedulerBackend.class::isInstance)
                .map(XxlJobSchedulerBackend.class::cast);
    }

    private static boolean tokenMatches(XxlJobSchedulerBackend backend, String token) {
        String expected = backend.accessToken();
        return expected == null || expected.isBlank() || expected.equals(token);
    }

    private static Map<String, Object> ok() {
        Map<String, Object> result = new HashMap<>();
        result.put("code", SUCCESS);
        result.put("msg", null);
        return result;
    }

    private static Map<String, Object> fail(String msg) {
        return Map.of("code", FAIL, "msg", msg);
    }
}
