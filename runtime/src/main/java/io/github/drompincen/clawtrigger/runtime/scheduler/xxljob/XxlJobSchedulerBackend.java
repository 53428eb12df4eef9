package io.github.drompincen.clawtrigger.runtime.scheduler.xxljob;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerState;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobAlreadyExistsException;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobHandle;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobNotFoundException;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobTriggers;
import io.github.drompincen.clawtrigger.runtime.scheduler.ScheduledJob;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delegates timing to XXL-JOB admin servers. This process registers as an executor, creates one
 * admin job per scheduled job, and runs the task when the admin calls back with the job id as
 * executor parameter.
 */
public class XxlJobSchedulerBackend implements SchedulerBackend {

    private static final Logger log = LoggerFactory.getLogger(XxlJobSchedulerBackend.class);

    public static final String TYPE = "xxljob";
    public static final String EXECUTOR_HANDLER = "clawTriggerHandler";
    private static final DateTimeFormatter ONE_TIME_CRON = DateTimeFormatter.ofPattern("s m H d M '?' yyyy");

    private final XxlJobAdminClient client;
    private final String appName;
    private final String executorAddress;
    private final int jobGroup;
    private final Duration heartbeatInterval;
    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, Integer> adminJobIds = new ConcurrentHashMap<>();
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();
    private volatile SchedulerState state = SchedulerState.STOPPED;
    private ScheduledExecutorService heartbeat;
    private ScheduledFuture<?> heartbeatFuture;
    private ExecutorService runner;

    public XxlJobSchedulerBackend(XxlJobAdminClient client, String appName, String executorAddress,
                                  int jobGroup, Duration heartbeatInterval) {
        this.client = client;
        this.appName = appName;
        this.executorAddress = executorAddress;
        this.jobGroup = jobGroup;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public String backendType() {
        return TYPE;
    }

    @Override
    public SchedulerState state() {
        return state;
    }

    public String accessToken() {
        return client.accessToken();
    }

    @Override
    public synchronized void start() {
        if (state != SchedulerState.STOPPED) {
            return;
        }
        client.post(XxlJobAdminClient.API_REGISTRY, registryBody());
        log.info("Registered XXL-JOB executor {} -> {}", appName, executorAddress);

        runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "xxljob-runner");
            t.setDaemon(true);
            return t;
        });
        heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "xxljob-heartbeat");
            t.setDaemon(true);
            return t;
        });
        long period = heartbeatInterval.toMillis();
        heartbeatFuture = heartbeat.scheduleWithFixedDelay(this::sendHeartbeat, period, period, TimeUnit.MILLISECONDS);
        state = SchedulerState.RUNNING;
        jobs.values().forEach(this::syncToAdmin);
    }

    @Override
    public synchronized void stop(boolean wait) {
        if (state == SchedulerState.STOPPED) {
            return;
        }
        heartbeatFuture.cancel(false);
        heartbeat.shutdown();
        runner.shutdown();
        if (wait) {
            try {
                if (!runner.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("XXL-JOB runs did not finish within 30s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        try {
            client.post(XxlJobAdminClient.API_REGISTRY_REMOVE, registryBody());
            log.info("Unregistered XXL-JOB executor {}", appName);
        } catch (XxlJobAdminException e) {
            log.warn("Failed to unregister XXL-JOB executor {}: {}", appName, e.getMessage());
        }
        state = SchedulerState.STOPPED;
    }

    /** Jobs registered while stopped are only pushed to the admin once the backend starts. */
    @Override
    public ScheduledJob scheduleJob(String jobId, String name, Runnable task, TriggerType type,
                                    TriggerConfig config, boolean replaceExisting) {
        JobTriggers.requireSchedulable(type, config);
        if (jobs.containsKey(jobId) && !replaceExisting) {
            throw new JobAlreadyExistsException(jobId);
        }
        String cron = type == TriggerType.ONE_TIME
                ? ONE_TIME_CRON.format(config.executeAt().atZone(ZoneOffset.UTC))
                : JobTriggers.toQuartzCron(type, config);
        Instant next = JobTriggers.nextRun(type, config, Instant.now());
        ScheduledJob job = new ScheduledJob(jobId, name, type, config, next, false, task, Map.of("cron", cron));
        jobs.put(jobId, job);
        if (state != SchedulerState.STOPPED) {
            syncToAdmin(job);
        }
        return job;
    }

    private void syncToAdmin(ScheduledJob job) {
        String jobId = job.jobId();
        String cron = String.valueOf(job.args().get("cron"));
        Map<String, Object> jobInfo = new LinkedHashMap<>();
        jobInfo.put("jobGroup", jobGroup);
        jobInfo.put("jobDesc", "ClawTrigger: " + (job.name() != null ? job.name() : jobId));
        jobInfo.put("author", "clawtrigger");
        jobInfo.put("scheduleType", "CRON");
        jobInfo.put("scheduleConf", cron);
        jobInfo.put("misfireStrategy", "DO_NOTHING");
        jobInfo.put("executorRouteStrategy", "FIRST");
        jobInfo.put("executorHandler", EXECUTOR_HANDLER);
        jobInfo.put("executorParam", jobId);
        jobInfo.put("executorBlockStrategy", "SERIAL_EXECUTION");
        jobInfo.put("executorTimeout", 0);
        jobInfo.put("executorFailRetryCount", 3);
        jobInfo.put("glueType", "BEAN");
        jobInfo.put("triggerStatus", 1);

        try {
            Integer adminId = adminJobIds.get(jobId);
            if (adminId != null) {
                jobInfo.put("id", adminId);
                client.post(XxlJobAdminClient.API_JOB_UPDATE, jobInfo);
            } else {
                JsonNode result = client.post(XxlJobAdminClient.API_JOB_ADD, jobInfo);
                adminJobIds.put(jobId, result.path("content").asInt());
            }
            log.info("Scheduled XXL-JOB job {} with cron '{}' (admin id {})", jobId, cron, adminJobIds.get(jobId));
        } catch (XxlJobAdminException e) {
            // Kept locally so admin callbacks can still run it once the admin is fixed.
            log.error("Failed to register job {} with XXL-JOB admin", jobId, e);
        }
    }

    @Override
    public boolean removeJob(String jobId) {
        ScheduledJob removed = jobs.remove(jobId);
        Integer adminId = adminJobIds.remove(jobId);
        if (adminId != null) {
            try {
                client.post(XxlJobAdminClient.API_JOB_REMOVE, Map.of("id", adminId));
            } catch (XxlJobAdminException e) {
                log.warn("Failed to remove job {} from XXL-JOB admin: {}", jobId, e.getMessage());
            }
        }
        return removed != null;
    }

    @Override
    public Optional<ScheduledJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<ScheduledJob> getJobs() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public void pauseJob(String jobId) {
        client.post(XxlJobAdminClient.API_JOB_STOP, Map.of("id", requireAdminId(jobId)));
        jobs.computeIfPresent(jobId, (id, job) -> job.withPaused(true));
        log.info("Paused XXL-JOB job {}", jobId);
    }

    @Override
    public void resumeJob(String jobId) {
        client.post(XxlJobAdminClient.API_JOB_START, Map.of("id", requireAdminId(jobId)));
        jobs.computeIfPresent(jobId, (id, job) -> job.withPaused(false));
        log.info("Resumed XXL-JOB job {}", jobId);
    }

    @Override
    public JobHandle executeJobNow(String jobId) {
        Integer adminId = requireAdminId(jobId);
        client.post(XxlJobAdminClient.API_JOB_TRIGGER, Map.of("id", adminId, "executorParam", jobId));
        log.info("Triggered XXL-JOB job {} immediately", jobId);
        return new JobHandle(jobId, String.valueOf(adminId), Instant.now());
    }

    @Override
    public SchedulerHealth healthCheck() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("adminAddresses", client.adminAddresses());
        details.put("appName", appName);
        boolean healthy = false;
        for (String address : client.adminAddresses()) {
            try {
                client.postTo(address, XxlJobAdminClient.API_REGISTRY, registryBody());
                details.put("connectedAdmin", address);
                healthy = true;
                break;
            } catch (XxlJobAdminException e) {
                details.put("error_" + address, e.getMessage());
            }
        }
        return new SchedulerHealth(healthy, TYPE, state, jobs.size(), details);
    }

    /**
     * Admin callback for one trigger of {@code jobId}. The task runs asynchronously and its result is
     * reported back to the admin under {@code logId}.
     *
     * @return false if the job is unknown or already running
     */
    public boolean runJob(String jobId, long logId, long logDateTime) {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            log.warn("XXL-JOB admin triggered unknown job {}", jobId);
            return false;
        }
        if (state == SchedulerState.STOPPED || !runningJobs.add(jobId)) {
            return false;
        }
        runner.execute(() -> {
            int code = 200;
            String message = null;
            try {
                job.task().run();
            } catch (Exception e) {
                log.error("XXL-JOB job {} failed", jobId, e);
                code = 500;
                message = e.getMessage();
            } finally {
                runningJobs.remove(jobId);
            }
            reportResult(logId, logDateTime, code, message);
        });
        return true;
    }

    public boolean isRunning(String jobId) {
        return runningJobs.contains(jobId);
    }

    private void reportResult(long logId, long logDateTime, int code, String message) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("logId", logId);
        result.put("logDateTim", logDateTime);
        result.put("handleCode", code);
        result.put("handleMsg", message);
        try {
            client.post(XxlJobAdminClient.API_CALLBACK, List.of(result));
        } catch (XxlJobAdminException e) {
            log.warn("Failed to report result of XXL-JOB log {}: {}", logId, e.getMessage());
        }
    }

    private void sendHeartbeat() {
        try {
            client.post(XxlJobAdminClient.API_REGISTRY, registryBody());
        } catch (Exception e) {
            log.warn("XXL-JOB heartbeat failed: {}", e.getMessage());
        }
    }

    private Integer requireAdminId(String jobId) {
        Integer adminId = adminJobIds.get(jobId);
        if (adminId == null) {
            throw new JobNotFoundException(jobId);
        }
        return adminId;
    }

    private Map<String, Object> registryBody() {
        return Map.of(
                "registryGroup", "EXECUTOR",
                "registryKey", appName,
                "registryValue", executorAddress);
    }
}
