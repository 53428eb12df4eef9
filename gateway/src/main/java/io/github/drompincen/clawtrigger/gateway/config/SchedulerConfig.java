package io.github.drompincen.clawtrigger.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import io.github.drompincen.clawtrigger.runtime.scheduler.local.TaskSchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.queue.QueueSchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.xxljob.XxlJobAdminClient;
import io.github.drompincen.clawtrigger.runtime.scheduler.xxljob.XxlJobSchedulerBackend;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

@Configuration
public class SchedulerConfig {

    private final SchedulerBackendRegistry registry;
    private final ExecutionQueue queue;
    private final ObjectMapper objectMapper;

    @Value("${clawtrigger.local.pool-size:4}")
    private int localPoolSize;
    @Value("${clawtrigger.queue.beat-interval-ms:1000}")
    private long beatIntervalMs;
    @Value("${clawtrigger.xxljob.admin-addresses:}")
    private String xxlAdminAddresses;
    @Value("${clawtrigger.xxljob.access-token:}")
    private String xxlAccessToken;
    @Value("${clawtrigger.xxljob.app-name:clawtrigger-executor}")
    private String xxlAppName;
    @Value("${clawtrigger.xxljob.executor-address:}")
    private String xxlExecutorAddress;
    @Value("${clawtrigger.xxljob.executor-port:${server.port:8080}}")
    private int xxlExecutorPort;
    @Value("${clawtrigger.xxljob.job-group:1}")
    private int xxlJobGroup;
    @Value("${clawtrigger.xxljob.timeout-seconds:10}")
    private long xxlTimeoutSeconds;

    public SchedulerConfig(SchedulerBackendRegistry registry, ExecutionQueue queue, ObjectMapper objectMapper) {
        this.registry = registry;
        this.queue = queue;
        this.objectMapper = objectMapper;
    }

    @Bean
    ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("clawtrigger-maint-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @PostConstruct
    void registerBackends() {
        registry.register(QueueSchedulerBackend.TYPE,
                () -> new QueueSchedulerBackend(queue, Duration.ofMillis(beatIntervalMs)), false);
        registry.register(TaskSchedulerBackend.TYPE, () -> new TaskSchedulerBackend(localPoolSize), false);
        registry.register(XxlJobSchedulerBackend.TYPE, this::xxlJobBackend, false);
    }

    private XxlJobSchedulerBackend xxlJobBackend() {
        List<String> admins = Arrays.stream(xxlAdminAddresses.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        Duration timeout = Duration.ofSeconds(xxlTimeoutSeconds);
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
        XxlJobAdminClient client = new XxlJobAdminClient(httpClient, objectMapper, admins, xxlAccessToken, timeout);
        return new XxlJobSchedulerBackend(client, xxlAppName, executorAddress(), xxlJobGroup, Duration.ofSeconds(30));
    }

    private String executorAddress() {
        if (!xxlExecutorAddress.isBlank()) {
            return xxlExecutorAddress;
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            host = "127.0.0.1";
        }
        return "http://" + host + ":" + xxlExecutorPort + "/";
    }
}
