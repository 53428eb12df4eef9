package io.github.drompincen.clawtrigger.runtime.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Named factories for scheduler backends plus the one backend active in this process. The active
 * backend is set explicitly once it has started. The job host is the backend whose job table runs
 * queued ticks here; in a worker-only process it is registered but never started, so it is never
 * active.
 */
@Component
public class SchedulerBackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchedulerBackendRegistry.class);

    private final Map<String, Supplier<SchedulerBackend>> factories = new ConcurrentHashMap<>();
    private final String defaultBackend;
    private volatile SchedulerBackend active;
    private volatile String activeName;
    private volatile SchedulerBackend jobHost;

    public SchedulerBackendRegistry(@Value("${clawtrigger.scheduler.backend:queue}") String defaultBackend) {
        this.defaultBackend = normalize(defaultBackend);
    }

    public void register(String name, Supplier<SchedulerBackend> factory, boolean override) {
        String key = normalize(name);
        if (factories.containsKey(key) && !override) {
            log.warn("Scheduler backend '{}' is already registered, ignoring", key);
            return;
        }
        factories.put(key, factory);
        log.info("Registered scheduler backend '{}'", key);
    }

    public boolean unregister(String name) {
        String key = normalize(name);
        if (key.equals(activeName)) {
            log.warn("Cannot unregister active scheduler backend '{}'", key);
            return false;
        }
        return factories.remove(key) != null;
    }

    public SchedulerBackend create(String name) {
        String key = normalize(name);
        Supplier<SchedulerBackend> factory = factories.get(key);
        if (factory == null) {
            throw new SchedulerBackendNotFoundException(key, listBackends());
        }
        return factory.get();
    }

    public boolean isRegistered(String name) {
        return factories.containsKey(normalize(name));
    }

    public List<String> listBackends() {
        List<String> names = new ArrayList<>(factories.keySet());
        Collections.sort(names);
        return names;
    }

    public String defaultBackend() {
        return defaultBackend;
    }

    public synchronized void setActive(SchedulerBackend backend) {
        if (active != null && active != backend) {
            log.warn("Replacing active scheduler backend '{}' with '{}'", activeName, backend.backendType());
        }
        this.active = backend;
        this.activeName = normalize(backend.backendType());
        this.jobHost = backend;
    }

    public Optional<SchedulerBackend> getActive() {
        return Optional.ofNullable(active);
    }

    public synchronized void setJobHost(SchedulerBackend backend) {
        this.jobHost = backend;
    }

    public Optional<SchedulerBackend> getJobHost() {
        return Optional.ofNullable(jobHost);
    }

    public synchronized void clearActive() {
        this.active = null;
        this.activeName = null;
        this.jobHost = null;
    }

    private static String normalize(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Backend name is required");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
