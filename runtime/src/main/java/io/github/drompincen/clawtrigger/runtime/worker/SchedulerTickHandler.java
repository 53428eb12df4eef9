package io.github.drompincen.clawtrigger.runtime.worker;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.runtime.queue.QueuedJob;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import io.github.drompincen.clawtrigger.runtime.scheduler.queue.QueueSchedulerBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SchedulerTickHandler implements QueuedJobHandler {

    private static final Logger log = LoggerFactory.getLogger(SchedulerTickHandler.class);

    private final SchedulerBackendRegistry registry;

    public SchedulerTickHandler(SchedulerBackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public QueuedJobDocument.Kind kind() {
        return QueuedJobDocument.Kind.SCHEDULER_TICK;
    }

    @Override
    public void handle(QueuedJob job) {
        SchedulerBackend host = registry.getJobHost()
                .orElseThrow(() -> new IllegalStateException("No scheduler backend registered yet"));
        if (!(host instanceof QueueSchedulerBackend queueBackend)) {
            log.warn("Dropping tick {} for job {}: backend here is {}", job.jobId(), job.payload(), host.backendType());
            return;
        }
        if (!queueBackend.runTick(job.payload())) {
            log.warn("Dropping tick {} for unknown job {}", job.jobId(), job.payload());
        }
    }
}
