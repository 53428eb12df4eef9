package io.github.drompincen.clawtrigger.runtime.scheduler;

import java.util.Collection;

public class SchedulerBackendNotFoundException extends RuntimeException {

    public SchedulerBackendNotFoundException(String name, Collection<String> available) {
        super("Unknown scheduler backend '" + name + "'. Available: " + available);
    }
}
