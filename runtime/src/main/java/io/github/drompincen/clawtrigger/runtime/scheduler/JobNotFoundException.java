package io.github.drompincen.clawtrigger.runtime.scheduler;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
    }
}
