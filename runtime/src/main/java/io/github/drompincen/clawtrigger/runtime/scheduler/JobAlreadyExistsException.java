package io.github.drompincen.clawtrigger.runtime.scheduler;

public class JobAlreadyExistsException extends RuntimeException {

    public JobAlreadyExistsException(String jobId) {
        super("Job already exists: " + jobId);
    }
}
