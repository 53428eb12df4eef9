package io.github.drompincen.clawtrigger.runtime.subscription;

public class InvalidTriggerConfigException extends RuntimeException {

    public InvalidTriggerConfigException(String message) {
        super(message);
    }

    public InvalidTriggerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
