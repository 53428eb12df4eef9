package io.github.drompincen.clawtrigger.runtime.worker;

public class ExecutionHandlerException extends RuntimeException {

    public ExecutionHandlerException(String message) {
        super(message);
    }

    public ExecutionHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
