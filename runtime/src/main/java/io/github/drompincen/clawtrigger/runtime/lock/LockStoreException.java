package io.github.drompincen.clawtrigger.runtime.lock;

public class LockStoreException extends RuntimeException {

    public LockStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
