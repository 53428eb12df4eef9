package io.github.drompincen.clawtrigger.runtime.breaker;

public record CallResult<T>(Kind kind, T value, Exception error) {

    public enum Kind { SUCCESS, FAILURE, REJECTED }

    public static <T> CallResult<T> success(T value) {
        return new CallResult<>(Kind.SUCCESS, value, null);
    }

    public static <T> CallResult<T> failure(Exception error) {
        return new CallResult<>(Kind.FAILURE, null, error);
    }

    public static <T> CallResult<T> rejected(CircuitBreakerOpenException error) {
        return new CallResult<>(Kind.REJECTED, null, error);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }

    public CircuitBreakerOpenException rejection() {
        return kind == Kind.REJECTED ? (CircuitBreakerOpenException) error : null;
    }
}
