package io.github.drompincen.clawtrigger.runtime.breaker;

import io.github.drompincen.clawtrigger.protocol.api.CircuitBreakerStatus;
import io.github.drompincen.clawtrigger.protocol.api.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker for one named dependency.
 *
 * <p>CLOSED passes calls through and counts consecutive failures; reaching {@code failMax} opens the
 * circuit. OPEN rejects calls until {@code resetTimeout} has elapsed, then the next caller becomes
 * the single HALF_OPEN trial: success closes the circuit, failure reopens it and restarts the timer.
 * Only the trial's own outcome settles HALF_OPEN; calls admitted earlier that finish during the trial
 * count toward {@code failCounter} but never change state. State is process-local.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);
    private static final long NOT_A_TRIAL = 0L;

    private final String name;
    private final int failMax;
    private final Duration resetTimeout;
    private final Clock clock;
    private final CircuitBreakerListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int failCounter;
    private Instant openedAt;
    private Instant lastStateChangeAt;
    private boolean trialInFlight;
    private long trialTicket;

    public CircuitBreaker(String name, int failMax, Duration resetTimeout) {
        this(name, failMax, resetTimeout, Clock.systemUTC(), CircuitBreakerListener.NOOP);
    }

    public CircuitBreaker(String name, int failMax, Duration resetTimeout, Clock clock,
                          CircuitBreakerListener listener) {
        if (failMax < 1) {
            throw new IllegalArgumentException("failMax must be at least 1");
        }
        this.name = name;
        this.failMax = failMax;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
        this.listener = listener;
        this.lastStateChangeAt = clock.instant();
    }

    public <T> T call(Callable<T> fn) throws Exception {
        long ticket = admit();
        return invoke(fn, ticket);
    }

    /** Like {@link #call(Callable)}, but returns the fallback's value instead of raising while OPEN. */
    public <T> T call(Callable<T> fn, Supplier<T> fallback) throws Exception {
        long ticket;
        try {
            ticket = admit();
        } catch (CircuitBreakerOpenException e) {
            log.debug("Circuit {} open, using fallback", name);
            return fallback.get();
        }
        return invoke(fn, ticket);
    }

    public <T> CompletableFuture<T> callAsync(Supplier<CompletableFuture<T>> fn) {
        return callAsync(fn, null);
    }

    public <T> CompletableFuture<T> callAsync(Supplier<CompletableFuture<T>> fn, Supplier<T> fallback) {
        long ticket;
        try {
            ticket = admit();
        } catch (CircuitBreakerOpenException e) {
            if (fallback != null) {
                return CompletableFuture.completedFuture(fallback.get());
            }
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<T> future;
        try {
            future = fn.get();
        } catch (RuntimeException e) {
            onFailure(ticket, e);
            return CompletableFuture.failedFuture(e);
        }
        return future.whenComplete((value, error) -> {
            if (error == null) {
                onSuccess(ticket);
            } else {
                onFailure(ticket, error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
            }
        });
    }

    /** Wraps {@code fn} so every invocation goes through this breaker. */
    public <T> Callable<T> decorate(Callable<T> fn) {
        return () -> call(fn);
    }

    public <T> CallResult<T> execute(Callable<T> fn) {
        long ticket;
        try {
            ticket = admit();
        } catch (CircuitBreakerOpenException e) {
            return CallResult.rejected(e);
        }
        try {
            return CallResult.success(invoke(fn, ticket));
        } catch (Exception e) {
            return CallResult.failure(e);
        }
    }

    private <T> T invoke(Callable<T> fn, long ticket) throws Exception {
        boolean recorded = false;
        try {
            T result = fn.call();
            recorded = true;
            onSuccess(ticket);
            return result;
        } catch (Exception e) {
            recorded = true;
            onFailure(ticket, e);
            throw e;
        } finally {
            // an Error escaped; count it so a HALF_OPEN trial is never left dangling
            if (!recorded) {
                onFailure(ticket, null);
            }
        }
    }

    public synchronized void reset() {
        failCounter = 0;
        trialInFlight = false;
        changeState(CircuitState.CLOSED);
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int failCounter() {
        return failCounter;
    }

    public synchronized Instant lastStateChangeAt() {
        return lastStateChangeAt;
    }

    public synchronized CircuitBreakerStatus status() {
        return new CircuitBreakerStatus(state, failCounter, failMax, resetTimeout.toSeconds());
    }

    public String name() {
        return name;
    }

    public int failMax() {
        return failMax;
    }

    public Duration resetTimeout() {
        return resetTimeout;
    }

    // returns the trial ticket when this call is the HALF_OPEN trial, otherwise NOT_A_TRIAL
    private long admit() {
        CircuitBreakerOpenException rejection = null;
        long ticket = NOT_A_TRIAL;
        synchronized (this) {
            switch (state) {
                case CLOSED -> { }
                case OPEN -> {
                    Instant reopenAt = openedAt.plus(resetTimeout);
                    Instant now = clock.instant();
                    if (now.isBefore(reopenAt)) {
                        rejection = new CircuitBreakerOpenException(name, resetTimeout, Duration.between(now, reopenAt));
                    } else {
                        changeState(CircuitState.HALF_OPEN);
                        ticket = startTrial();
                    }
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        rejection = new CircuitBreakerOpenException(name, resetTimeout, Duration.ZERO);
                    } else {
                        ticket = startTrial();
                    }
                }
            }
        }
        if (rejection != null) {
            listener.onRejected(this);
            throw rejection;
        }
        return ticket;
    }

    // caller holds the monitor
    private long startTrial() {
        trialInFlight = true;
        return ++trialTicket;
    }

    // caller holds the monitor
    private boolean isCurrentTrial(long ticket) {
        return state == CircuitState.HALF_OPEN && trialInFlight && ticket == trialTicket;
    }

    private void onSuccess(long ticket) {
        synchronized (this) {
            if (isCurrentTrial(ticket)) {
                trialInFlight = false;
                failCounter = 0;
                changeState(CircuitState.CLOSED);
            } else if (state == CircuitState.CLOSED) {
                failCounter = 0;
            }
        }
        listener.onSuccess(this);
    }

    private void onFailure(long ticket, Throwable error) {
        synchronized (this) {
            failCounter++;
            if (isCurrentTrial(ticket)) {
                trialInFlight = false;
                open();
            } else if (state == CircuitState.CLOSED && failCounter >= failMax) {
                open();
            }
        }
        listener.onFailure(this, error);
    }

    // caller holds the monitor
    private void open() {
        openedAt = clock.instant();
        changeState(CircuitState.OPEN);
        log.warn("Circuit {} opened after {} consecutive failures, retry in {}s",
                name, failCounter, resetTimeout.toSeconds());
    }

    // caller holds the monitor
    private void changeState(CircuitState next) {
        CircuitState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        lastStateChangeAt = clock.instant();
        log.info("Circuit {} changed state {} -> {}", name, previous, next);
        listener.onStateChange(this, previous, next);
    }
}
