package com.project.hatchmark.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Circuit breaker guarding a remote collaborator (ledger RPC, REST store).
 *
 * States:
 *
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Collaborator is failing, requests are blocked
 * - HALF_OPEN: Probing whether the collaborator recovered
 *
 * Transitions:
 * - CLOSED -> OPEN: After failureThreshold consecutive failures
 * - OPEN -> HALF_OPEN: After openDuration has passed
 * - HALF_OPEN -> CLOSED: After successThreshold consecutive successes
 * - HALF_OPEN -> OPEN: After any failure
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openDuration;
    private final Clock clock;

    private final AtomicReference<State> state;
    private final AtomicInteger failureCount;
    private final AtomicInteger successCount;
    private final AtomicReference<Instant> lastFailureTime;
    private final AtomicReference<Instant> stateChangedTime;

    /**
     * Create a circuit breaker with default settings: open after 5 failures, stay open 30s,
     * close after 3 successes.
     *
     * @param name Identifier for logging
     */
    public CircuitBreaker(String name) {
        this(name, 5, 3, Duration.ofSeconds(30), Clock.systemUTC());
    }

    /**
     * @param name Identifier for logging
     * @param failureThreshold Number of failures before opening circuit
     * @param successThreshold Number of successes in half-open to close circuit
     * @param openDuration How long to stay open before trying half-open
     * @param clock Time source for the open window
     */
    public CircuitBreaker(String name, int failureThreshold, int successThreshold,
                          Duration openDuration, Clock clock) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new IllegalArgumentException("Thresholds must be positive");
        }

        this.name = name;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.openDuration = openDuration;
        this.clock = clock;

        this.state = new AtomicReference<>(State.CLOSED);
        this.failureCount = new AtomicInteger(0);
        this.successCount = new AtomicInteger(0);
        this.lastFailureTime = new AtomicReference<>(Instant.MIN);
        this.stateChangedTime = new AtomicReference<>(clock.instant());
    }

    /**
     * Execute an operation through the circuit breaker.
     *
     * @throws CircuitBreakerOpenException if circuit is open
     */
    public <T> T execute(Supplier<T> operation) {
        if (!canExecute()) {
            throw new CircuitBreakerOpenException(
                String.format("Circuit breaker '%s' is OPEN. Last failure: %s",
                    name, lastFailureTime.get())
            );
        }

        try {
            T result = operation.get();
            recordSuccess();
            return result;
        } catch (RuntimeException e) {
            recordFailure();
            throw e;
        }
    }

    /**
     * Check if an operation can be executed.
     */
    public boolean canExecute() {
        switch (state.get()) {
            case CLOSED:
                return true;

            case OPEN:
                if (shouldTransitionToHalfOpen()) {
                    transitionTo(State.HALF_OPEN);
                    return true;
                }
                return false;

            case HALF_OPEN:
                return true;

            default:
                return false;
        }
    }

    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            int successes = successCount.incrementAndGet();
            if (successes >= successThreshold) {
                transitionTo(State.CLOSED);
            }
        } else if (currentState == State.CLOSED) {
            failureCount.set(0);
        }
    }

    public void recordFailure() {
        lastFailureTime.set(clock.instant());
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            transitionTo(State.OPEN);
        } else if (currentState == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold) {
                transitionTo(State.OPEN);
            }
        }
    }

    private boolean shouldTransitionToHalfOpen() {
        Instant changedAt = stateChangedTime.get();
        return !clock.instant().isBefore(changedAt.plus(openDuration));
    }

    private synchronized void transitionTo(State newState) {
        State oldState = state.get();
        if (oldState != newState) {
            state.set(newState);
            stateChangedTime.set(clock.instant());

            if (newState == State.CLOSED) {
                failureCount.set(0);
                successCount.set(0);
            } else {
                successCount.set(0);
            }

            if (newState == State.OPEN) {
                log.warn("[CircuitBreaker:{}] State changed: {} -> {}", name, oldState, newState);
            } else {
                log.info("[CircuitBreaker:{}] State changed: {} -> {}", name, oldState, newState);
            }
        }
    }

    public State getState() {
        if (state.get() == State.OPEN && shouldTransitionToHalfOpen()) {
            transitionTo(State.HALF_OPEN);
        }
        return state.get();
    }

    public String getName() {
        return name;
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    /**
     * Manually reset the circuit breaker to closed state.
     */
    public void reset() {
        transitionTo(State.CLOSED);
    }

    /**
     * Manually trip the circuit breaker to open state.
     */
    public void trip() {
        transitionTo(State.OPEN);
    }

    /**
     * Thrown instead of calling the collaborator while the circuit is open.
     */
    public static class CircuitBreakerOpenException extends RuntimeException {
        public CircuitBreakerOpenException(String message) {
            super(message);
        }
    }
}
