package com.teknolojikpanda.findings.triage.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Guards calls to the task tracker.
 * <ul>
 *     <li>CLOSED: calls pass through; consecutive failures are counted.</li>
 *     <li>OPEN: calls are rejected with {@link CircuitBreakerOpenException} until the cooldown elapses.</li>
 *     <li>HALF_OPEN: one trial call decides between CLOSED and OPEN.</li>
 * </ul>
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
    private final Duration cooldown;
    private final Clock clock;
    private final AtomicInteger failureCount = new AtomicInteger();
    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicReference<Instant> openedAt = new AtomicReference<>();
    private final AtomicLong blockedCalls = new AtomicLong();
    private final AtomicLong openEvents = new AtomicLong();

    public CircuitBreaker(@Nonnull String name, int failureThreshold, @Nonnull Duration cooldown) {
        this(name, failureThreshold, cooldown, Clock.systemUTC());
    }

    public CircuitBreaker(@Nonnull String name, int failureThreshold, @Nonnull Duration cooldown, @Nonnull Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.failureThreshold = failureThreshold;
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return true while calls are being rejected; moves OPEN to HALF_OPEN once the cooldown elapsed
     */
    public boolean isOpen() {
        if (state.get() != State.OPEN) {
            return false;
        }
        Instant opened = openedAt.get();
        if (opened != null && !Duration.between(opened, clock.instant()).minus(cooldown).isNegative()) {
            if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                LogSupport.info(log, LogEvent.BREAKER_HALF_OPEN, "Cooldown elapsed, allowing a trial call", "breaker", name);
            }
            return false;
        }
        return true;
    }

    /**
     * Time left until an open circuit lets a trial call through; zero unless {@link State#OPEN}.
     */
    @Nonnull
    public Duration remainingCooldown() {
        Instant opened = openedAt.get();
        if (state.get() != State.OPEN || opened == null) {
            return Duration.ZERO;
        }
        Duration left = cooldown.minus(Duration.between(opened, clock.instant()));
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * @throws CircuitBreakerOpenException when the circuit is open
     * @throws Exception whatever the operation throws; the failure is recorded first
     */
    public <T> T execute(@Nonnull Operation<T> operation) throws Exception {
        if (isOpen()) {
            blockedCalls.incrementAndGet();
            throw new CircuitBreakerOpenException("Circuit breaker [" + name + "] is OPEN");
        }
        T result;
        try {
            result = operation.execute();
        } catch (Exception e) {
            recordFailure();
            throw e;
        }
        recordSuccess();
        return result;
    }

    public void recordFailure() {
        int failures = failureCount.incrementAndGet();
        State current = state.get();
        if (current == State.HALF_OPEN || (current == State.CLOSED && failures >= failureThreshold)) {
            open(failures);
        } else {
            log.debug("Circuit breaker [{}] failure {}/{}", name, failures, failureThreshold);
        }
    }

    public void reset() {
        failureCount.set(0);
        state.set(State.CLOSED);
        openedAt.set(null);
    }

    private void open(int failures) {
        state.set(State.OPEN);
        openedAt.set(clock.instant());
        openEvents.incrementAndGet();
        LogSupport.warn(log, LogEvent.BREAKER_OPEN, "Tracker calls suspended",
                "breaker", name,
                "failures", failures,
                "cooldownMs", cooldown.toMillis());
    }

    private void recordSuccess() {
        if (state.get() == State.HALF_OPEN) {
            LogSupport.info(log, LogEvent.BREAKER_CLOSED, "Trial call succeeded", "breaker", name);
            reset();
        } else {
            failureCount.set(0);
        }
    }

    @Nonnull
    public State getState() {
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public long getBlockedCalls() {
        return blockedCalls.get();
    }

    public long getOpenEvents() {
        return openEvents.get();
    }

    @FunctionalInterface
    public interface Operation<T> {
        T execute() throws Exception;
    }

    public static class CircuitBreakerOpenException extends RuntimeException {
        public CircuitBreakerOpenException(String message) {
            super(message);
        }
    }
}
