package com.tsl.search.resilience;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Consecutive-failure breaker. Once open it rejects calls until the open window elapses; it never
 * retries on the caller's behalf.
 */
public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final LongSupplier clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this(name, failureThreshold, openDurationMs, System::currentTimeMillis);
    }

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs, LongSupplier clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public boolean allowRequest() {
        return clock.getAsLong() >= openUntilMs.get();
    }

    public boolean isOpen() {
        return !allowRequest();
    }

    public void recordSuccess() {
        failureCount.set(0);
    }

    public void recordFailure() {
        int failures = failureCount.incrementAndGet();
        if (failures >= failureThreshold) {
            openUntilMs.set(clock.getAsLong() + openDurationMs);
            failureCount.set(0);
        }
    }
}
