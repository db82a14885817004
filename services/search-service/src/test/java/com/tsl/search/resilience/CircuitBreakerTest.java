package com.tsl.search.resilience;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CircuitBreakerTest {

    @Test
    void opensAfterThresholdAndClosesAfterWindow() {
        AtomicLong now = new AtomicLong(1_000L);
        CircuitBreaker breaker = new CircuitBreaker("rerank", 2, 500L, now::get);

        breaker.recordFailure();
        assertTrue(breaker.allowRequest());
        breaker.recordFailure();
        assertTrue(breaker.isOpen());

        now.addAndGet(499L);
        assertFalse(breaker.allowRequest());
        now.addAndGet(1L);
        assertTrue(breaker.allowRequest());
    }

    @Test
    void successResetsFailureCount() {
        CircuitBreaker breaker = new CircuitBreaker("embed", 2, 500L, () -> 0L);

        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertTrue(breaker.allowRequest());
    }
}
