package com.docpulse.pipeline.resilience;

import com.docpulse.pipeline.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Transition tests for the {@link ProviderHealth} circuit breaker.
 */
class ProviderHealthTest {

    private static final CircuitBreakerPolicy POLICY =
            new CircuitBreakerPolicy(5, 2, Duration.ofSeconds(60), 1);

    private MutableClock clock;
    private ProviderHealth health;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        health = new ProviderHealth("primary", POLICY, clock);
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            health.recordFailure();
        }
    }

    // =========================================================================
    // CLOSED -> OPEN
    // =========================================================================

    @Test
    @DisplayName("Stays CLOSED below the failure threshold")
    void belowThreshold_staysClosed() {
        fail(4);

        assertEquals(CircuitState.CLOSED, health.state());
        assertTrue(health.tryAcquirePermission());
        assertEquals(4, health.consecutiveFailures());
    }

    @Test
    @DisplayName("Opens after exactly failureThreshold consecutive failures")
    void atThreshold_opens() {
        fail(5);

        assertEquals(CircuitState.OPEN, health.state());
        assertTrue(health.isOpen());
        assertFalse(health.tryAcquirePermission());
        assertEquals(Duration.ofSeconds(60), health.cooldownRemaining());
    }

    @Test
    @DisplayName("A success resets the consecutive failure count")
    void successResetsFailures() {
        fail(4);
        health.recordSuccess();
        fail(4);

        assertEquals(CircuitState.CLOSED, health.state());
    }

    // =========================================================================
    // OPEN -> HALF_OPEN -> CLOSED / OPEN
    // =========================================================================

    @Test
    @DisplayName("Moves to HALF_OPEN only once the cooldown has elapsed")
    void cooldown_movesToHalfOpen() {
        fail(5);

        clock.advance(Duration.ofSeconds(59));
        assertEquals(CircuitState.OPEN, health.state());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitState.HALF_OPEN, health.state());
    }

    @Test
    @DisplayName("HALF_OPEN admits at most halfOpenProbeLimit probes at once")
    void halfOpen_limitsProbes() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));

        assertTrue(health.tryAcquirePermission());
        assertFalse(health.tryAcquirePermission());

        health.recordSuccess();
        assertTrue(health.tryAcquirePermission());
    }

    @Test
    @DisplayName("successThreshold consecutive successes in HALF_OPEN close the circuit")
    void halfOpen_successesClose() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));

        assertTrue(health.tryAcquirePermission());
        health.recordSuccess();
        assertEquals(CircuitState.HALF_OPEN, health.state());

        assertTrue(health.tryAcquirePermission());
        health.recordSuccess();
        assertEquals(CircuitState.CLOSED, health.state());
    }

    @Test
    @DisplayName("Any failure in HALF_OPEN reopens with a fresh cooldown")
    void halfOpen_failureReopens() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));
        assertTrue(health.tryAcquirePermission());

        health.recordFailure();

        assertEquals(CircuitState.OPEN, health.state());
        clock.advance(Duration.ofSeconds(30));
        assertEquals(CircuitState.OPEN, health.state());
        assertEquals(Duration.ofSeconds(30), health.cooldownRemaining());
        clock.advance(Duration.ofSeconds(30));
        assertEquals(CircuitState.HALF_OPEN, health.state());
    }

    @Test
    @DisplayName("Released probe permission frees the HALF_OPEN slot without an outcome")
    void releasePermission_freesSlot() {
        fail(5);
        clock.advance(Duration.ofSeconds(60));
        assertTrue(health.tryAcquirePermission());

        health.releasePermission();

        assertTrue(health.tryAcquirePermission());
        assertEquals(CircuitState.HALF_OPEN, health.state());
    }

    // =========================================================================
    // Quota
    // =========================================================================

    @Test
    @DisplayName("Quota exhaustion is tracked separately from the circuit")
    void quotaExhausted_doesNotOpen() {
        health.markQuotaExhausted();

        assertTrue(health.isQuotaExhausted());
        assertEquals(CircuitState.CLOSED, health.state());
        assertEquals(0, health.consecutiveFailures());
    }

    @Test
    @DisplayName("Timestamps record the last success and failure")
    void timestamps() {
        health.recordFailure();
        Instant failedAt = clock.instant();
        clock.advance(Duration.ofSeconds(5));
        health.recordSuccess();

        assertEquals(failedAt, health.lastFailureAt());
        assertEquals(clock.instant(), health.lastSuccessAt());
    }
}
