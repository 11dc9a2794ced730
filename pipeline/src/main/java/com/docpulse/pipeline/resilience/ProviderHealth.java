package com.docpulse.pipeline.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Circuit breaker and health record for one external provider.
 *
 * <pre>
 *   CLOSED    --failureThreshold consecutive failures--&gt; OPEN
 *   OPEN      --cooldown elapsed--------------------------&gt; HALF_OPEN
 *   HALF_OPEN --successThreshold consecutive successes----&gt; CLOSED
 *   HALF_OPEN --any failure (cooldown restarts)-----------&gt; OPEN
 * </pre>
 *
 * <p>HALF_OPEN admits at most {@code halfOpenProbeLimit} trial calls in
 * flight at once. Every method is synchronized on the instance.</p>
 */
public class ProviderHealth {

    private static final Logger logger = LoggerFactory.getLogger(ProviderHealth.class);

    private final String name;
    private final CircuitBreakerPolicy policy;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int probesInFlight;
    private Instant openedAt;
    private Instant lastFailureAt;
    private Instant lastSuccessAt;
    private boolean quotaExhausted;

    public ProviderHealth(String name, CircuitBreakerPolicy policy) {
        this(name, policy, Clock.systemUTC());
    }

    public ProviderHealth(String name, CircuitBreakerPolicy policy, Clock clock) {
        this.name = name;
        this.policy = policy;
        this.clock = clock;
    }

    public String name() {
        return name;
    }

    /**
     * Current state, moving OPEN to HALF_OPEN once the cooldown has elapsed.
     */
    public synchronized CircuitState state() {
        if (state == CircuitState.OPEN && cooldownElapsed()) {
            transition(CircuitState.HALF_OPEN);
            consecutiveSuccesses = 0;
            probesInFlight = 0;
        }
        return state;
    }

    /**
     * Whether a call may proceed now. In HALF_OPEN a successful check reserves
     * one probe slot, released by the next {@link #recordSuccess()} or
     * {@link #recordFailure()}.
     */
    public synchronized boolean tryAcquirePermission() {
        switch (state()) {
            case CLOSED:
                return true;
            case HALF_OPEN:
                if (probesInFlight < policy.halfOpenProbeLimit()) {
                    probesInFlight++;
                    return true;
                }
                return false;
            default:
                return false;
        }
    }

    public synchronized boolean isOpen() {
        return state() == CircuitState.OPEN;
    }

    public synchronized void recordSuccess() {
        lastSuccessAt = clock.instant();
        consecutiveFailures = 0;
        consecutiveSuccesses++;
        releaseProbe();

        if (state == CircuitState.HALF_OPEN && consecutiveSuccesses >= policy.successThreshold()) {
            transition(CircuitState.CLOSED);
        }
    }

    public synchronized void recordFailure() {
        lastFailureAt = clock.instant();
        consecutiveSuccesses = 0;
        consecutiveFailures++;
        releaseProbe();

        if (state == CircuitState.HALF_OPEN) {
            open();
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= policy.failureThreshold()) {
            open();
        }
    }

    /**
     * Gives back a HALF_OPEN probe slot without recording an outcome, for
     * calls abandoned before they finished.
     */
    public synchronized void releasePermission() {
        releaseProbe();
    }

    /**
     * Marks the provider as out of quota for the rest of the run. Does not
     * touch the circuit.
     */
    public synchronized void markQuotaExhausted() {
        if (!quotaExhausted) {
            logger.warn("Provider {} quota exhausted, disabled for the rest of the run", name);
        }
        quotaExhausted = true;
    }

    public synchronized boolean isQuotaExhausted() {
        return quotaExhausted;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized int consecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public synchronized Instant lastFailureAt() {
        return lastFailureAt;
    }

    public synchronized Instant lastSuccessAt() {
        return lastSuccessAt;
    }

    /**
     * Time left before an OPEN circuit admits a probe; zero when not OPEN.
     */
    public synchronized Duration cooldownRemaining() {
        if (state() != CircuitState.OPEN || openedAt == null) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(openedAt, clock.instant());
        Duration remaining = policy.cooldown().minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void open() {
        openedAt = clock.instant();
        probesInFlight = 0;
        transition(CircuitState.OPEN);
    }

    private void releaseProbe() {
        if (probesInFlight > 0) {
            probesInFlight--;
        }
    }

    private boolean cooldownElapsed() {
        return openedAt == null
                || !clock.instant().isBefore(openedAt.plus(policy.cooldown()));
    }

    private void transition(CircuitState next) {
        if (state != next) {
            logger.info("Circuit for {} {} -> {} (consecutive failures: {})",
                    name, state, next, consecutiveFailures);
            state = next;
        }
    }
}
