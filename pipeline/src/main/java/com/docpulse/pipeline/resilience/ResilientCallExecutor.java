package com.docpulse.pipeline.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Runs a call with exponential backoff, rate-limit-aware waiting and
 * fail-fast handling of non-retryable errors.
 *
 * <p>Backoff before retry {@code n} (0-based) is
 * {@code min(maxDelay, baseDelay * 2^n) * (1 ± jitterFactor)}, clamped to
 * {@code maxDelay}. Rate-limited failures sleep the server's wait hint
 * (capped at {@code maxDelay}) instead; hints above the policy's ceiling end
 * the retry loop immediately.</p>
 *
 * <p>Thread-safe: holds no per-call state.</p>
 */
public class ResilientCallExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ResilientCallExecutor.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public ResilientCallExecutor(RetryPolicy policy) {
        this(policy, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1) used for jitter
     */
    public ResilientCallExecutor(RetryPolicy policy, Sleeper sleeper, DoubleSupplier random) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.random = random;
    }

    public RetryPolicy policy() {
        return policy;
    }

    public <T> T execute(Callable<T> operation, ErrorClassifier classifier) throws Exception {
        return execute(operation, classifier, AttemptListener.NONE);
    }

    /**
     * Executes {@code operation} until it succeeds, fails non-retryably, or the
     * attempt budget runs out. The last error is rethrown unchanged.
     */
    public <T> T execute(Callable<T> operation, ErrorClassifier classifier,
                         AttemptListener listener) throws Exception {
        int maxAttempts = policy.maxAttempts();

        for (int attempt = 1; ; attempt++) {
            try {
                T result = operation.call();
                listener.onAttempt(new AttemptListener.Attempt(attempt, true, null, null));
                return result;
            } catch (InterruptedException e) {
                listener.onAttempt(new AttemptListener.Attempt(attempt, false, e, null));
                throw e;
            } catch (Exception e) {
                ErrorClassification classification = classifier.classify(e);
                Duration delay = attempt < maxAttempts ? delayFor(classification, attempt - 1) : null;
                listener.onAttempt(new AttemptListener.Attempt(attempt, false, e, delay));

                if (delay == null) {
                    if (classification.kind() != ErrorClassification.Kind.NON_RETRYABLE
                            && attempt >= maxAttempts) {
                        logger.warn("Giving up after {} attempts: {}", attempt, e.getMessage());
                    }
                    throw e;
                }

                logger.warn("Attempt {}/{} failed ({}): {}. Retrying in {}ms",
                        attempt, maxAttempts, classification.kind(), e.getMessage(), delay.toMillis());
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Delay before the next attempt, or {@code null} when no retry should follow.
     */
    private Duration delayFor(ErrorClassification classification, int retryIndex) {
        switch (classification.kind()) {
            case NON_RETRYABLE:
                return null;
            case RATE_LIMITED:
                Duration hint = classification.waitHint();
                if (hint == null) {
                    return backoffDelay(retryIndex);
                }
                if (policy.rateLimitCeiling() != null && hint.compareTo(policy.rateLimitCeiling()) > 0) {
                    logger.warn("Rate-limit wait of {}s exceeds ceiling of {}s, not retrying",
                            hint.toSeconds(), policy.rateLimitCeiling().toSeconds());
                    return null;
                }
                return hint.compareTo(policy.maxDelay()) > 0 ? policy.maxDelay() : hint;
            default:
                return backoffDelay(retryIndex);
        }
    }

    /**
     * Exponential backoff with jitter for the given 0-based retry index.
     */
    Duration backoffDelay(int retryIndex) {
        double maxMs = policy.maxDelay().toMillis();
        double exponential = policy.baseDelay().toMillis() * Math.pow(2, Math.min(retryIndex, 30));
        double capped = Math.min(maxMs, exponential);
        double jitter = (random.getAsDouble() * 2.0 - 1.0) * policy.jitterFactor();
        double jittered = Math.max(0.0, Math.min(maxMs, capped * (1.0 + jitter)));
        return Duration.ofMillis(Math.round(jittered));
    }
}
