package com.docpulse.pipeline.provider;

import com.docpulse.pipeline.metrics.PipelineMetrics;
import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.SummaryResult;
import com.docpulse.pipeline.resilience.CircuitBreakerPolicy;
import com.docpulse.pipeline.resilience.ProviderHealth;
import com.docpulse.pipeline.resilience.ResilientCallExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primary/fallback summarization with per-provider retries, circuit breaking
 * and quota tracking.
 *
 * <p>A provider is skipped while its circuit is OPEN (or HALF_OPEN with no
 * probe slot free) or after it reported quota exhaustion. Each logical call
 * that ends in an error after retries counts as one breaker failure; quota
 * exhaustion never does.</p>
 *
 * <p>With a spend ceiling, every admitted call reserves the cost of the most
 * expensive call seen so far until it settles, and a call is refused once
 * recorded spend plus outstanding reservations reaches the ceiling. Spend can
 * still pass the ceiling by what the last admitted calls cost beyond their
 * reservation, which before the first completed call is their whole cost.</p>
 *
 * <p>Thread-safe: health and usage objects synchronize internally; budget
 * accounting is guarded by its own lock.</p>
 */
public class ResilientProviderClient {

    private static final Logger logger = LoggerFactory.getLogger(ResilientProviderClient.class);

    private final List<SummarizationProvider> providers;
    private final ResilientCallExecutor executor;
    private final double maxTotalCostUsd;
    private final PipelineMetrics metrics;
    private final Map<String, ProviderHealth> health = new LinkedHashMap<>();
    private final Map<String, ProviderUsage> usage = new LinkedHashMap<>();

    private final Object budgetLock = new Object();
    private double reservedUsd;
    private double largestCallCostUsd;

    public ResilientProviderClient(SummarizationProvider primary,
                                   Optional<SummarizationProvider> fallback,
                                   ResilientCallExecutor executor,
                                   CircuitBreakerPolicy policy) {
        this(primary, fallback, executor, policy, Clock.systemUTC(), 0.0);
    }

    /**
     * @param maxTotalCostUsd spend ceiling across all providers; 0 means unlimited
     */
    public ResilientProviderClient(SummarizationProvider primary,
                                   Optional<SummarizationProvider> fallback,
                                   ResilientCallExecutor executor,
                                   CircuitBreakerPolicy policy,
                                   Clock clock,
                                   double maxTotalCostUsd) {
        this(primary, fallback, executor, policy, clock, maxTotalCostUsd, PipelineMetrics.simple());
    }

    public ResilientProviderClient(SummarizationProvider primary,
                                   Optional<SummarizationProvider> fallback,
                                   ResilientCallExecutor executor,
                                   CircuitBreakerPolicy policy,
                                   Clock clock,
                                   double maxTotalCostUsd,
                                   PipelineMetrics metrics) {
        List<SummarizationProvider> chain = new ArrayList<>();
        chain.add(primary);
        fallback.ifPresent(chain::add);
        this.providers = Collections.unmodifiableList(chain);
        this.executor = executor;
        this.maxTotalCostUsd = maxTotalCostUsd;
        this.metrics = metrics;

        for (SummarizationProvider provider : providers) {
            if (health.containsKey(provider.name())) {
                throw new IllegalArgumentException("Duplicate provider name: " + provider.name());
            }
            health.put(provider.name(), new ProviderHealth(provider.name(), policy, clock));
            usage.put(provider.name(), new ProviderUsage());
        }
    }

    /**
     * Summarizes {@code content}, trying the primary provider first.
     *
     * @throws AllProvidersFailedException when no provider produced a result
     * @throws CostLimitExceededException  when the spend ceiling has been reached
     */
    public SummaryResult extract(String content, List<ExtractionTarget> targets) throws InterruptedException {
        double reservation = reserveBudget();
        boolean settled = false;
        try {
            Map<String, String> errors = new LinkedHashMap<>();
            for (int i = 0; i < providers.size(); i++) {
                SummarizationProvider provider = providers.get(i);
                ProviderHealth providerHealth = health.get(provider.name());
                boolean fallbackUsed = i > 0;

                if (providerHealth.isQuotaExhausted()) {
                    logger.debug("Skipping {}: quota exhausted", provider.name());
                    errors.put(provider.name(), "quota exhausted");
                    continue;
                }
                if (!providerHealth.tryAcquirePermission()) {
                    logger.debug("Skipping {}: circuit {}", provider.name(), providerHealth.state());
                    errors.put(provider.name(), "circuit " + providerHealth.state());
                    continue;
                }

                ProviderUsage counters = usage.get(provider.name());
                if (fallbackUsed) {
                    counters.recordFallbackActivation();
                    logger.info("Using fallback provider {} ({})", provider.name(), errors);
                }

                long start = System.nanoTime();
                try {
                    ProviderResponse response = executor.execute(
                            () -> provider.summarize(content, targets),
                            ProviderErrors::classify,
                            attempt -> counters.recordRequest(attempt.isRetry()));

                    providerHealth.recordSuccess();
                    double cost = provider.cost(response.usage());
                    settleBudget(reservation, () -> counters.recordSuccess(response.usage(), cost), cost);
                    settled = true;
                    metrics.providerRequest(provider.name(), true, elapsed(start));
                    metrics.providerUsage(provider.name(), response.usage(), cost);
                    return new SummaryResult(provider.name(), provider.model(), response.content(),
                            response.usage(), cost, fallbackUsed);
                } catch (InterruptedException e) {
                    providerHealth.releasePermission();
                    throw e;
                } catch (QuotaExhaustedException e) {
                    providerHealth.releasePermission();
                    providerHealth.markQuotaExhausted();
                    counters.recordFailure();
                    metrics.providerRequest(provider.name(), false, elapsed(start));
                    errors.put(provider.name(), ProviderErrors.describe(e));
                } catch (Exception e) {
                    providerHealth.recordFailure();
                    counters.recordFailure();
                    metrics.providerRequest(provider.name(), false, elapsed(start));
                    errors.put(provider.name(), ProviderErrors.describe(e));
                    logger.warn("Provider {} failed: {}", provider.name(), e.getMessage());
                }
            }

            throw new AllProvidersFailedException(errors);
        } finally {
            if (!settled) {
                settleBudget(reservation, () -> { }, 0.0);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Budget
    // -------------------------------------------------------------------------

    /**
     * Admits one call against the spend ceiling and returns the amount
     * reserved for it.
     *
     * @throws CostLimitExceededException when spend plus reservations has reached the ceiling
     */
    private double reserveBudget() {
        if (maxTotalCostUsd <= 0) {
            return 0.0;
        }
        synchronized (budgetLock) {
            double committed = totalCostUsd() + reservedUsd;
            if (committed >= maxTotalCostUsd) {
                throw new CostLimitExceededException(committed, maxTotalCostUsd);
            }
            reservedUsd += largestCallCostUsd;
            return largestCallCostUsd;
        }
    }

    /**
     * Releases {@code reservation}, recording actual spend in the same step
     * so concurrent admissions never see both or neither.
     */
    private void settleBudget(double reservation, Runnable recordSpend, double actualCostUsd) {
        if (maxTotalCostUsd <= 0) {
            recordSpend.run();
            return;
        }
        synchronized (budgetLock) {
            recordSpend.run();
            reservedUsd = Math.max(0.0, reservedUsd - reservation);
            largestCallCostUsd = Math.max(largestCallCostUsd, actualCostUsd);
        }
    }

    /**
     * Cost held back for calls that have been admitted but not yet settled.
     */
    public double reservedCostUsd() {
        synchronized (budgetLock) {
            return reservedUsd;
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public double totalCostUsd() {
        return usage.values().stream().mapToDouble(ProviderUsage::cost).sum();
    }

    public ProviderHealth health(String providerName) {
        ProviderHealth h = health.get(providerName);
        if (h == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerName);
        }
        return h;
    }

    public Map<String, ProviderUsage.Snapshot> usage() {
        Map<String, ProviderUsage.Snapshot> snapshot = new LinkedHashMap<>();
        usage.forEach((name, counters) -> snapshot.put(name, counters.snapshot()));
        return snapshot;
    }

    public List<String> providerNames() {
        return providers.stream().map(SummarizationProvider::name).toList();
    }
}
