package com.docpulse.pipeline.provider;

/**
 * Accumulated provider spend reached the configured ceiling.
 */
public class CostLimitExceededException extends PermanentProviderException {

    public CostLimitExceededException(double spentUsd, double limitUsd) {
        super("all", String.format("Cost limit reached: $%.4f spent of $%.4f allowed", spentUsd, limitUsd));
    }
}
