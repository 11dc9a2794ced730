package com.docpulse.pipeline.provider;

/**
 * The provider's quota or credit is used up. Never retried; the provider is
 * skipped for the rest of the run.
 */
public class QuotaExhaustedException extends ProviderException {

    public QuotaExhaustedException(String provider, String message) {
        super(provider, message);
    }
}
