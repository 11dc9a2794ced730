package com.docpulse.pipeline.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Neither the primary nor the fallback provider could produce a result.
 */
public class AllProvidersFailedException extends ProviderException {

    private final Map<String, String> providerErrors;

    /**
     * @param providerErrors terminal error per provider tried or skipped, in call order
     */
    public AllProvidersFailedException(Map<String, String> providerErrors) {
        super("all", "All providers failed: " + providerErrors);
        this.providerErrors = Collections.unmodifiableMap(new LinkedHashMap<>(providerErrors));
    }

    public Map<String, String> getProviderErrors() {
        return providerErrors;
    }
}
