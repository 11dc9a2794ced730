package com.docpulse.pipeline.provider;

import com.docpulse.pipeline.model.ExtractionTarget;
import com.docpulse.pipeline.model.TokenUsage;

import java.util.List;

/**
 * A model endpoint that turns document text into structured fields.
 *
 * <p>Implementations signal failures with the {@link ProviderException}
 * family so the resilient client can decide between retrying, falling back
 * and giving up.</p>
 */
public interface SummarizationProvider {

    String name();

    String model();

    ProviderResponse summarize(String content, List<ExtractionTarget> targets) throws InterruptedException;

    /**
     * Cost in USD of a call that consumed {@code usage}. Free by default.
     */
    default double cost(TokenUsage usage) {
        return 0.0;
    }
}
