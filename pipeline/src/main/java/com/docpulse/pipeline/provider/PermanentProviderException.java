package com.docpulse.pipeline.provider;

/**
 * Malformed request or response, authentication failure and the like.
 */
public class PermanentProviderException extends ProviderException {

    public PermanentProviderException(String provider, String message) {
        super(provider, message);
    }

    public PermanentProviderException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
