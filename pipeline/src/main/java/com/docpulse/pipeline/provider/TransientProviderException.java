package com.docpulse.pipeline.provider;

/**
 * Timeout, connection failure or server-side error. Safe to retry.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String provider, String message) {
        super(provider, message);
    }

    public TransientProviderException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }
}
