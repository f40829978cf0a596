package com.example.filingcontacts.exception;

/**
 * Upstream asked us to slow down. Retried with backoff, never surfaced to callers.
 */
public abstract class TransientUpstreamException extends ContactExtractionException {

    protected TransientUpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
