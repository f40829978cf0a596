package com.example.filingcontacts.exception;

public class RateLimitedException extends TransientUpstreamException {

    public RateLimitedException(String message) {
        super(message, null);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
