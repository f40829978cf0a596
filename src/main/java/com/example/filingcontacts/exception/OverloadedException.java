package com.example.filingcontacts.exception;

public class OverloadedException extends TransientUpstreamException {

    public OverloadedException(String message) {
        super(message, null);
    }

    public OverloadedException(String message, Throwable cause) {
        super(message, cause);
    }
}
