package com.example.filingcontacts.exception;

public class FatalExtractionException extends ContactExtractionException {

    public FatalExtractionException(String message) {
        super(message);
    }

    public FatalExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
