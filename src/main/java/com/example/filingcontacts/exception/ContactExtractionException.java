package com.example.filingcontacts.exception;

/**
 * Base type for failures raised by the language-model extraction service.
 */
public class ContactExtractionException extends RuntimeException {

    public ContactExtractionException(String message) {
        super(message);
    }

    public ContactExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
