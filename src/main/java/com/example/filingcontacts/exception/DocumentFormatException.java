package com.example.filingcontacts.exception;

/**
 * The downloaded bytes are not a usable PDF (empty, truncated, or some other file type).
 */
public class DocumentFormatException extends RuntimeException {

    public DocumentFormatException(String message) {
        super(message);
    }
}
