package com.example.filingcontacts.exception;

/**
 * The document has more pages than the service accepts in one call.
 * Not retried: the caller splits the document instead.
 */
public class PageLimitExceededException extends ContactExtractionException {

    private final int maxPages;

    public PageLimitExceededException(int maxPages, String message) {
        super(message);
        this.maxPages = maxPages;
    }

    public int getMaxPages() {
        return maxPages;
    }
}
