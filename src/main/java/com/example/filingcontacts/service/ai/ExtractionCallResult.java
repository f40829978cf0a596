package com.example.filingcontacts.service.ai;

import com.example.filingcontacts.dto.RawContact;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What came of a retried language-model call. Contacts are empty unless the outcome is SUCCESS.
 */
@Getter
@ToString(exclude = "contacts")
public class ExtractionCallResult {

    private final Outcome outcome;
    private final List<RawContact> contacts;
    private final int calls;
    private final Integer maxPages;
    private final String error;

    private ExtractionCallResult(Outcome outcome, List<RawContact> contacts, int calls, Integer maxPages, String error) {
        this.outcome = outcome;
        this.contacts = contacts;
        this.calls = calls;
        this.maxPages = maxPages;
        this.error = error;
    }

    public static ExtractionCallResult success(List<RawContact> contacts, int calls) {
        return new ExtractionCallResult(Outcome.SUCCESS,
                contacts == null ? new ArrayList<>() : contacts, calls, null, null);
    }

    public static ExtractionCallResult transientFailure(int calls, String error) {
        return new ExtractionCallResult(Outcome.TRANSIENT_FAILURE, Collections.emptyList(), calls, null, error);
    }

    public static ExtractionCallResult fatalFailure(int calls, String error) {
        return new ExtractionCallResult(Outcome.FATAL_FAILURE, Collections.emptyList(), calls, null, error);
    }

    public static ExtractionCallResult pageLimitExceeded(int calls, int maxPages, String error) {
        return new ExtractionCallResult(Outcome.PAGE_LIMIT_EXCEEDED, Collections.emptyList(), calls, maxPages, error);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public enum Outcome {
        SUCCESS,
        TRANSIENT_FAILURE,
        FATAL_FAILURE,
        PAGE_LIMIT_EXCEEDED
    }
}
