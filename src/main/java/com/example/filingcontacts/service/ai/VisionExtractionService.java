package com.example.filingcontacts.service.ai;

import com.example.filingcontacts.dto.RawContact;

import java.util.List;

/**
 * Language-model contact extraction.
 *
 * Implementations signal failures through the {@code ContactExtractionException} hierarchy:
 * {@code RateLimitedException} and {@code OverloadedException} for throttling,
 * {@code PageLimitExceededException} when a document has too many pages for one request,
 * {@code FatalExtractionException} for everything else.
 */
public interface VisionExtractionService {

    /**
     * Send the whole PDF to the model and read contacts from it.
     */
    List<RawContact> extractContacts(byte[] pdfBytes, String fileName);

    /**
     * Read contacts from text that was already extracted from a filing.
     */
    List<RawContact> extractContactsFromText(String text, String fileName);
}
