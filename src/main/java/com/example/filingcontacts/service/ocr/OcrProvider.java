package com.example.filingcontacts.service.ocr;

import com.example.filingcontacts.dto.OcrResult;

import java.io.IOException;

/**
 * Interface for OCR back ends used by the extraction cascade.
 */
public interface OcrProvider {

    /**
     * Get the name of this provider
     */
    String getName();

    /**
     * Check if this provider is enabled by configuration
     */
    boolean isEnabled();

    /**
     * Extract text from a whole PDF
     *
     * @param pdfBytes the document
     * @return recognized text, never null; confidence may be null when the engine reports none
     */
    OcrResult extractText(byte[] pdfBytes) throws IOException;
}
