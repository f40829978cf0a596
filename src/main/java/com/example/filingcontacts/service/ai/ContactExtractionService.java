package com.example.filingcontacts.service.ai;

import com.example.filingcontacts.dto.PageRange;
import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.service.Sleeper;
import com.example.filingcontacts.service.extraction.PdfChunker;
import com.example.filingcontacts.service.extraction.PdfTextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for language-model contact extraction. Every call goes through
 * {@link BackoffRetryExecutor}; whole-document calls that hit the page ceiling
 * are split with {@link PdfChunker} and the chunk results concatenated.
 */
@Service
public class ContactExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(ContactExtractionService.class);

    private final VisionExtractionService visionService;
    private final BackoffRetryExecutor retryExecutor;
    private final PdfChunker chunker;
    private final PdfTextExtractor textExtractor;
    private final Sleeper sleeper;

    @Value("${extraction.chunk.delay-ms:3000}")
    private long chunkDelayMs = 3000;

    public ContactExtractionService(VisionExtractionService visionService,
                                    BackoffRetryExecutor retryExecutor,
                                    PdfChunker chunker,
                                    PdfTextExtractor textExtractor,
                                    Sleeper sleeper) {
        this.visionService = visionService;
        this.retryExecutor = retryExecutor;
        this.chunker = chunker;
        this.textExtractor = textExtractor;
        this.sleeper = sleeper;
    }

    public List<RawContact> extractFromText(String text, String fileName) {
        ExtractionCallResult result = retryExecutor.execute(fileName,
                () -> visionService.extractContactsFromText(text, fileName));
        if (!result.isSuccess()) {
            logger.warn("⚠️ Text extraction for {} ended with {}: {}", fileName, result.getOutcome(), result.getError());
        }
        return result.getContacts();
    }

    public List<RawContact> extractFromDocument(byte[] pdfBytes, String fileName) {
        ExtractionCallResult result = retryExecutor.execute(fileName,
                () -> visionService.extractContacts(pdfBytes, fileName));
        if (result.getOutcome() == ExtractionCallResult.Outcome.PAGE_LIMIT_EXCEEDED) {
            return extractInChunks(pdfBytes, fileName, result.getMaxPages());
        }
        if (!result.isSuccess()) {
            logger.warn("⚠️ Document extraction for {} ended with {}: {}", fileName, result.getOutcome(), result.getError());
        }
        return result.getContacts();
    }

    private List<RawContact> extractInChunks(byte[] pdfBytes, String fileName, int maxPages) {
        List<RawContact> contacts = new ArrayList<>();
        List<byte[]> chunks;
        List<PageRange> ranges;
        try {
            ranges = chunker.planChunks(textExtractor.countPages(pdfBytes), maxPages);
            chunks = chunker.split(pdfBytes, ranges);
        } catch (IOException | IllegalArgumentException e) {
            logger.error("❌ Could not split {} into {}-page chunks: {}", fileName, maxPages, e.getMessage());
            return contacts;
        }

        logger.info("Splitting {} into {} chunks of at most {} pages", fileName, chunks.size(), maxPages);
        for (int i = 0; i < chunks.size(); i++) {
            if (i > 0) {
                try {
                    sleeper.sleep(chunkDelayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("⚠️ Interrupted between chunks of {}, keeping {} contacts", fileName, contacts.size());
                    return contacts;
                }
            }
            byte[] chunk = chunks.get(i);
            String label = fileName + " [pages " + ranges.get(i) + "]";
            ExtractionCallResult result = retryExecutor.execute(label, () -> visionService.extractContacts(chunk, label));
            if (result.getOutcome() == ExtractionCallResult.Outcome.PAGE_LIMIT_EXCEEDED) {
                logger.warn("⚠️ Chunk {} still over the page limit, skipping", label);
                continue;
            }
            logger.info("Chunk {}/{} of {}: {} contacts", i + 1, chunks.size(), fileName, result.getContacts().size());
            contacts.addAll(result.getContacts());
        }
        return contacts;
    }
}
