package com.example.filingcontacts.service;

import com.example.filingcontacts.dto.ExtractionResult;
import com.example.filingcontacts.dto.JobMetrics;
import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.dto.StoredObject;
import com.example.filingcontacts.exception.DocumentFormatException;
import com.example.filingcontacts.model.Contact;
import com.example.filingcontacts.model.JobRun;
import com.example.filingcontacts.repository.ContactRepository;
import com.example.filingcontacts.service.ai.ContactExtractionService;
import com.example.filingcontacts.service.contact.ContactNormalizer;
import com.example.filingcontacts.service.extraction.ExtractionOrchestrator;
import com.example.filingcontacts.service.extraction.PdfValidator;
import com.example.filingcontacts.service.job.JobRunTracker;
import com.example.filingcontacts.service.storage.DocumentStore;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one ingestion job: every PDF under a store prefix is downloaded, validated,
 * pushed through the extraction cascade, turned into contacts and saved, while the
 * job run records what happened to each file.
 */
@Service
public class ContactIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(ContactIngestionService.class);

    private final DocumentStore documentStore;
    private final PdfValidator pdfValidator;
    private final ExtractionOrchestrator orchestrator;
    private final ContactExtractionService contactExtractionService;
    private final ContactNormalizer normalizer;
    private final ContactRepository contactRepository;
    private final JobRunTracker tracker;
    private final Sleeper sleeper;

    @Value("${ingestion.document-delay-ms:3000}")
    private long documentDelayMs = 3000;

    public ContactIngestionService(DocumentStore documentStore,
                                   PdfValidator pdfValidator,
                                   ExtractionOrchestrator orchestrator,
                                   ContactExtractionService contactExtractionService,
                                   ContactNormalizer normalizer,
                                   ContactRepository contactRepository,
                                   JobRunTracker tracker,
                                   Sleeper sleeper) {
        this.documentStore = documentStore;
        this.pdfValidator = pdfValidator;
        this.orchestrator = orchestrator;
        this.contactExtractionService = contactExtractionService;
        this.normalizer = normalizer;
        this.contactRepository = contactRepository;
        this.tracker = tracker;
        this.sleeper = sleeper;
    }

    public JobRun runJob(String projectOrigin, JobRun.TriggerType triggerType, String prefix) {
        String jobId = tracker.start(projectOrigin, triggerType);
        JobMetrics metrics = new JobMetrics();

        try {
            List<StoredObject> documents = documentStore.list(prefix).stream()
                    .filter(o -> o.getKey().toLowerCase().endsWith(".pdf"))
                    .collect(Collectors.toList());
            logger.info("📄 Job {}: {} PDFs under {}", jobId, documents.size(), prefix);

            for (int i = 0; i < documents.size(); i++) {
                if (i > 0) {
                    sleeper.sleep(documentDelayMs);
                }
                processDocument(documents.get(i).getKey(), jobId, projectOrigin, metrics);
                tracker.recordProgress(jobId, metrics);
            }
            return tracker.complete(jobId, metrics);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return tracker.fail(jobId, "Job interrupted", ExceptionUtils.getStackTrace(e), metrics);
        } catch (Exception e) {
            logger.error("❌ Job {} aborted: {}", jobId, e.getMessage(), e);
            return tracker.fail(jobId, e.getMessage(), ExceptionUtils.getStackTrace(e), metrics);
        }
    }

    /**
     * Processes a single filing outside a job run and reports how it went.
     */
    public JobMetrics processDocument(String key, String projectOrigin) {
        JobMetrics metrics = new JobMetrics();
        processDocument(key, null, projectOrigin, metrics);
        return metrics;
    }

    void processDocument(String key, String jobId, String projectOrigin, JobMetrics metrics) {
        metrics.fileSeen();
        String fileName = fileName(key);

        byte[] bytes;
        try {
            bytes = documentStore.fetchBytes(key);
        } catch (IOException e) {
            logger.warn("⚠️ Download failed for {}: {}", key, e.getMessage());
            metrics.downloadFailed(fileName, e.getMessage());
            return;
        }

        try {
            pdfValidator.validate(bytes);
        } catch (DocumentFormatException e) {
            logger.warn("⚠️ Skipping {}: {}", fileName, e.getMessage());
            metrics.validationFailed(fileName, e.getMessage());
            return;
        }

        ExtractionResult result = orchestrator.processDocument(key, bytes);
        if (!result.isSuccess()) {
            metrics.processingFailed(fileName, "All extraction methods failed: " + result.describeSteps());
            return;
        }

        List<RawContact> rawContacts = result.isVisionResult()
                ? result.getVisionContacts()
                : contactExtractionService.extractFromText(result.getText(), fileName);
        List<Contact> contacts = normalizer.normalizeAll(rawContacts, fileName, jobId, projectOrigin);

        try {
            contactRepository.saveAll(contacts);
        } catch (DataAccessException e) {
            logger.error("❌ Could not save contacts from {}: {}", fileName, e.getMessage());
            metrics.processingFailed(fileName, e.getMessage());
            return;
        }
        metrics.succeeded(contacts.size());
        logger.info("✅ {}: {} contacts saved (via {})", fileName, contacts.size(), result.getWinningTier().getLabel());
    }

    private static String fileName(String key) {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }
}
