package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.config.WorkDirectoryConfig;
import com.example.filingcontacts.dto.ContentClassification;
import com.example.filingcontacts.dto.ExtractionAttempt;
import com.example.filingcontacts.dto.ExtractionAttempt.Tier;
import com.example.filingcontacts.dto.ExtractionResult;
import com.example.filingcontacts.dto.OcrResult;
import com.example.filingcontacts.dto.OptimizationResult;
import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.dto.SourceDocument;
import com.example.filingcontacts.service.ai.ContactExtractionService;
import com.example.filingcontacts.service.ocr.OcrProvider;
import com.example.filingcontacts.service.render.RenderOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Runs a document through the extraction cascade:
 * basic parse, Ghostscript-optimized parse, cloud OCR, local OCR, and finally
 * whole-document language-model extraction. The first tier that produces usable
 * output wins; every tier tried is recorded on the result.
 */
@Service
public class ExtractionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    static final int MIN_USABLE_CHARS = 100;

    private final ContentClassifier classifier;
    private final PdfTextExtractor textExtractor;
    private final RenderOptimizer renderOptimizer;
    private final OcrProvider cloudOcr;
    private final OcrProvider localOcr;
    private final ContactExtractionService contactExtractionService;
    private final WorkDirectoryConfig workDirectories;

    @Value("${extraction.cloud-ocr.max-bytes:10485760}")
    private long cloudOcrMaxBytes = 10L * 1024 * 1024;

    @Value("${extraction.ocr.max-pages:50}")
    private int ocrMaxPages = 50;

    public ExtractionOrchestrator(ContentClassifier classifier,
                                  PdfTextExtractor textExtractor,
                                  RenderOptimizer renderOptimizer,
                                  @Qualifier("textractOcrProvider") OcrProvider cloudOcr,
                                  @Qualifier("tesseractOcrProvider") OcrProvider localOcr,
                                  ContactExtractionService contactExtractionService,
                                  WorkDirectoryConfig workDirectories) {
        this.classifier = classifier;
        this.textExtractor = textExtractor;
        this.renderOptimizer = renderOptimizer;
        this.cloudOcr = cloudOcr;
        this.localOcr = localOcr;
        this.contactExtractionService = contactExtractionService;
        this.workDirectories = workDirectories;
    }

    public ExtractionResult processDocument(String key, byte[] bytes) {
        Path workDir;
        try {
            workDir = workDirectories.createDocumentDirectory();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create work directory for " + key, e);
        }

        try {
            ContentClassification classification = classifier.classify(bytes);
            SourceDocument document = new SourceDocument(key, bytes.length, classification.getPageCount(), classification);
            return runCascade(document, bytes, workDir);
        } finally {
            try {
                FileSystemUtils.deleteRecursively(workDir);
            } catch (IOException e) {
                logger.warn("⚠️ Could not delete work directory {}: {}", workDir, e.getMessage());
            }
        }
    }

    private ExtractionResult runCascade(SourceDocument document, byte[] bytes, Path workDir) {
        ExtractionResult result = new ExtractionResult();
        result.setDocument(document);
        ExtractionTier.Context context = new ExtractionTier.Context(document, bytes, workDir);

        for (ExtractionTier tier : cascade()) {
            ExtractionAttempt attempt = new ExtractionAttempt(tier.getTier());
            result.getAttempts().add(attempt);
            String label = tier.getTier().getLabel();

            ExtractionTier.Output output;
            try {
                output = tier.getFunction().attempt(context, attempt);
            } catch (Exception e) {
                attempt.setError(e.getMessage());
                attempt.addStep(label + ": failed (" + e.getMessage() + ")");
                logger.warn("⚠️ {} tier failed for {}: {}", label, document.getFileName(), e.getMessage());
                continue;
            }
            if (output.isSkipped()) {
                continue;
            }

            attempt.setCharacterCount(output.getText().length());
            if (isUsable(tier, document, output)) {
                attempt.setSuccess(true);
                result.setSuccess(true);
                result.setWinningTier(tier.getTier());
                result.setText(output.getText());
                result.setVisionContacts(output.getContacts());
                logger.info("✅ {} extracted via {} ({} chars, {} contacts)", document.getFileName(), label,
                        output.getText().length(), output.getContacts().size());
                return result;
            }
            attempt.addStep(label + ": insufficient output");
        }

        logger.error("❌ All extraction tiers failed for {}: {}", document.getFileName(), result.describeSteps());
        return result;
    }

    private boolean isUsable(ExtractionTier tier, SourceDocument document, ExtractionTier.Output output) {
        if (tier.getTier() == Tier.VISION_FALLBACK) {
            return !output.getContacts().isEmpty();
        }
        int length = output.getText().trim().length();
        if (tier.isOcr() && document.isImageBased()) {
            return length > 0;
        }
        return length >= MIN_USABLE_CHARS;
    }

    List<ExtractionTier> cascade() {
        return Arrays.asList(
                ExtractionTier.text(Tier.BASIC, this::basicParse),
                ExtractionTier.text(Tier.OPTIMIZED, this::optimizedParse),
                ExtractionTier.ocr(Tier.CLOUD_OCR, this::cloudOcr),
                ExtractionTier.ocr(Tier.LOCAL_OCR, this::localOcr),
                ExtractionTier.text(Tier.VISION_FALLBACK, this::visionFallback)
        );
    }

    private ExtractionTier.Output basicParse(ExtractionTier.Context context, ExtractionAttempt attempt) throws IOException {
        String text = textExtractor.extractText(context.getBytes());
        attempt.addStep("basic: PDFBox text parse (" + text.length() + " chars)");
        return ExtractionTier.Output.text(text);
    }

    private ExtractionTier.Output optimizedParse(ExtractionTier.Context context, ExtractionAttempt attempt) throws IOException {
        byte[] candidate = optimizedBytes(context, attempt);
        String text = textExtractor.extractText(candidate);
        attempt.addStep("optimized: PDFBox text parse (" + text.length() + " chars)");
        return ExtractionTier.Output.text(text);
    }

    private ExtractionTier.Output cloudOcr(ExtractionTier.Context context, ExtractionAttempt attempt) throws IOException {
        if (!cloudOcr.isEnabled()) {
            attempt.addStep("cloud-ocr: skipped, " + cloudOcr.getName() + " disabled");
            return ExtractionTier.Output.skipped();
        }
        if (overOcrPageLimit(context, attempt, "cloud-ocr")) {
            return ExtractionTier.Output.skipped();
        }

        byte[] candidate = context.getBytes();
        if (candidate.length > cloudOcrMaxBytes) {
            attempt.addStep("cloud-ocr: " + candidate.length / 1024 + " KB over size limit, compressing");
            candidate = optimizedBytes(context, attempt);
            if (candidate.length > cloudOcrMaxBytes) {
                attempt.addStep("cloud-ocr: skipped, still " + candidate.length / 1024 + " KB after compression");
                return ExtractionTier.Output.skipped();
            }
        }

        OcrResult ocr = cloudOcr.extractText(candidate);
        attempt.addStep("cloud-ocr: " + cloudOcr.getName() + " (" + ocr.length() + " chars)");
        return ExtractionTier.Output.text(ocr.getText());
    }

    private ExtractionTier.Output localOcr(ExtractionTier.Context context, ExtractionAttempt attempt) throws IOException {
        if (!localOcr.isEnabled()) {
            attempt.addStep("local-ocr: skipped, " + localOcr.getName() + " disabled");
            return ExtractionTier.Output.skipped();
        }
        if (overOcrPageLimit(context, attempt, "local-ocr")) {
            return ExtractionTier.Output.skipped();
        }
        OcrResult ocr = localOcr.extractText(context.getBytes());
        attempt.addStep("local-ocr: " + localOcr.getName() + " (" + ocr.length() + " chars)");
        return ExtractionTier.Output.text(ocr.getText());
    }

    private ExtractionTier.Output visionFallback(ExtractionTier.Context context, ExtractionAttempt attempt) {
        String fileName = context.getDocument().getFileName();
        List<RawContact> contacts = contactExtractionService.extractFromDocument(context.getBytes(), fileName);
        attempt.addStep("vision-fallback: whole document to language model (" + contacts.size() + " contacts)");
        return ExtractionTier.Output.contacts(contacts);
    }

    private byte[] optimizedBytes(ExtractionTier.Context context, ExtractionAttempt attempt) {
        if (context.getOptimizedBytes() == null) {
            OptimizationResult optimized = renderOptimizer.optimize(context.getBytes(), context.getWorkDir());
            attempt.addStep(optimized.isOptimized()
                    ? "Ghostscript optimized " + context.getBytes().length / 1024 + " KB to " + optimized.getBytes().length / 1024 + " KB"
                    : "Ghostscript made no improvement, using original bytes");
            context.setOptimizedBytes(optimized.getBytes());
        }
        return context.getOptimizedBytes();
    }

    private boolean overOcrPageLimit(ExtractionTier.Context context, ExtractionAttempt attempt, String label) {
        int pages = context.getDocument().getPageCount();
        if (pages > ocrMaxPages) {
            attempt.addStep(label + ": skipped, " + pages + " pages over OCR limit of " + ocrMaxPages);
            return true;
        }
        return false;
    }
}
