package com.example.filingcontacts.service.ocr;

import com.example.filingcontacts.dto.OcrResult;
import com.example.filingcontacts.service.storage.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentRequest;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentResponse;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.FeatureType;
import software.amazon.awssdk.services.textract.model.S3Object;

import java.io.IOException;
import java.util.UUID;

/**
 * AWS Textract OCR. The document is staged in the filing bucket, analyzed with
 * TABLES and FORMS features, and every LINE block becomes one line of output.
 * The staged copy is removed again whether or not the analysis succeeds.
 */
@Component
public class TextractOcrProvider implements OcrProvider {

    private static final Logger logger = LoggerFactory.getLogger(TextractOcrProvider.class);

    private final TextractClient textract;
    private final DocumentStore documentStore;

    @Value("${ocr.textract.enabled:true}")
    private boolean enabled = true;

    @Value("${ocr.textract.staging-prefix:textract-staging/}")
    private String stagingPrefix = "textract-staging/";

    public TextractOcrProvider(TextractClient textract, DocumentStore documentStore) {
        this.textract = textract;
        this.documentStore = documentStore;
    }

    @Override
    public String getName() {
        return "AWS Textract";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public OcrResult extractText(byte[] pdfBytes) throws IOException {
        String key = stagingPrefix + UUID.randomUUID() + ".pdf";
        documentStore.upload(key, pdfBytes);

        try {
            AnalyzeDocumentRequest request = AnalyzeDocumentRequest.builder()
                    .document(Document.builder()
                            .s3Object(S3Object.builder().bucket(documentStore.getLocation()).name(key).build())
                            .build())
                    .featureTypes(FeatureType.TABLES, FeatureType.FORMS)
                    .build();
            AnalyzeDocumentResponse response = textract.analyzeDocument(request);

            StringBuilder text = new StringBuilder();
            double confidenceSum = 0;
            int lines = 0;
            for (Block block : response.blocks()) {
                if (block.blockType() == BlockType.LINE && block.text() != null) {
                    text.append(block.text()).append('\n');
                    if (block.confidence() != null) {
                        confidenceSum += block.confidence();
                    }
                    lines++;
                }
            }
            Double confidence = lines == 0 ? null : confidenceSum / lines;
            logger.info("Textract returned {} lines ({} chars)", lines, text.length());
            return new OcrResult(text.toString().trim(), confidence);

        } catch (SdkException e) {
            throw new IOException("Textract analysis failed: " + e.getMessage(), e);
        } finally {
            removeStagedCopy(key);
        }
    }

    private void removeStagedCopy(String key) {
        try {
            documentStore.delete(key);
        } catch (IOException e) {
            logger.warn("⚠️ Could not remove Textract staging object {}: {}", key, e.getMessage());
        }
    }
}
