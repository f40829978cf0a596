package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.dto.ContentClassification;
import com.example.filingcontacts.dto.ContentClassification.ContentType;
import com.example.filingcontacts.dto.ContentClassification.RecommendedMethod;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Decides how much embedded text a filing carries, which drives the OCR success bar
 * and the recommended extraction method.
 */
@Service
public class ContentClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ContentClassifier.class);

    static final double TEXT_BASED_MIN_AVG_PER_PAGE = 500;
    static final double TEXT_BASED_MIN_DENSITY = 50;
    static final double IMAGE_BASED_MAX_AVG_PER_PAGE = 50;
    static final double IMAGE_BASED_MAX_DENSITY = 10;

    public ContentClassification classify(byte[] pdfBytes) {
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            String text = new PDFTextStripper().getText(document).trim();
            ContentClassification classification = classify(text.length(), document.getNumberOfPages(), pdfBytes.length);
            logger.info("Classified PDF as {} ({} chars, {} pages, {} chars/page, density {})",
                    classification.getContentType().getLabel(), classification.getTextLength(),
                    classification.getPageCount(), Math.round(classification.getAvgTextPerPage()),
                    Math.round(classification.getTextDensity()));
            return classification;
        } catch (IOException e) {
            logger.warn("⚠️ Could not parse PDF for classification: {}", e.getMessage());
            return ContentClassification.unknown();
        }
    }

    /**
     * Pure classification from raw numbers; first matching rule wins.
     */
    public ContentClassification classify(int textLength, int pageCount, long sizeBytes) {
        double avgTextPerPage = (double) textLength / Math.max(pageCount, 1);
        double sizeKb = sizeBytes / 1024.0;
        double density;
        if (sizeKb > 0) {
            density = textLength / sizeKb;
        } else {
            density = textLength == 0 ? 0 : Double.POSITIVE_INFINITY;
        }

        ContentType type;
        RecommendedMethod method;
        if (avgTextPerPage > TEXT_BASED_MIN_AVG_PER_PAGE && density > TEXT_BASED_MIN_DENSITY) {
            type = ContentType.TEXT_BASED;
            method = RecommendedMethod.GHOSTSCRIPT_ONLY;
        } else if (avgTextPerPage < IMAGE_BASED_MAX_AVG_PER_PAGE && density < IMAGE_BASED_MAX_DENSITY) {
            type = ContentType.IMAGE_BASED;
            method = RecommendedMethod.TEXTRACT;
        } else {
            type = ContentType.MIXED;
            method = RecommendedMethod.BOTH;
        }
        return new ContentClassification(type, method, textLength, pageCount, avgTextPerPage, density);
    }
}
