package com.example.filingcontacts.service.ocr;

import com.example.filingcontacts.dto.OcrResult;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Local Tesseract OCR over pages rendered at 300 DPI. Each page is read as a
 * uniform text block first; sparse results get a second single-column pass and
 * the longer reading wins.
 */
@Component
public class TesseractOcrProvider implements OcrProvider {

    private static final Logger logger = LoggerFactory.getLogger(TesseractOcrProvider.class);

    static final int PSM_SINGLE_BLOCK = 6;
    static final int PSM_SINGLE_COLUMN = 4;
    static final int SECOND_PASS_THRESHOLD = 100;
    private static final int RENDER_DPI = 300;

    @Value("${ocr.tesseract.enabled:true}")
    private boolean enabled = true;

    @Value("${tesseract.datapath:}")
    private String tesseractDataPath;

    @Value("${tesseract.language:eng}")
    private String language = "eng";

    private Tesseract tesseract;

    @Override
    public String getName() {
        return "Tesseract OCR";
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public OcrResult extractText(byte[] pdfBytes) throws IOException {
        StringBuilder text = new StringBuilder();
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFRenderer renderer = new PDFRenderer(document);
            int pages = document.getNumberOfPages();
            for (int i = 0; i < pages; i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, RENDER_DPI, ImageType.GRAY);
                String pageText = readPage(image, i + 1);
                if (!pageText.isEmpty()) {
                    if (text.length() > 0) {
                        text.append("\n\n");
                    }
                    text.append(pageText);
                }
            }
            logger.info("Tesseract read {} chars from {} pages", text.length(), pages);
        }
        return new OcrResult(text.toString(), null);
    }

    private String readPage(BufferedImage image, int pageNumber) {
        String block = safeOcr(image, PSM_SINGLE_BLOCK, pageNumber);
        if (block.length() >= SECOND_PASS_THRESHOLD) {
            return block;
        }
        String column = safeOcr(image, PSM_SINGLE_COLUMN, pageNumber);
        return column.length() > block.length() ? column : block;
    }

    private String safeOcr(BufferedImage image, int pageSegMode, int pageNumber) {
        try {
            String text = ocrPage(image, pageSegMode);
            return text == null ? "" : text.trim();
        } catch (TesseractException e) {
            logger.warn("⚠️ Tesseract failed on page {} (psm {}): {}", pageNumber, pageSegMode, e.getMessage());
            return "";
        }
    }

    /**
     * One Tesseract pass over a rendered page.
     */
    protected synchronized String ocrPage(BufferedImage image, int pageSegMode) throws TesseractException {
        Tesseract tess = getTesseractInstance();
        tess.setPageSegMode(pageSegMode);
        return tess.doOCR(image);
    }

    private Tesseract getTesseractInstance() {
        if (tesseract == null) {
            tesseract = new Tesseract();
            if (tesseractDataPath != null && !tesseractDataPath.isEmpty()) {
                tesseract.setDatapath(tesseractDataPath);
            } else if (System.getenv("TESSDATA_PREFIX") != null) {
                tesseract.setDatapath(System.getenv("TESSDATA_PREFIX"));
            }
            tesseract.setLanguage(language);
            tesseract.setOcrEngineMode(3);
            tesseract.setVariable("preserve_interword_spaces", "1");
        }
        return tesseract;
    }
}
