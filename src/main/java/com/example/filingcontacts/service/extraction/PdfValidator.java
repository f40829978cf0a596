package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.exception.DocumentFormatException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Rejects downloads that cannot be a PDF before any extraction tier touches them.
 */
@Component
public class PdfValidator {

    static final int MIN_PDF_BYTES = 1024;
    private static final String PDF_MAGIC = "%PDF-";

    public void validate(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DocumentFormatException("Downloaded file is empty");
        }
        if (bytes.length < MIN_PDF_BYTES) {
            throw new DocumentFormatException("File too small (" + bytes.length
                    + " bytes), likely corrupt or error page");
        }
        String header = new String(bytes, 0, PDF_MAGIC.length(), StandardCharsets.ISO_8859_1);
        if (!PDF_MAGIC.equals(header)) {
            throw new DocumentFormatException("Invalid PDF header. File appears to be: " + detectFileType(bytes));
        }
    }

    /**
     * Best guess at what a file is from its leading bytes.
     */
    public static String detectFileType(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return "Unknown file type";
        }
        String hex = toHex(bytes, 4);
        if (hex.startsWith("25504446")) {
            return "PDF";
        }
        if (hex.startsWith("ffd8ff")) {
            return "JPEG image";
        }
        if (hex.startsWith("89504e47")) {
            return "PNG image";
        }
        if (hex.startsWith("474946")) {
            return "GIF image";
        }
        if (hex.startsWith("504b0304")) {
            return "ZIP/Office document";
        }

        String text = new String(bytes, 0, Math.min(bytes.length, 100), StandardCharsets.UTF_8).trim();
        String lower = text.toLowerCase();
        if (lower.startsWith("<!doctype") || lower.startsWith("<html")) {
            return "HTML document";
        }
        if (lower.startsWith("<?xml")) {
            return "XML document";
        }
        if (text.startsWith("{") || text.startsWith("[")) {
            return "JSON document";
        }
        return "Unknown file type";
    }

    private static String toHex(byte[] bytes, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < Math.min(count, bytes.length); i++) {
            sb.append(String.format("%02x", bytes[i]));
        }
        return sb.toString();
    }
}
