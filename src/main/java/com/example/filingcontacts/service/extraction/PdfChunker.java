package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.dto.PageRange;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits documents that exceed a per-request page ceiling into contiguous page ranges.
 */
@Component
public class PdfChunker {

    /**
     * Contiguous, non-overlapping ranges that cover pages 1..totalPages exactly once.
     */
    public List<PageRange> planChunks(int totalPages, int maxPages) {
        if (totalPages < 1) {
            throw new IllegalArgumentException("Document has no pages");
        }
        if (maxPages < 1) {
            throw new IllegalArgumentException("maxPages must be positive, was " + maxPages);
        }
        List<PageRange> ranges = new ArrayList<>();
        for (int start = 1; start <= totalPages; start += maxPages) {
            ranges.add(new PageRange(start, Math.min(start + maxPages - 1, totalPages)));
        }
        return ranges;
    }

    /**
     * Builds one standalone PDF per range.
     */
    public List<byte[]> split(byte[] pdfBytes, List<PageRange> ranges) throws IOException {
        List<byte[]> chunks = new ArrayList<>();
        try (PDDocument source = Loader.loadPDF(pdfBytes)) {
            int total = source.getNumberOfPages();
            for (PageRange range : ranges) {
                if (range.getEndPage() > total) {
                    throw new IllegalArgumentException("Range " + range + " exceeds " + total + " pages");
                }
                try (PDDocument chunk = new PDDocument()) {
                    for (int page = range.getStartPage(); page <= range.getEndPage(); page++) {
                        chunk.importPage(source.getPage(page - 1));
                    }
                    ByteArrayOutputStream out = new ByteArrayOutputStream();
                    chunk.save(out);
                    chunks.add(out.toByteArray());
                }
            }
        }
        return chunks;
    }
}
