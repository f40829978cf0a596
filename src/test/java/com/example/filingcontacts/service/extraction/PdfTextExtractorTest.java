package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.TestPdfs;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PdfTextExtractorTest {

    private final PdfTextExtractor extractor = new PdfTextExtractor();

    @Test
    void extractsEmbeddedTextWithCollapsedWhitespace() throws Exception {
        byte[] pdf = TestPdfs.textPages(1, List.of("EXHIBIT A", "Smith Family Trust", "123 Main Street"));

        String text = extractor.extractText(pdf);

        assertThat(text).isEqualTo("EXHIBIT A Smith Family Trust 123 Main Street");
        assertThat(extractor.countPages(pdf)).isEqualTo(1);
    }

    @Test
    void collapseWhitespaceHandlesNull() {
        assertThat(PdfTextExtractor.collapseWhitespace(null)).isEmpty();
        assertThat(PdfTextExtractor.collapseWhitespace("  a \n\n b\t c ")).isEqualTo("a b c");
    }
}
