package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.TestPdfs;
import com.example.filingcontacts.dto.PageRange;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfChunkerTest {

    private final PdfChunker chunker = new PdfChunker();

    @Test
    void splitsIntoHundredPageRanges() {
        assertThat(chunker.planChunks(250, 100))
                .containsExactly(new PageRange(1, 100), new PageRange(101, 200), new PageRange(201, 250));
    }

    @Test
    void withinLimitIsOneRange() {
        assertThat(chunker.planChunks(80, 100)).containsExactly(new PageRange(1, 80));
        assertThat(chunker.planChunks(100, 100)).containsExactly(new PageRange(1, 100));
    }

    @Test
    void rangesCoverEveryPageExactlyOnce() {
        for (int total = 1; total <= 40; total++) {
            for (int max = 1; max <= 12; max++) {
                List<PageRange> ranges = chunker.planChunks(total, max);

                assertThat(ranges).hasSize((total + max - 1) / max);
                int expectedStart = 1;
                for (PageRange range : ranges) {
                    assertThat(range.getStartPage()).isEqualTo(expectedStart);
                    assertThat(range.getPageCount()).isLessThanOrEqualTo(max);
                    expectedStart = range.getEndPage() + 1;
                }
                assertThat(expectedStart).isEqualTo(total + 1);
            }
        }
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> chunker.planChunks(10, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunker.planChunks(0, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void splitProducesOnePdfPerRange() throws Exception {
        byte[] pdf = TestPdfs.blankPages(5);

        List<byte[]> chunks = chunker.split(pdf, chunker.planChunks(5, 2));

        assertThat(chunks).hasSize(3);
        int[] expectedPages = {2, 2, 1};
        for (int i = 0; i < chunks.size(); i++) {
            try (PDDocument chunk = Loader.loadPDF(chunks.get(i))) {
                assertThat(chunk.getNumberOfPages()).isEqualTo(expectedPages[i]);
            }
        }
    }

    @Test
    void splitRejectsRangesPastTheEnd() throws Exception {
        byte[] pdf = TestPdfs.blankPages(2);

        assertThatThrownBy(() -> chunker.split(pdf, List.of(new PageRange(1, 3))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
