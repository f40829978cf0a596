package com.example.filingcontacts.service.ai;

import com.example.filingcontacts.TestPdfs;
import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.exception.FatalExtractionException;
import com.example.filingcontacts.exception.PageLimitExceededException;
import com.example.filingcontacts.service.extraction.PdfChunker;
import com.example.filingcontacts.service.extraction.PdfTextExtractor;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContactExtractionServiceTest {

    @Mock
    private VisionExtractionService visionService;

    private RecordingSleeper sleeper;
    private ContactExtractionService service;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        service = new ContactExtractionService(visionService, new BackoffRetryExecutor(sleeper),
                new PdfChunker(), new PdfTextExtractor(), sleeper);
    }

    @Test
    void textExtractionReturnsModelContacts() {
        when(visionService.extractContactsFromText("text", "a.pdf")).thenReturn(List.of(contact("Smith")));

        assertThat(service.extractFromText("text", "a.pdf")).extracting(RawContact::getName).containsExactly("Smith");
    }

    @Test
    void fatalFailureYieldsNoContacts() {
        when(visionService.extractContactsFromText(anyString(), anyString()))
                .thenThrow(new FatalExtractionException("bad key"));

        assertThat(service.extractFromText("text", "a.pdf")).isEmpty();
        verify(visionService, times(1)).extractContactsFromText(anyString(), anyString());
    }

    @Test
    void wholeDocumentWithinLimitIsNotChunked() throws Exception {
        byte[] pdf = TestPdfs.blankPages(2);
        when(visionService.extractContacts(pdf, "a.pdf")).thenReturn(List.of(contact("Smith")));

        assertThat(service.extractFromDocument(pdf, "a.pdf")).hasSize(1);
        assertThat(sleeper.getDelays()).isEmpty();
    }

    @Test
    void pageLimitSplitsDocumentAndConcatenatesChunks() throws Exception {
        byte[] pdf = TestPdfs.blankPages(5);
        when(visionService.extractContacts(any(byte[].class), anyString()))
                .thenThrow(new PageLimitExceededException(2, "5 pages, limit 2"))
                .thenReturn(List.of(contact("Smith")))
                .thenReturn(List.of(contact("Jones"), contact("Brown")))
                .thenReturn(List.of(contact("Smith")));

        List<RawContact> contacts = service.extractFromDocument(pdf, "big.pdf");

        // duplicates across chunks are left for the dedup pass
        assertThat(contacts).extracting(RawContact::getName).containsExactly("Smith", "Jones", "Brown", "Smith");
        assertThat(sleeper.getDelays()).containsExactly(3000L, 3000L);

        ArgumentCaptor<byte[]> sent = ArgumentCaptor.forClass(byte[].class);
        verify(visionService, times(4)).extractContacts(sent.capture(), anyString());
        List<Integer> pageCounts = new ArrayList<>();
        for (byte[] bytes : sent.getAllValues().subList(1, 4)) {
            try (PDDocument chunk = Loader.loadPDF(bytes)) {
                pageCounts.add(chunk.getNumberOfPages());
            }
        }
        assertThat(pageCounts).containsExactly(2, 2, 1);
    }

    @Test
    void chunkStillOverLimitContributesNothing() throws Exception {
        byte[] pdf = TestPdfs.blankPages(4);
        when(visionService.extractContacts(any(byte[].class), anyString()))
                .thenThrow(new PageLimitExceededException(2, "too many"))
                .thenThrow(new PageLimitExceededException(1, "still too many"))
                .thenReturn(List.of(contact("Jones")));

        assertThat(service.extractFromDocument(pdf, "big.pdf")).extracting(RawContact::getName).containsExactly("Jones");
    }

    @Test
    void chunkLabelsNameThePageRange() throws Exception {
        byte[] pdf = TestPdfs.blankPages(3);
        when(visionService.extractContacts(any(byte[].class), anyString()))
                .thenThrow(new PageLimitExceededException(2, "too many"))
                .thenReturn(new ArrayList<>());

        service.extractFromDocument(pdf, "big.pdf");

        verify(visionService).extractContacts(any(byte[].class), eq("big.pdf [pages 1-2]"));
        verify(visionService).extractContacts(any(byte[].class), eq("big.pdf [pages 3-3]"));
        verify(visionService, never()).extractContactsFromText(anyString(), anyString());
    }

    private static RawContact contact(String name) {
        RawContact contact = new RawContact();
        contact.setName(name);
        return contact;
    }
}
