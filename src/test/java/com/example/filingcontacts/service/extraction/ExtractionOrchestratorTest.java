package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.config.WorkDirectoryConfig;
import com.example.filingcontacts.dto.ContentClassification;
import com.example.filingcontacts.dto.ContentClassification.ContentType;
import com.example.filingcontacts.dto.ContentClassification.RecommendedMethod;
import com.example.filingcontacts.dto.ExtractionAttempt;
import com.example.filingcontacts.dto.ExtractionAttempt.Tier;
import com.example.filingcontacts.dto.ExtractionResult;
import com.example.filingcontacts.dto.OcrResult;
import com.example.filingcontacts.dto.OptimizationResult;
import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.service.ai.ContactExtractionService;
import com.example.filingcontacts.service.ocr.OcrProvider;
import com.example.filingcontacts.service.render.RenderOptimizer;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ExtractionOrchestratorTest {

    private static final String USABLE = StringUtils.repeat("Smith Family Trust 123 Main St ", 5);
    private static final byte[] PDF = "%PDF-1.4 test".getBytes();

    @Mock private ContentClassifier classifier;
    @Mock private PdfTextExtractor textExtractor;
    @Mock private RenderOptimizer renderOptimizer;
    @Mock private OcrProvider cloudOcr;
    @Mock private OcrProvider localOcr;
    @Mock private ContactExtractionService contactExtractionService;

    @TempDir
    Path workRoot;

    private ExtractionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        WorkDirectoryConfig workDirectories = new WorkDirectoryConfig();
        ReflectionTestUtils.setField(workDirectories, "workDir", workRoot.toString());
        orchestrator = new ExtractionOrchestrator(classifier, textExtractor, renderOptimizer,
                cloudOcr, localOcr, contactExtractionService, workDirectories);

        classifiedAs(ContentType.MIXED, 3);
        when(renderOptimizer.optimize(any(byte[].class), any(Path.class))).thenReturn(OptimizationResult.unchanged(PDF));
        when(cloudOcr.isEnabled()).thenReturn(true);
        when(cloudOcr.getName()).thenReturn("cloud");
        when(localOcr.isEnabled()).thenReturn(true);
        when(localOcr.getName()).thenReturn("local");
        when(contactExtractionService.extractFromDocument(any(byte[].class), anyString())).thenReturn(new ArrayList<>());
    }

    @Test
    void basicParseWinsWhenItYieldsEnoughText() throws Exception {
        when(textExtractor.extractText(PDF)).thenReturn(USABLE);

        ExtractionResult result = orchestrator.processDocument("filings/a.pdf", PDF);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getWinningTier()).isEqualTo(Tier.BASIC);
        assertThat(result.getText()).isEqualTo(USABLE);
        assertThat(result.getAttemptedTiers()).containsExactly(Tier.BASIC);
        assertThat(result.getDocument().getFileName()).isEqualTo("a.pdf");
        verify(renderOptimizer, never()).optimize(any(byte[].class), any(Path.class));
    }

    @Test
    void fallsThroughTiersInOrder() throws Exception {
        when(textExtractor.extractText(any(byte[].class))).thenReturn("too short");
        when(cloudOcr.extractText(any(byte[].class))).thenReturn(new OcrResult(USABLE, 97.0));

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        assertThat(result.getWinningTier()).isEqualTo(Tier.CLOUD_OCR);
        assertThat(result.getAttemptedTiers()).containsExactly(Tier.BASIC, Tier.OPTIMIZED, Tier.CLOUD_OCR);
        assertThat(result.getAttempts().get(0).isSuccess()).isFalse();
        assertThat(result.getAttempts().get(0).getCharacterCount()).isEqualTo(9);
        assertThat(result.getAttempts().get(2).isSuccess()).isTrue();
        verify(localOcr, never()).extractText(any(byte[].class));
    }

    @Test
    void imageBasedDocumentAcceptsAnyOcrText() throws Exception {
        classifiedAs(ContentType.IMAGE_BASED, 2);
        when(textExtractor.extractText(any(byte[].class))).thenReturn("");
        when(cloudOcr.isEnabled()).thenReturn(false);
        when(localOcr.extractText(any(byte[].class))).thenReturn(new OcrResult("Jones", null));

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        assertThat(result.getWinningTier()).isEqualTo(Tier.LOCAL_OCR);
        assertThat(result.getText()).isEqualTo("Jones");
        ExtractionAttempt cloud = result.getAttempts().get(2);
        assertThat(cloud.getTier()).isEqualTo(Tier.CLOUD_OCR);
        assertThat(cloud.getSteps()).anyMatch(s -> s.contains("skipped"));
    }

    @Test
    void shortOcrTextOnMixedDocumentIsNotEnough() throws Exception {
        when(textExtractor.extractText(any(byte[].class))).thenReturn("");
        when(cloudOcr.extractText(any(byte[].class))).thenReturn(new OcrResult("Jones", null));
        when(localOcr.extractText(any(byte[].class))).thenReturn(new OcrResult("Jones", null));
        when(contactExtractionService.extractFromDocument(any(byte[].class), anyString()))
                .thenReturn(List.of(new RawContact()));

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        assertThat(result.getWinningTier()).isEqualTo(Tier.VISION_FALLBACK);
        assertThat(result.isVisionResult()).isTrue();
        assertThat(result.getVisionContacts()).hasSize(1);
        assertThat(result.getAttemptedTiers())
                .containsExactly(Tier.BASIC, Tier.OPTIMIZED, Tier.CLOUD_OCR, Tier.LOCAL_OCR, Tier.VISION_FALLBACK);
    }

    @Test
    void everyTierFailingIsTerminalFailureWithAllAttempts() throws Exception {
        when(textExtractor.extractText(any(byte[].class))).thenReturn("");
        when(cloudOcr.extractText(any(byte[].class))).thenReturn(OcrResult.empty());
        when(localOcr.extractText(any(byte[].class))).thenReturn(OcrResult.empty());

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getWinningTier()).isNull();
        assertThat(result.getAttempts()).hasSize(5).noneMatch(ExtractionAttempt::isSuccess);
        assertThat(result.describeSteps()).contains("vision-fallback");
    }

    @Test
    void throwingTierIsRecordedAndCascadeContinues() throws Exception {
        when(textExtractor.extractText(PDF)).thenThrow(new IOException("damaged xref"));
        when(renderOptimizer.optimize(any(byte[].class), any(Path.class)))
                .thenReturn(new OptimizationResult("%PDF-repaired".getBytes(), true));
        when(textExtractor.extractText(argThat(b -> b != PDF))).thenReturn(USABLE);

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        assertThat(result.getAttempts().get(0).getError()).isEqualTo("damaged xref");
        assertThat(result.getWinningTier()).isEqualTo(Tier.OPTIMIZED);
    }

    @Test
    void oversizedDocumentSkipsCloudOcrWhenCompressionIsNotEnough() throws Exception {
        ReflectionTestUtils.setField(orchestrator, "cloudOcrMaxBytes", 5L);
        when(textExtractor.extractText(any(byte[].class))).thenReturn("");
        when(localOcr.extractText(any(byte[].class))).thenReturn(new OcrResult(USABLE, null));

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        verify(cloudOcr, never()).extractText(any(byte[].class));
        assertThat(result.getWinningTier()).isEqualTo(Tier.LOCAL_OCR);
        assertThat(result.getAttempts().get(2).getSteps()).anyMatch(s -> s.contains("after compression"));
    }

    @Test
    void oversizedDocumentUsesCompressedBytesForCloudOcr() throws Exception {
        byte[] compressed = "%PDF".getBytes();
        ReflectionTestUtils.setField(orchestrator, "cloudOcrMaxBytes", 5L);
        when(renderOptimizer.optimize(any(byte[].class), any(Path.class))).thenReturn(new OptimizationResult(compressed, true));
        when(textExtractor.extractText(any(byte[].class))).thenReturn("");
        when(cloudOcr.extractText(compressed)).thenReturn(new OcrResult(USABLE, 90.0));

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        assertThat(result.getWinningTier()).isEqualTo(Tier.CLOUD_OCR);
        verify(cloudOcr).extractText(compressed);
    }

    @Test
    void longDocumentsSkipBothOcrTiers() throws Exception {
        classifiedAs(ContentType.IMAGE_BASED, 120);
        when(textExtractor.extractText(any(byte[].class))).thenReturn("");

        ExtractionResult result = orchestrator.processDocument("a.pdf", PDF);

        verify(cloudOcr, never()).extractText(any(byte[].class));
        verify(localOcr, never()).extractText(any(byte[].class));
        assertThat(result.getAttempts().get(3).getSteps()).anyMatch(s -> s.contains("over OCR limit"));
    }

    @Test
    void workDirectoryIsRemovedOnSuccessAndFailure() throws Exception {
        when(textExtractor.extractText(any(byte[].class))).thenReturn(USABLE);
        orchestrator.processDocument("a.pdf", PDF);
        assertThat(children(workRoot)).isEmpty();

        when(classifier.classify(any(byte[].class))).thenThrow(new IllegalStateException("boom"));
        assertThatThrownBy(() -> orchestrator.processDocument("b.pdf", PDF)).isInstanceOf(IllegalStateException.class);
        assertThat(children(workRoot)).isEmpty();
    }

    private void classifiedAs(ContentType type, int pages) {
        when(classifier.classify(any(byte[].class)))
                .thenReturn(new ContentClassification(type, RecommendedMethod.BOTH, 0, pages, 0, 0));
    }

    private static List<Path> children(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.collect(Collectors.toList());
        }
    }
}
