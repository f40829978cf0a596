package com.example.filingcontacts.service.extraction;

import com.example.filingcontacts.dto.ExtractionAttempt;
import com.example.filingcontacts.dto.RawContact;
import com.example.filingcontacts.dto.SourceDocument;
import lombok.Getter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One step of the extraction cascade: a tier name plus the function that tries it.
 */
@Getter
public class ExtractionTier {

    private final ExtractionAttempt.Tier tier;
    private final boolean ocr;
    private final TierFunction function;

    private ExtractionTier(ExtractionAttempt.Tier tier, boolean ocr, TierFunction function) {
        this.tier = tier;
        this.ocr = ocr;
        this.function = function;
    }

    public static ExtractionTier text(ExtractionAttempt.Tier tier, TierFunction function) {
        return new ExtractionTier(tier, false, function);
    }

    public static ExtractionTier ocr(ExtractionAttempt.Tier tier, TierFunction function) {
        return new ExtractionTier(tier, true, function);
    }

    @FunctionalInterface
    public interface TierFunction {
        Output attempt(Context context, ExtractionAttempt attempt) throws Exception;
    }

    /**
     * Per-document state shared by the tiers of one cascade run.
     */
    @Getter
    public static class Context {
        private final SourceDocument document;
        private final byte[] bytes;
        private final Path workDir;
        private byte[] optimizedBytes;

        public Context(SourceDocument document, byte[] bytes, Path workDir) {
            this.document = document;
            this.bytes = bytes;
            this.workDir = workDir;
        }

        public void setOptimizedBytes(byte[] optimizedBytes) {
            this.optimizedBytes = optimizedBytes;
        }
    }

    /**
     * What a tier produced: text, contacts (vision tier only), or nothing because it was skipped.
     */
    @Getter
    public static class Output {
        private final String text;
        private final List<RawContact> contacts;
        private final boolean skipped;

        private Output(String text, List<RawContact> contacts, boolean skipped) {
            this.text = text;
            this.contacts = contacts;
            this.skipped = skipped;
        }

        public static Output text(String text) {
            return new Output(text == null ? "" : text, new ArrayList<>(), false);
        }

        public static Output contacts(List<RawContact> contacts) {
            return new Output("", contacts == null ? new ArrayList<>() : contacts, false);
        }

        public static Output skipped() {
            return new Output("", new ArrayList<>(), true);
        }
    }
}
