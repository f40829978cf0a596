package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of running one document through the cascade. On success {@code winningTier}
 * names the first tier that produced usable output; text tiers fill {@code text},
 * the vision tier fills {@code visionContacts}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionResult {
    private SourceDocument document;
    private boolean success;
    private ExtractionAttempt.Tier winningTier;
    private String text;
    private List<RawContact> visionContacts = new ArrayList<>();
    private List<ExtractionAttempt> attempts = new ArrayList<>();

    public boolean isVisionResult() {
        return success && winningTier == ExtractionAttempt.Tier.VISION_FALLBACK;
    }

    public List<ExtractionAttempt.Tier> getAttemptedTiers() {
        return attempts.stream().map(ExtractionAttempt::getTier).collect(Collectors.toList());
    }

    public String describeSteps() {
        return attempts.stream()
                .flatMap(a -> a.getSteps().stream())
                .collect(Collectors.joining(" -> "));
    }
}
