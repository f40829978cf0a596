package com.example.filingcontacts.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What one tier of the cascade did with a document.
 */
@Data
@NoArgsConstructor
public class ExtractionAttempt {
    private Tier tier;
    private boolean success;
    private int characterCount;
    private List<String> steps = new ArrayList<>();
    private String error;

    public ExtractionAttempt(Tier tier) {
        this.tier = tier;
    }

    public void addStep(String step) {
        steps.add(step);
    }

    public enum Tier {
        BASIC("basic"),
        OPTIMIZED("optimized"),
        CLOUD_OCR("cloud-ocr"),
        LOCAL_OCR("local-ocr"),
        VISION_FALLBACK("vision-fallback");

        private final String label;

        Tier(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
