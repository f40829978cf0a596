package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContentClassification {
    private ContentType contentType;
    private RecommendedMethod recommendedMethod;
    private int textLength;
    private int pageCount;
    private double avgTextPerPage;
    private double textDensity; // characters per KB of file

    public static ContentClassification unknown() {
        return new ContentClassification(ContentType.UNKNOWN, RecommendedMethod.BOTH, 0, 0, 0, 0);
    }

    public enum ContentType {
        TEXT_BASED("text-based"),
        IMAGE_BASED("image-based"),
        MIXED("mixed"),
        UNKNOWN("unknown");

        private final String label;

        ContentType(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    public enum RecommendedMethod {
        GHOSTSCRIPT_ONLY("ghostscript-only"),
        TEXTRACT("textract"),
        BOTH("both");

        private final String label;

        RecommendedMethod(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }
}
