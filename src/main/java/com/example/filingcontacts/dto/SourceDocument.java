package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A filing as seen by the extraction cascade. Fixed once classified.
 */
@Getter
@ToString
@AllArgsConstructor
public class SourceDocument {
    private final String key;
    private final long sizeBytes;
    private final int pageCount;
    private final ContentClassification classification;

    public String getFileName() {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }

    public boolean isImageBased() {
        return classification.getContentType() == ContentClassification.ContentType.IMAGE_BASED;
    }
}
