package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A contact judged a duplicate of an earlier one. Scores are only set in fuzzy mode.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateEntry {
    private Long id;
    private Long originalId;
    private String matchReason;
    private Double nameSimilarity;
    private Double companySimilarity;
}
