package com.example.filingcontacts.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A filing left out of a run, with why.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkippedFile {
    private String file;
    private String reason;
    private String error;
}
