package com.example.filingcontacts.dto;

import com.example.filingcontacts.model.SkippedFile;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters owned by one ingestion run. Failure counters plus successes never
 * exceed {@code totalFiles}, since every document lands in at most one bucket.
 */
@Data
@NoArgsConstructor
public class JobMetrics {

    public static final int MAX_SKIPPED_FILES = 100;

    private int totalFiles;
    private int downloadFailed;
    private int validationFailed;
    private int processingFailed;
    private int successfullyProcessed;
    private int totalContacts;
    private List<SkippedFile> skippedFiles = new ArrayList<>();

    public void fileSeen() {
        totalFiles++;
    }

    public void downloadFailed(String file, String error) {
        downloadFailed++;
        skip(file, "download_failed", error);
    }

    public void validationFailed(String file, String error) {
        validationFailed++;
        skip(file, "validation_failed", error);
    }

    public void processingFailed(String file, String error) {
        processingFailed++;
        skip(file, "processing_failed", error);
    }

    public void succeeded(int contactsSaved) {
        successfullyProcessed++;
        totalContacts += contactsSaved;
    }

    public int getAccountedFiles() {
        return downloadFailed + validationFailed + processingFailed + successfullyProcessed;
    }

    private void skip(String file, String reason, String error) {
        if (skippedFiles.size() < MAX_SKIPPED_FILES) {
            skippedFiles.add(new SkippedFile(file, reason, error));
        }
    }
}
