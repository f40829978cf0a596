package com.example.filingcontacts.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobRunStatistics {
    private String jobType;
    private long totalRuns;
    private long completedRuns;
    private long failedRuns;
    private int successRate;
    private long totalFilesProcessed;
    private long totalContactsExtracted;
    private Double averageDurationSeconds;
}
