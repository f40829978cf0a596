package com.example.filingcontacts.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One end-to-end execution of the ingestion pipeline over a batch of filings.
 * Status only ever moves forward: PENDING -> RUNNING -> COMPLETED | FAILED.
 */
@Entity
@Table(name = "job_runs", indexes = {
        @Index(name = "job_runs_type_status_idx", columnList = "job_type, status"),
        @Index(name = "job_runs_started_at_idx", columnList = "started_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobRun {

    public static final Duration STALE_AFTER = Duration.ofHours(24);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, unique = true, length = 100)
    private String jobId;

    @Column(name = "job_type", nullable = false, length = 50)
    private String jobType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 20)
    private TriggerType triggerType = TriggerType.CRON;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Column(name = "total_files", nullable = false)
    private int totalFiles;

    @Column(name = "download_failed", nullable = false)
    private int downloadFailed;

    @Column(name = "validation_failed", nullable = false)
    private int validationFailed;

    @Column(name = "processing_failed", nullable = false)
    private int processingFailed;

    @Column(name = "successfully_processed", nullable = false)
    private int successfullyProcessed;

    @Column(name = "total_contacts", nullable = false)
    private int totalContacts;

    @Lob
    @Convert(converter = SkippedFilesConverter.class)
    @Column(name = "skipped_files")
    private List<SkippedFile> skippedFiles = new ArrayList<>();

    @Lob
    @Column(name = "error_message")
    private String errorMessage;

    @Lob
    @Column(name = "error_stack")
    private String errorStack;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Moves the run to {@code next}, rejecting anything but a forward step.
     */
    public void transitionTo(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job run " + jobId + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    /**
     * Stamps completion time and derives the duration from it.
     */
    public void finish(Instant at) {
        this.completedAt = at;
        if (startedAt != null) {
            this.durationSeconds = Math.max(0, Duration.between(startedAt, at).getSeconds());
        }
    }

    public boolean isRunning() {
        return status == JobStatus.RUNNING;
    }

    public boolean isStale(Instant now) {
        return isRunning() && startedAt != null && startedAt.isBefore(now.minus(STALE_AFTER));
    }

    public int getTotalFailures() {
        return downloadFailed + validationFailed + processingFailed;
    }

    public int getSuccessRate() {
        if (totalFiles == 0) {
            return 0;
        }
        return (int) Math.round(successfullyProcessed * 100.0 / totalFiles);
    }

    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }

        public boolean canTransitionTo(JobStatus next) {
            switch (this) {
                case PENDING:
                    return next == RUNNING;
                case RUNNING:
                    return next == COMPLETED || next == FAILED;
                default:
                    return false;
            }
        }
    }

    public enum TriggerType {
        CRON,
        MANUAL,
        API
    }
}
