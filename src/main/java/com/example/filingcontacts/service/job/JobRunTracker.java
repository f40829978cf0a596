package com.example.filingcontacts.service.job;

import com.example.filingcontacts.dto.JobMetrics;
import com.example.filingcontacts.dto.JobRunStatistics;
import com.example.filingcontacts.model.JobRun;
import com.example.filingcontacts.model.JobRun.JobStatus;
import com.example.filingcontacts.model.JobRun.TriggerType;
import com.example.filingcontacts.repository.JobRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Persists the lifecycle and counters of ingestion runs.
 */
@Service
public class JobRunTracker {

    private static final Logger logger = LoggerFactory.getLogger(JobRunTracker.class);

    static final int MAX_RECENT = 500;
    static final String STALE_MESSAGE = "Job marked as failed due to stale status (running > 24 hours)";
    static final String STALE_STACK = "Cleaned up on application startup";

    private final JobRunRepository jobRunRepository;
    private final JobIdGenerator jobIdGenerator;
    private final Clock clock;

    public JobRunTracker(JobRunRepository jobRunRepository, JobIdGenerator jobIdGenerator, Clock clock) {
        this.jobRunRepository = jobRunRepository;
        this.jobIdGenerator = jobIdGenerator;
        this.clock = clock;
    }

    /**
     * Creates the run and moves it straight to RUNNING.
     *
     * @return the new job id
     */
    @Transactional
    public String start(String jobType, TriggerType triggerType) {
        JobRun run = new JobRun();
        run.setJobId(jobIdGenerator.generate(jobType));
        run.setJobType(jobType);
        run.setTriggerType(triggerType);
        run.setStatus(JobStatus.PENDING);
        run.setStartedAt(clock.instant());
        jobRunRepository.save(run);

        run.transitionTo(JobStatus.RUNNING);
        jobRunRepository.save(run);
        logger.info("▶️ Started {} job {} ({})", jobType, run.getJobId(), triggerType);
        return run.getJobId();
    }

    @Transactional
    public JobRun recordProgress(String jobId, JobMetrics metrics) {
        JobRun run = load(jobId);
        if (!run.isRunning()) {
            throw new IllegalStateException("Job run " + jobId + " is " + run.getStatus() + ", not running");
        }
        applyMetrics(run, metrics);
        return jobRunRepository.save(run);
    }

    @Transactional
    public JobRun complete(String jobId, JobMetrics metrics) {
        JobRun run = load(jobId);
        applyMetrics(run, metrics);
        run.transitionTo(JobStatus.COMPLETED);
        run.finish(clock.instant());
        logger.info("✅ Job {} completed in {}s: {}/{} files processed, {} contacts",
                jobId, run.getDurationSeconds(), run.getSuccessfullyProcessed(), run.getTotalFiles(), run.getTotalContacts());
        return jobRunRepository.save(run);
    }

    /**
     * Marks the run failed, keeping whatever counters were gathered before the failure.
     */
    @Transactional
    public JobRun fail(String jobId, String errorMessage, String errorStack, JobMetrics partialMetrics) {
        JobRun run = load(jobId);
        if (partialMetrics != null) {
            applyMetrics(run, partialMetrics);
        }
        run.transitionTo(JobStatus.FAILED);
        run.finish(clock.instant());
        run.setErrorMessage(errorMessage);
        run.setErrorStack(errorStack);
        logger.error("❌ Job {} failed after {}s: {}", jobId, run.getDurationSeconds(), errorMessage);
        return jobRunRepository.save(run);
    }

    /**
     * Fails every run left RUNNING for longer than {@link JobRun#STALE_AFTER}.
     *
     * @return number of runs reclaimed
     */
    @Transactional
    public int reclaimStale() {
        Instant now = clock.instant();
        List<JobRun> stale = jobRunRepository.findByStatusAndStartedAtBefore(JobStatus.RUNNING, now.minus(JobRun.STALE_AFTER));
        for (JobRun run : stale) {
            run.transitionTo(JobStatus.FAILED);
            run.finish(now);
            run.setErrorMessage(STALE_MESSAGE);
            run.setErrorStack(STALE_STACK);
            logger.warn("⚠️ Reclaimed stale job {} (started {})", run.getJobId(), run.getStartedAt());
        }
        jobRunRepository.saveAll(stale);
        return stale.size();
    }

    @Transactional(readOnly = true)
    public Optional<JobRun> findByJobId(String jobId) {
        return jobRunRepository.findByJobId(jobId);
    }

    @Transactional(readOnly = true)
    public List<JobRun> findRecent(int limit) {
        int capped = Math.max(1, Math.min(limit, MAX_RECENT));
        return jobRunRepository.findAllByOrderByStartedAtDesc(PageRequest.of(0, capped));
    }

    @Transactional(readOnly = true)
    public JobRunStatistics getStatistics(String jobType) {
        List<JobRun> runs = jobRunRepository.findByJobTypeOrderByStartedAtDesc(jobType);
        long completed = runs.stream().filter(r -> r.getStatus() == JobStatus.COMPLETED).count();
        long failed = runs.stream().filter(r -> r.getStatus() == JobStatus.FAILED).count();
        long files = runs.stream().mapToLong(JobRun::getTotalFiles).sum();
        long contacts = runs.stream().mapToLong(JobRun::getTotalContacts).sum();
        OptionalDouble duration = runs.stream()
                .filter(r -> r.getDurationSeconds() != null)
                .mapToLong(JobRun::getDurationSeconds)
                .average();
        int successRate = runs.isEmpty() ? 0 : (int) Math.round(completed * 100.0 / runs.size());
        return new JobRunStatistics(jobType, runs.size(), completed, failed, successRate, files, contacts,
                duration.isPresent() ? duration.getAsDouble() : null);
    }

    private JobRun load(String jobId) {
        return jobRunRepository.findByJobId(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job run " + jobId));
    }

    private void applyMetrics(JobRun run, JobMetrics metrics) {
        if (metrics.getAccountedFiles() > metrics.getTotalFiles()) {
            throw new IllegalArgumentException("Job " + run.getJobId() + " accounts for "
                    + metrics.getAccountedFiles() + " files but only saw " + metrics.getTotalFiles());
        }
        run.setTotalFiles(metrics.getTotalFiles());
        run.setDownloadFailed(metrics.getDownloadFailed());
        run.setValidationFailed(metrics.getValidationFailed());
        run.setProcessingFailed(metrics.getProcessingFailed());
        run.setSuccessfullyProcessed(metrics.getSuccessfullyProcessed());
        run.setTotalContacts(metrics.getTotalContacts());
        run.setSkippedFiles(new ArrayList<>(metrics.getSkippedFiles()));
    }
}
