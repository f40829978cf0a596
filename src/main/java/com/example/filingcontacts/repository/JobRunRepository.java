package com.example.filingcontacts.repository;

import com.example.filingcontacts.model.JobRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface JobRunRepository extends JpaRepository<JobRun, Long> {
    Optional<JobRun> findByJobId(String jobId);
    List<JobRun> findByStatusAndStartedAtBefore(JobRun.JobStatus status, Instant cutoff);
    List<JobRun> findByJobTypeOrderByStartedAtDesc(String jobType);
    List<JobRun> findAllByOrderByStartedAtDesc(Pageable pageable);
}
