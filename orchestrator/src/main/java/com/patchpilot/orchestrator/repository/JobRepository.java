package com.patchpilot.orchestrator.repository;

import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    List<Job> findByState(JobState state);

    List<Job> findByStateIn(Collection<JobState> states);

    /** The backlog, oldest first. */
    List<Job> findByStateOrderByQueuedAtAsc(JobState state);

    long countByState(JobState state);

    /** Dedupe check: true whatever state the existing job is in. */
    boolean existsByUrl(String url);

    Optional<Job> findByUrl(String url);
}
