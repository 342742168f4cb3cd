package com.patchpilot.orchestrator.repository;

import com.patchpilot.orchestrator.model.JobTransition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface JobTransitionRepository extends JpaRepository<JobTransition, UUID> {

    List<JobTransition> findByJobIdOrderByCreatedAtAsc(UUID jobId);
}
