package com.patchpilot.orchestrator.repository;

import com.patchpilot.orchestrator.model.ParallelBatch;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ParallelBatchRepository extends JpaRepository<ParallelBatch, UUID> {

    List<ParallelBatch> findTop20ByOrderByStartedAtDesc();
}
