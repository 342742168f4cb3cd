package com.patchpilot.orchestrator.repository;

import com.patchpilot.orchestrator.model.WorkRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/** Keyed by job id. */
public interface WorkRecordRepository extends JpaRepository<WorkRecord, UUID> {
}
