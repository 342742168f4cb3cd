package com.patchpilot.orchestrator.repository;

import com.patchpilot.orchestrator.model.BatchItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BatchItemRepository extends JpaRepository<BatchItem, UUID> {

    List<BatchItem> findByBatchId(UUID batchId);
}
