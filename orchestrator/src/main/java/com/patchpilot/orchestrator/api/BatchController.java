package com.patchpilot.orchestrator.api;

import com.patchpilot.orchestrator.api.dto.BatchResponse;
import com.patchpilot.orchestrator.api.dto.StartBatchRequest;
import com.patchpilot.orchestrator.engine.BatchStatus;
import com.patchpilot.orchestrator.engine.ParallelOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Parallel batches.
 *
 * POST /batches                       start a batch, returns 202 with its id
 * GET  /batches                       the most recent batches
 * GET  /batches/{id}                  live status while running, stored status after
 * POST /batches/{id}/cancel           cancel every job of the batch that has not started
 * POST /batches/jobs/{jobId}/cancel   cancel one job wherever it is queued
 * POST /batches/cancel                cancel all running batches
 *
 * Cancellation is cooperative: a job already handed to the worker runs to the end.
 */
@RestController
@RequestMapping("/batches")
public class BatchController {

    private final ParallelOrchestrator orchestrator;

    public BatchController(ParallelOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> start(@RequestBody StartBatchRequest req) {
        UUID batchId = orchestrator.submit(req.toOptions());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("batchId", batchId));
    }

    @GetMapping
    public List<BatchResponse> recent() {
        return orchestrator.recentBatches().stream().map(BatchResponse::from).toList();
    }

    @GetMapping("/{id}")
    public BatchStatus status(@PathVariable UUID id) {
        return orchestrator.status(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Batch not found: " + id));
    }

    @PostMapping("/{id}/cancel")
    public Map<String, Object> cancelBatch(@PathVariable UUID id) {
        if (!orchestrator.cancelAll(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Batch not running: " + id);
        }
        return Map.of("batchId", id, "cancelled", true);
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public Map<String, Object> cancelJob(@PathVariable UUID jobId) {
        if (!orchestrator.cancel(jobId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not in a running batch: " + jobId);
        }
        return Map.of("jobId", jobId, "cancelled", true);
    }

    @PostMapping("/cancel")
    public Map<String, Object> cancelAll() {
        return Map.of("batches", orchestrator.cancelAll());
    }
}
