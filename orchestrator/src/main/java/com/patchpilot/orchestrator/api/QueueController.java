package com.patchpilot.orchestrator.api;

import com.patchpilot.orchestrator.api.dto.JobResponse;
import com.patchpilot.orchestrator.api.dto.QueueItemRequest;
import com.patchpilot.orchestrator.queue.QueueManager;
import com.patchpilot.orchestrator.queue.QueueStatus;
import com.patchpilot.orchestrator.queue.ReplenishmentResult;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Operator surface over the backlog.
 *
 * GET    /queue              size and thresholds
 * GET    /queue/jobs         queued jobs, oldest first
 * POST   /queue/replenish    pull from the candidate sources now
 * POST   /queue/prioritize   move one entry to the front
 * POST   /queue/remove       abandon one entry
 * DELETE /queue              abandon everything queued
 */
@RestController
@RequestMapping("/queue")
public class QueueController {

    private final QueueManager queue;

    public QueueController(QueueManager queue) {
        this.queue = queue;
    }

    @GetMapping
    public QueueStatus status() {
        return queue.getQueueStatus();
    }

    @GetMapping("/jobs")
    public List<JobResponse> jobs() {
        return queue.getQueuedJobs().stream().map(JobResponse::from).toList();
    }

    @PostMapping("/replenish")
    public ReplenishmentResult replenish() throws InterruptedException {
        return queue.replenish();
    }

    @PostMapping("/prioritize")
    public Map<String, Object> prioritize(@RequestBody QueueItemRequest req) {
        if (!queue.prioritize(req.url())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Not in queue: " + req.url());
        }
        return Map.of("url", req.url(), "prioritized", true);
    }

    @PostMapping("/remove")
    public Map<String, Object> remove(@RequestBody QueueItemRequest req) {
        if (!queue.removeFromQueue(req.url())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Not in queue: " + req.url());
        }
        return Map.of("url", req.url(), "removed", true);
    }

    @DeleteMapping
    public Map<String, Object> clear(@RequestParam(defaultValue = "Queue cleared by operator") String reason) {
        return Map.of("cleared", queue.clearQueue(reason));
    }
}
