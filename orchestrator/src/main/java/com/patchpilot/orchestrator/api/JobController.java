package com.patchpilot.orchestrator.api;

import com.patchpilot.orchestrator.api.dto.EnqueueJobRequest;
import com.patchpilot.orchestrator.api.dto.JobResponse;
import com.patchpilot.orchestrator.api.dto.SessionResponse;
import com.patchpilot.orchestrator.api.dto.TransitionRequest;
import com.patchpilot.orchestrator.api.dto.TransitionResponse;
import com.patchpilot.orchestrator.lifecycle.JobStateMachine;
import com.patchpilot.orchestrator.lifecycle.SessionService;
import com.patchpilot.orchestrator.model.Job;
import com.patchpilot.orchestrator.model.JobState;
import com.patchpilot.orchestrator.queue.QueueManager;
import com.patchpilot.orchestrator.repository.JobRepository;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for job lifecycle.
 *
 * GET  /jobs?state=QUEUED       list jobs, optionally filtered by state
 * POST /jobs                    ingest an issue and put it on the queue
 * GET  /jobs/{id}               current state of a job
 * GET  /jobs/{id}/history       every transition the job went through
 * GET  /jobs/{id}/sessions      work sessions, oldest first
 * POST /jobs/{id}/transition    operator transition (close, mark merged, ...)
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobRepository   jobRepo;
    private final JobStateMachine stateMachine;
    private final SessionService  sessions;
    private final QueueManager    queue;

    public JobController(JobRepository jobRepo, JobStateMachine stateMachine,
                         SessionService sessions, QueueManager queue) {
        this.jobRepo      = jobRepo;
        this.stateMachine = stateMachine;
        this.sessions     = sessions;
        this.queue        = queue;
    }

    @GetMapping
    public List<JobResponse> list(@RequestParam(required = false) JobState state) {
        List<Job> jobs = state == null ? jobRepo.findAll() : jobRepo.findByState(state);
        return jobs.stream().map(JobResponse::from).toList();
    }

    /**
     * Ingest an issue by hand.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"url":"https://github.com/acme/api/issues/42","projectId":"acme/api","title":"NPE in src/auth.ts"}'
     *
     * HTTP 409 if an issue with the same URL is already tracked, whatever its state.
     */
    @PostMapping
    public ResponseEntity<JobResponse> enqueue(@RequestBody EnqueueJobRequest req) {
        if (req.url() == null || req.url().isBlank() || req.projectId() == null || req.projectId().isBlank()) {
            throw new IllegalArgumentException("url and projectId are required");
        }
        Job job = queue.enqueue(req.toCandidate()).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.CONFLICT, "Issue already tracked: " + req.url()));
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return jobRepo.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    @GetMapping("/{id}/history")
    public List<TransitionResponse> history(@PathVariable UUID id) {
        return stateMachine.history(id).stream()
                .map(TransitionResponse::from)
                .toList();
    }

    @GetMapping("/{id}/sessions")
    public List<SessionResponse> sessions(@PathVariable UUID id) {
        jobRepo.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
        return sessions.sessionsFor(id).stream()
                .map(SessionResponse::from)
                .toList();
    }

    /**
     * HTTP 409 if the edge is not allowed from the job's current state.
     */
    @PostMapping("/{id}/transition")
    public JobResponse transition(@PathVariable UUID id, @RequestBody TransitionRequest req) {
        if (req.target() == null) {
            throw new IllegalArgumentException("target is required");
        }
        return JobResponse.from(stateMachine.transition(id, req.target(), req.reason()));
    }
}
