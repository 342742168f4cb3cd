package com.patchpilot.orchestrator.api;

import com.patchpilot.orchestrator.api.dto.StartRunnerRequest;
import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.engine.AutonomousRunner;
import com.patchpilot.orchestrator.engine.RunnerOptions;
import com.patchpilot.orchestrator.engine.RunnerResult;
import com.patchpilot.orchestrator.engine.RunnerStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Autonomous runner controls.
 *
 * POST /runner/start    start a run in the background (409 if one is active)
 * POST /runner/pause    stop picking up jobs until resumed
 * POST /runner/resume
 * POST /runner/stop     finish the current job, then stop
 * GET  /runner          current status
 * GET  /runner/last     result of the most recent finished run
 */
@RestController
@RequestMapping("/runner")
public class RunnerController {

    private final AutonomousRunner     runner;
    private final PatchPilotProperties props;

    public RunnerController(AutonomousRunner runner, PatchPilotProperties props) {
        this.runner = runner;
        this.props  = props;
    }

    @PostMapping("/start")
    public ResponseEntity<RunnerStatus> start(@RequestBody(required = false) StartRunnerRequest req) {
        RunnerOptions options = RunnerOptions.defaults(props);
        if (req != null) {
            options = req.applyTo(options);
        }
        runner.start(options);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(runner.getStatus());
    }

    @PostMapping("/pause")
    public RunnerStatus pause() {
        runner.pause();
        return runner.getStatus();
    }

    @PostMapping("/resume")
    public RunnerStatus resume() {
        runner.resume();
        return runner.getStatus();
    }

    @PostMapping("/stop")
    public RunnerStatus stop() {
        runner.requestStop();
        return runner.getStatus();
    }

    @GetMapping
    public RunnerStatus status() {
        return runner.getStatus();
    }

    @GetMapping("/last")
    public RunnerResult last() {
        return runner.lastResult().orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "No run has finished yet"));
    }
}
