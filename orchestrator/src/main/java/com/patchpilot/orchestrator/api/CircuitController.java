package com.patchpilot.orchestrator.api;

import com.patchpilot.orchestrator.resilience.CircuitBreakerRegistry;
import com.patchpilot.orchestrator.resilience.CircuitSnapshot;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * GET  /circuits                     every breaker's state
 * POST /circuits/{operation}/reset   close one breaker
 * POST /circuits/reset               close all breakers
 */
@RestController
@RequestMapping("/circuits")
public class CircuitController {

    private final CircuitBreakerRegistry circuits;

    public CircuitController(CircuitBreakerRegistry circuits) {
        this.circuits = circuits;
    }

    @GetMapping
    public List<CircuitSnapshot> status() {
        return circuits.status();
    }

    @PostMapping("/{operation}/reset")
    public CircuitSnapshot reset(@PathVariable String operation) {
        circuits.reset(operation);
        return circuits.get(operation).snapshot();
    }

    @PostMapping("/reset")
    public List<CircuitSnapshot> resetAll() {
        circuits.resetAll();
        return circuits.status();
    }
}
