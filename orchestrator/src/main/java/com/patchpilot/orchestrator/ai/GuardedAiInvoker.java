package com.patchpilot.orchestrator.ai;

import com.patchpilot.orchestrator.OrchestratorException;
import com.patchpilot.orchestrator.resilience.CircuitBreakerRegistry;
import com.patchpilot.orchestrator.resilience.GuardedCalls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The {@link AiInvoker} the engine uses: every query runs through the
 * "ai-invoke" circuit breaker, the retry policy, and a watchdog that kills
 * the CLI process when it stops producing output.
 *
 * Resilience failures (open circuit, hung process, retries exhausted) come
 * back as unsuccessful results rather than exceptions.
 */
@Component
public class GuardedAiInvoker implements AiInvoker {

    private static final Logger log = LoggerFactory.getLogger(GuardedAiInvoker.class);

    private final ClaudeCliInvoker cli;
    private final GuardedCalls     guarded;

    public GuardedAiInvoker(ClaudeCliInvoker cli, GuardedCalls guarded) {
        this.cli     = cli;
        this.guarded = guarded;
    }

    @Override
    public AiResult query(String prompt, AiQuery query) throws InterruptedException {
        Map<String, Object> metadata = Map.of(
                "cwd", String.valueOf(query.cwd()),
                "prompt", prompt.length() > 100 ? prompt.substring(0, 100) : prompt);
        // Attempts run one after another, so one slot is enough for the live process.
        AtomicReference<Process> process = new AtomicReference<>();
        try {
            return guarded.supervised(CircuitBreakerRegistry.AI_INVOKE, query.timeout(),
                    ctx -> cli.kill(process),
                    metadata,
                    watchdog -> cli.run(prompt, query, watchdog, process));
        } catch (OrchestratorException e) {
            log.warn("AI invocation failed: {}", e.getMessage());
            return AiResult.failed(e.getMessage());
        }
    }
}
