package com.patchpilot.orchestrator.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.resilience.TransientException;
import com.patchpilot.orchestrator.resilience.Watchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the Claude Code CLI as a child process.
 *
 * <pre>
 *   claude --print --output-format stream-json --verbose
 *          --dangerously-skip-permissions --max-turns N [--model M] [--resume ID]
 * </pre>
 *
 * The prompt goes in on stdin. Every output line heartbeats the watchdog; the
 * final {@code result} event carries cost, turn count and the conversation id.
 *
 * This is the raw adapter. Callers go through {@link GuardedAiInvoker}, which
 * adds the breaker, retries and the watchdog that can kill the process.
 */
@Component
public class ClaudeCliInvoker {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCliInvoker.class);

    private static final int ERROR_TAIL_LINES = 20;

    private final PatchPilotProperties.Ai ai;
    private final ObjectMapper            json;

    public ClaudeCliInvoker(PatchPilotProperties props, ObjectMapper objectMapper) {
        this.ai   = props.ai();
        this.json = objectMapper;
    }

    /**
     * @param processRef receives the child process as soon as it starts, so a
     *                   watchdog on another thread can {@link #kill} it
     * @throws TransientException if the CLI cannot be started or dies without a result
     */
    public AiResult run(String prompt, AiQuery query, Watchdog watchdog,
                        AtomicReference<Process> processRef) throws InterruptedException {
        List<String> command = buildCommand(query);
        log.info("Starting Claude CLI in {} (max turns {})", query.cwd(), query.maxTurns());
        log.debug("Command: {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(query.cwd().toFile())
                .redirectErrorStream(true);
        pb.environment().put("TERM", "dumb");
        pb.environment().put("CI", "true");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TransientException("Failed to spawn Claude CLI: " + e.getMessage(), e);
        }
        processRef.set(process);

        StreamState state = new StreamState();
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(prompt.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            process.destroyForcibly();
            throw new TransientException("Failed to send prompt to Claude CLI: " + e.getMessage(), e);
        }

        try (BufferedReader out = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = out.readLine()) != null) {
                watchdog.heartbeat();
                consume(line, state);
            }
        } catch (IOException e) {
            // The stream closes under us when the watchdog kills the process.
            if (!watchdog.hasFired()) {
                throw new TransientException("Lost Claude CLI output: " + e.getMessage(), e);
            }
        }

        int exit = process.waitFor();
        return toResult(exit, state, query);
    }

    /** Terminates the process and everything it spawned. Safe to call from any thread. */
    public void kill(AtomicReference<Process> processRef) {
        Process process = processRef.get();
        if (process == null || !process.isAlive()) {
            return;
        }
        log.warn("Killing Claude CLI process {}", process.pid());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    // ------------------------------------------------------------------
    // Command and stream parsing
    // ------------------------------------------------------------------

    List<String> buildCommand(AiQuery query) {
        List<String> cmd = new ArrayList<>(List.of(
                ai.cliPath(), "--print",
                "--output-format", "stream-json",
                "--verbose",
                "--dangerously-skip-permissions",
                "--max-turns", String.valueOf(query.maxTurns() > 0 ? query.maxTurns() : ai.maxTurns())));
        String model = query.model() != null ? query.model() : ai.model();
        if (model != null && !model.isBlank()) {
            cmd.add("--model");
            cmd.add(model);
        }
        if (query.resumeSessionId() != null) {
            cmd.add("--resume");
            cmd.add(query.resumeSessionId());
        }
        return cmd;
    }

    void consume(String line, StreamState state) {
        if (!line.startsWith("{")) {
            state.remember(line);
            return;
        }
        JsonNode event;
        try {
            event = json.readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Skipping unparseable CLI line: {}", e.getOriginalMessage());
            state.remember(line);
            return;
        }
        String type = event.path("type").asText();
        if (event.hasNonNull("session_id")) {
            state.sessionId = event.get("session_id").asText();
        }
        switch (type) {
            case "assistant" -> state.assistantMessages++;
            case "result"    -> state.result = event;
            default          -> { }
        }
    }

    AiResult toResult(int exitCode, StreamState state, AiQuery query) {
        JsonNode result = state.result;
        if (result == null) {
            if (exitCode != 0) {
                throw new TransientException("Claude CLI exited with code %d without a result: %s"
                        .formatted(exitCode, state.tail()));
            }
            return new AiResult(false, "", 0.0, state.assistantMessages, state.sessionId,
                    "Claude CLI produced no result event");
        }

        double cost  = result.path("total_cost_usd").asDouble(0.0);
        int    turns = result.path("num_turns").asInt(state.assistantMessages);
        String subtype = result.path("subtype").asText("");
        boolean ok = !result.path("is_error").asBoolean(false) && "success".equals(subtype);
        String output = result.path("result").asText("");

        if (query.maxBudgetUsd() > 0 && cost > query.maxBudgetUsd()) {
            log.warn("Claude CLI run cost ${} over its ${} budget", cost, query.maxBudgetUsd());
        }
        log.info("Claude CLI finished: {} in {} turn(s), ${}", ok ? "success" : subtype, turns, cost);
        return new AiResult(ok, output, cost, turns, state.sessionId,
                ok ? null : "Claude CLI run ended with " + (subtype.isEmpty() ? "an error" : subtype));
    }

    /** Mutable parse state for one run. */
    static final class StreamState {
        JsonNode result;
        String   sessionId;
        int      assistantMessages;

        private final Deque<String> tail = new ArrayDeque<>();

        void remember(String line) {
            if (tail.size() == ERROR_TAIL_LINES) {
                tail.removeFirst();
            }
            tail.addLast(line);
        }

        String tail() {
            return String.join("\n", tail);
        }
    }
}
