package com.patchpilot.orchestrator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link WorkspaceOperations} over the {@code git} executable on the PATH.
 */
@Component
public class GitCli implements WorkspaceOperations {

    private static final Logger log = LoggerFactory.getLogger(GitCli.class);

    private static final long TIMEOUT_SECONDS = 120;

    @Override
    public void checkoutBranch(Path repo, String branch) throws InterruptedException {
        git(repo, "checkout", "-B", branch);
    }

    @Override
    public void switchBranch(Path repo, String branch) throws InterruptedException {
        git(repo, "checkout", branch);
    }

    @Override
    public boolean hasUncommittedChanges(Path repo) throws InterruptedException {
        return !git(repo, "status", "--porcelain").isBlank();
    }

    @Override
    public void commitAll(Path repo, String message) throws InterruptedException {
        git(repo, "add", "-A");
        git(repo, "commit", "-m", message);
    }

    @Override
    public void push(Path repo, String branch, String remote, boolean skipVerification) throws InterruptedException {
        List<String> args = new ArrayList<>(List.of("push", "--set-upstream", remote, branch));
        if (skipVerification) {
            args.add("--no-verify");
        }
        git(repo, args.toArray(String[]::new));
    }

    @Override
    public String headSha(Path repo) throws InterruptedException {
        return git(repo, "rev-parse", "HEAD").trim();
    }

    // ------------------------------------------------------------------

    private String git(Path repo, String... args) throws InterruptedException {
        List<String> command = new ArrayList<>();
        command.add("git");
        command.addAll(List.of(args));
        log.debug("git {} (in {})", String.join(" ", args), repo);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(repo.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new WorkspaceException("Failed to run git " + args[0] + ": " + e.getMessage(), e);
        }

        String output;
        try {
            output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new WorkspaceException("Failed to read git " + args[0] + " output", e);
        }
        if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            throw new WorkspaceException("git " + args[0] + " timed out after " + TIMEOUT_SECONDS + "s");
        }
        if (process.exitValue() != 0) {
            throw new WorkspaceException("git %s failed (exit %d): %s"
                    .formatted(args[0], process.exitValue(), output.trim()));
        }
        return output;
    }
}
