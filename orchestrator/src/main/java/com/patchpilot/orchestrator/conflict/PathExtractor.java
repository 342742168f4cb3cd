package com.patchpilot.orchestrator.conflict;

import java.util.Set;

/**
 * Guesses which repository paths an issue's text refers to.
 *
 * Implementations return normalized paths (see {@link ConflictDetector#normalize}).
 */
public interface PathExtractor {

    Set<String> extract(String title, String body);
}
