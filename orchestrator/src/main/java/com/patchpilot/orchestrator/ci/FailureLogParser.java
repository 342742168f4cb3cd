package com.patchpilot.orchestrator.ci;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the useful part out of a CI log: the lines that look like errors, and the tail.
 */
public final class FailureLogParser {

    static final int    MAX_ERRORS      = 20;
    static final int    MAX_LOG_CHARS   = 10_000;
    static final String TRUNCATION_MARK = "...[truncated]...\n";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final List<Pattern> ERROR_PATTERNS = List.of(
            Pattern.compile("error\\[.*?\\]:.*$", FLAGS),        // rustc
            Pattern.compile("Error:.*$", FLAGS),
            Pattern.compile("FAIL\\s+.*$", FLAGS),
            Pattern.compile("✗.*$", FLAGS),
            Pattern.compile("×.*$", FLAGS),
            Pattern.compile("AssertionError:.*$", FLAGS),
            Pattern.compile("TypeError:.*$", FLAGS),
            Pattern.compile("SyntaxError:.*$", FLAGS),
            Pattern.compile("ReferenceError:.*$", FLAGS),
            Pattern.compile("expected.*to.*$", FLAGS),
            Pattern.compile("^\\s+✕.*$", FLAGS),                 // jest
            Pattern.compile("^FAILED:.*$", FLAGS)
    );

    private static final Pattern LABELLED_SUMMARY = Pattern.compile(
            "(?:summary|fixed|changes made|what i did):\\s*([^\\n]+(?:\\n- [^\\n]+)*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIXED_SENTENCE = Pattern.compile(
            "I (?:have )?(?:fixed|addressed|resolved)[^.]*\\.", Pattern.CASE_INSENSITIVE);

    static final String DEFAULT_SUMMARY = "Fixed CI failures";

    private FailureLogParser() {}

    /** Distinct error-looking lines longer than 10 characters, in pattern order, at most 20. */
    public static List<String> parseErrors(String log) {
        Set<String> seen = new LinkedHashSet<>();
        for (Pattern pattern : ERROR_PATTERNS) {
            Matcher m = pattern.matcher(log);
            while (m.find()) {
                String cleaned = m.group().trim();
                if (cleaned.length() > 10) {
                    seen.add(cleaned);
                }
            }
        }
        List<String> errors = new ArrayList<>(seen);
        return errors.size() > MAX_ERRORS ? errors.subList(0, MAX_ERRORS) : errors;
    }

    /** Keeps the end of the log, where build tools print the failure. */
    public static String truncate(String log) {
        if (log.length() <= MAX_LOG_CHARS) {
            return log;
        }
        return TRUNCATION_MARK + log.substring(log.length() - MAX_LOG_CHARS);
    }

    /**
     * A one-paragraph description of what the AI changed, taken from its final output.
     */
    public static String extractFixSummary(String output) {
        if (output == null || output.isBlank()) {
            return DEFAULT_SUMMARY;
        }
        Matcher labelled = LABELLED_SUMMARY.matcher(output);
        if (labelled.find()) {
            return labelled.group(1);
        }
        Matcher sentence = FIXED_SENTENCE.matcher(output);
        if (sentence.find()) {
            return sentence.group();
        }
        String[] paragraphs = output.split("\\n\\n+");
        String last = paragraphs[paragraphs.length - 1];
        if (!last.isBlank() && last.length() < 500) {
            return last.trim();
        }
        return DEFAULT_SUMMARY;
    }
}
