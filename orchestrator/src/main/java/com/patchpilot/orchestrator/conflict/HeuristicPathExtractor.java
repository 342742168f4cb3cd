package com.patchpilot.orchestrator.conflict;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based extraction of path-like tokens from issue text.
 *
 * Picks up paths under common source roots, bare file names with a known
 * extension, and module specifiers in import/require statements.
 */
@Component
public class HeuristicPathExtractor implements PathExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    // Longer extensions first, and a word boundary after, so "x.tsx" is not read as "x.ts".
    private static final String EXTENSIONS =
            "tsx|ts|jsx|js|py|rb|go|rs|java|cpp|hpp|c|h|scss|css|html|json|yaml|yml|md|txt";

    private static final List<Pattern> FILE_PATTERNS = List.of(
            Pattern.compile("(?:^|\\s|`)((?:src|lib|test|tests|app|packages|components|pages|api)/[\\w\\-./]+\\.\\w+)", FLAGS),
            Pattern.compile("(?:^|\\s|`)([\\w\\-./]+\\.(?:" + EXTENSIONS + "))\\b", FLAGS),
            Pattern.compile("(?:in|from|import|require)\\s+['\"]([@\\w\\-./]+)['\"]", FLAGS)
    );

    @Override
    public Set<String> extract(String title, String body) {
        String text = (title == null ? "" : title) + "\n" + (body == null ? "" : body);
        Set<String> paths = new LinkedHashSet<>();
        for (Pattern pattern : FILE_PATTERNS) {
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                String normalized = ConflictDetector.normalize(m.group(1));
                if (!normalized.isEmpty()) {
                    paths.add(normalized);
                }
            }
        }
        return paths;
    }
}
