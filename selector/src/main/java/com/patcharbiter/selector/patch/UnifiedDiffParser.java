package com.patcharbiter.selector.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the changed lines of a unified diff, file by file and hunk by hunk.
 *
 * Hunk headers are honoured for their line counts, so a removed line whose
 * text starts with "-- " is never mistaken for a "--- a/file" header.
 * Text without any hunk header is read as a single implicit hunk.
 */
public final class UnifiedDiffParser {

    private static final Pattern HUNK_HEADER = Pattern.compile(
            "^@@ -\\d+(?:,(\\d+))? \\+\\d+(?:,(\\d+))? @@.*$");

    private static final Pattern DIFF_GIT = Pattern.compile("^diff --git a/(\\S+) b/(\\S+).*$");

    private UnifiedDiffParser() {}

    public static List<DiffLine> changedLines(String diff) {
        List<String> lines = diff.lines().toList();
        boolean hasHunks = lines.stream().anyMatch(l -> HUNK_HEADER.matcher(l).matches());
        return hasHunks ? parseHunks(lines) : parseImplicitHunk(lines);
    }

    private static List<DiffLine> parseHunks(List<String> lines) {
        List<DiffLine> result = new ArrayList<>();
        String file = null;
        int oldRemaining = 0;
        int newRemaining = 0;

        for (String line : lines) {
            if (oldRemaining > 0 || newRemaining > 0) {
                if (line.startsWith("+")) {
                    result.add(new DiffLine(DiffLine.Kind.ADDED, file, line.substring(1)));
                    newRemaining--;
                } else if (line.startsWith("-")) {
                    result.add(new DiffLine(DiffLine.Kind.REMOVED, file, line.substring(1)));
                    oldRemaining--;
                } else if (line.startsWith("\\")) {
                    // "\ No newline at end of file" does not count against the hunk
                    continue;
                } else {
                    oldRemaining--;
                    newRemaining--;
                }
                continue;
            }

            Matcher hunk = HUNK_HEADER.matcher(line);
            if (hunk.matches()) {
                oldRemaining = hunk.group(1) == null ? 1 : Integer.parseInt(hunk.group(1));
                newRemaining = hunk.group(2) == null ? 1 : Integer.parseInt(hunk.group(2));
                continue;
            }
            Matcher header = DIFF_GIT.matcher(line);
            if (header.matches()) {
                file = header.group(2);
            } else if (line.startsWith("+++ ")) {
                file = stripPrefix(line.substring(4).strip());
            }
        }
        return result;
    }

    private static List<DiffLine> parseImplicitHunk(List<String> lines) {
        List<DiffLine> result = new ArrayList<>();
        for (String line : lines) {
            if (line.startsWith("+++ ") || line.startsWith("--- ")) {
                continue;
            }
            if (line.startsWith("+")) {
                result.add(new DiffLine(DiffLine.Kind.ADDED, null, line.substring(1)));
            } else if (line.startsWith("-")) {
                result.add(new DiffLine(DiffLine.Kind.REMOVED, null, line.substring(1)));
            }
        }
        return result;
    }

    private static String stripPrefix(String path) {
        if (path.startsWith("a/") || path.startsWith("b/")) {
            return path.substring(2);
        }
        return path;
    }
}
