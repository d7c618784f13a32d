package com.patcharbiter.selector.patch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reduces a diff to a signature that ignores comments and formatting.
 *
 * Two candidates with equal signatures make the same code change, so only
 * the first of them is shown to the agent. The function is pure: the same
 * text always yields the same signature.
 */
public final class PatchCanonicalizer {

    private static final Pattern PURE_COMMENT = Pattern.compile("^\\s*#.*", Pattern.DOTALL);
    private static final Pattern WHITESPACE   = Pattern.compile("\\s+");

    private PatchCanonicalizer() {}

    public static String canonicalize(String rawDiff) {
        List<String> extracted = new ArrayList<>();
        for (DiffLine line : UnifiedDiffParser.changedLines(rawDiff)) {
            String content = stripMarkers(line.content(), line.marker());
            if (content.isBlank() || PURE_COMMENT.matcher(content).matches()) {
                continue;
            }
            String code = CommentStripper.strip(content.stripTrailing());
            if (code.isBlank()) {
                continue;
            }
            extracted.add(line.marker() + code);
        }
        return WHITESPACE.matcher(String.join("\n", extracted)).replaceAll("");
    }

    // Marker characters repeated after the diff marker are dropped as well.
    private static String stripMarkers(String content, char marker) {
        int i = 0;
        while (i < content.length() && content.charAt(i) == marker) {
            i++;
        }
        return content.substring(i);
    }
}
