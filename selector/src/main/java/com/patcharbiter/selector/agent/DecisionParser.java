package com.patcharbiter.selector.agent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the final report in an agent reply:
 * <pre>
 *   ### Status: succeed
 *   ### Result: Patch-2
 *   ### Analysis: ...
 * </pre>
 * The report only counts when the status line is immediately followed by
 * the result line and an analysis section follows the result.
 */
public final class DecisionParser {

    private static final Pattern STATUS = Pattern.compile(
            "(?:###\\s*)?Status:\\s*(success|succeed|successfully|successful)\\s*\\n\\s*(?:###\\s*)?Result:",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RESULT = Pattern.compile(
            "(?:###\\s*)?Result:\\s*(.+?)\\s*(?:###\\s*)?Analysis:",
            Pattern.CASE_INSENSITIVE);

    private static final String PATCH_PREFIX = "Patch-";

    private DecisionParser() {}

    /**
     * Extract the selection token, i.e. whatever follows the last
     * {@code Patch-} in the result value ("2" for "Patch-2"). The token is
     * not validated against the working set.
     */
    public static Optional<String> extractSelection(String reply) {
        if (reply == null || !STATUS.matcher(reply).find()) {
            return Optional.empty();
        }
        Matcher m = RESULT.matcher(reply);
        if (!m.find()) {
            return Optional.empty();
        }
        String value = m.group(1).strip();
        int last = value.lastIndexOf(PATCH_PREFIX);
        return Optional.of(last < 0 ? value : value.substring(last + PATCH_PREFIX.length()).strip());
    }
}
