package com.patcharbiter.selector.patch;

/**
 * Removes a trailing {@code #} comment from a single source line.
 *
 * The scanner skips string literals (single, double and triple quoted, with
 * backslash escapes) so a {@code #} inside a string is kept. A line that
 * cannot be tokenized on its own (an unterminated string, an unclosed
 * bracket) falls back to cutting at the first {@code #}.
 */
public final class CommentStripper {

    private CommentStripper() {}

    public static String strip(String line) {
        int commentStart;
        try {
            commentStart = findComment(line);
        } catch (UntokenizableLineException e) {
            int hash = line.indexOf('#');
            return hash >= 0 ? line.substring(0, hash).stripTrailing() : line;
        }
        String code = commentStart >= 0 ? line.substring(0, commentStart) : line;
        return code.stripTrailing();
    }

    /** Index of the comment's {@code #}, or -1 when the line has no comment. */
    private static int findComment(String line) {
        int depth = 0;
        int i = 0;
        int length = line.length();
        while (i < length) {
            char c = line.charAt(i);
            if (c == '#') {
                if (depth > 0) {
                    throw new UntokenizableLineException();
                }
                return i;
            }
            if (c == '\'' || c == '"') {
                i = skipString(line, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            }
            i++;
        }
        if (depth > 0) {
            throw new UntokenizableLineException();
        }
        return -1;
    }

    /** Returns the index just past the literal that opens at {@code start}. */
    private static int skipString(String line, int start) {
        char quote = line.charAt(start);
        boolean triple = line.startsWith(String.valueOf(quote).repeat(3), start);
        String closing = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
        int i = start + closing.length();
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (line.startsWith(closing, i)) {
                return i + closing.length();
            }
            i++;
        }
        throw new UntokenizableLineException();
    }

    private static final class UntokenizableLineException extends RuntimeException {
        UntokenizableLineException() {
            super(null, null, false, false);
        }
    }
}
