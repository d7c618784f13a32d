package com.patcharbiter.selector.tool;

import java.util.regex.Pattern;

/** POSIX shell quoting for single command-line words. */
public final class ShellQuoting {

    private static final Pattern SAFE = Pattern.compile("[\\w@%+=:,./-]+");

    private ShellQuoting() {}

    /** Returns {@code value} unchanged when it is safe, otherwise single-quoted. */
    public static String quote(String value) {
        if (value.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
