package com.patcharbiter.selector.patch;

/** An added or removed line inside a hunk, with its +/- marker removed. */
public record DiffLine(Kind kind, String file, String content) {

    public enum Kind { ADDED, REMOVED }

    public char marker() {
        return kind == Kind.ADDED ? '+' : '-';
    }
}
