package com.example.contractlens.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a line edit script. Line numbers are 1-based; {@code lineNumberA} is
 * null for added lines and {@code lineNumberB} is null for removed lines.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffLine(LineChangeType type, String content, Integer lineNumberA, Integer lineNumberB) {

    public static DiffLine added(String content, int lineNumberB) {
        return new DiffLine(LineChangeType.ADDED, content, null, lineNumberB);
    }

    public static DiffLine removed(String content, int lineNumberA) {
        return new DiffLine(LineChangeType.REMOVED, content, lineNumberA, null);
    }

    public static DiffLine unchanged(String content, int lineNumberA, int lineNumberB) {
        return new DiffLine(LineChangeType.UNCHANGED, content, lineNumberA, lineNumberB);
    }
}
