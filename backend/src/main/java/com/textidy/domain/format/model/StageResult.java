package com.textidy.domain.format.model;

import java.util.List;

/**
 * Outcome of one formatting stage.
 *
 * @param text    the stage output, or null when the stage failed
 * @param failure failure message, or null on success
 * @param notes   informational diagnostics produced by a successful stage
 */
public record StageResult(
        String text,
        String failure,
        List<Diagnostic> notes
) {

    public static StageResult success(String text) {
        return new StageResult(text, null, List.of());
    }

    public static StageResult success(String text, List<Diagnostic> notes) {
        return new StageResult(text, null, List.copyOf(notes));
    }

    public static StageResult failure(String message) {
        return new StageResult(null, message, List.of());
    }

    public boolean succeeded() {
        return failure == null;
    }
}
