package com.textidy.domain.format.model;

import java.util.List;

/**
 * Result of formatting one document.
 *
 * @param text        formatted text
 * @param changed     whether the formatted text differs from the input
 * @param diagnostics syntax findings on the input, stage faults and notes, in emission order
 * @param degraded    true when the full pipeline failed and the minimal fallback was used
 */
public record FormatResult(
        String text,
        boolean changed,
        List<Diagnostic> diagnostics,
        boolean degraded
) {

    public List<Diagnostic> faults() {
        return diagnostics.stream()
                .filter(d -> d.category() == DiagnosticCategory.STAGE_FAULT)
                .toList();
    }
}
