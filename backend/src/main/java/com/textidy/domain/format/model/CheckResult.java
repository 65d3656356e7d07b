package com.textidy.domain.format.model;

import java.util.List;

/**
 * Result of validating one document.
 *
 * @param valid       true if no brace or environment problems were found
 * @param issues      brace and environment diagnostics, in source order
 * @param warnings    cross-reference findings; informational only
 * @param suggestions missing-package and obsolete-command advice
 */
public record CheckResult(
        boolean valid,
        List<Diagnostic> issues,
        List<Diagnostic> warnings,
        List<Diagnostic> suggestions
) {

    public List<String> messages() {
        return issues.stream().map(Diagnostic::message).toList();
    }
}
