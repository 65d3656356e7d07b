package com.textidy.domain.format.model;

/**
 * A validation or fault message returned to the caller. Never thrown.
 *
 * @param category what kind of problem this is
 * @param source   the component that produced it (validator name or stage name)
 * @param message  human-readable description
 * @param line     1-based source line, or null when the problem has no single location
 */
public record Diagnostic(
        DiagnosticCategory category,
        String source,
        String message,
        Integer line
) {

    public static Diagnostic of(DiagnosticCategory category, String source, String message) {
        return new Diagnostic(category, source, message, null);
    }

    public static Diagnostic at(DiagnosticCategory category, String source, String message, int line) {
        return new Diagnostic(category, source, message, line);
    }

    public static Diagnostic stageFault(String stageName, String message) {
        return new Diagnostic(DiagnosticCategory.STAGE_FAULT, stageName, stageName + ": " + message, null);
    }

    public Severity severity() {
        return DiagnosticClassifier.severity(this);
    }

    public enum Severity {
        CRITICAL,
        WARNING,
        INFO
    }
}
