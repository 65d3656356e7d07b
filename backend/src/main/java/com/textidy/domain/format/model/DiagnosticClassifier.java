package com.textidy.domain.format.model;

import java.util.Locale;

/**
 * Derives a severity and an optional fix hint from a diagnostic's category and message.
 */
public final class DiagnosticClassifier {

    private DiagnosticClassifier() {
    }

    /**
     * CRITICAL for structural breakage, WARNING for problems the formatter worked around,
     * INFO for everything else.
     */
    public static Diagnostic.Severity severity(Diagnostic diagnostic) {
        return switch (diagnostic.category()) {
            case BRACE, ENVIRONMENT -> Diagnostic.Severity.CRITICAL;
            case STAGE_FAULT, PATTERN, CROSS_REFERENCE, COMMAND -> Diagnostic.Severity.WARNING;
            case LINE_LENGTH, SUGGESTION -> byMessage(lower(diagnostic));
        };
    }

    private static Diagnostic.Severity byMessage(String message) {
        if (message.contains("unmatched") || message.contains("missing")) {
            return Diagnostic.Severity.CRITICAL;
        }
        if (mentionsSpacing(message) || message.contains("unknown")) {
            return Diagnostic.Severity.WARNING;
        }
        return Diagnostic.Severity.INFO;
    }

    /**
     * A short hint on how to fix the problem, or null when there is nothing useful to say.
     */
    public static String suggestion(Diagnostic diagnostic) {
        String message = lower(diagnostic);
        DiagnosticCategory category = diagnostic.category();

        if (message.contains("unmatched")) {
            return "Check for missing opening or closing braces/environments";
        }
        if (mentionsSpacing(message)) {
            return "Remove extra spaces around command braces";
        }
        if (message.contains("incomplete") || message.contains("dangling")) {
            return "Add the missing closing brace or content";
        }
        if (category == DiagnosticCategory.ENVIRONMENT) {
            return "Verify environment names match between \\begin and \\end";
        }
        if (message.startsWith("undefined reference")) {
            return "Add a matching \\label or correct the reference key";
        }
        if (message.startsWith("unused label")) {
            return "Reference the label or remove it";
        }
        if (category == DiagnosticCategory.LINE_LENGTH) {
            return "Break the line or enable wrap_long_lines";
        }
        if (category == DiagnosticCategory.BRACE || category == DiagnosticCategory.COMMAND) {
            return "Review LaTeX syntax for this element";
        }
        return null;
    }

    private static boolean mentionsSpacing(String message) {
        return message.contains("spacing") || message.contains("spaces");
    }

    private static String lower(Diagnostic diagnostic) {
        return diagnostic.message() == null ? "" : diagnostic.message().toLowerCase(Locale.ROOT);
    }
}
