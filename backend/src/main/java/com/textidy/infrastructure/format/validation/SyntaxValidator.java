package com.textidy.infrastructure.format.validation;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.domain.format.model.EnvironmentFrame;
import com.textidy.domain.format.model.SymbolTable;
import com.textidy.infrastructure.format.protection.PatternStore;
import com.textidy.infrastructure.format.text.LatexText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Checks brace balance and environment nesting.
 * <p>
 * Verbatim-style blocks, {@code \verb} spans and comments are blanked out first, keeping every
 * newline so reported line numbers match the input. Diagnostics come back in a fixed order:
 * brace problems first, then environment problems, each in source order.
 * </p>
 */
@Slf4j
@Component
public class SyntaxValidator {

    public static final String SOURCE = "syntax";

    private static final Pattern BEGIN_PATTERN = Pattern.compile("\\\\begin\\s*\\{\\s*([^}]+?)\\s*\\}");
    private static final Pattern END_PATTERN = Pattern.compile("\\\\end\\s*\\{\\s*([^}]+?)\\s*\\}");
    private static final Pattern INLINE_VERB = Pattern.compile("\\\\verb\\*?([^\\sa-zA-Z*])[^\\n]*?\\1");

    private final Pattern verbatimBlock;

    public SyntaxValidator(PatternStore patternStore) {
        SymbolTable symbols = patternStore.symbolTable();
        String names = symbols.verbatimEnvironments().stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        this.verbatimBlock = Pattern.compile("\\\\begin\\{(" + names + ")\\}.*?\\\\end\\{\\1\\}", Pattern.DOTALL);
    }

    /**
     * Validate {@code text}. An empty list means the document is well formed.
     */
    public List<Diagnostic> check(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String content = prepare(text);
        List<Diagnostic> diagnostics = new ArrayList<>();
        checkBraces(content, diagnostics);
        checkEnvironments(content, diagnostics);

        if (!diagnostics.isEmpty()) {
            log.debug("Syntax check found {} issues", diagnostics.size());
        }
        return diagnostics;
    }

    /**
     * Plain messages, in the same order as {@link #check(String)}.
     */
    public List<String> messages(String text) {
        return check(text).stream().map(Diagnostic::message).toList();
    }

    String prepare(String text) {
        StringBuilder sb = new StringBuilder(text);
        blank(sb, verbatimBlock.matcher(text));
        blank(sb, INLINE_VERB.matcher(sb.toString()));

        int lineStart = 0;
        while (lineStart <= sb.length()) {
            int lineEnd = sb.indexOf("\n", lineStart);
            if (lineEnd < 0) {
                lineEnd = sb.length();
            }
            String line = sb.substring(lineStart, lineEnd);
            int comment = LatexText.commentStart(line);
            if (comment >= 0) {
                for (int i = lineStart + comment; i < lineEnd; i++) {
                    sb.setCharAt(i, ' ');
                }
            }
            lineStart = lineEnd + 1;
        }
        return sb.toString();
    }

    private static void blank(StringBuilder sb, Matcher matcher) {
        while (matcher.find()) {
            for (int i = matcher.start(); i < matcher.end(); i++) {
                if (sb.charAt(i) != '\n') {
                    sb.setCharAt(i, ' ');
                }
            }
        }
    }

    private void checkBraces(String content, List<Diagnostic> diagnostics) {
        Deque<Integer> open = new ArrayDeque<>();
        boolean closerReported = false;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                open.push(i);
            } else if (c == '}') {
                if (!open.isEmpty()) {
                    open.pop();
                } else if (!closerReported) {
                    diagnostics.add(Diagnostic.at(DiagnosticCategory.BRACE, SOURCE,
                            "Unmatched closing braces: 1", LatexText.lineOf(content, i)));
                    closerReported = true;
                }
            }
        }

        if (!open.isEmpty()) {
            diagnostics.add(Diagnostic.at(DiagnosticCategory.BRACE, SOURCE,
                    "Unmatched opening braces: " + open.size(), LatexText.lineOf(content, open.peekLast())));
        }
    }

    private void checkEnvironments(String content, List<Diagnostic> diagnostics) {
        List<Marker> markers = collectMarkers(content);

        long documentBegins = markers.stream()
                .filter(m -> m.begin() && m.name().equals("document"))
                .count();
        if (documentBegins > 1) {
            diagnostics.add(Diagnostic.of(DiagnosticCategory.ENVIRONMENT, SOURCE,
                    "Multiple \\begin{document} environments found - only one is allowed"));
        }

        // Match ends against open environments in document order
        Deque<EnvironmentFrame> stack = new ArrayDeque<>();
        for (Marker marker : markers) {
            if (marker.begin()) {
                stack.push(new EnvironmentFrame(marker.name(), marker.line()));
                continue;
            }

            if (stack.isEmpty()) {
                diagnostics.add(unmatchedEnd(marker));
            } else if (stack.peek().name().equals(marker.name())) {
                stack.pop();
            } else {
                diagnostics.add(Diagnostic.at(DiagnosticCategory.ENVIRONMENT, SOURCE,
                        "Environment mismatch: expected \\end{" + stack.peek().name()
                                + "}, found \\end{" + marker.name() + "}", marker.line()));
                if (containsName(stack, marker.name())) {
                    // Close the intermediate environments left open
                    while (!stack.peek().name().equals(marker.name())) {
                        EnvironmentFrame dropped = stack.pop();
                        diagnostics.add(Diagnostic.at(DiagnosticCategory.ENVIRONMENT, SOURCE,
                                "Unmatched \\begin{" + dropped.name() + "}", dropped.line()));
                    }
                    stack.pop();
                } else {
                    diagnostics.add(unmatchedEnd(marker));
                }
            }
        }

        // Whatever is still open was never closed, outermost first
        Iterator<EnvironmentFrame> bottomUp = stack.descendingIterator();
        while (bottomUp.hasNext()) {
            EnvironmentFrame frame = bottomUp.next();
            diagnostics.add(Diagnostic.at(DiagnosticCategory.ENVIRONMENT, SOURCE,
                    "Unmatched environment \\begin{" + frame.name() + "} - missing \\end{" + frame.name() + "}",
                    frame.line()));
        }
    }

    private static Diagnostic unmatchedEnd(Marker marker) {
        return Diagnostic.at(DiagnosticCategory.ENVIRONMENT, SOURCE,
                "Unmatched \\end{" + marker.name() + "} - no corresponding \\begin", marker.line());
    }

    private static boolean containsName(Deque<EnvironmentFrame> stack, String name) {
        return stack.stream().anyMatch(frame -> frame.name().equals(name));
    }

    private static List<Marker> collectMarkers(String content) {
        List<Marker> markers = new ArrayList<>();
        addMarkers(content, BEGIN_PATTERN.matcher(content), true, markers);
        addMarkers(content, END_PATTERN.matcher(content), false, markers);
        markers.sort((a, b) -> Integer.compare(a.offset(), b.offset()));
        return markers;
    }

    private static void addMarkers(String content, Matcher matcher, boolean begin, List<Marker> markers) {
        while (matcher.find()) {
            if (LatexText.isEscaped(content, matcher.start())) {
                continue;
            }
            markers.add(new Marker(matcher.start(), begin, matcher.group(1), LatexText.lineOf(content, matcher.start())));
        }
    }

    private record Marker(int offset, boolean begin, String name, int line) {}
}
