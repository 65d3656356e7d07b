package com.textidy.infrastructure.format.math;

import com.textidy.domain.format.model.SymbolTable;
import com.textidy.infrastructure.format.text.LatexText;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds math regions in a document in one left-to-right pass.
 * Escaped dollars and comments are skipped. A region whose closing delimiter is missing is not
 * reported, and scanning resumes after its opening delimiter.
 */
public final class MathSpanScanner {

    private static final Pattern BEGIN = Pattern.compile("\\\\begin\\{([^}]+)\\}");

    private final SymbolTable symbols;

    public MathSpanScanner(SymbolTable symbols) {
        this.symbols = symbols;
    }

    public List<MathSpan> scan(String text) {
        List<MathSpan> spans = new ArrayList<>();
        Matcher begin = BEGIN.matcher(text);
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);

            if (c == '%') {
                int eol = text.indexOf('\n', i);
                i = eol < 0 ? text.length() : eol + 1;
                continue;
            }

            if (c == '$') {
                MathSpan span = text.startsWith("$$", i) ? displayDollar(text, i) : inlineDollar(text, i);
                if (span != null) {
                    spans.add(span);
                    i = span.end();
                } else {
                    i += text.startsWith("$$", i) ? 2 : 1;
                }
                continue;
            }

            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                MathSpan span = null;
                if (next == '(') {
                    span = delimited(text, i, "\\)", MathSpan.Kind.INLINE_PAREN);
                } else if (next == '[') {
                    span = delimited(text, i, "\\]", MathSpan.Kind.DISPLAY_BRACKET);
                } else if (text.startsWith("\\begin{", i) && begin.find(i) && begin.start() == i
                        && symbols.isMathEnvironment(begin.group(1))) {
                    span = environment(text, i, begin.end(), begin.group(1));
                }

                if (span != null) {
                    spans.add(span);
                    i = span.end();
                } else {
                    i += 2;
                }
                continue;
            }

            i++;
        }
        return spans;
    }

    private static MathSpan inlineDollar(String text, int open) {
        int close = findUnescaped(text, "$", open + 1);
        if (close < 0) {
            return null;
        }
        return new MathSpan(open, open + 1, close, close + 1, MathSpan.Kind.INLINE_DOLLAR);
    }

    private static MathSpan displayDollar(String text, int open) {
        int close = findUnescaped(text, "$$", open + 2);
        if (close < 0) {
            return null;
        }
        return new MathSpan(open, open + 2, close, close + 2, MathSpan.Kind.DISPLAY_DOLLAR);
    }

    private static MathSpan delimited(String text, int open, String closer, MathSpan.Kind kind) {
        int close = findUnescaped(text, closer, open + 2);
        if (close < 0) {
            return null;
        }
        return new MathSpan(open, open + 2, close, close + closer.length(), kind);
    }

    private static MathSpan environment(String text, int open, int bodyStart, String name) {
        String closer = "\\end{" + name + "}";
        int close = text.indexOf(closer, bodyStart);
        if (close < 0) {
            return null;
        }
        return new MathSpan(open, bodyStart, close, close + closer.length(), MathSpan.Kind.ENVIRONMENT);
    }

    /**
     * First unescaped occurrence of {@code delimiter} at or after {@code from}, skipping comments.
     */
    private static int findUnescaped(String text, String delimiter, int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                if (delimiter.charAt(0) == '\\' && text.startsWith(delimiter, i) && !LatexText.isEscaped(text, i)) {
                    return i;
                }
                i += 2;
                continue;
            }
            if (c == '%') {
                int eol = text.indexOf('\n', i);
                if (eol < 0) {
                    return -1;
                }
                i = eol + 1;
                continue;
            }
            if (text.startsWith(delimiter, i)) {
                return i;
            }
            i++;
        }
        return -1;
    }
}
