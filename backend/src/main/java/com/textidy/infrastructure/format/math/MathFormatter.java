package com.textidy.infrastructure.format.math;

import com.textidy.domain.format.model.SymbolTable;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes spacing inside math regions.
 * <p>
 * Outside braces, {@code = + -} and the relations {@code <= >= != :=} get one space on each side
 * and blank runs collapse. Everything inside {@code {...}} is copied as-is, except that blanks
 * around {@code ^} and {@code _} are removed everywhere. Constructs such as {@code \frac} and
 * {@code \sum} lose the blanks between the command and its arguments.
 * </p>
 */
@Component
public class MathFormatter {

    // Blanks before a script marker, only when something other than indentation precedes them
    private static final Pattern BLANKS_BEFORE_SCRIPT = Pattern.compile("(?<=[^\\s\\\\])[ \\t]+(?=[_^])");
    private static final Pattern BLANKS_AFTER_SCRIPT = Pattern.compile("(?<!\\\\)([_^])[ \\t]+");

    private static final String[] RELATIONS = {"<=", ">=", "!=", ":="};

    /**
     * A preceding character after which {@code +} or {@code -} is a sign and left unspaced.
     */
    private static final String UNARY_CONTEXT = "([{=,&+-^_<>;|";

    private static final String SCRIPT_MARKERS = "^_";

    public String format(String text, SymbolTable symbols) {
        List<MathSpan> spans = new MathSpanScanner(symbols).scan(text);
        if (spans.isEmpty()) {
            return text;
        }

        Set<String> constructs = symbols.constructNames();
        StringBuilder out = new StringBuilder(text.length() + 32);
        int last = 0;

        for (MathSpan span : spans) {
            out.append(text, last, span.start());
            if (span.dollarDelimited() && endsWithLetter(out)) {
                out.append(' ');
            }

            String body = text.substring(span.bodyStart(), span.bodyEnd());
            out.append(text, span.start(), span.bodyStart())
                    .append(formatBody(body, constructs))
                    .append(text, span.bodyEnd(), span.end());

            if (span.dollarDelimited() && span.end() < text.length() && Character.isLetter(text.charAt(span.end()))) {
                out.append(' ');
            }
            last = span.end();
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    String formatBody(String body, Set<String> constructs) {
        String collapsed = BLANKS_BEFORE_SCRIPT.matcher(body).replaceAll("");
        collapsed = BLANKS_AFTER_SCRIPT.matcher(collapsed).replaceAll("$1");
        String spaced = spaceOperators(collapsed, constructs);

        if (spaced.indexOf('\n') < 0) {
            return spaced.strip();
        }
        int firstBreak = spaced.indexOf('\n');
        String head = spaced.substring(0, firstBreak).stripLeading();
        return head + spaced.substring(firstBreak);
    }

    private String spaceOperators(String body, Set<String> constructs) {
        StringBuilder out = new StringBuilder(body.length() + 16);
        int n = body.length();
        int i = 0;

        while (i < n) {
            char c = body.charAt(i);

            // Control sequence; constructs also pull in their arguments
            if (c == '\\') {
                int j = commandEnd(body, i);
                String command = body.substring(i, j);
                out.append(command);
                i = j;
                if (command.length() > 1 && constructs.contains(command.substring(1))) {
                    i = appendConstructArguments(body, i, out);
                }
                continue;
            }

            // Braced group, copied as-is
            if (c == '{') {
                int end = LatexText.matchingBrace(body, i);
                if (end < 0) {
                    out.append(body, i, n);
                    break;
                }
                out.append(body, i, end);
                i = end;
                continue;
            }

            // Comment runs to end of line
            if (c == '%') {
                int eol = body.indexOf('\n', i);
                int end = eol < 0 ? n : eol;
                out.append(body, i, end);
                i = end;
                continue;
            }

            // Line break: drop trailing blanks, keep the next line's indentation
            if (c == '\n') {
                stripTrailingBlanks(out);
                out.append('\n');
                i++;
                while (i < n && isBlank(body.charAt(i))) {
                    out.append(body.charAt(i));
                    i++;
                }
                continue;
            }

            // Blank run collapses to one space, or to nothing at the end of a line
            if (isBlank(c)) {
                int runEnd = skipBlanks(body, i);
                boolean lineEnds = runEnd >= n || body.charAt(runEnd) == '\n';
                if (!lineEnds && out.length() > 0 && !isBlank(out.charAt(out.length() - 1))) {
                    out.append(' ');
                }
                i = runEnd;
                continue;
            }

            String operator = operatorAt(body, i);
            if (operator != null) {
                i += operator.length();
                if (isUnary(out, operator)) {
                    out.append(operator);
                    continue;
                }
                int previous = lastNonBlank(out);
                if (previous >= 0 && out.charAt(previous) == '&' && !LatexText.isEscaped(out, previous)) {
                    // Alignment point: the operator sticks to its '&', as in "a &= b"
                    out.setLength(previous);
                    if (!atLineStart(out)) {
                        stripTrailingBlanks(out);
                        out.append(' ');
                    }
                    out.append('&').append(operator);
                } else if (atLineStart(out)) {
                    // Continuation line: keep its indentation
                    out.append(operator);
                } else {
                    stripTrailingBlanks(out);
                    out.append(' ').append(operator);
                }
                int next = skipBlanks(body, i);
                if (next < n && body.charAt(next) != '\n') {
                    out.append(' ');
                }
                i = next;
                continue;
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int appendConstructArguments(String body, int from, StringBuilder out) {
        int pos = from;
        while (true) {
            int j = skipBlanks(body, pos);
            if (j >= body.length()) {
                return pos;
            }
            char c = body.charAt(j);
            if (c == '{') {
                int end = LatexText.matchingBrace(body, j);
                if (end < 0) {
                    return pos;
                }
                out.append(body, j, end);
                pos = end;
            } else if (c == '_' || c == '^') {
                out.append(c);
                int arg = skipBlanks(body, j + 1);
                if (arg >= body.length()) {
                    return arg;
                }
                int argEnd;
                if (body.charAt(arg) == '{') {
                    argEnd = LatexText.matchingBrace(body, arg);
                    if (argEnd < 0) {
                        return arg;
                    }
                } else if (body.charAt(arg) == '\\') {
                    argEnd = commandEnd(body, arg);
                } else {
                    argEnd = arg + 1;
                }
                out.append(body, arg, argEnd);
                pos = argEnd;
            } else {
                return pos;
            }
        }
    }

    private static String operatorAt(String body, int i) {
        for (String relation : RELATIONS) {
            if (body.startsWith(relation, i)) {
                return relation;
            }
        }
        char c = body.charAt(i);
        return c == '=' || c == '+' || c == '-' ? String.valueOf(c) : null;
    }

    /**
     * True when {@code operator} is left unspaced: a sign at the start of a line or after an
     * opening delimiter or another operator, or any operator right after a script marker.
     */
    private static boolean isUnary(StringBuilder out, String operator) {
        boolean sign = operator.equals("+") || operator.equals("-");
        int k = lastNonBlank(out);
        if (k < 0 || out.charAt(k) == '\n') {
            return sign;
        }
        if (LatexText.isEscaped(out, k)) {
            return false;
        }
        char c = out.charAt(k);
        return sign ? UNARY_CONTEXT.indexOf(c) >= 0 : SCRIPT_MARKERS.indexOf(c) >= 0;
    }

    /**
     * Offset of the last output character that is not a blank, stopping at a newline; -1 when
     * there is none.
     */
    private static int lastNonBlank(CharSequence out) {
        for (int k = out.length() - 1; k >= 0; k--) {
            char c = out.charAt(k);
            if (c == '\n' || !isBlank(c)) {
                return k;
            }
        }
        return -1;
    }

    private static boolean atLineStart(CharSequence out) {
        int k = lastNonBlank(out);
        return k < 0 || out.charAt(k) == '\n';
    }

    /**
     * End offset of the control sequence starting at {@code start}: a run of letters, or a
     * single character.
     */
    private static int commandEnd(String body, int start) {
        int j = start + 1;
        if (j < body.length() && Character.isLetter(body.charAt(j))) {
            while (j < body.length() && Character.isLetter(body.charAt(j))) {
                j++;
            }
            return j;
        }
        return Math.min(j + 1, body.length());
    }

    private static int skipBlanks(String body, int from) {
        int j = from;
        while (j < body.length() && isBlank(body.charAt(j))) {
            j++;
        }
        return j;
    }

    private static void stripTrailingBlanks(StringBuilder out) {
        int end = out.length();
        while (end > 0 && isBlank(out.charAt(end - 1)) && !LatexText.isEscaped(out, end - 1)) {
            end--;
        }
        out.setLength(end);
    }

    private static boolean endsWithLetter(CharSequence out) {
        return out.length() > 0 && Character.isLetter(out.charAt(out.length() - 1));
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }
}
