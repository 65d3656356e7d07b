package com.textidy.infrastructure.format.text;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small lexical helpers shared by the stages, the validator and the scanners.
 */
public final class LatexText {

    private static final Pattern DOCUMENT_CLASS = Pattern.compile("\\\\documentclass[^{\\n]*\\{\\s*([^}]+?)\\s*\\}");

    private LatexText() {
    }

    /**
     * Name of the declared document class, or null. Comments are ignored.
     */
    public static String documentClass(String text) {
        Matcher matcher = DOCUMENT_CLASS.matcher(stripComments(text));
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * True if the character at {@code index} is preceded by an odd number of backslashes.
     */
    public static boolean isEscaped(CharSequence text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    /**
     * Index of the first unescaped {@code %} in a line, or -1.
     */
    public static int commentStart(String line) {
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == '%' && !isEscaped(line, i)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The part of a line before its comment.
     */
    public static String codePart(String line) {
        int pos = commentStart(line);
        return pos < 0 ? line : line.substring(0, pos);
    }

    /**
     * The text with every line cut at its comment. Line count is unchanged.
     */
    public static String stripComments(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        List<String> lines = lines(text);
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(codePart(lines.get(i)));
        }
        return sb.toString();
    }

    public static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    public static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == ' ' || line.charAt(end - 1) == '\t')) {
            end--;
        }
        return line.substring(0, end);
    }

    public static boolean isBlank(String line) {
        return line.isBlank();
    }

    /**
     * Split on {@code \n}, keeping trailing empty lines.
     */
    public static List<String> lines(String text) {
        return List.of(text.split("\n", -1));
    }

    /**
     * 1-based line number of a character offset.
     */
    public static int lineOf(CharSequence text, int offset) {
        int line = 1;
        int end = Math.min(offset, text.length());
        for (int i = 0; i < end; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Offset just past the brace group opening at {@code open}, or -1 if it never closes.
     * Escaped braces do not count.
     */
    public static int matchingBrace(CharSequence text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }
}
