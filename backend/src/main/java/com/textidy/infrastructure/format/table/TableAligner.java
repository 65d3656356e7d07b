package com.textidy.infrastructure.format.table;

import com.textidy.domain.format.model.PlaceholderMap;
import com.textidy.domain.format.model.SymbolTable;
import com.textidy.domain.format.model.TableRow;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Aligns the {@code &} separators of tabular environments into columns.
 * <p>
 * A body line is a data row when its code part has an unescaped {@code &} outside braces. Each
 * column is padded to the widest cell of that column across the whole table, counting protected
 * text with the width it will have once restored. The last cell of a row is never padded, and
 * rules, comments and nested tables pass through unchanged.
 * </p>
 */
@Component
public class TableAligner {

    private static final Pattern MARKER = Pattern.compile("\\\\(begin|end)\\{([^}]+)\\}");

    public String align(String text, SymbolTable symbols, PlaceholderMap placeholders) {
        List<String> lines = new ArrayList<>(LatexText.lines(text));
        boolean changed = false;

        for (int i = 0; i < lines.size(); i++) {
            String environment = openedTable(lines.get(i), symbols);
            if (environment == null) {
                continue;
            }
            int end = findEnd(lines, i, environment);
            if (end < 0) {
                continue;
            }
            changed |= alignBody(lines, i + 1, end, symbols, placeholders);
        }
        return changed ? String.join("\n", lines) : text;
    }

    /**
     * Name of a tabular environment that this line opens and leaves open, or null.
     */
    private static String openedTable(String line, SymbolTable symbols) {
        String code = LatexText.codePart(line);
        Matcher matcher = MARKER.matcher(code);
        String open = null;
        int depth = 0;
        while (matcher.find()) {
            if (LatexText.isEscaped(code, matcher.start()) || !symbols.isTabularEnvironment(matcher.group(2))) {
                continue;
            }
            if (matcher.group(1).equals("begin")) {
                if (depth == 0) {
                    open = matcher.group(2);
                }
                depth++;
            } else if (depth > 0) {
                depth--;
            }
        }
        return depth > 0 ? open : null;
    }

    private static int findEnd(List<String> lines, int beginLine, String environment) {
        int depth = 1;
        for (int j = beginLine + 1; j < lines.size(); j++) {
            String code = LatexText.codePart(lines.get(j));
            Matcher matcher = MARKER.matcher(code);
            while (matcher.find()) {
                if (!matcher.group(2).equals(environment) || LatexText.isEscaped(code, matcher.start())) {
                    continue;
                }
                depth += matcher.group(1).equals("begin") ? 1 : -1;
                if (depth == 0) {
                    return j;
                }
            }
        }
        return -1;
    }

    private boolean alignBody(List<String> lines, int from, int to, SymbolTable symbols, PlaceholderMap placeholders) {
        // Rows of a nested table pass through untouched
        List<TableRow> rows = new ArrayList<>();
        int nested = 0;
        for (int j = from; j < to; j++) {
            String line = lines.get(j);
            int change = nestingChange(line, symbols);
            if (nested > 0 || change != 0) {
                rows.add(TableRow.passthrough(line));
            } else {
                rows.add(parseRow(line));
            }
            nested = Math.max(0, nested + change);
        }

        // Pad every cell to its column width
        int[] widths = columnWidths(rows, placeholders);
        boolean changed = false;
        for (int k = 0; k < rows.size(); k++) {
            TableRow row = rows.get(k);
            if (row.isPassthrough()) {
                continue;
            }
            String formatted = render(row, widths, placeholders);
            if (!formatted.equals(row.raw())) {
                lines.set(from + k, formatted);
                changed = true;
            }
        }
        return changed;
    }

    TableRow parseRow(String line) {
        int commentStart = LatexText.commentStart(line);
        String code = commentStart < 0 ? line : line.substring(0, commentStart);
        String comment = commentStart < 0 ? "" : line.substring(commentStart);

        List<String> cells = splitCells(code);
        if (cells.size() < 2) {
            return TableRow.passthrough(line);
        }

        String last = cells.get(cells.size() - 1);
        String terminator = "";
        int breakAt = rowBreak(last);
        if (breakAt >= 0) {
            terminator = last.substring(breakAt).strip();
            last = last.substring(0, breakAt);
        }
        cells.set(cells.size() - 1, last);

        List<String> trimmed = cells.stream().map(String::strip).toList();
        return TableRow.data(line, LatexText.leadingWhitespace(code), trimmed, terminator, comment.strip());
    }

    private static List<String> splitCells(String code) {
        List<String> cells = new ArrayList<>();
        int depth = 0;
        int cellStart = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '&' && depth == 0) {
                cells.add(code.substring(cellStart, i));
                cellStart = i + 1;
            }
        }
        cells.add(code.substring(cellStart));
        return cells;
    }

    /**
     * Offset of the row break {@code \\} at brace depth 0, or -1.
     */
    private static int rowBreak(String cell) {
        int depth = 0;
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (c == '\\') {
                if (depth == 0 && i + 1 < cell.length() && cell.charAt(i + 1) == '\\') {
                    return i;
                }
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            }
        }
        return -1;
    }

    private static int[] columnWidths(List<TableRow> rows, PlaceholderMap placeholders) {
        int columns = rows.stream().mapToInt(r -> r.cells().size()).max().orElse(0);
        int[] widths = new int[columns];
        for (TableRow row : rows) {
            for (int c = 0; c < row.cells().size(); c++) {
                widths[c] = Math.max(widths[c], placeholders.displayWidth(row.cells().get(c)));
            }
        }
        return widths;
    }

    private static String render(TableRow row, int[] widths, PlaceholderMap placeholders) {
        StringBuilder sb = new StringBuilder(row.indent());
        List<String> cells = row.cells();
        for (int c = 0; c < cells.size(); c++) {
            String cell = cells.get(c);
            if (c > 0) {
                sb.append(" & ");
            }
            sb.append(cell);
            if (c < cells.size() - 1) {
                sb.append(" ".repeat(Math.max(0, widths[c] - placeholders.displayWidth(cell))));
            }
        }

        String line = LatexText.stripTrailing(sb.toString());
        if (!row.terminator().isEmpty()) {
            line += " " + row.terminator();
        }
        if (!row.comment().isEmpty()) {
            line += " " + row.comment();
        }
        return line;
    }

    private static int nestingChange(String line, SymbolTable symbols) {
        String code = LatexText.codePart(line);
        Matcher matcher = MARKER.matcher(code);
        int change = 0;
        while (matcher.find()) {
            if (symbols.isTabularEnvironment(matcher.group(2)) && !LatexText.isEscaped(code, matcher.start())) {
                change += matcher.group(1).equals("begin") ? 1 : -1;
            }
        }
        return change;
    }
}
