package com.textidy.domain.format.model;

import java.util.List;

/**
 * A line inside a tabular body. Passthrough rows (rules, comments, blank lines) carry only the
 * raw line; data rows are split into cells with the row terminator and comment detached.
 *
 * @param raw        the line as it was read
 * @param indent     leading whitespace of a data row
 * @param cells      trimmed cells, empty for passthrough rows
 * @param terminator trailing {@code \\} token (with its optional spacing argument), or empty
 * @param comment    trailing comment including its {@code %}, or empty
 */
public record TableRow(
        String raw,
        String indent,
        List<String> cells,
        String terminator,
        String comment
) {

    public static TableRow passthrough(String raw) {
        return new TableRow(raw, "", List.of(), "", "");
    }

    public static TableRow data(String raw, String indent, List<String> cells, String terminator, String comment) {
        return new TableRow(raw, indent, List.copyOf(cells), terminator, comment);
    }

    public boolean isPassthrough() {
        return cells.isEmpty();
    }
}
