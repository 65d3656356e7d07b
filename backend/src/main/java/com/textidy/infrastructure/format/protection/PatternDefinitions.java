package com.textidy.infrastructure.format.protection;

import java.util.List;
import java.util.Map;

/**
 * Raw, not yet compiled pattern data as read from a pattern source.
 *
 * @param protection category -> regular expressions, in file order
 * @param symbols    symbol-table key -> names
 */
public record PatternDefinitions(
        Map<String, List<String>> protection,
        Map<String, List<String>> symbols
) {

    public static PatternDefinitions defaults() {
        return new PatternDefinitions(DefaultPatterns.PROTECTION, DefaultPatterns.SYMBOLS);
    }
}
