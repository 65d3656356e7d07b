package com.textidy.infrastructure.format.pipeline;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.PlaceholderMap;
import com.textidy.domain.format.model.SymbolTable;
import com.textidy.infrastructure.format.text.LatexText;

/**
 * Read-only inputs shared by all stages of one formatting call.
 *
 * @param config       effective options for this call
 * @param placeholders tokens minted by content protection, for display-width lookups
 * @param symbols      math and environment names
 */
public record StageContext(
        FormatterConfig config,
        PlaceholderMap placeholders,
        SymbolTable symbols
) {

    public boolean flag(String key) {
        return config.flag(key);
    }

    public int integer(String key) {
        return config.integer(key);
    }

    /**
     * 1-based line of {@code offset} in the unprotected document. Protected spans may contain
     * newlines that the stage cannot see.
     */
    public int sourceLine(String text, int offset) {
        String prefix = placeholders.expand(text.substring(0, Math.min(offset, text.length())));
        return LatexText.lineOf(prefix, prefix.length());
    }
}
