package com.textidy.domain.format.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable flat option map. Keys not known to the formatter are kept as-is; values of the
 * wrong type are ignored per key and the built-in default applies.
 */
public final class FormatterConfig {

    public static final String LINE_LENGTH = "line_length";
    public static final String INDENT_SIZE = "indent_size";
    public static final String INDENT_DOCUMENT_BODY = "indent_document_body";
    public static final String REMOVE_TRAILING_WHITESPACE = "remove_trailing_whitespace";
    public static final String COMPRESS_EMPTY_LINES = "compress_empty_lines";
    public static final String MAX_EMPTY_LINES = "max_empty_lines";
    public static final String NORMALIZE_COMMANDS = "normalize_commands";
    public static final String FORMAT_BIBLIOGRAPHY = "format_bibliography";
    public static final String NORMALIZE_CITATIONS = "normalize_citations";
    public static final String FORMAT_BIBITEM_ENTRIES = "format_bibitem_entries";
    public static final String ADD_BIBLIOGRAPHY_SPACING = "add_bibliography_spacing";
    public static final String FORMAT_CROSSREFERENCES = "format_crossreferences";
    public static final String NORMALIZE_REF_SPACING = "normalize_ref_spacing";
    public static final String VALIDATE_CROSSREFERENCES = "validate_crossreferences";
    public static final String FIX_SPACING = "fix_spacing";
    public static final String ALIGN_ENVIRONMENTS = "align_environments";
    public static final String FIX_MATH_SPACING = "fix_math_spacing";
    public static final String SORT_PACKAGES = "sort_packages";
    public static final String NORMALIZE_QUOTES = "normalize_quotes";
    public static final String ALIGN_AMPERSANDS = "align_ampersands";
    public static final String ENSURE_FINAL_NEWLINE = "ensure_final_newline";
    public static final String ACADEMIC_PAPER = "academic_paper";
    public static final String BOOK_FORMATTING = "book_formatting";
    public static final String BEAMER_PRESENTATION = "beamer_presentation";
    public static final String WRAP_LONG_LINES = "wrap_long_lines";
    public static final String ALIGN_COMMENTS = "align_comments";
    public static final String COMMENT_COLUMN = "comment_column";
    public static final String SUGGEST_IMPROVEMENTS = "suggest_improvements";

    private static final Map<String, Object> DEFAULTS = defaultValues();

    private static final FormatterConfig DEFAULT = new FormatterConfig(DEFAULTS);

    private final Map<String, Object> values;

    private FormatterConfig(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static FormatterConfig defaults() {
        return DEFAULT;
    }

    /**
     * A copy of this config with {@code overrides} laid over it. Null values are skipped.
     */
    public FormatterConfig withOverrides(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        overrides.forEach((key, value) -> {
            if (key != null && value != null) {
                merged.put(key, value);
            }
        });
        return new FormatterConfig(merged);
    }

    public boolean flag(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return DEFAULTS.get(key) instanceof Boolean b && b;
    }

    public int integer(String key) {
        Object value = values.get(key);
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).intValue();
        }
        return DEFAULTS.get(key) instanceof Integer i ? i : 0;
    }

    public Object value(String key) {
        return values.get(key);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static Map<String, Object> defaultValues() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(LINE_LENGTH, 80);
        map.put(INDENT_SIZE, 2);
        map.put(INDENT_DOCUMENT_BODY, true);
        map.put(REMOVE_TRAILING_WHITESPACE, true);
        map.put(COMPRESS_EMPTY_LINES, true);
        map.put(MAX_EMPTY_LINES, 2);
        map.put(NORMALIZE_COMMANDS, true);
        map.put(FORMAT_BIBLIOGRAPHY, true);
        map.put(NORMALIZE_CITATIONS, true);
        map.put(FORMAT_BIBITEM_ENTRIES, true);
        map.put(ADD_BIBLIOGRAPHY_SPACING, true);
        map.put(FORMAT_CROSSREFERENCES, true);
        map.put(NORMALIZE_REF_SPACING, true);
        map.put(VALIDATE_CROSSREFERENCES, true);
        map.put(FIX_SPACING, true);
        map.put(ALIGN_ENVIRONMENTS, true);
        map.put(FIX_MATH_SPACING, true);
        map.put(SORT_PACKAGES, true);
        map.put(NORMALIZE_QUOTES, true);
        map.put(ALIGN_AMPERSANDS, true);
        map.put(ENSURE_FINAL_NEWLINE, true);
        map.put(ACADEMIC_PAPER, false);
        map.put(BOOK_FORMATTING, false);
        map.put(BEAMER_PRESENTATION, false);
        map.put(WRAP_LONG_LINES, false);
        map.put(ALIGN_COMMENTS, false);
        map.put(COMMENT_COLUMN, 50);
        map.put(SUGGEST_IMPROVEMENTS, false);
        return map;
    }

    @Override
    public String toString() {
        return "FormatterConfig" + values;
    }
}
