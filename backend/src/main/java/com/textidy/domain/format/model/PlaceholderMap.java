package com.textidy.domain.format.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Token to original-text mapping produced by content protection.
 * <p>
 * A token is {@code open + index digits + close}. The two sentinels are private-use characters
 * chosen so that they do not occur in the protected document, and the index digits are
 * private-use characters too, so a token contains no ASCII at all and can never be matched by
 * the ASCII-based rewrite rules of the pipeline.
 * </p>
 */
public final class PlaceholderMap {

    private static final char DIGIT_BASE = '\uF000';

    private static final PlaceholderMap EMPTY = new PlaceholderMap('\uE000', '\uE001', Map.of());

    private final char open;
    private final char close;
    private final Map<String, String> entries;

    private PlaceholderMap(char open, char close, Map<String, String> entries) {
        this.open = open;
        this.close = close;
        this.entries = entries;
    }

    public static PlaceholderMap empty() {
        return EMPTY;
    }

    public static Builder builder(char open, char close) {
        if (open == close) {
            throw new IllegalArgumentException("Placeholder sentinels must differ");
        }
        return new Builder(open, close);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public String originalOf(String token) {
        return entries.get(token);
    }

    /**
     * Tokens in the order they were minted.
     */
    public Set<String> tokens() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    /**
     * Replace every known token in {@code text} by its original.
     *
     * @param text     text that may contain tokens
     * @param restored receives each token that was found, may be null
     * @return the expanded text
     */
    public String expand(String text, Set<String> restored) {
        if (entries.isEmpty() || text.indexOf(open) < 0) {
            return text;
        }

        StringBuilder sb = new StringBuilder(text.length() + 64);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == open) {
                int end = text.indexOf(close, i + 1);
                if (end > i) {
                    String token = text.substring(i, end + 1);
                    String original = entries.get(token);
                    if (original != null) {
                        sb.append(original);
                        if (restored != null) {
                            restored.add(token);
                        }
                        i = end + 1;
                        continue;
                    }
                }
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    public String expand(String text) {
        return expand(text, null);
    }

    /**
     * Width of {@code fragment} once its tokens are restored, in code points.
     */
    public int displayWidth(String fragment) {
        String expanded = expand(fragment);
        return expanded.codePointCount(0, expanded.length());
    }

    /**
     * True if {@code fragment} holds a token whose original runs over more than one line.
     */
    public boolean spansLines(String fragment) {
        return fragment.indexOf(open) >= 0 && expand(fragment).indexOf('\n') >= 0;
    }

    public static final class Builder {

        private final char open;
        private final char close;
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder(char open, char close) {
            this.open = open;
            this.close = close;
        }

        /**
         * Register {@code original} and return the fresh token that stands for it.
         */
        public String mint(String original) {
            String index = Integer.toString(entries.size());
            StringBuilder token = new StringBuilder(index.length() + 2).append(open);
            for (int i = 0; i < index.length(); i++) {
                token.append((char) (DIGIT_BASE + (index.charAt(i) - '0')));
            }
            token.append(close);
            String key = token.toString();
            entries.put(key, original);
            return key;
        }

        /**
         * True if the range touches a token minted by this builder.
         */
        public boolean overlapsToken(CharSequence text, int start, int end) {
            for (int i = start; i < end; i++) {
                char c = text.charAt(i);
                if (c == open || c == close || (c >= DIGIT_BASE && c <= DIGIT_BASE + 9)) {
                    return true;
                }
            }
            return false;
        }

        public PlaceholderMap build() {
            return new PlaceholderMap(open, close, new LinkedHashMap<>(entries));
        }
    }
}
