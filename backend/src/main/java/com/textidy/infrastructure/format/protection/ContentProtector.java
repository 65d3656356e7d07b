package com.textidy.infrastructure.format.protection;

import com.textidy.domain.format.model.PlaceholderMap;
import com.textidy.domain.format.model.ProtectedText;
import com.textidy.domain.format.model.ProtectionPattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Replaces protected substrings with opaque placeholder tokens before formatting,
 * and restores them afterwards.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContentProtector {

    private static final char SENTINEL_FIRST = '\uE000';
    private static final char SENTINEL_LAST = '\uEFFF';

    private final PatternStore patternStore;

    /**
     * Replace every protected substring of {@code text} with a fresh token.
     * Patterns are applied in priority order; a match that would overlap an existing token is
     * left alone, so the first pattern to claim a region wins.
     *
     * @param text the document text
     * @return the protected text and the token map needed to undo it
     */
    public ProtectedText protect(String text) {
        if (text == null || text.isEmpty()) {
            return new ProtectedText(text, PlaceholderMap.empty());
        }

        char[] sentinels = pickSentinels(text);
        PlaceholderMap.Builder placeholders = PlaceholderMap.builder(sentinels[0], sentinels[1]);
        String current = text;

        for (ProtectionPattern pattern : patternStore.patterns()) {
            List<int[]> matches = findMatches(current, pattern, placeholders);
            if (matches.isEmpty()) {
                continue;
            }

            StringBuilder sb = new StringBuilder(current);
            for (int i = matches.size() - 1; i >= 0; i--) {
                int[] range = matches.get(i);
                String token = placeholders.mint(current.substring(range[0], range[1]));
                sb.replace(range[0], range[1], token);
            }
            current = sb.toString();
        }

        PlaceholderMap map = placeholders.build();
        if (!map.isEmpty()) {
            log.debug("Protected {} spans", map.size());
        }
        return new ProtectedText(current, map);
    }

    /**
     * Put the original substrings back.
     *
     * @param text         formatted text containing tokens
     * @param placeholders the map returned by {@link #protect(String)}
     * @return restored text and the tokens that could not be found
     */
    public RestoreResult restore(String text, PlaceholderMap placeholders) {
        if (text == null || placeholders == null || placeholders.isEmpty()) {
            return new RestoreResult(text, List.of());
        }

        Set<String> restored = new HashSet<>();
        String result = placeholders.expand(text, restored);

        List<String> missing = new ArrayList<>();
        for (String token : placeholders.tokens()) {
            if (!restored.contains(token)) {
                log.warn("Placeholder missing from formatted text, original='{}'", placeholders.originalOf(token));
                missing.add(placeholders.originalOf(token));
            }
        }
        return new RestoreResult(result, missing);
    }

    private List<int[]> findMatches(String text, ProtectionPattern pattern, PlaceholderMap.Builder placeholders) {
        List<int[]> matches = new ArrayList<>();
        try {
            Matcher matcher = pattern.pattern().matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                if (start == end || placeholders.overlapsToken(text, start, end)) {
                    continue;
                }
                matches.add(new int[]{start, end});
            }
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Protection pattern '{}' ({}) failed, skipping: {}",
                    pattern.pattern().pattern(), pattern.category(), e.toString());
            return List.of();
        }
        return matches;
    }

    private static char[] pickSentinels(String text) {
        char[] picked = new char[2];
        int found = 0;
        for (char c = SENTINEL_FIRST; c <= SENTINEL_LAST && found < 2; c++) {
            if (text.indexOf(c) < 0) {
                picked[found++] = c;
            }
        }
        if (found < 2) {
            throw new IllegalStateException("No free private-use sentinel characters in input");
        }
        return picked;
    }

    /**
     * Result of restoring placeholders.
     *
     * @param text          the restored text
     * @param missingTokens original substrings whose tokens were not found in the formatted text
     */
    public record RestoreResult(String text, List<String> missingTokens) {

        public boolean complete() {
            return missingTokens.isEmpty();
        }
    }
}
