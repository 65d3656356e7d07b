package com.textidy.domain.format.model;

import java.util.regex.Pattern;

/**
 * A compiled protection rule. Rules are evaluated in ascending priority order.
 *
 * @param category the pattern-file category this rule came from
 * @param priority evaluation order, lower runs first (most specific first)
 * @param pattern  the compiled matcher
 */
public record ProtectionPattern(
        String category,
        int priority,
        Pattern pattern
) {}
