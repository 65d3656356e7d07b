package com.textidy.infrastructure.format.math;

/**
 * Location of one math region.
 *
 * @param start     offset of the opening delimiter
 * @param bodyStart offset just past the opening delimiter
 * @param bodyEnd   offset of the closing delimiter
 * @param end       offset just past the closing delimiter
 * @param kind      how the region is delimited
 */
public record MathSpan(int start, int bodyStart, int bodyEnd, int end, Kind kind) {

    public enum Kind {
        INLINE_DOLLAR,
        DISPLAY_DOLLAR,
        INLINE_PAREN,
        DISPLAY_BRACKET,
        ENVIRONMENT
    }

    public boolean dollarDelimited() {
        return kind == Kind.INLINE_DOLLAR || kind == Kind.DISPLAY_DOLLAR;
    }
}
