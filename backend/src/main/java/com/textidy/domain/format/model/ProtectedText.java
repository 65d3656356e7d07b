package com.textidy.domain.format.model;

/**
 * Result of protecting a document: the rewritten text plus the placeholders needed to undo it.
 */
public record ProtectedText(String text, PlaceholderMap placeholders) {}
