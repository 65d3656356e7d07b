package com.textidy.domain.format.model;

/**
 * One open environment awaiting its {@code \end}.
 *
 * @param name environment name as written in {@code \begin{...}}
 * @param line 1-based line of the {@code \begin} marker
 */
public record EnvironmentFrame(String name, int line) {}
