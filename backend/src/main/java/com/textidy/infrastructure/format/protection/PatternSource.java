package com.textidy.infrastructure.format.protection;

import java.util.Optional;

/**
 * Supplies protection rules and symbol names from outside the formatter.
 * An empty result means "not available"; implementations must not throw.
 */
public interface PatternSource {

    Optional<PatternDefinitions> load();
}
