package com.textidy.domain.format.model;

import java.util.List;
import java.util.Set;

/**
 * Names the formatter needs to recognise LaTeX structure.
 *
 * @param operators             math operators
 * @param functions             math function commands
 * @param symbols               math symbol commands
 * @param mathEnvironments      environments whose body is math
 * @param verbatimEnvironments  environments whose body must never be rewritten or validated
 * @param tabularEnvironments   environments whose rows are aligned on {@code &}
 * @param constructs            commands taking braced arguments whose surrounding whitespace is trimmed
 */
public record SymbolTable(
        List<String> operators,
        List<String> functions,
        List<String> symbols,
        List<String> mathEnvironments,
        List<String> verbatimEnvironments,
        List<String> tabularEnvironments,
        List<String> constructs
) {

    public SymbolTable {
        operators = List.copyOf(operators);
        functions = List.copyOf(functions);
        symbols = List.copyOf(symbols);
        mathEnvironments = List.copyOf(mathEnvironments);
        verbatimEnvironments = List.copyOf(verbatimEnvironments);
        tabularEnvironments = List.copyOf(tabularEnvironments);
        constructs = List.copyOf(constructs);
    }

    /**
     * True for a math environment name, starred variants included.
     */
    public boolean isMathEnvironment(String name) {
        return mathEnvironments.contains(stripStar(name));
    }

    public boolean isTabularEnvironment(String name) {
        return tabularEnvironments.contains(name) || tabularEnvironments.contains(stripStar(name));
    }

    public Set<String> constructNames() {
        return Set.copyOf(constructs);
    }

    private static String stripStar(String name) {
        return name.endsWith("*") ? name.substring(0, name.length() - 1) : name;
    }
}
