package com.textidy.infrastructure.format.protection;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.domain.format.model.ProtectionPattern;
import com.textidy.domain.format.model.SymbolTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Compiled protection rules and symbol table owned by one formatter instance.
 * <p>
 * Rules are ordered most specific first: verbatim regions, then the file categories in
 * {@link #CATEGORY_ORDER}, then any other categories in file order. Invalid expressions are
 * skipped. The store is immutable once built.
 * </p>
 */
@Slf4j
public class PatternStore {

    public static final String VERBATIM_CATEGORY = "verbatim";

    public static final List<String> CATEGORY_ORDER = List.of(
            "chemical_formulas",
            "compound_terms",
            "reference_patterns",
            "numerical_ranges",
            "package_options",
            "comment_patterns",
            "general_patterns"
    );

    private static final String INLINE_VERB = "\\\\verb\\*?([^\\sa-zA-Z*])[^\\n]*?\\1";

    private final List<ProtectionPattern> patterns;
    private final SymbolTable symbolTable;
    private final List<Diagnostic> invalidPatterns;

    public PatternStore(PatternSource source) {
        PatternDefinitions definitions = loadSafely(source);
        List<Diagnostic> invalid = new ArrayList<>();

        this.symbolTable = toSymbolTable(definitions.symbols());
        this.patterns = compile(definitions.protection(), symbolTable, invalid);
        this.invalidPatterns = List.copyOf(invalid);

        log.info("Loaded {} protection patterns ({} invalid skipped), {} math environments",
                patterns.size(), invalidPatterns.size(), symbolTable.mathEnvironments().size());
    }

    /**
     * A store built from the built-in rules only.
     */
    public static PatternStore defaults() {
        return new PatternStore(null);
    }

    public List<ProtectionPattern> patterns() {
        return patterns;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public List<Diagnostic> invalidPatterns() {
        return invalidPatterns;
    }

    private static PatternDefinitions loadSafely(PatternSource source) {
        if (source == null) {
            return PatternDefinitions.defaults();
        }
        try {
            Optional<PatternDefinitions> loaded = source.load();
            if (loaded.isPresent()) {
                return loaded.get();
            }
        } catch (RuntimeException e) {
            log.warn("Pattern source failed, using built-in defaults: {}", e.getMessage());
        }
        return PatternDefinitions.defaults();
    }

    private static List<ProtectionPattern> compile(Map<String, List<String>> protection,
                                                   SymbolTable symbols,
                                                   List<Diagnostic> invalid) {
        List<ProtectionPattern> compiled = new ArrayList<>();

        compiled.add(new ProtectionPattern(VERBATIM_CATEGORY, 0,
                Pattern.compile(verbatimBlockRegex(symbols.verbatimEnvironments()), Pattern.DOTALL)));
        compiled.add(new ProtectionPattern(VERBATIM_CATEGORY, 1, Pattern.compile(INLINE_VERB)));

        Map<String, List<String>> ordered = orderCategories(protection);
        for (Map.Entry<String, List<String>> entry : ordered.entrySet()) {
            List<String> expressions = entry.getValue() != null ? entry.getValue() : List.of();
            for (String expression : expressions) {
                if (expression == null || expression.isEmpty()) {
                    continue;
                }
                try {
                    compiled.add(new ProtectionPattern(entry.getKey(), compiled.size(), Pattern.compile(expression)));
                } catch (PatternSyntaxException e) {
                    log.warn("Skipping invalid protection pattern '{}' in category {}: {}",
                            expression, entry.getKey(), e.getDescription());
                    invalid.add(Diagnostic.of(DiagnosticCategory.PATTERN, entry.getKey(),
                            "Invalid protection pattern '" + expression + "': " + e.getDescription()));
                }
            }
        }
        return List.copyOf(compiled);
    }

    private static Map<String, List<String>> orderCategories(Map<String, List<String>> protection) {
        Map<String, List<String>> ordered = new LinkedHashMap<>();
        if (protection == null) {
            return ordered;
        }
        for (String category : CATEGORY_ORDER) {
            if (protection.containsKey(category)) {
                ordered.put(category, protection.get(category));
            }
        }
        protection.forEach(ordered::putIfAbsent);
        return ordered;
    }

    private static String verbatimBlockRegex(List<String> environments) {
        String names = environments.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return "\\\\begin\\{(" + names + ")\\}.*?\\\\end\\{\\1\\}";
    }

    private static SymbolTable toSymbolTable(Map<String, List<String>> symbols) {
        return new SymbolTable(
                symbolList(symbols, "operators"),
                symbolList(symbols, "functions"),
                symbolList(symbols, "symbols"),
                symbolList(symbols, "environments"),
                symbolList(symbols, "verbatim_environments"),
                symbolList(symbols, "tabular_environments"),
                symbolList(symbols, "constructs")
        );
    }

    private static List<String> symbolList(Map<String, List<String>> symbols, String key) {
        List<String> values = symbols != null ? symbols.get(key) : null;
        if (values == null) {
            values = DefaultPatterns.SYMBOLS.get(key);
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }
}
