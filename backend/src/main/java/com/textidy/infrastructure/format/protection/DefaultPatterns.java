package com.textidy.infrastructure.format.protection;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in protection rules and symbol names, used when no pattern files are available.
 */
public final class DefaultPatterns {

    private DefaultPatterns() {
    }

    public static final Map<String, List<String>> PROTECTION = protection();

    public static final Map<String, List<String>> SYMBOLS = symbols();

    private static Map<String, List<String>> protection() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("chemical_formulas", List.of(
                "Li-S",
                "Li₂S₆",
                "CoSe₂",
                "Ti₃C₂Tₓ",
                "HKUST-1",
                "PPy@S/GA-VD",
                "Ni-HAB",
                "USTB-27-Co"
        ));
        map.put("compound_terms", List.of(
                "roll-to-roll",
                "X-ray",
                "charge-discharge",
                "solid-liquid-solid",
                "two-column",
                "two-dimensional"
        ));
        map.put("reference_patterns", List.of(
                "References?\\s+\\d+-\\d+",
                "pages?\\s+\\d+-\\d+",
                "equations?\\s+\\d+-\\d+"
        ));
        map.put("numerical_ranges", List.of(
                "\\d+\\.?\\d*-\\d+\\.?\\d*"
        ));
        // key=value option lists; a leading backslash means display math, not options
        map.put("package_options", List.of(
                "(?<!\\\\)\\[[^\\[\\]\\n]*=[^\\[\\]\\n]*\\]"
        ));
        map.put("comment_patterns", List.of(
                "%.*?---.*?---.*",
                "%.*?-{10,}.*",
                "%.*?-\\s*-\\s*-.*"
        ));
        map.put("general_patterns", List.of(
                "[A-Z][a-z]?[₀-₉]*-[A-Z][a-z]?[₀-₉]*",
                "[A-Z][A-Za-z]*-[A-Za-z0-9]+"
        ));
        return map;
    }

    private static Map<String, List<String>> symbols() {
        Map<String, List<String>> map = new LinkedHashMap<>();
        map.put("operators", List.of("=", "+", "-", "*", "/", "\\pm", "\\mp", "\\times", "\\div"));
        map.put("functions", List.of("\\sin", "\\cos", "\\tan", "\\log", "\\ln", "\\exp", "\\sqrt", "\\frac"));
        map.put("symbols", List.of("\\alpha", "\\beta", "\\gamma", "\\delta", "\\epsilon", "\\theta",
                "\\lambda", "\\mu", "\\pi", "\\sigma", "\\omega"));
        map.put("environments", List.of("equation", "align", "gather", "multline", "split", "alignat",
                "eqnarray", "flalign", "displaymath", "math"));
        map.put("verbatim_environments", List.of("verbatim", "verbatim*", "Verbatim", "lstlisting",
                "minted", "comment"));
        map.put("tabular_environments", List.of("tabular", "tabular*", "tabularx", "array", "longtable"));
        map.put("constructs", List.of("frac", "dfrac", "tfrac", "cfrac", "binom", "sum", "prod",
                "int", "iint", "oint", "bigcup", "bigcap"));
        return map;
    }
}
