package com.textidy.infrastructure.format.validation;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports references to labels that are never defined and labels that are never referenced.
 * Comments are ignored. Results are warnings and never fail a check.
 */
@Component
public class CrossReferenceChecker {

    public static final String SOURCE = "cross-references";

    private static final Pattern LABEL = Pattern.compile("\\\\label\\s*\\{\\s*([^}]+?)\\s*\\}");
    private static final Pattern REFERENCE = Pattern.compile(
            "\\\\(?:ref|pageref|eqref|autoref|[cC]ref)\\s*\\{\\s*([^}]+?)\\s*\\}");

    public List<Diagnostic> check(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String code = LatexText.stripComments(text);
        Map<String, Integer> labels = firstOccurrences(code, LABEL, false);
        Map<String, Integer> references = firstOccurrences(code, REFERENCE, true);

        List<Diagnostic> warnings = new ArrayList<>();
        references.forEach((key, line) -> {
            if (!labels.containsKey(key)) {
                warnings.add(Diagnostic.at(DiagnosticCategory.CROSS_REFERENCE, SOURCE,
                        "Undefined reference: " + key, line));
            }
        });
        labels.forEach((key, line) -> {
            if (!references.containsKey(key)) {
                warnings.add(Diagnostic.at(DiagnosticCategory.CROSS_REFERENCE, SOURCE,
                        "Unused label: " + key, line));
            }
        });
        return warnings;
    }

    private static Map<String, Integer> firstOccurrences(String code, Pattern pattern, boolean splitKeys) {
        Map<String, Integer> found = new LinkedHashMap<>();
        Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            int line = LatexText.lineOf(code, matcher.start());
            // \cref accepts a comma separated list
            String[] keys = splitKeys ? matcher.group(1).split(",") : new String[]{matcher.group(1)};
            for (String key : keys) {
                String trimmed = key.trim();
                if (!trimmed.isEmpty()) {
                    found.putIfAbsent(trimmed, line);
                }
            }
        }
        return found;
    }
}
