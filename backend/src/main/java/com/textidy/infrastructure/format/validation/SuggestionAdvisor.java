package com.textidy.infrastructure.format.validation;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.infrastructure.format.text.LatexText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Advises on packages a document uses without loading them and on obsolete font switches.
 * Comments are ignored. Each package is suggested at most once.
 */
@Slf4j
@Component
public class SuggestionAdvisor {

    public static final String SOURCE = "suggestions";

    private static final Pattern PACKAGE = Pattern.compile("\\\\usepackage\\s*(?:\\[[^\\]]*\\])?\\s*\\{([^}]*)\\}");
    private static final Pattern REFERENCE = Pattern.compile("\\\\(?!href)(?:[a-zA-Z]*ref|cite[a-zA-Z]*)\\s*\\{");
    private static final Pattern TABULAR = Pattern.compile("\\\\begin\\s*\\{tabular\\*?\\}");
    private static final Pattern BOLD_SWITCH = Pattern.compile("\\\\bf(?![a-zA-Z])");
    private static final Pattern ITALIC_SWITCH = Pattern.compile("\\\\it(?![a-zA-Z])");

    private static final Map<String, String> COMMAND_PACKAGES = commandPackages();

    public List<Diagnostic> suggest(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        String code = LatexText.stripComments(text);
        Set<String> loaded = loadedPackages(code);
        Set<String> suggested = new HashSet<>();
        List<Diagnostic> suggestions = new ArrayList<>();

        if (uses(code, "\\includegraphics") && missing("graphicx", loaded, suggested)) {
            suggestions.add(advice("Consider adding \\usepackage{graphicx} for image support"));
        }
        if (uses(code, REFERENCE) && missing("hyperref", loaded, suggested)) {
            suggestions.add(advice("Consider adding \\usepackage{hyperref} for clickable references"));
        }
        if (uses(code, TABULAR) && missing("booktabs", loaded, suggested)) {
            suggestions.add(advice("Consider using \\usepackage{booktabs} for better table formatting"));
        }
        if (uses(code, BOLD_SWITCH)) {
            suggestions.add(advice("Replace \\bf with \\textbf{} or \\bfseries"));
        }
        if (uses(code, ITALIC_SWITCH)) {
            suggestions.add(advice("Replace \\it with \\textit{} or \\itshape"));
        }

        COMMAND_PACKAGES.forEach((command, pkg) -> {
            // hyperref provides the url command as well
            boolean satisfied = pkg.equals("url") && loaded.contains("hyperref");
            if (!satisfied && uses(code, command) && missing(pkg, loaded, suggested)) {
                suggestions.add(advice("Consider adding \\usepackage{" + pkg + "} for " + command + " support"));
            }
        });

        if (!suggestions.isEmpty()) {
            log.debug("Found {} improvement suggestions", suggestions.size());
        }
        return suggestions;
    }

    private static Set<String> loadedPackages(String code) {
        Set<String> packages = new HashSet<>();
        Matcher matcher = PACKAGE.matcher(code);
        while (matcher.find()) {
            for (String name : matcher.group(1).split(",")) {
                if (!name.isBlank()) {
                    packages.add(name.trim());
                }
            }
        }
        return packages;
    }

    /**
     * True if {@code pkg} is neither loaded nor already suggested; marks it as suggested.
     */
    private static boolean missing(String pkg, Set<String> loaded, Set<String> suggested) {
        return !loaded.contains(pkg) && suggested.add(pkg);
    }

    private static boolean uses(String code, String command) {
        Pattern pattern = Pattern.compile(Pattern.quote(command) + "(?![a-zA-Z])");
        return uses(code, pattern);
    }

    private static boolean uses(String code, Pattern pattern) {
        Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            if (!LatexText.isEscaped(code, matcher.start())) {
                return true;
            }
        }
        return false;
    }

    private static Diagnostic advice(String message) {
        return Diagnostic.of(DiagnosticCategory.SUGGESTION, SOURCE, message);
    }

    private static Map<String, String> commandPackages() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("\\url", "url");
        map.put("\\href", "hyperref");
        map.put("\\includegraphics", "graphicx");
        map.put("\\toprule", "booktabs");
        map.put("\\midrule", "booktabs");
        map.put("\\bottomrule", "booktabs");
        return map;
    }
}
