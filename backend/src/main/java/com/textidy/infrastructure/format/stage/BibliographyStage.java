package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tidies bibliography commands, citation key lists and {@code \bibitem} entries.
 */
@Component
@Order(500)
public class BibliographyStage implements FormattingStage {

    private static final Pattern BIBLIOGRAPHY_COMMAND = Pattern.compile(
            "\\\\(bibliography|bibliographystyle)\\s*\\{\\s*([^}]+?)\\s*\\}");

    private static final Pattern CITATION = Pattern.compile(
            "\\\\(cite|citep|citet|citealt|citealp|citeauthor|citeyear)(\\*?)((?:[ \\t]*\\[[^\\]\\n]*\\])*)[ \\t]*\\{([^{}\\n]*)\\}");

    private static final Pattern OPTIONAL_ARGUMENT = Pattern.compile("\\[[^\\]\\n]*\\]");

    private static final Pattern BIBITEM = Pattern.compile(
            "\\\\bibitem(\\[[^\\]\\n]*\\])?[ \\t]*\\{[ \\t]*([^{}\\n]+?)[ \\t]*\\}[ \\t]*(?=[^\\s])");

    private static final Pattern BIBLIOGRAPHY_LINE = Pattern.compile("^\\\\bibliography(style)?\\{[^}]+\\}");

    @Override
    public String name() {
        return "bibliography";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.FORMAT_BIBLIOGRAPHY)) {
            return StageResult.success(text);
        }

        String result = BIBLIOGRAPHY_COMMAND.matcher(text).replaceAll(m ->
                Matcher.quoteReplacement("\\" + m.group(1) + "{" + m.group(2) + "}"));

        if (context.flag(FormatterConfig.NORMALIZE_CITATIONS)) {
            result = CITATION.matcher(result).replaceAll(m -> Matcher.quoteReplacement(
                    "\\" + m.group(1) + m.group(2) + optionalArguments(m.group(3))
                            + "{" + citationList(m.group(4)) + "}"));
        }
        if (context.flag(FormatterConfig.FORMAT_BIBITEM_ENTRIES)) {
            result = BIBITEM.matcher(result).replaceAll(m -> Matcher.quoteReplacement(
                    "\\bibitem" + (m.group(1) != null ? m.group(1) : "") + "{" + m.group(2) + "} "));
        }
        if (context.flag(FormatterConfig.ADD_BIBLIOGRAPHY_SPACING)) {
            result = spaceBibliographyLines(result);
        }
        return StageResult.success(result);
    }

    static String citationList(String keys) {
        return Arrays.stream(keys.split(",", -1))
                .map(String::trim)
                .collect(Collectors.joining(", "));
    }

    private static String optionalArguments(String arguments) {
        StringBuilder sb = new StringBuilder();
        Matcher matcher = OPTIONAL_ARGUMENT.matcher(arguments);
        while (matcher.find()) {
            sb.append(matcher.group());
        }
        return sb.toString();
    }

    private static String spaceBibliographyLines(String text) {
        List<String> lines = LatexText.lines(text);
        List<String> result = new ArrayList<>(lines.size() + 4);

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean bibliographyLine = BIBLIOGRAPHY_LINE.matcher(line.strip()).find();

            if (bibliographyLine && !result.isEmpty() && !LatexText.isBlank(result.get(result.size() - 1))) {
                result.add("");
            }
            result.add(line);
            if (bibliographyLine && i + 1 < lines.size() && !LatexText.isBlank(lines.get(i + 1))) {
                result.add("");
            }
        }
        return String.join("\n", result);
    }
}
