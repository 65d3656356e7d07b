package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes whitespace between a command name and its argument and trims the arguments of
 * structural commands. Reports suspicious command spacing and dangling citations as notes.
 */
@Component
@Order(400)
public class CommandStage implements FormattingStage {

    private static final Pattern SPACE_BEFORE_ARGUMENT = Pattern.compile("\\\\([a-zA-Z]+)[ \\t]+\\{");

    private static final Pattern TRIMMED_ARGUMENT = Pattern.compile(
            "\\\\(begin|end|usepackage|documentclass|textbf|textit|emph|part|chapter|section|subsection"
                    + "|subsubsection|paragraph|title|author)(\\*?)\\{[ \\t]*([^{}\\n]*?)[ \\t]*\\}");

    private static final Pattern SPACED_STYLE = Pattern.compile("\\\\(textbf|emph|textit)[ \\t]+\\{");
    private static final Pattern SPACED_CITE = Pattern.compile("\\\\cite[ \\t]+\\{");
    private static final Pattern DANGLING_CITE = Pattern.compile("\\\\cite\\{[ \\t]*$", Pattern.MULTILINE);

    @Override
    public String name() {
        return "commands";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.NORMALIZE_COMMANDS)) {
            return StageResult.success(text);
        }

        List<Diagnostic> notes = detectProblems(text, context);

        String result = SPACE_BEFORE_ARGUMENT.matcher(text).replaceAll("\\\\$1{");
        result = TRIMMED_ARGUMENT.matcher(result).replaceAll(m ->
                Matcher.quoteReplacement("\\" + m.group(1) + m.group(2) + "{" + m.group(3) + "}"));

        return StageResult.success(result, notes);
    }

    private List<Diagnostic> detectProblems(String text, StageContext context) {
        List<Diagnostic> notes = new ArrayList<>();
        Matcher styled = SPACED_STYLE.matcher(text);
        while (styled.find()) {
            notes.add(note("Extra spaces in \\" + styled.group(1) + " command", text, styled.start(), context));
        }
        Matcher spacedCite = SPACED_CITE.matcher(text);
        while (spacedCite.find()) {
            notes.add(note("Extra spaces in \\cite command", text, spacedCite.start(), context));
        }
        Matcher dangling = DANGLING_CITE.matcher(text);
        while (dangling.find()) {
            notes.add(note("Incomplete \\cite command", text, dangling.start(), context));
        }
        notes.sort((a, b) -> Integer.compare(a.line(), b.line()));
        return notes;
    }

    private Diagnostic note(String message, String text, int offset, StageContext context) {
        return Diagnostic.at(DiagnosticCategory.COMMAND, name(), message, context.sourceLine(text, offset));
    }
}
