package com.textidy.infrastructure.format;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.domain.format.model.FormatResult;
import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.ProtectedText;
import com.textidy.infrastructure.format.pipeline.DegradedFormatter;
import com.textidy.infrastructure.format.pipeline.FormattingPipeline;
import com.textidy.infrastructure.format.pipeline.FormattingRun;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.protection.ContentProtector;
import com.textidy.infrastructure.format.protection.PatternStore;
import com.textidy.infrastructure.format.text.LatexText;
import com.textidy.infrastructure.format.validation.CrossReferenceChecker;
import com.textidy.infrastructure.format.validation.SuggestionAdvisor;
import com.textidy.infrastructure.format.validation.SyntaxValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats one document end to end:
 * <p>
 * strip BOM → validate → protect → stages → restore → line-length notes → suggestions
 * </p>
 * Never throws for non-null input. If anything escapes stage isolation, or protected text is
 * lost on the way, the result is the degraded fallback and {@link FormatResult#degraded()} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentFormatter {

    private static final char BOM = '\uFEFF';

    private final PatternStore patternStore;
    private final ContentProtector contentProtector;
    private final FormattingPipeline formattingPipeline;
    private final DegradedFormatter degradedFormatter;
    private final SyntaxValidator syntaxValidator;
    private final CrossReferenceChecker crossReferenceChecker;
    private final SuggestionAdvisor suggestionAdvisor;

    public FormatResult format(String text) {
        return format(text, FormatterConfig.defaults());
    }

    public FormatResult format(String text, FormatterConfig config) {
        if (text == null) {
            throw new IllegalArgumentException("Text must not be null");
        }
        String input = !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
        List<Diagnostic> diagnostics = new ArrayList<>(patternStore.invalidPatterns());

        try {
            diagnostics.addAll(syntaxValidator.check(input));
            if (config.flag(FormatterConfig.VALIDATE_CROSSREFERENCES)) {
                diagnostics.addAll(crossReferenceChecker.check(input));
            }

            ProtectedText protectedText = contentProtector.protect(input);
            StageContext context = new StageContext(config, protectedText.placeholders(), patternStore.symbolTable());
            FormattingRun run = formattingPipeline.run(protectedText.text(), context);
            diagnostics.addAll(run.getDiagnostics());

            ContentProtector.RestoreResult restored = contentProtector.restore(run.getText(), protectedText.placeholders());
            if (!restored.complete()) {
                log.error("Formatting lost {} protected spans, using degraded output", restored.missingTokens().size());
                diagnostics.add(Diagnostic.stageFault("restore",
                        restored.missingTokens().size() + " protected spans were lost"));
                return degraded(text, input, diagnostics);
            }

            String formatted = restored.text();
            diagnostics.addAll(lineLengthNotes(formatted, config.integer(FormatterConfig.LINE_LENGTH)));
            if (config.flag(FormatterConfig.SUGGEST_IMPROVEMENTS)) {
                diagnostics.addAll(suggestionAdvisor.suggest(formatted));
            }

            if (run.hasFaults()) {
                log.warn("Formatted with {} failed stages: {}", run.getFailedStages().size(), run.getFailedStages());
            }
            return new FormatResult(formatted, !formatted.equals(text), diagnostics, false);
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Formatting pipeline failed, using degraded output", e);
            diagnostics.add(Diagnostic.stageFault("pipeline", e.getClass().getSimpleName()
                    + (e.getMessage() != null ? ": " + e.getMessage() : "")));
            return degraded(text, input, diagnostics);
        }
    }

    private FormatResult degraded(String original, String input, List<Diagnostic> diagnostics) {
        String fallback = degradedFormatter.format(input);
        return new FormatResult(fallback, !fallback.equals(original), diagnostics, true);
    }

    private static List<Diagnostic> lineLengthNotes(String text, int lineLength) {
        if (lineLength <= 0) {
            return List.of();
        }
        List<Diagnostic> notes = new ArrayList<>();
        List<String> lines = LatexText.lines(text);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int width = line.codePointCount(0, line.length());
            if (width > lineLength) {
                notes.add(Diagnostic.at(DiagnosticCategory.LINE_LENGTH, "line-length",
                        "Line is " + width + " characters long, limit is " + lineLength, i + 1));
            }
        }
        return notes;
    }
}
