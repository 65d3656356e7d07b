package com.textidy.application.format;

import com.textidy.application.format.exception.InputTooLargeException;
import com.textidy.domain.format.model.CheckResult;
import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.FormatResult;
import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.infrastructure.format.DocumentFormatter;
import com.textidy.infrastructure.format.validation.CrossReferenceChecker;
import com.textidy.infrastructure.format.validation.SuggestionAdvisor;
import com.textidy.infrastructure.format.validation.SyntaxValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class FormatAppService {

    private final DocumentFormatter documentFormatter;
    private final SyntaxValidator syntaxValidator;
    private final CrossReferenceChecker crossReferenceChecker;
    private final SuggestionAdvisor suggestionAdvisor;
    private final FormatterConfig defaultFormatterConfig;

    @Value("${formatter.max-input-length}")
    private int maxInputLength;

    /**
     * Format a document with the service defaults overridden by {@code options}.
     */
    public FormatResult format(String text, Map<String, Object> options) {
        requireWithinLimit(text);

        FormatterConfig config = defaultFormatterConfig.withOverrides(options);
        FormatResult result = documentFormatter.format(text, config);

        log.info("Formatted {} chars: changed={}, diagnostics={}, degraded={}",
                text.length(), result.changed(), result.diagnostics().size(), result.degraded());
        return result;
    }

    public CheckResult check(String text) {
        requireWithinLimit(text);

        List<Diagnostic> issues = syntaxValidator.check(text);
        List<Diagnostic> warnings = crossReferenceChecker.check(text);
        List<Diagnostic> suggestions = suggestionAdvisor.suggest(text);
        return new CheckResult(issues.isEmpty(), issues, warnings, suggestions);
    }

    private void requireWithinLimit(String text) {
        if (text.length() > maxInputLength) {
            throw new InputTooLargeException(
                    String.format("Input is %d characters, the limit is %d", text.length(), maxInputLength));
        }
    }
}
