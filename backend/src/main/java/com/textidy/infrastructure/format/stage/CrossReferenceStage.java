package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Trims label and reference keys and separates references from adjacent words.
 * A {@code ~} tie before a reference is left alone.
 */
@Component
@Order(600)
public class CrossReferenceStage implements FormattingStage {

    private static final Pattern REFERENCE_COMMAND = Pattern.compile(
            "\\\\(label|ref|pageref|eqref)\\s*\\{\\s*([^}]+?)\\s*\\}");

    private static final Pattern LETTER_BEFORE = Pattern.compile(
            "([a-zA-Z])(\\\\(?:ref|pageref|eqref)\\{[^}]+\\})");

    private static final Pattern LETTER_AFTER = Pattern.compile(
            "(\\\\(?:ref|pageref|eqref)\\{[^}]+\\})([a-zA-Z])");

    @Override
    public String name() {
        return "cross-references";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.FORMAT_CROSSREFERENCES)) {
            return StageResult.success(text);
        }

        String result = REFERENCE_COMMAND.matcher(text).replaceAll(m ->
                Matcher.quoteReplacement("\\" + m.group(1) + "{" + m.group(2) + "}"));

        if (context.flag(FormatterConfig.NORMALIZE_REF_SPACING)) {
            result = LETTER_BEFORE.matcher(result).replaceAll("$1 $2");
            result = LETTER_AFTER.matcher(result).replaceAll("$1 $2");
        }
        return StageResult.success(result);
    }
}
