package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Re-indents every line by its {@code \begin}/{@code \end} nesting depth.
 * <p>
 * A line starting with {@code \end} is already outdented. {@code \end{document}} always sits in
 * column 0, and the document body itself is only indented when {@code indent_document_body} is
 * set. Markers inside comments do not count. A line carrying protected content that runs over
 * several lines is left where it is, since only its first line could move.
 * </p>
 */
@Component
@Order(800)
public class EnvironmentIndentStage implements FormattingStage {

    private static final Pattern MARKER = Pattern.compile("\\\\(begin|end)\\s*\\{\\s*([^}]+?)\\s*\\}");
    private static final Pattern LEADING_END = Pattern.compile("\\G\\s*\\\\end\\s*\\{\\s*([^}]+?)\\s*\\}");
    private static final String DOCUMENT = "document";

    @Override
    public String name() {
        return "environments";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.ALIGN_ENVIRONMENTS)) {
            return StageResult.success(text);
        }

        String unit = " ".repeat(Math.max(0, context.integer(FormatterConfig.INDENT_SIZE)));
        boolean indentBody = context.flag(FormatterConfig.INDENT_DOCUMENT_BODY);

        List<String> result = new ArrayList<>();
        int level = 0;

        for (String line : LatexText.lines(text)) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                result.add("");
                continue;
            }

            String code = LatexText.codePart(stripped);
            int indent = Math.max(0, level - leadingEnds(code, indentBody));
            if (code.startsWith("\\end{" + DOCUMENT + "}")) {
                indent = 0;
            }
            if (context.placeholders().spansLines(line)) {
                result.add(line);
            } else {
                result.add(unit.repeat(indent) + stripped);
            }

            level = Math.max(0, level + depthChange(code, indentBody));
        }
        return StageResult.success(String.join("\n", result));
    }

    private static int leadingEnds(String code, boolean indentBody) {
        int count = 0;
        Matcher matcher = LEADING_END.matcher(code);
        while (matcher.find()) {
            if (counts(matcher.group(1), indentBody)) {
                count++;
            }
        }
        return count;
    }

    private static int depthChange(String code, boolean indentBody) {
        int change = 0;
        Matcher matcher = MARKER.matcher(code);
        while (matcher.find()) {
            if (LatexText.isEscaped(code, matcher.start()) || !counts(matcher.group(2), indentBody)) {
                continue;
            }
            change += matcher.group(1).equals("begin") ? 1 : -1;
        }
        return change;
    }

    private static boolean counts(String environment, boolean indentBody) {
        return indentBody || !DOCUMENT.equals(environment);
    }
}
