package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.PlaceholderMap;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps prose lines wider than {@code line_length} at word boundaries, keeping their indentation.
 * <p>
 * Only plain text is wrapped. Lines that start with a command or a comment, open or close an
 * environment, carry an inline comment, a table row or a line break are left as they are.
 * Words never break inside braces or inline math.
 * </p>
 */
@Component
@Order(1150)
public class LineWrapStage implements FormattingStage {

    @Override
    public String name() {
        return "line-wrap";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        int limit = context.integer(FormatterConfig.LINE_LENGTH);
        if (!context.flag(FormatterConfig.WRAP_LONG_LINES) || limit <= 0) {
            return StageResult.success(text);
        }

        PlaceholderMap placeholders = context.placeholders();
        List<String> result = new ArrayList<>();
        for (String line : LatexText.lines(text)) {
            if (!wrappable(line, limit, placeholders)) {
                result.add(line);
                continue;
            }

            String indent = LatexText.leadingWhitespace(line);
            String current = null;
            for (String word : words(line.strip())) {
                if (current == null) {
                    current = indent + word;
                } else if (placeholders.displayWidth(current) + 1 + placeholders.displayWidth(word) <= limit) {
                    current = current + " " + word;
                } else {
                    result.add(current);
                    current = indent + word;
                }
            }
            result.add(current != null ? current : line);
        }
        return StageResult.success(String.join("\n", result));
    }

    private static boolean wrappable(String line, int limit, PlaceholderMap placeholders) {
        if (placeholders.displayWidth(line) <= limit) {
            return false;
        }
        String stripped = line.strip();
        return !stripped.startsWith("%")
                && !stripped.startsWith("\\")
                && !line.contains("\\begin{")
                && !line.contains("\\end{")
                && LatexText.commentStart(line) < 0
                && line.indexOf('&') < 0
                && !line.contains("\\\\")
                && !placeholders.spansLines(line);
    }

    /**
     * Blank-separated words; blanks inside braces or inline math do not separate.
     */
    static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        int depth = 0;
        boolean math = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                // Escaped character or command name start, never a separator
                word.append(c).append(text.charAt(++i));
                continue;
            }
            if ((c == ' ' || c == '\t') && depth == 0 && !math) {
                if (!word.isEmpty()) {
                    words.add(word.toString());
                    word.setLength(0);
                }
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == '$') {
                math = !math;
            }
            word.append(c);
        }
        if (!word.isEmpty()) {
            words.add(word.toString());
        }
        return words;
    }
}
