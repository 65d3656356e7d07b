package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Removes padding just inside braces and brackets and collapses runs of blanks in the code part
 * of each line. Indentation, comments and control spaces ({@code \ }) are kept.
 */
@Component
@Order(700)
public class SpacingStage implements FormattingStage {

    @Override
    public String name() {
        return "spacing";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.FIX_SPACING)) {
            return StageResult.success(text);
        }
        List<String> lines = LatexText.lines(text);
        return StageResult.success(lines.stream()
                .map(SpacingStage::fixLine)
                .collect(Collectors.joining("\n")));
    }

    static String fixLine(String line) {
        int commentStart = LatexText.commentStart(line);
        String code = commentStart < 0 ? line : line.substring(0, commentStart);
        String comment = commentStart < 0 ? "" : line.substring(commentStart);

        String indent = LatexText.leadingWhitespace(code);
        StringBuilder out = new StringBuilder(line.length()).append(indent);
        int i = indent.length();

        while (i < code.length()) {
            char c = code.charAt(i);
            if (!isBlank(c)) {
                out.append(c);
                i++;
                continue;
            }
            if (LatexText.isEscaped(code, i)) {
                out.append(c);
                i++;
                continue;
            }

            int runEnd = i;
            while (runEnd < code.length() && isBlank(code.charAt(runEnd))) {
                runEnd++;
            }

            boolean afterOpener = out.length() > indent.length() && isOpener(out, out.length() - 1);
            boolean beforeCloser = runEnd < code.length() && isCloser(code.charAt(runEnd));
            boolean atCodeEnd = runEnd == code.length();

            if (!afterOpener && !beforeCloser && !(atCodeEnd && comment.isEmpty())) {
                out.append(' ');
            }
            i = runEnd;
        }

        return out.append(comment).toString();
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isOpener(CharSequence text, int index) {
        char c = text.charAt(index);
        return (c == '{' || c == '[') && !LatexText.isEscaped(text, index);
    }

    private static boolean isCloser(char c) {
        return c == '}' || c == ']';
    }
}
