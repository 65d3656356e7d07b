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

/**
 * Starts inline comments at {@code comment_column}. Comments that cannot reach the column
 * follow their code after two spaces. Comment-only lines are untouched.
 */
@Component
@Order(1250)
public class CommentAlignStage implements FormattingStage {

    private static final int MIN_GAP = 2;

    @Override
    public String name() {
        return "comments";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.ALIGN_COMMENTS)) {
            return StageResult.success(text);
        }

        int column = Math.max(0, context.integer(FormatterConfig.COMMENT_COLUMN));
        List<String> result = new ArrayList<>();
        for (String line : LatexText.lines(text)) {
            int commentStart = LatexText.commentStart(line);
            String code = commentStart < 0 ? "" : LatexText.stripTrailing(line.substring(0, commentStart));
            if (code.isBlank()) {
                result.add(line);
                continue;
            }

            int width = context.placeholders().displayWidth(code);
            int gap = width < column ? column - width : MIN_GAP;
            result.add(code + " ".repeat(gap) + LatexText.stripTrailing(line.substring(commentStart)));
        }
        return StageResult.success(String.join("\n", result));
    }
}
