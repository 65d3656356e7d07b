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
 * Caps runs of blank lines at {@code max_empty_lines}. Whitespace-only lines count as blank
 * and are emptied.
 */
@Component
@Order(300)
public class BlankLineStage implements FormattingStage {

    @Override
    public String name() {
        return "blank-lines";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.COMPRESS_EMPTY_LINES)) {
            return StageResult.success(text);
        }

        int maxEmpty = Math.max(0, context.integer(FormatterConfig.MAX_EMPTY_LINES));
        List<String> result = new ArrayList<>();
        int emptyRun = 0;

        for (String line : LatexText.lines(text)) {
            if (LatexText.isBlank(line)) {
                emptyRun++;
                if (emptyRun <= maxEmpty) {
                    result.add("");
                }
            } else {
                emptyRun = 0;
                result.add(line);
            }
        }
        return StageResult.success(String.join("\n", result));
    }
}
