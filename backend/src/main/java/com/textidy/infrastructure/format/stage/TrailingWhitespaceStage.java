package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
@Order(200)
public class TrailingWhitespaceStage implements FormattingStage {

    @Override
    public String name() {
        return "trailing-whitespace";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.REMOVE_TRAILING_WHITESPACE)) {
            return StageResult.success(text);
        }
        return StageResult.success(LatexText.lines(text).stream()
                .map(LatexText::stripTrailing)
                .collect(Collectors.joining("\n")));
    }
}
