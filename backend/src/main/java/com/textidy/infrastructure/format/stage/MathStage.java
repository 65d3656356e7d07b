package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.math.MathFormatter;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(900)
@RequiredArgsConstructor
public class MathStage implements FormattingStage {

    private final MathFormatter mathFormatter;

    @Override
    public String name() {
        return "math";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.FIX_MATH_SPACING)) {
            return StageResult.success(text);
        }
        return StageResult.success(mathFormatter.format(text, context.symbols()));
    }
}
