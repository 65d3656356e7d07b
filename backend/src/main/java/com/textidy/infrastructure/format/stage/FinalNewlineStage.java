package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1300)
public class FinalNewlineStage implements FormattingStage {

    @Override
    public String name() {
        return "final-newline";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.ENSURE_FINAL_NEWLINE) || text.isEmpty() || text.endsWith("\n")) {
            return StageResult.success(text);
        }
        return StageResult.success(text + "\n");
    }
}
