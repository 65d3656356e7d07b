package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(100)
public class LineEndingStage implements FormattingStage {

    @Override
    public String name() {
        return "line-endings";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        return StageResult.success(text.replace("\r\n", "\n").replace('\r', '\n'));
    }
}
