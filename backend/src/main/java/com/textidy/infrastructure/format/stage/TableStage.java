package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.table.TableAligner;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1200)
@RequiredArgsConstructor
public class TableStage implements FormattingStage {

    private final TableAligner tableAligner;

    @Override
    public String name() {
        return "tables";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.ALIGN_AMPERSANDS)) {
            return StageResult.success(text);
        }
        return StageResult.success(tableAligner.align(text, context.symbols(), context.placeholders()));
    }
}
