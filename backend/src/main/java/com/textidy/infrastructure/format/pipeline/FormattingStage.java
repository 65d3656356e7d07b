package com.textidy.infrastructure.format.pipeline;

import com.textidy.domain.format.model.StageResult;

/**
 * One text-to-text rewrite step of the formatting pipeline.
 * <p>
 * Implementations are Spring beans ordered with {@link org.springframework.core.annotation.Order};
 * registering another bean adds a stage. A stage must leave placeholder tokens intact and should
 * report expected problems through {@link StageResult#failure(String)} rather than throwing.
 * </p>
 */
public interface FormattingStage {

    /**
     * Stable name used in diagnostics and logs.
     */
    String name();

    StageResult apply(String text, StageContext context);
}
