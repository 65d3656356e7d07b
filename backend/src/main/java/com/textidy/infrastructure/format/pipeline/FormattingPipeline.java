package com.textidy.infrastructure.format.pipeline;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the ordered formatting stages over protected text.
 * <p>
 * line endings → trailing whitespace → [academic paper → book → beamer] → blank lines → commands
 * → bibliography → cross references → spacing → environments → math → packages → quotes
 * → [line wrap] → tables → [comments] → final newline
 * </p>
 * Bracketed stages are opt-in through their config keys.
 * Each stage is isolated: when it fails or throws, its output is discarded, a stage fault is
 * recorded and the next stage receives the text from before the failing stage.
 */
@Slf4j
@Component
public class FormattingPipeline {

    private final List<FormattingStage> stages;

    public FormattingPipeline(List<FormattingStage> stages) {
        this.stages = List.copyOf(stages);
        log.info("Formatting pipeline: {}", this.stages.stream().map(FormattingStage::name).toList());
    }

    public List<FormattingStage> stages() {
        return stages;
    }

    public FormattingRun run(String text, StageContext context) {
        FormattingRun run = new FormattingRun(text);

        for (FormattingStage stage : stages) {
            long start = System.nanoTime();
            StageResult result = applyIsolated(stage, run.getText(), context);
            long elapsedMicros = (System.nanoTime() - start) / 1_000;

            if (result.succeeded() && result.text() != null) {
                run.setText(result.text());
                run.getDiagnostics().addAll(result.notes());
                run.getCompletedStages().add(stage.name());
                log.debug("Stage {} finished in {}us", stage.name(), elapsedMicros);
            } else {
                String message = result.failure() != null ? result.failure() : "stage returned no text";
                log.warn("Stage {} failed, keeping previous text: {}", stage.name(), message);
                run.getDiagnostics().add(Diagnostic.stageFault(stage.name(), message));
                run.getFailedStages().add(stage.name());
            }
        }

        log.debug("Pipeline finished: completed={}, failed={}, changed={}",
                run.getCompletedStages().size(), run.getFailedStages().size(),
                !run.getText().equals(run.getInputText()));
        return run;
    }

    private static StageResult applyIsolated(FormattingStage stage, String text, StageContext context) {
        try {
            return stage.apply(text, context);
        } catch (RuntimeException | StackOverflowError e) {
            return StageResult.failure(e.getClass().getSimpleName()
                    + (e.getMessage() != null ? ": " + e.getMessage() : ""));
        }
    }
}
