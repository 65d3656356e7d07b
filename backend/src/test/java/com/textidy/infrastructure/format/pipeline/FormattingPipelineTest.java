package com.textidy.infrastructure.format.pipeline;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.domain.format.model.StageResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static com.textidy.infrastructure.format.FormatterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class FormattingPipelineTest {

    private static FormattingStage stage(String name, Function<String, StageResult> body) {
        return new FormattingStage() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public StageResult apply(String text, StageContext context) {
                return body.apply(text);
            }
        };
    }

    private final FormattingStage upper = stage("upper", t -> StageResult.success(t.toUpperCase()));
    private final FormattingStage suffix = stage("suffix", t -> StageResult.success(t + "!"));

    @Test
    @DisplayName("stages run in order")
    void order() {
        FormattingRun run = new FormattingPipeline(List.of(upper, suffix)).run("ab", context());

        assertThat(run.getText()).isEqualTo("AB!");
        assertThat(run.getCompletedStages()).containsExactly("upper", "suffix");
        assertThat(run.hasFaults()).isFalse();
    }

    @Test
    @DisplayName("a throwing stage is skipped and reported")
    void throwingStage() {
        FormattingStage broken = stage("broken", t -> {
            throw new IllegalStateException("boom");
        });

        FormattingRun run = new FormattingPipeline(List.of(upper, broken, suffix)).run("ab", context());
        FormattingRun reference = new FormattingPipeline(List.of(upper, suffix)).run("ab", context());

        assertThat(run.getText()).isEqualTo(reference.getText());
        assertThat(run.getFailedStages()).containsExactly("broken");
        assertThat(run.getDiagnostics())
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.category()).isEqualTo(DiagnosticCategory.STAGE_FAULT);
                    assertThat(d.source()).isEqualTo("broken");
                    assertThat(d.message()).isEqualTo("broken: IllegalStateException: boom");
                });
    }

    @Test
    @DisplayName("a stage reporting failure is treated like a throwing one")
    void failedResult() {
        FormattingStage refusing = stage("refusing", t -> StageResult.failure("cannot"));

        FormattingRun run = new FormattingPipeline(List.of(refusing, suffix)).run("ab", context());

        assertThat(run.getText()).isEqualTo("ab!");
        assertThat(run.getDiagnostics()).extracting(Diagnostic::message).containsExactly("refusing: cannot");
    }

    @Test
    @DisplayName("stack overflow inside a stage is contained")
    void stackOverflow() {
        FormattingStage deep = stage("deep", t -> {
            throw new StackOverflowError();
        });

        FormattingRun run = new FormattingPipeline(List.of(deep)).run("ab", context());

        assertThat(run.getText()).isEqualTo("ab");
        assertThat(run.getDiagnostics()).extracting(Diagnostic::message).containsExactly("deep: StackOverflowError");
    }

    @Test
    @DisplayName("stage notes are collected")
    void notes() {
        Diagnostic note = Diagnostic.of(DiagnosticCategory.COMMAND, "noting", "look here");
        FormattingStage noting = stage("noting", t -> StageResult.success(t, List.of(note)));

        FormattingRun run = new FormattingPipeline(List.of(noting)).run("ab", context());

        assertThat(run.getDiagnostics()).containsExactly(note);
    }
}
