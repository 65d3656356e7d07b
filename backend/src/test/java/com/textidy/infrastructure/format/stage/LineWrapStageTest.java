package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.textidy.infrastructure.format.FormatterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class LineWrapStageTest {

    private final LineWrapStage stage = new LineWrapStage();

    private final StageContext narrow = context(Map.of(
            FormatterConfig.WRAP_LONG_LINES, true,
            FormatterConfig.LINE_LENGTH, 20));

    private String apply(String text) {
        return stage.apply(text, narrow).text();
    }

    @Test
    @DisplayName("long prose wraps greedily and keeps its indentation")
    void wraps() {
        assertThat(apply("  one two three four five six")).isEqualTo("  one two three four\n  five six");
    }

    @Test
    @DisplayName("braces and inline math are never split")
    void unbreakableGroups() {
        String formatted = apply("see $a + b + c$ and \\textbf{very bold words}");

        assertThat(formatted).isEqualTo("see $a + b + c$ and\n\\textbf{very bold words}");
        assertThat(apply(formatted)).isEqualTo(formatted);
    }

    @Test
    @DisplayName("commands, environments, comments and table rows are left alone")
    void skipped() {
        String text = String.join("\n",
                "\\section{A rather long heading text}",
                "text \\begin{center} and more words here",
                "some prose words here % and a comment",
                "cell one & cell two & cell three",
                "row text goes on and on \\\\");

        assertThat(apply(text)).isEqualTo(text);
    }

    @Test
    @DisplayName("off by default")
    void disabled() {
        String text = "word ".repeat(30).strip();

        assertThat(stage.apply(text, context()).text()).isEqualTo(text);
    }

    @Test
    @DisplayName("words split on blanks outside groups only")
    void words() {
        assertThat(LineWrapStage.words("a  {b c} $d e$ \\ f"))
                .containsExactly("a", "{b c}", "$d e$", "\\ f");
    }
}
