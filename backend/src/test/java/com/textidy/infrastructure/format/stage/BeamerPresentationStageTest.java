package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.textidy.infrastructure.format.FormatterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class BeamerPresentationStageTest {

    private final BeamerPresentationStage stage = new BeamerPresentationStage();

    private final StageContext enabled = context(Map.of(FormatterConfig.BEAMER_PRESENTATION, true));

    private String apply(String text) {
        return stage.apply(text, enabled).text();
    }

    @Test
    @DisplayName("frame titles attach to the frame and frames are separated")
    void frames() {
        String text = String.join("\n",
                "\\documentclass{beamer}",
                "\\begin{document}",
                "\\begin{frame} {Intro}",
                "Hi",
                "\\end{frame}",
                "\\begin{frame}[fragile]  {Code}",
                "x",
                "\\end{frame}",
                "\\end{document}");

        String formatted = apply(text);

        assertThat(formatted).isEqualTo(String.join("\n",
                "\\documentclass{beamer}",
                "\\begin{document}",
                "\\begin{frame}{Intro}",
                "Hi",
                "\\end{frame}",
                "",
                "\\begin{frame}[fragile]{Code}",
                "x",
                "\\end{frame}",
                "",
                "\\end{document}"));
        assertThat(apply(formatted)).isEqualTo(formatted);
    }

    @Test
    @DisplayName("a frame closing the text gets no trailing blank line")
    void lastFrame() {
        String text = "\\documentclass{beamer}\n\\begin{frame}{A}\n\\end{frame}";

        assertThat(apply(text)).isEqualTo(text);
    }

    @Test
    @DisplayName("other document classes are untouched")
    void otherClass() {
        String text = "\\documentclass{article}\n\\begin{frame} {A}\n\\end{frame}\nx";

        assertThat(apply(text)).isEqualTo(text);
    }
}
