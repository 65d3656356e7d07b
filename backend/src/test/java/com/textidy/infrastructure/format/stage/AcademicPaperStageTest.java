package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.textidy.infrastructure.format.FormatterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class AcademicPaperStageTest {

    private final AcademicPaperStage stage = new AcademicPaperStage();

    private final StageContext enabled = context(Map.of(FormatterConfig.ACADEMIC_PAPER, true));

    private String apply(String text) {
        return stage.apply(text, enabled).text();
    }

    @Test
    @DisplayName("title block follows the document start when the author is in the preamble")
    void titleAfterBeginDocument() {
        String text = String.join("\n",
                "\\documentclass{article}",
                "\\author{Ada}",
                "\\begin{document}",
                "Intro.",
                "\\section{Methods}",
                "Text.",
                "\\end{document}");

        String formatted = apply(text);

        assertThat(formatted).isEqualTo(String.join("\n",
                "\\documentclass{article}",
                "\\author{Ada}",
                "\\begin{document}",
                "\\maketitle",
                "Intro.",
                "",
                "\\section{Methods}",
                "Text.",
                "\\end{document}"));
        assertThat(apply(formatted)).isEqualTo(formatted);
    }

    @Test
    @DisplayName("an author declared in the body gets the title block after its closing brace")
    void titleAfterAuthor() {
        String text = "\\begin{document}\n\\author{Ada \\and\n  Bob}\nBody";

        assertThat(apply(text)).isEqualTo("\\begin{document}\n\\author{Ada \\and\n  Bob}\n\\maketitle\nBody");
    }

    @Test
    @DisplayName("an existing title block is not duplicated")
    void existingTitle() {
        String text = "\\author{Ada}\n\\begin{document}\n\\maketitle\nBody";

        assertThat(apply(text)).isEqualTo(text);
    }

    @Test
    @DisplayName("section headings are set off by a blank line, except at the top")
    void sections() {
        assertThat(apply("\\section*{A}\ntext\n\\section{B}\n\n\\section{C}"))
                .isEqualTo("\\section*{A}\ntext\n\n\\section{B}\n\n\\section{C}");
    }

    @Test
    @DisplayName("off by default")
    void disabled() {
        String text = "\\author{Ada}\ntext\n\\section{B}";

        assertThat(stage.apply(text, context()).text()).isEqualTo(text);
    }
}
