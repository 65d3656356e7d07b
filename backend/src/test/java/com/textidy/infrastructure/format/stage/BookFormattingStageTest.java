package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.textidy.infrastructure.format.FormatterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class BookFormattingStageTest {

    private final BookFormattingStage stage = new BookFormattingStage();

    private final StageContext enabled = context(Map.of(FormatterConfig.BOOK_FORMATTING, true));

    private String apply(String text) {
        return stage.apply(text, enabled).text();
    }

    @Test
    @DisplayName("front matter, main matter and chapter page breaks are added")
    void structure() {
        String text = String.join("\n",
                "\\documentclass[a4paper]{book}",
                "\\begin{document}",
                "\\chapter*{Preface}",
                "Hi.",
                "\\chapter{One}",
                "A.",
                "\\chapter{Two}",
                "\\end{document}");

        String formatted = apply(text);

        assertThat(formatted).isEqualTo(String.join("\n",
                "\\documentclass[a4paper]{book}",
                "\\begin{document}",
                "\\frontmatter",
                "\\chapter*{Preface}",
                "Hi.",
                "\\mainmatter",
                "\\chapter{One}",
                "A.",
                "\\clearpage",
                "\\chapter{Two}",
                "\\end{document}"));
        assertThat(apply(formatted)).isEqualTo(formatted);
    }

    @Test
    @DisplayName("existing page breaks before a chapter are respected")
    void existingBreaks() {
        String text = String.join("\n",
                "\\documentclass{book}",
                "\\begin{document}",
                "\\frontmatter",
                "\\mainmatter",
                "\\chapter{A}",
                "x",
                "\\cleardoublepage",
                "",
                "\\chapter{B}",
                "\\end{document}");

        assertThat(apply(text)).isEqualTo(text);
    }

    @Test
    @DisplayName("other document classes are untouched")
    void otherClass() {
        String text = "\\documentclass{article}\n\\begin{document}\n\\chapter{A}\n\\end{document}";

        assertThat(apply(text)).isEqualTo(text);
    }
}
