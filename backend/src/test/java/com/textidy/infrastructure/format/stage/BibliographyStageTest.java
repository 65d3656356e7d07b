package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.textidy.infrastructure.format.FormatterFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class BibliographyStageTest {

    private final BibliographyStage stage = new BibliographyStage();

    private String apply(String text) {
        return stage.apply(text, context()).text();
    }

    @Test
    @DisplayName("citation keys are trimmed and joined with comma-space")
    void citationList() {
        assertThat(apply("\\cite{a,b ,  c}")).isEqualTo("\\cite{a, b, c}");
        assertThat(apply("\\citep [see][p. 5] { x,y }")).isEqualTo("\\citep[see][p. 5]{x, y}");
        assertThat(apply("\\citeauthor*{k1,k2}")).isEqualTo("\\citeauthor*{k1, k2}");
    }

    @Test
    @DisplayName("bibitem keys are trimmed and followed by one space")
    void bibitem() {
        assertThat(apply("\\bibitem{ knuth }Donald Knuth")).isEqualTo("\\bibitem{knuth} Donald Knuth");
        assertThat(apply("\\bibitem[K84]{knuth}   TeXbook")).isEqualTo("\\bibitem[K84]{knuth} TeXbook");
    }

    @Test
    @DisplayName("bibliography commands get blank lines around them")
    void spacing() {
        String text = "text\n\\bibliographystyle{ plain }\n\\bibliography{refs}\nmore";

        String once = apply(text);

        assertThat(once).isEqualTo("text\n\n\\bibliographystyle{plain}\n\n\\bibliography{refs}\n\nmore");
        assertThat(apply(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("citation normalization can be switched off separately")
    void citationsDisabled() {
        var ctx = context(Map.of(FormatterConfig.NORMALIZE_CITATIONS, false));

        assertThat(stage.apply("\\cite{a,b}", ctx).text()).isEqualTo("\\cite{a,b}");
    }
}
