package com.textidy.infrastructure.format.validation;

import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticCategory;
import com.textidy.infrastructure.format.protection.PatternStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SyntaxValidatorTest {

    private SyntaxValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SyntaxValidator(PatternStore.defaults());
    }

    @Nested
    @DisplayName("braces")
    class Braces {

        @Test
        @DisplayName("unclosed group reports the exact number of open braces")
        void unclosed() {
            assertThat(validator.messages("\\textbf{bold")).containsExactly("Unmatched opening braces: 1");
            assertThat(validator.messages("{{a}")).containsExactly("Unmatched opening braces: 1");
            assertThat(validator.messages("{{{")).containsExactly("Unmatched opening braces: 3");
        }

        @Test
        @DisplayName("excess closers are reported once")
        void excessClosers() {
            assertThat(validator.messages("text}")).containsExactly("Unmatched closing braces: 1");
            assertThat(validator.messages("a}}} b}")).containsExactly("Unmatched closing braces: 1");
        }

        @Test
        @DisplayName("scan continues after an excess closer")
        void closerThenOpener() {
            assertThat(validator.messages("} {")).containsExactly(
                    "Unmatched closing braces: 1",
                    "Unmatched opening braces: 1");
        }

        @Test
        @DisplayName("escaped braces and comments do not count")
        void escapedAndComments() {
            assertThat(validator.check("\\{ set \\} % {")).isEmpty();
            assertThat(validator.check("50\\% {ok}")).isEmpty();
        }

        @Test
        @DisplayName("diagnostics carry the line of the problem")
        void lineNumbers() {
            List<Diagnostic> diagnostics = validator.check("first\nsecond}\n");

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0).line()).isEqualTo(2);
            assertThat(diagnostics.get(0).category()).isEqualTo(DiagnosticCategory.BRACE);
        }
    }

    @Nested
    @DisplayName("environments")
    class Environments {

        @Test
        @DisplayName("matched pairs are fine")
        void matched() {
            assertThat(validator.check("\\begin{itemize}\n\\item a\n\\end{itemize}")).isEmpty();
        }

        @Test
        @DisplayName("an end for a different environment names both")
        void mismatch() {
            assertThat(validator.messages("\\begin{itemize}\n\\item a\n\\end{enumerate}")).containsExactly(
                    "Environment mismatch: expected \\end{itemize}, found \\end{enumerate}",
                    "Unmatched \\end{enumerate} - no corresponding \\begin",
                    "Unmatched environment \\begin{itemize} - missing \\end{itemize}");
        }

        @Test
        @DisplayName("an end matching a deeper frame unwinds the frames above it")
        void recovery() {
            assertThat(validator.messages("\\begin{figure}\n\\begin{center}\n\\end{figure}")).containsExactly(
                    "Environment mismatch: expected \\end{center}, found \\end{figure}",
                    "Unmatched \\begin{center}");
        }

        @Test
        @DisplayName("an end with nothing open")
        void strayEnd() {
            assertThat(validator.messages("text\n\\end{quote}"))
                    .containsExactly("Unmatched \\end{quote} - no corresponding \\begin");
        }

        @Test
        @DisplayName("leftover frames are reported from the outermost in")
        void leftovers() {
            assertThat(validator.messages("\\begin{a}\\begin{b}")).containsExactly(
                    "Unmatched environment \\begin{a} - missing \\end{a}",
                    "Unmatched environment \\begin{b} - missing \\end{b}");
        }

        @Test
        @DisplayName("a second document environment is reported")
        void twoDocuments() {
            String text = "\\begin{document}\n\\end{document}\n\\begin{document}\n\\end{document}";

            assertThat(validator.messages(text))
                    .containsExactly("Multiple \\begin{document} environments found - only one is allowed");
        }

        @Test
        @DisplayName("brace diagnostics come before environment diagnostics")
        void ordering() {
            assertThat(validator.messages("\\begin{x}\n{")).containsExactly(
                    "Unmatched opening braces: 1",
                    "Unmatched environment \\begin{x} - missing \\end{x}");
        }
    }

    @Nested
    @DisplayName("verbatim exemption")
    class Verbatim {

        @Test
        @DisplayName("problems inside verbatim blocks are ignored")
        void verbatimBlock() {
            String text = "\\begin{verbatim}\n{ \\begin{x} }}\n\\end{verbatim}\n\\begin{lstlisting}\n\\end{y}\n\\end{lstlisting}";

            assertThat(validator.check(text)).isEmpty();
        }

        @Test
        @DisplayName("inline verb is ignored")
        void inlineVerb() {
            assertThat(validator.check("type \\verb|{| to open")).isEmpty();
        }

        @Test
        @DisplayName("line numbers after a verbatim block stay correct")
        void linesAfterVerbatim() {
            List<Diagnostic> diagnostics = validator.check("\\begin{verbatim}\n}\n\\end{verbatim}\n}");

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0).line()).isEqualTo(4);
        }
    }
}
