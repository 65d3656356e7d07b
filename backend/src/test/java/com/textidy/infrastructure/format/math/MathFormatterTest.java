package com.textidy.infrastructure.format.math;

import com.textidy.domain.format.model.SymbolTable;
import com.textidy.infrastructure.format.FormatterFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MathFormatterTest {

    private final MathFormatter formatter = new MathFormatter();
    private final SymbolTable symbols = FormatterFixtures.PATTERNS.symbolTable();

    private String format(String text) {
        return formatter.format(text, symbols);
    }

    @Nested
    @DisplayName("operators")
    class Operators {

        @Test
        @DisplayName("binary operators get one space each side")
        void binary() {
            assertThat(format("$x+y-z=a$")).isEqualTo("$x + y - z = a$");
            assertThat(format("$a<=b$")).isEqualTo("$a <= b$");
            assertThat(format("$a   =    b$")).isEqualTo("$a = b$");
        }

        @Test
        @DisplayName("unary signs stay attached")
        void unary() {
            assertThat(format("$-1$")).isEqualTo("$-1$");
            assertThat(format("$f(-x)$")).isEqualTo("$f(-x)$");
            assertThat(format("$a=-b$")).isEqualTo("$a = -b$");
            assertThat(format("$x^=$")).isEqualTo("$x^=$");
        }

        @Test
        @DisplayName("braced groups are copied verbatim")
        void braces() {
            assertThat(format("$x^{a+b}$")).isEqualTo("$x^{a+b}$");
        }
    }

    @Nested
    @DisplayName("scripts and constructs")
    class Scripts {

        @Test
        @DisplayName("blanks around sub and superscripts are removed")
        void scripts() {
            assertThat(format("$x _ {i+1} ^ 2$")).isEqualTo("$x_{i+1}^2$");
        }

        @Test
        @DisplayName("construct arguments are pulled to the command")
        void constructs() {
            assertThat(format("$\\frac {a+b} {c}$")).isEqualTo("$\\frac{a+b}{c}$");
            assertThat(format("$\\sum _ {i=1} ^ {n} x$")).isEqualTo("$\\sum_{i=1}^{n} x$");
        }
    }

    @Nested
    @DisplayName("delimiters")
    class Delimiters {

        @Test
        @DisplayName("every delimiter kind is recognised and its body trimmed")
        void kinds() {
            assertThat(format("$$ a=b $$")).isEqualTo("$$a = b$$");
            assertThat(format("\\( x=1 \\)")).isEqualTo("\\(x = 1\\)");
            assertThat(format("\\[ x=1 \\]")).isEqualTo("\\[x = 1\\]");
        }

        @Test
        @DisplayName("letters touching a dollar are separated")
        void adjacentLetters() {
            assertThat(format("x$a$y")).isEqualTo("x $a$ y");
        }

        @Test
        @DisplayName("multi-line environments keep their layout")
        void environment() {
            String text = "\\begin{align}\n  a&=b+c \\\\\n  d&=e\n\\end{align}";

            assertThat(format(text)).isEqualTo("\\begin{align}\n  a &= b + c \\\\\n  d &= e\n\\end{align}");
        }

        @Test
        @DisplayName("relations at alignment points are spaced and stay attached to the ampersand")
        void alignmentPoints() {
            String text = "\\begin{align*}\na&=b\\\\\nc  &<=   d\n  &=e\n\\end{align*}";

            String formatted = format(text);

            assertThat(formatted).isEqualTo("\\begin{align*}\na &= b\\\\\nc &<= d\n  &= e\n\\end{align*}");
            assertThat(format(formatted)).isEqualTo(formatted);
        }

        @Test
        @DisplayName("indentation before a script or an operator survives on continuation lines")
        void continuationLines() {
            String text = "\\begin{equation}\n  x\n  ^{2} = y\n  = z\n\\end{equation}";

            assertThat(format(text)).isEqualTo(text);
        }

        @Test
        @DisplayName("unterminated, escaped and commented dollars are not math")
        void notMath() {
            assertThat(format("costs $5 and more")).isEqualTo("costs $5 and more");
            assertThat(format("\\$a=b\\$")).isEqualTo("\\$a=b\\$");
            assertThat(format("% $x+y$\n$a=b$")).isEqualTo("% $x+y$\n$a = b$");
        }
    }

    @Test
    @DisplayName("formatting is idempotent")
    void idempotent() {
        String once = format("We have $x+y=z$ and \\[ \\frac {1} {2}+x \\] done");

        assertThat(format(once)).isEqualTo(once);
    }
}
