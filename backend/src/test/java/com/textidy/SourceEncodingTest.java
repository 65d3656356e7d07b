package com.textidy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * javac decodes unicode escapes before it tokenizes, comments and Javadoc included, so a stray
 * backslash-u in a LaTeX example breaks the build.
 */
class SourceEncodingTest {

    // An odd run of backslashes, one or more 'u', then anything but four hex digits
    private static final Pattern ILLEGAL_ESCAPE = Pattern.compile("(?<!\\\\)(\\\\\\\\)*\\\\u+(?![0-9a-fA-F]{4})");

    private static final List<Path> ROOTS = List.of(Path.of("src", "main", "java"), Path.of("src", "test", "java"));

    @Test
    @DisplayName("no source file contains an illegal unicode escape")
    void noIllegalEscapes() throws IOException {
        List<String> offenders = new ArrayList<>();
        for (Path file : javaFiles()) {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            for (int i = 0; i < lines.size(); i++) {
                Matcher matcher = ILLEGAL_ESCAPE.matcher(lines.get(i));
                if (matcher.find()) {
                    offenders.add(file + ":" + (i + 1));
                }
            }
        }

        assertThat(offenders).isEmpty();
    }

    @Test
    @DisplayName("sentinel and byte order mark characters are written as escapes")
    void noRawSentinels() throws IOException {
        List<String> offenders = new ArrayList<>();
        for (Path file : javaFiles()) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            boolean raw = content.chars().anyMatch(c -> c == 0xFEFF || (c >= 0xE000 && c <= 0xF8FF));
            if (raw) {
                offenders.add(file.toString());
            }
        }

        assertThat(offenders).isEmpty();
    }

    @Test
    @DisplayName("the escape check sees through even runs of backslashes")
    void escapeRules() {
        assertThat(ILLEGAL_ESCAPE.matcher("{@code \\usepackage}").find()).isTrue();
        assertThat(ILLEGAL_ESCAPE.matcher("\\\\\\usepackage").find()).isTrue();
        assertThat(ILLEGAL_ESCAPE.matcher("'\\uE000'").find()).isFalse();
        assertThat(ILLEGAL_ESCAPE.matcher("\"\\\\usepackage\"").find()).isFalse();
    }

    private static List<Path> javaFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path root : ROOTS) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            try (Stream<Path> walk = Files.walk(root)) {
                walk.filter(p -> p.toString().endsWith(".java")).forEach(files::add);
            }
        }
        assertThat(files).isNotEmpty();
        return files;
    }
}
