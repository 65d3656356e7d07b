package com.textidy.infrastructure.format.pipeline;

import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Minimal cleanup used when the full pipeline cannot complete: unified line endings,
 * no trailing whitespace and a final newline.
 */
@Component
public class DegradedFormatter {

    public String format(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        String stripped = LatexText.lines(normalized).stream()
                .map(LatexText::stripTrailing)
                .collect(Collectors.joining("\n"));
        return stripped.endsWith("\n") ? stripped : stripped + "\n";
    }
}
