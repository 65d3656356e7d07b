package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Slide layout for the {@code beamer} class: frame titles attach to their frame and frames are
 * separated by a blank line.
 */
@Component
@Order(270)
public class BeamerPresentationStage implements FormattingStage {

    private static final String BEAMER = "beamer";
    private static final Pattern FRAME_TITLE = Pattern.compile("(\\\\begin\\{frame\\}(?:\\[[^\\]\\n]*\\])?)[ \\t]+\\{");
    private static final Pattern END_FRAME = Pattern.compile("\\\\end\\s*\\{frame\\}");

    @Override
    public String name() {
        return "beamer-presentation";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.BEAMER_PRESENTATION) || !BEAMER.equals(LatexText.documentClass(text))) {
            return StageResult.success(text);
        }

        List<String> lines = LatexText.lines(FRAME_TITLE.matcher(text).replaceAll("$1{"));
        List<String> result = new ArrayList<>(lines.size() + 8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            result.add(line);
            boolean endsFrame = END_FRAME.matcher(LatexText.codePart(line).strip()).lookingAt();
            if (endsFrame && i + 1 < lines.size() && !LatexText.isBlank(lines.get(i + 1))) {
                result.add("");
            }
        }
        return StageResult.success(String.join("\n", result));
    }
}
