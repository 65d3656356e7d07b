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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Article conventions: a title block is typeset once an author is declared, and every section
 * heading is set off by a blank line.
 * <p>
 * The title command goes right after the line opening the document body when the author sits
 * in the preamble, otherwise after the line that closes the author argument.
 * </p>
 */
@Component
@Order(250)
public class AcademicPaperStage implements FormattingStage {

    private static final Pattern AUTHOR = Pattern.compile("\\\\author\\s*(?:\\[[^\\]]*\\])?\\s*\\{");
    private static final Pattern MAKETITLE = Pattern.compile("\\\\maketitle(?![a-zA-Z])");
    private static final Pattern BEGIN_DOCUMENT = Pattern.compile("\\\\begin\\s*\\{document\\}");
    private static final Pattern SECTION = Pattern.compile("\\\\section\\*?\\s*[\\[{]");
    private static final String MAKETITLE_LINE = "\\maketitle";

    @Override
    public String name() {
        return "academic-paper";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.ACADEMIC_PAPER)) {
            return StageResult.success(text);
        }

        List<String> lines = new ArrayList<>(LatexText.lines(text));
        int titleAfter = titleLine(LatexText.stripComments(text));
        if (titleAfter >= 0) {
            lines.add(titleAfter + 1, MAKETITLE_LINE);
        }
        return StageResult.success(String.join("\n", separateSections(lines)));
    }

    /**
     * 0-based line after which the title command belongs, or -1 when none is needed.
     */
    private static int titleLine(String code) {
        Matcher author = AUTHOR.matcher(code);
        if (!find(author, code) || find(MAKETITLE.matcher(code), code)) {
            return -1;
        }
        int authorEnd = LatexText.matchingBrace(code, author.end() - 1);
        if (authorEnd < 0) {
            return -1;
        }

        Matcher begin = BEGIN_DOCUMENT.matcher(code);
        if (find(begin, code) && author.start() < begin.start()) {
            return LatexText.lineOf(code, begin.start()) - 1;
        }
        return LatexText.lineOf(code, authorEnd - 1) - 1;
    }

    private static List<String> separateSections(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size() + 8);
        for (String line : lines) {
            boolean heading = SECTION.matcher(LatexText.codePart(line).strip()).lookingAt();
            if (heading && !result.isEmpty() && !LatexText.isBlank(result.get(result.size() - 1))) {
                result.add("");
            }
            result.add(line);
        }
        return result;
    }

    private static boolean find(Matcher matcher, String code) {
        while (matcher.find()) {
            if (!LatexText.isEscaped(code, matcher.start())) {
                return true;
            }
        }
        return false;
    }
}
