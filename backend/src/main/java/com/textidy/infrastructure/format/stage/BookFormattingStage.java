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
 * Book structure for the {@code book} class: front matter opens the body, main matter starts at
 * the first numbered chapter and every numbered chapter starts on a fresh page.
 */
@Component
@Order(260)
public class BookFormattingStage implements FormattingStage {

    private static final String BOOK = "book";
    private static final Pattern BEGIN_DOCUMENT = Pattern.compile("\\\\begin\\s*\\{document\\}");
    private static final Pattern CHAPTER = Pattern.compile("\\\\chapter\\s*(?:\\[[^\\]]*\\])?\\s*\\{");
    private static final Pattern FRONTMATTER = Pattern.compile("\\\\frontmatter(?![a-zA-Z])");
    private static final Pattern MAINMATTER = Pattern.compile("\\\\mainmatter(?![a-zA-Z])");
    private static final Pattern PAGE_BREAK = Pattern.compile(
            "\\\\(?:clearpage|cleardoublepage|newpage|mainmatter)(?![a-zA-Z])");

    @Override
    public String name() {
        return "book-formatting";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.BOOK_FORMATTING) || !BOOK.equals(LatexText.documentClass(text))) {
            return StageResult.success(text);
        }

        String code = LatexText.stripComments(text);
        boolean frontmatterPending = !FRONTMATTER.matcher(code).find();
        boolean mainmatterPending = !MAINMATTER.matcher(code).find();

        List<String> result = new ArrayList<>();
        for (String line : LatexText.lines(text)) {
            String stripped = LatexText.codePart(line).strip();

            if (CHAPTER.matcher(stripped).lookingAt()) {
                if (mainmatterPending) {
                    result.add("\\mainmatter");
                    mainmatterPending = false;
                } else if (!followsPageBreak(result)) {
                    result.add("\\clearpage");
                }
            }
            result.add(line);

            if (frontmatterPending && BEGIN_DOCUMENT.matcher(stripped).lookingAt()) {
                result.add("\\frontmatter");
                frontmatterPending = false;
            }
        }
        return StageResult.success(String.join("\n", result));
    }

    private static boolean followsPageBreak(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            String code = LatexText.codePart(lines.get(i)).strip();
            if (!code.isEmpty()) {
                return PAGE_BREAK.matcher(code).matches();
            }
        }
        return false;
    }
}
