package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.math.MathSpan;
import com.textidy.infrastructure.format.math.MathSpanScanner;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns straight quotes in running text into TeX quotes. Math, accents such as {@code \"o}
 * and apostrophes are left alone.
 */
@Component
@Order(1100)
public class QuoteStage implements FormattingStage {

    private static final Pattern DOUBLE_QUOTED = Pattern.compile("(?<!\\\\)\"([^\"\\n]*)\"");
    private static final Pattern SINGLE_QUOTED = Pattern.compile("(?<![\\\\\\w'`])'([^'\\n]+?)'(?![\\w'])");

    @Override
    public String name() {
        return "quotes";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.NORMALIZE_QUOTES)) {
            return StageResult.success(text);
        }

        List<MathSpan> spans = new MathSpanScanner(context.symbols()).scan(text);
        StringBuilder out = new StringBuilder(text.length() + 16);
        int last = 0;
        for (MathSpan span : spans) {
            out.append(convert(text.substring(last, span.start())));
            out.append(text, span.start(), span.end());
            last = span.end();
        }
        out.append(convert(text.substring(last)));
        return StageResult.success(out.toString());
    }

    static String convert(String prose) {
        String result = DOUBLE_QUOTED.matcher(prose).replaceAll("``$1''");
        return SINGLE_QUOTED.matcher(result).replaceAll("`$1'");
    }
}
