package com.textidy.infrastructure.format.stage;

import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.domain.format.model.StageResult;
import com.textidy.infrastructure.format.pipeline.FormattingStage;
import com.textidy.infrastructure.format.pipeline.StageContext;
import com.textidy.infrastructure.format.text.LatexText;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sorts the package declarations of the preamble by package name and gathers them where the
 * first one stood, separated from surrounding text by blank lines.
 */
@Component
@Order(1000)
public class PackageSortStage implements FormattingStage {

    private static final Pattern PACKAGE_LINE = Pattern.compile("^\\\\usepackage[^{]*\\{([^}]+)\\}");

    @Override
    public String name() {
        return "packages";
    }

    @Override
    public StageResult apply(String text, StageContext context) {
        if (!context.flag(FormatterConfig.SORT_PACKAGES)) {
            return StageResult.success(text);
        }

        List<String> lines = LatexText.lines(text);
        List<PackageLine> packages = new ArrayList<>();
        Set<Integer> positions = new HashSet<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (LatexText.codePart(line).contains("\\begin{document}")) {
                break;
            }
            Matcher matcher = PACKAGE_LINE.matcher(line.strip());
            if (matcher.find()) {
                packages.add(new PackageLine(matcher.group(1).strip(), line.strip()));
                positions.add(i);
            }
        }

        if (packages.isEmpty()) {
            return StageResult.success(text);
        }

        packages.sort(Comparator.comparing(PackageLine::name));
        int insertAt = Collections.min(positions);

        List<String> result = new ArrayList<>(lines.size() + 2);
        for (int i = 0; i < lines.size(); i++) {
            if (!positions.contains(i)) {
                result.add(lines.get(i));
                continue;
            }
            if (i != insertAt) {
                continue;
            }

            if (!result.isEmpty() && !LatexText.isBlank(result.get(result.size() - 1))) {
                result.add("");
            }
            packages.forEach(p -> result.add(p.line()));

            int next = i + 1;
            while (next < lines.size() && positions.contains(next)) {
                next++;
            }
            if (next < lines.size() && !LatexText.isBlank(lines.get(next))) {
                result.add("");
            }
        }
        return StageResult.success(String.join("\n", result));
    }

    private record PackageLine(String name, String line) {}
}
