package com.textidy.infrastructure.format;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.textidy.domain.format.model.FormatterConfig;
import com.textidy.infrastructure.format.protection.JsonPatternSource;
import com.textidy.infrastructure.format.protection.PatternStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.Map;

@Configuration
public class FormatterConfiguration {

    @Value("${formatter.patterns.location:classpath:patterns/}")
    private String patternLocation;

    @Value("${formatter.indent-size:2}")
    private int indentSize;

    @Value("${formatter.max-empty-lines:2}")
    private int maxEmptyLines;

    @Value("${formatter.line-length:80}")
    private int lineLength;

    @Value("${formatter.comment-column:50}")
    private int commentColumn;

    @Bean
    public PatternStore patternStore(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return new PatternStore(new JsonPatternSource(resourceLoader, objectMapper, patternLocation));
    }

    /**
     * Service-wide defaults; request options are laid over these.
     */
    @Bean
    public FormatterConfig defaultFormatterConfig() {
        return FormatterConfig.defaults().withOverrides(Map.of(
                FormatterConfig.INDENT_SIZE, indentSize,
                FormatterConfig.MAX_EMPTY_LINES, maxEmptyLines,
                FormatterConfig.LINE_LENGTH, lineLength,
                FormatterConfig.COMMENT_COLUMN, commentColumn
        ));
    }
}
