package com.textidy.infrastructure.format.protection;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@code scientific_patterns.json} and {@code math_patterns.json} from a Spring resource
 * location such as {@code classpath:patterns/} or {@code file:/etc/textidy/}.
 * Each file falls back to the built-in data on its own when it is missing or malformed.
 */
@Slf4j
public class JsonPatternSource implements PatternSource {

    static final String PROTECTION_FILE = "scientific_patterns.json";
    static final String SYMBOLS_FILE = "math_patterns.json";

    private static final TypeReference<LinkedHashMap<String, List<String>>> CATEGORY_MAP =
            new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public JsonPatternSource(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = location.endsWith("/") ? location : location + "/";
    }

    @Override
    public Optional<PatternDefinitions> load() {
        LinkedHashMap<String, List<String>> protection = read(PROTECTION_FILE);
        LinkedHashMap<String, List<String>> symbols = read(SYMBOLS_FILE);

        if (protection == null && symbols == null) {
            return Optional.empty();
        }

        return Optional.of(new PatternDefinitions(
                protection != null ? protection : DefaultPatterns.PROTECTION,
                symbols != null ? symbols : DefaultPatterns.SYMBOLS
        ));
    }

    private LinkedHashMap<String, List<String>> read(String fileName) {
        Resource resource = resourceLoader.getResource(location + fileName);
        if (!resource.exists()) {
            log.warn("Pattern file {}{} not found, using built-in defaults", location, fileName);
            return null;
        }

        try (InputStream in = resource.getInputStream()) {
            LinkedHashMap<String, List<String>> data = objectMapper.readValue(in, CATEGORY_MAP);
            if (data == null) {
                log.warn("Pattern file {}{} is empty, using built-in defaults", location, fileName);
            }
            return data;
        } catch (IOException e) {
            log.warn("Could not load pattern file {}{}: {}", location, fileName, e.getMessage());
            return null;
        }
    }
}
