package com.textidy.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record FormatRequest(
        @NotNull(message = "Text is required")
        String text,

        Map<String, Object> options
) {}
