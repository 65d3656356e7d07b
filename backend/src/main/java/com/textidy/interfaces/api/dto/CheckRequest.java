package com.textidy.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;

public record CheckRequest(
        @NotNull(message = "Text is required")
        String text
) {}
