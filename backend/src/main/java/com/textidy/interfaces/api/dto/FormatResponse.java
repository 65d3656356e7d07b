package com.textidy.interfaces.api.dto;

import com.textidy.domain.format.model.FormatResult;

import java.util.List;

public record FormatResponse(
        String formattedText,
        boolean changed,
        List<DiagnosticDto> diagnostics,
        boolean degraded
) {

    public static FormatResponse from(FormatResult result) {
        return new FormatResponse(result.text(), result.changed(),
                DiagnosticDto.fromAll(result.diagnostics()), result.degraded());
    }
}
