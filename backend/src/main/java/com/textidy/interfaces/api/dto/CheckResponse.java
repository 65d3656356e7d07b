package com.textidy.interfaces.api.dto;

import com.textidy.domain.format.model.CheckResult;

import java.util.List;

public record CheckResponse(
        boolean valid,
        List<DiagnosticDto> issues,
        List<DiagnosticDto> warnings,
        List<DiagnosticDto> suggestions
) {

    public static CheckResponse from(CheckResult result) {
        return new CheckResponse(result.valid(),
                DiagnosticDto.fromAll(result.issues()), DiagnosticDto.fromAll(result.warnings()),
                DiagnosticDto.fromAll(result.suggestions()));
    }
}
