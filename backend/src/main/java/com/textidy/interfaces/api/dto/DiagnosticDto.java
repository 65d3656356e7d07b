package com.textidy.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.textidy.domain.format.model.Diagnostic;
import com.textidy.domain.format.model.DiagnosticClassifier;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticDto(
        String category,
        String source,
        String message,
        Integer line,
        String severity,
        String suggestion
) {

    public static DiagnosticDto from(Diagnostic diagnostic) {
        return new DiagnosticDto(diagnostic.category().name(), diagnostic.source(),
                diagnostic.message(), diagnostic.line(),
                diagnostic.severity().name(), DiagnosticClassifier.suggestion(diagnostic));
    }

    public static List<DiagnosticDto> fromAll(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(DiagnosticDto::from).toList();
    }
}
