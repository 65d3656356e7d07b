package com.textidy.domain.format.model;

public enum DiagnosticCategory {
    BRACE,
    ENVIRONMENT,
    STAGE_FAULT,
    PATTERN,
    COMMAND,
    CROSS_REFERENCE,
    LINE_LENGTH,
    SUGGESTION
}
