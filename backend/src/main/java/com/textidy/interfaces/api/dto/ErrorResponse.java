package com.textidy.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
