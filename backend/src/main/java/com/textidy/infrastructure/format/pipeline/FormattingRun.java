package com.textidy.infrastructure.format.pipeline;

import com.textidy.domain.format.model.Diagnostic;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one pipeline run. Accumulates the text and the diagnostics of each stage.
 */
@Data
public class FormattingRun {

    // --- Input ---
    private final String inputText;

    // --- Progress ---
    private String text;
    private List<String> completedStages = new ArrayList<>();
    private List<String> failedStages = new ArrayList<>();

    // --- Diagnostics ---
    private List<Diagnostic> diagnostics = new ArrayList<>();

    public FormattingRun(String inputText) {
        this.inputText = inputText;
        this.text = inputText;
    }

    public boolean hasFaults() {
        return !failedStages.isEmpty();
    }
}
