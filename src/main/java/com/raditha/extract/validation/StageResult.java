package com.raditha.extract.validation;

import java.util.List;

/**
 * Result of one syntax gate stage.
 *
 * @param stage       1 for the minimal scaffold, 2 for the enriched one
 * @param status      outcome
 * @param diagnostics problems that decided the outcome, expected ones already removed
 * @param detail      short explanation for logs
 */
public record StageResult(int stage, StageStatus status, List<ScaffoldDiagnostic> diagnostics, String detail) {

    public StageResult {
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static StageResult accepted(int stage) {
        return new StageResult(stage, StageStatus.ACCEPTED, List.of(), "scaffold parsed cleanly");
    }

    public static StageResult skipped(int stage, String detail) {
        return new StageResult(stage, StageStatus.SKIPPED, List.of(), detail);
    }
}
