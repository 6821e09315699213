package com.raditha.extract.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates errors and warnings while a request moves through the pipeline.
 * Messages are only ever appended, so once an error is present the report stays invalid.
 */
public class ValidationReport {
    private final List<ValidationMessage> errors = new ArrayList<>();
    private final List<ValidationMessage> warnings = new ArrayList<>();

    public void addError(String code, String message) {
        errors.add(new ValidationMessage(code, message));
    }

    public void addWarning(String code, String message) {
        warnings.add(new ValidationMessage(code, message));
    }

    public void addWarningOnce(String code, String message) {
        if (!hasWarning(code)) {
            addWarning(code, message);
        }
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(w -> w.code().equals(code));
    }

    public List<ValidationMessage> errors() {
        return List.copyOf(errors);
    }

    public List<ValidationMessage> warnings() {
        return List.copyOf(warnings);
    }

    /**
     * Freeze the report into a result.
     */
    public ValidationResult toResult(ExtractionAnalysis analysis, List<String> suggestedParameters,
                                     String suggestedReturnType, String returnTypeReason) {
        return new ValidationResult(isValid(), errors, warnings, analysis,
                suggestedParameters, suggestedReturnType, returnTypeReason);
    }
}
