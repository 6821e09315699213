package com.raditha.extract.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final report for an extraction request.
 *
 * @param isValid             no blocking error was raised
 * @param errors              blocking problems, in the order found
 * @param warnings            advisory problems, in the order found
 * @param analysis            gathered analysis, null when the request failed before analysis
 * @param suggestedParameters parameter declarations for the extracted function
 * @param suggestedReturnType return type for the extracted function
 * @param returnTypeReason    why that return type was chosen
 */
public record ValidationResult(
        @JsonProperty("isValid") boolean isValid,
        List<ValidationMessage> errors,
        List<ValidationMessage> warnings,
        ExtractionAnalysis analysis,
        List<String> suggestedParameters,
        String suggestedReturnType,
        String returnTypeReason) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        suggestedParameters = List.copyOf(suggestedParameters);
    }

    public boolean hasError(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }

    public boolean hasWarning(String code) {
        return warnings.stream().anyMatch(w -> w.code().equals(code));
    }
}
