package com.raditha.extract.validation;

import com.raditha.extract.model.ExtractionRequest;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.util.SourceText;

import java.util.List;

/**
 * Checks that run before any parsing: the name is present and the line range can be read.
 */
public class RequestValidator {

    /**
     * Validate the request shape.
     *
     * @return false when the range cannot be read and the pipeline has to stop
     */
    public boolean validate(ExtractionRequest request, ValidationReport report) {
        if (request.newName() == null || request.newName().isBlank()) {
            report.addError(ValidationCodes.METHOD_NAME_EMPTY, "Method name cannot be empty");
        }

        int lineCount = request.source().lineCount();
        int start = request.startLine();
        int end = request.endLine();
        boolean rangeOk = true;
        if (start < 1 || start > lineCount) {
            report.addError(ValidationCodes.START_LINE_INVALID,
                    "Start line " + start + " is outside the file (1-" + lineCount + ")");
            rangeOk = false;
        }
        if (end < 1 || end > lineCount) {
            report.addError(ValidationCodes.END_LINE_INVALID,
                    "End line " + end + " is outside the file (1-" + lineCount + ")");
            rangeOk = false;
        }
        if (rangeOk && start > end) {
            report.addError(ValidationCodes.LINE_RANGE_INVALID,
                    "Start line " + start + " is after end line " + end);
            rangeOk = false;
        }
        if (!rangeOk) {
            return false;
        }

        List<String> selected = request.source().lines().subList(start - 1, end);
        if (selected.stream().allMatch(SourceText::isBlankOrComment)) {
            report.addError(ValidationCodes.EMPTY_SELECTION, "Empty selection: the selected lines contain no code");
        }
        return true;
    }
}
