package com.raditha.extract.validation;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.model.ExtractionOptions;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.util.SourceText;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rules tying the selected code to the modifiers requested for the new function.
 */
public class SelectionRuleValidator {

    private static final Pattern THIS = Pattern.compile("\\bthis\\b");
    private static final Pattern AWAIT = Pattern.compile("\\bawait\\b");

    private final HostDialect dialect;

    public SelectionRuleValidator(HostDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * @param selectedLines raw selected lines
     * @param options       requested modifiers
     */
    public void check(List<String> selectedLines, ExtractionOptions options, ValidationReport report) {
        List<String> stripped = SourceText.stripCommentsAndStrings(selectedLines);
        String code = String.join("\n", stripped);

        if (options.isStatic() && THIS.matcher(code).find()) {
            report.addError(ValidationCodes.THIS_IN_STATIC_CONTEXT,
                    "The selection references 'this' and cannot be extracted into a static function");
        }

        if (options.isAsync() && !dialect.supportsAsync()) {
            report.addWarning(ValidationCodes.UNSUPPORTED_MODIFIER,
                    dialect.languageName() + " has no async functions; the async modifier is ignored");
        } else if (!options.isAsync() && dialect.supportsAsync() && AWAIT.matcher(code).find()) {
            report.addWarning(ValidationCodes.ASYNC_REQUIRED,
                    "The selection uses 'await'; the extracted function must be async");
        }

        for (int i = stripped.size() - 1; i >= 0; i--) {
            String line = stripped.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            if (!line.endsWith(";") && !line.endsWith("}")) {
                report.addWarning(ValidationCodes.INCOMPLETE_STATEMENT,
                        "The selection does not end with a complete statement");
            }
            break;
        }
    }
}
