package com.raditha.extract.validation;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.SourceModel;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the proposed function name: identifier grammar, reserved words, naming convention
 * and collisions with functions that already exist next to the enclosing one.
 */
public class NamingValidator {

    private static final Logger logger = LoggerFactory.getLogger(NamingValidator.class);

    private final HostDialect dialect;

    public NamingValidator(HostDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Grammar, keyword and convention checks. A blank name is reported by {@link RequestValidator}.
     */
    public void checkName(String name, ValidationReport report) {
        if (name == null || name.isBlank()) {
            return;
        }
        char first = name.charAt(0);
        if (!Character.isLetter(first) && first != '_' && first != dialect.identifierSigil()) {
            report.addError(ValidationCodes.METHOD_NAME_INVALID_START,
                    "Method name '" + name + "' must start with a letter, '_' or '" + dialect.identifierSigil() + "'");
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_' && c != dialect.identifierSigil()) {
                report.addError(ValidationCodes.METHOD_NAME_INVALID_CHARS,
                        "Method name '" + name + "' contains invalid character '" + c + "'");
                break;
            }
        }
        if (dialect.isReserved(name)) {
            report.addError(ValidationCodes.METHOD_NAME_RESERVED,
                    "'" + name + "' is a reserved keyword in " + dialect.languageName()
                            + " and cannot be used as a function name");
        } else if (!dialect.followsNamingConvention(name)) {
            report.addWarning(ValidationCodes.METHOD_NAME_CONVENTION,
                    "Method name '" + name + "' does not follow the lowerCamelCase convention");
        }
    }

    /**
     * Report a function with the same name in the same container as the enclosing function.
     * Module-level TypeScript functions share the empty container.
     */
    public void checkConflicts(String name, FunctionScope enclosing, SourceModel structure, ValidationReport report) {
        if (name == null || name.isBlank() || enclosing == null) {
            return;
        }
        try {
            for (FunctionScope function : structure.functions()) {
                if (function.name().equals(name) && function.container().equals(enclosing.container())) {
                    String where = enclosing.container().isEmpty() ? "this module" : "'" + enclosing.container() + "'";
                    report.addError(ValidationCodes.METHOD_NAME_CONFLICT,
                            "A function named '" + name + "' already exists in " + where
                                    + " (line " + function.range().startLine() + ")");
                    return;
                }
            }
        } catch (Exception e) {
            logger.warn("Name conflict scan failed: {}", e.getMessage());
            report.addWarning(ValidationCodes.NAME_CONFLICT_CHECK_FAILED,
                    "Could not check for existing functions named '" + name + "': " + e.getMessage());
        }
    }
}
