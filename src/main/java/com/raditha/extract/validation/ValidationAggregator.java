package com.raditha.extract.validation;

import com.raditha.extract.analysis.ComplexityCalculator;
import com.raditha.extract.analysis.VariableAnalysis;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.model.ExtractionAnalysis;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.ReturnAnalysis;
import com.raditha.extract.model.ReturnStrategy;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.model.VariableUsage;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges the analysis signals into one {@link ExtractionAnalysis} and raises the advisories
 * that depend on the whole picture.
 */
public class ValidationAggregator {

    private final ExtractionConfig config;

    public ValidationAggregator(ExtractionConfig config) {
        this.config = config;
    }

    /**
     * @param scope    enclosing function, null when the selection is not inside one
     * @param analysis variable analysis, {@link VariableAnalysis#empty()} when it could not run
     * @param returns  return shape, null when it could not be resolved
     */
    public ExtractionAnalysis aggregate(FunctionScope scope, VariableAnalysis analysis, ReturnAnalysis returns,
                                        ValidationReport report) {
        List<String> external = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        List<String> local = new ArrayList<>();
        List<String> undeclared = new ArrayList<>();

        for (VariableUsage usage : analysis.variables().values()) {
            String name = usage.name();
            if (usage.declaredInSelection()) {
                local.add(name);
                if (usage.usedAfterSelection()) {
                    report.addWarning(ValidationCodes.VARIABLE_NEEDS_RETURN,
                            "Variable '" + name + "' is declared in the extraction and used after it; "
                                    + "it must be returned");
                }
            } else if (usage.declaredBeforeSelection()) {
                external.add(name);
                if (usage.isModified()) {
                    modified.add(name);
                }
            } else {
                undeclared.add(name);
                report.addWarning(ValidationCodes.UNDECLARED_VARIABLE,
                        "Variable '" + name + "' is not declared in the enclosing function; "
                                + "it may be a field or a global");
            }
        }

        if (modified.size() > config.maxModifiedVariables()) {
            report.addWarning(ValidationCodes.TOO_MANY_MODIFIED_VARS,
                    modified.size() + " variables declared before the selection are modified in it ("
                            + String.join(", ", modified) + "); the extracted function may be hard to follow");
        }
        if (external.size() > config.maxExternalVariables()) {
            report.addWarning(ValidationCodes.TOO_MANY_DEPENDENCIES,
                    "The selection depends on " + external.size() + " variables from the enclosing function; "
                            + "consider a smaller extraction");
        }
        if (analysis.hasReturnStatements()) {
            report.addWarning(ValidationCodes.HAS_RETURN_STATEMENTS,
                    "The selection contains return statements; callers must handle the returned value");
            if (!modified.isEmpty()) {
                report.addWarning(ValidationCodes.COMPLEX_REFACTORING_NEEDED,
                        "The selection both returns and modifies " + String.join(", ", modified)
                                + "; the extraction needs manual restructuring");
            }
        }

        int complexity = analysis.cyclomaticComplexity();
        if (complexity > config.maxCyclomaticComplexity()) {
            report.addWarning(ValidationCodes.HIGH_COMPLEXITY,
                    "Cyclomatic complexity " + complexity + " exceeds " + config.maxCyclomaticComplexity());
        }
        int variableScore = ComplexityCalculator.variableComplexity(analysis.variables().values());
        if (variableScore > config.maxVariableComplexity()) {
            report.addWarning(ValidationCodes.HIGH_VARIABLE_COMPLEXITY,
                    "Variable complexity " + variableScore + " exceeds " + config.maxVariableComplexity());
        }

        ReturnStrategy strategy = returns == null ? ReturnStrategy.VOID : returns.strategy();
        if (returns != null && strategy != ReturnStrategy.VOID) {
            report.addWarning(ValidationCodes.RETURN_TYPE_ANALYSIS, returns.reason());
        }

        return new ExtractionAnalysis(
                scope == null ? "" : scope.qualifiedName(),
                scope != null,
                complexity,
                variableScore,
                external,
                modified,
                local,
                undeclared,
                strategy,
                analysis.hasReturnStatements(),
                analysis.variables(),
                returns);
    }
}
