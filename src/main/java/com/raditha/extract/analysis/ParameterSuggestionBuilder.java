package com.raditha.extract.analysis;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.model.VariableUsage;

import java.util.Comparator;
import java.util.List;

/**
 * Turns the variables flowing into a selection into parameters of the extracted function.
 */
public class ParameterSuggestionBuilder {

    private final HostDialect dialect;

    public ParameterSuggestionBuilder(HostDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * Parameters ordered by the line where each variable is first used, then by name.
     */
    public List<ParameterSpec> build(VariableAnalysis analysis, ValidationReport report) {
        return analysis.flowIn().stream()
                .sorted(Comparator.comparingInt(VariableUsage::firstSeenLine).thenComparing(VariableUsage::name))
                .map(usage -> toParameter(usage, report))
                .toList();
    }

    private ParameterSpec toParameter(VariableUsage usage, ValidationReport report) {
        ParameterSpec.Mode mode = ParameterSpec.Mode.VALUE;
        if (usage.isModified() && usage.usedAfterSelection()) {
            if (dialect.supportsReferenceParameters()) {
                mode = ParameterSpec.Mode.REFERENCE;
            } else {
                report.addWarning(ValidationCodes.PARAMETER_NEEDS_RETURN,
                        "'" + usage.name() + "' is modified in the selection and used after it, but "
                                + dialect.languageName() + " has no reference parameters; return its new value instead");
            }
        }
        String declaration = dialect.formatParameter(usage.name(), usage.inferredType(), mode);
        return new ParameterSpec(usage.name(), usage.inferredType(), mode, declaration);
    }
}
