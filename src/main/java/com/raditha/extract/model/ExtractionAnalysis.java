package com.raditha.extract.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything learned about a selection, gathered into one value.
 *
 * @param containingScopeName     qualified name of the enclosing function, empty when there is none
 * @param scopeValid              whether the selection lies within a single function
 * @param cyclomaticComplexity    1 + decision points in the selection
 * @param variableComplexityScore weighted count of variable usages
 * @param externalVariables       variables declared before the selection and used in it
 * @param modifiedVariables       external variables written inside the selection
 * @param localVariables          variables declared inside the selection
 * @param undeclaredVariables     variables with no declaration in the enclosing function
 * @param returnStrategy          chosen return strategy
 * @param hasReturnStatements     whether the selection contains explicit returns
 * @param variables               per-variable usage, in order of first appearance
 * @param returnAnalysis          full return-shape decision
 */
public record ExtractionAnalysis(
        String containingScopeName,
        boolean scopeValid,
        int cyclomaticComplexity,
        int variableComplexityScore,
        List<String> externalVariables,
        List<String> modifiedVariables,
        List<String> localVariables,
        List<String> undeclaredVariables,
        ReturnStrategy returnStrategy,
        boolean hasReturnStatements,
        @JsonIgnore Map<String, VariableUsage> variables,
        @JsonIgnore ReturnAnalysis returnAnalysis) {

    public ExtractionAnalysis {
        containingScopeName = containingScopeName == null ? "" : containingScopeName;
        externalVariables = List.copyOf(externalVariables);
        modifiedVariables = List.copyOf(modifiedVariables);
        localVariables = List.copyOf(localVariables);
        undeclaredVariables = List.copyOf(undeclaredVariables);
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
