package com.raditha.extract.analysis;

import com.raditha.extract.model.ReturnSite;
import com.raditha.extract.model.ValidationMessage;
import com.raditha.extract.model.VariableUsage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a variable analyzer found in a selection.
 *
 * @param variables            usages keyed by name, in order of first appearance
 * @param returnSites          explicit returns of the selection, nested functions excluded
 * @param cyclomaticComplexity decision-point complexity of the selection
 * @param warnings             advisories raised while analyzing
 */
public record VariableAnalysis(
        Map<String, VariableUsage> variables,
        List<ReturnSite> returnSites,
        int cyclomaticComplexity,
        List<ValidationMessage> warnings) {

    public VariableAnalysis {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        returnSites = List.copyOf(returnSites);
        warnings = List.copyOf(warnings);
    }

    /**
     * Nothing found, used when analysis could not run.
     */
    public static VariableAnalysis empty() {
        return new VariableAnalysis(Map.of(), List.of(), 1, List.of());
    }

    public boolean hasReturnStatements() {
        return !returnSites.isEmpty();
    }

    public List<VariableUsage> flowIn() {
        return variables.values().stream().filter(VariableUsage::isFlowIn).toList();
    }

    public List<VariableUsage> flowOut() {
        return variables.values().stream().filter(VariableUsage::isFlowOut).toList();
    }
}
