package com.raditha.extract.analysis;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.ReturnAnalysis;
import com.raditha.extract.model.ReturnSite;
import com.raditha.extract.model.ReturnStrategy;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.model.VariableUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides how the extracted function hands results back to its caller.
 * The first matching rule wins: returns mixed with values needed afterwards, explicit returns,
 * one value needed afterwards, several values needed afterwards, nothing.
 */
public class ReturnStrategyResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReturnStrategyResolver.class);

    private final HostDialect dialect;
    private final int maxTupleSize;

    public ReturnStrategyResolver(HostDialect dialect, int maxTupleSize) {
        this.dialect = dialect;
        this.maxTupleSize = maxTupleSize;
    }

    /**
     * @param analysis     variables and return sites of the selection
     * @param functionName proposed name of the extracted function, used to name a result record
     * @param report       receives advisories about the chosen shape
     */
    public ReturnAnalysis resolve(VariableAnalysis analysis, String functionName, ValidationReport report) {
        List<ReturnSite> sites = analysis.returnSites();
        List<VariableUsage> flowOut = analysis.flowOut();
        List<String> flowOutNames = flowOut.stream().map(VariableUsage::name).toList();

        ReturnAnalysis result;
        if (!sites.isEmpty() && !flowOut.isEmpty()) {
            report.addWarning(ValidationCodes.MIXED_RETURN_STRATEGY,
                    "The selection returns early and also defines " + String.join(", ", flowOutNames)
                            + " for the code after it; simplify the selection before extracting");
            result = new ReturnAnalysis(ReturnStrategy.MIXED, dialect.untypedPlaceholder(),
                    "Explicit returns combined with variables used after the selection", flowOutNames, List.of());
        } else if (!sites.isEmpty()) {
            result = explicitReturn(sites, report);
        } else if (flowOut.size() == 1) {
            VariableUsage only = flowOut.get(0);
            result = new ReturnAnalysis(ReturnStrategy.SINGLE_VARIABLE, only.inferredType(),
                    "Variable '" + only.name() + "' is assigned in the selection and used after it",
                    flowOutNames, List.of());
        } else if (flowOut.size() > 1) {
            result = multipleVariables(flowOut, flowOutNames, functionName, report);
        } else {
            result = ReturnAnalysis.voidReturn("No return statements and no variables used after the selection");
        }
        logger.debug("Return strategy {} with type {}", result.strategy(), result.suggestedType());
        return result;
    }

    private ReturnAnalysis explicitReturn(List<ReturnSite> sites, ValidationReport report) {
        Set<String> types = sites.stream()
                .map(ReturnSite::inferredType)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        String lines = sites.stream().map(s -> String.valueOf(s.line())).collect(Collectors.joining(", "));
        if (types.size() == 1) {
            String type = types.iterator().next();
            return new ReturnAnalysis(ReturnStrategy.EXPLICIT_RETURN, type,
                    "Selection returns " + type + " (line " + lines + ")", List.of(), List.of());
        }
        report.addWarning(ValidationCodes.AMBIGUOUS_RETURN_TYPE,
                "Return statements disagree on the returned type: " + String.join(", ", types));
        return new ReturnAnalysis(ReturnStrategy.MIXED, dialect.untypedPlaceholder(),
                "Return statements produce different types (" + String.join(", ", types) + ")",
                List.of(), List.of());
    }

    private ReturnAnalysis multipleVariables(List<VariableUsage> flowOut, List<String> names, String functionName,
                                             ValidationReport report) {
        if (flowOut.size() > maxTupleSize) {
            report.addWarning(ValidationCodes.TOO_MANY_RETURN_VALUES,
                    flowOut.size() + " variables (" + String.join(", ", names) + ") are used after the selection, "
                            + "more than the " + maxTupleSize + " that can be returned together; "
                            + "pass them by reference or extract a smaller selection");
            return new ReturnAnalysis(ReturnStrategy.VOID, dialect.voidType(),
                    "Too many variables used after the selection to return", names, List.of());
        }
        List<ParameterSpec> components = flowOut.stream()
                .map(v -> new ParameterSpec(v.name(), v.inferredType(), ParameterSpec.Mode.VALUE,
                        dialect.formatParameter(v.name(), v.inferredType(), ParameterSpec.Mode.VALUE)))
                .toList();
        return new ReturnAnalysis(ReturnStrategy.MULTIPLE_VARIABLES, dialect.multiValueType(functionName, components),
                "Variables " + String.join(", ", names) + " are used after the selection; return them as "
                        + dialect.describeMultiValue(functionName, components),
                names, components);
    }
}
