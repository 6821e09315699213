package com.raditha.extract.model;

import java.util.List;

/**
 * Result of return-shape resolution.
 *
 * @param strategy          chosen return strategy
 * @param suggestedType     return type to declare on the extracted function
 * @param reason            human-readable explanation of the choice
 * @param flowOutVariables  variables declared in the selection and needed after it, in order
 * @param components        (name, type) pairs of a multi-value return, empty otherwise
 */
public record ReturnAnalysis(
        ReturnStrategy strategy,
        String suggestedType,
        String reason,
        List<String> flowOutVariables,
        List<ParameterSpec> components) {

    public static final String VOID_TYPE = "void";

    public ReturnAnalysis {
        flowOutVariables = flowOutVariables == null ? List.of() : List.copyOf(flowOutVariables);
        components = components == null ? List.of() : List.copyOf(components);
    }

    public static ReturnAnalysis voidReturn(String reason) {
        return new ReturnAnalysis(ReturnStrategy.VOID, VOID_TYPE, reason, List.of(), List.of());
    }

    public boolean requiresReturnValue() {
        return strategy != ReturnStrategy.VOID && !VOID_TYPE.equals(suggestedType);
    }
}
