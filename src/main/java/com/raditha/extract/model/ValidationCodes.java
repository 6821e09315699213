package com.raditha.extract.model;

/**
 * Stable codes carried by {@link ValidationMessage}. Callers match on these, so they never change.
 */
public final class ValidationCodes {

    // naming
    public static final String METHOD_NAME_EMPTY = "METHOD_NAME_EMPTY";
    public static final String METHOD_NAME_INVALID_START = "METHOD_NAME_INVALID_START";
    public static final String METHOD_NAME_INVALID_CHARS = "METHOD_NAME_INVALID_CHARS";
    public static final String METHOD_NAME_RESERVED = "METHOD_NAME_RESERVED";
    public static final String METHOD_NAME_CONVENTION = "METHOD_NAME_CONVENTION";
    public static final String METHOD_NAME_CONFLICT = "METHOD_NAME_CONFLICT";
    public static final String NAME_CONFLICT_CHECK_FAILED = "NAME_CONFLICT_CHECK_FAILED";

    // request and scope
    public static final String START_LINE_INVALID = "START_LINE_INVALID";
    public static final String END_LINE_INVALID = "END_LINE_INVALID";
    public static final String LINE_RANGE_INVALID = "LINE_RANGE_INVALID";
    public static final String EMPTY_SELECTION = "EMPTY_SELECTION";
    public static final String NOT_IN_METHOD_SCOPE = "NOT_IN_METHOD_SCOPE";
    public static final String SCOPE_LOOKUP_FAILED = "SCOPE_LOOKUP_FAILED";
    public static final String STRUCTURE_PARSE_FAILED = "STRUCTURE_PARSE_FAILED";

    // variable analysis
    public static final String VARIABLE_ANALYSIS_FAILED = "VARIABLE_ANALYSIS_FAILED";
    public static final String PARTIAL_SEMANTIC_RESOLUTION = "PARTIAL_SEMANTIC_RESOLUTION";
    public static final String HEURISTIC_ANALYSIS = "HEURISTIC_ANALYSIS";
    public static final String SEMANTIC_MODEL_UNAVAILABLE = "SEMANTIC_MODEL_UNAVAILABLE";
    public static final String VARIABLE_NEEDS_RETURN = "VARIABLE_NEEDS_RETURN";
    public static final String UNDECLARED_VARIABLE = "UNDECLARED_VARIABLE";
    public static final String TOO_MANY_MODIFIED_VARS = "TOO_MANY_MODIFIED_VARS";

    // return shape and parameters
    public static final String MIXED_RETURN_STRATEGY = "MIXED_RETURN_STRATEGY";
    public static final String AMBIGUOUS_RETURN_TYPE = "AMBIGUOUS_RETURN_TYPE";
    public static final String TOO_MANY_RETURN_VALUES = "TOO_MANY_RETURN_VALUES";
    public static final String RETURN_TYPE_ANALYSIS = "RETURN_TYPE_ANALYSIS";
    public static final String RETURN_ANALYSIS_FAILED = "RETURN_ANALYSIS_FAILED";
    public static final String PARAMETER_NEEDS_RETURN = "PARAMETER_NEEDS_RETURN";
    public static final String HAS_RETURN_STATEMENTS = "HAS_RETURN_STATEMENTS";
    public static final String COMPLEX_REFACTORING_NEEDED = "COMPLEX_REFACTORING_NEEDED";

    // syntax gate
    public static final String SYNTAX_ERROR = "SYNTAX_ERROR";
    public static final String ENHANCED_VALIDATION_FAILED = "ENHANCED_VALIDATION_FAILED";

    // host rules
    public static final String THIS_IN_STATIC_CONTEXT = "THIS_IN_STATIC_CONTEXT";
    public static final String ASYNC_REQUIRED = "ASYNC_REQUIRED";
    public static final String UNSUPPORTED_MODIFIER = "UNSUPPORTED_MODIFIER";
    public static final String INCOMPLETE_STATEMENT = "INCOMPLETE_STATEMENT";

    // aggregate
    public static final String HIGH_COMPLEXITY = "HIGH_COMPLEXITY";
    public static final String HIGH_VARIABLE_COMPLEXITY = "HIGH_VARIABLE_COMPLEXITY";
    public static final String TOO_MANY_DEPENDENCIES = "TOO_MANY_DEPENDENCIES";
    public static final String VALIDATION_FAILED = "VALIDATION_FAILED";

    private ValidationCodes() {
    }
}
