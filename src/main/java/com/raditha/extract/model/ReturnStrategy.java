package com.raditha.extract.model;

/**
 * The shape of the value an extracted function hands back to its caller.
 */
public enum ReturnStrategy {
    VOID,
    EXPLICIT_RETURN,
    SINGLE_VARIABLE,
    MULTIPLE_VARIABLES,
    /**
     * Explicit returns combined with flow-out variables, or returns of incompatible types.
     * Not resolved automatically.
     */
    MIXED
}
