package com.raditha.extract.model;

/**
 * Where a variable referenced by a selection is declared, relative to that selection.
 * Decides how the variable reaches the extracted function.
 */
public enum VariableScope {
    /**
     * Declared inside the selection - stays local to the extracted function, or is returned
     */
    LOCAL,

    /**
     * Declared earlier in the enclosing function (or one of its parameters) - passed as a parameter
     */
    FLOW_IN,

    /**
     * Declared in neither place - a field, global or something unresolved
     */
    EXTERNAL
}
