package com.raditha.extract.model;

/**
 * Specification for a parameter of the extracted function.
 *
 * @param name        parameter name, same as the flowed-in variable
 * @param type        parameter type
 * @param mode        value or reference passing
 * @param declaration the parameter as it would be written in the host language, e.g. "int x"
 */
public record ParameterSpec(
        String name,
        String type,
        Mode mode,
        String declaration) {

    /**
     * How a parameter is passed.
     */
    public enum Mode {
        VALUE,
        REFERENCE
    }

    /**
     * Create a value parameter declared as "type name".
     */
    public ParameterSpec(String name, String type) {
        this(name, type, Mode.VALUE, type + " " + name);
    }

    /**
     * Format as parameter declaration.
     */
    public String toParameterDeclaration() {
        return declaration;
    }
}
