package com.raditha.extract.dialect;

/**
 * A variable declaration recognised by pattern matching a single source line.
 *
 * @param name         declared name
 * @param declaredType type text as written, null when none was written or it is an untyped keyword
 * @param initializer  right-hand side text, null when absent
 * @param kind         what introduced the name
 * @param iterable     source collection of a loop binding, null otherwise
 * @param column       0-based column of the name within the line
 */
public record LexicalDeclaration(
        String name,
        String declaredType,
        String initializer,
        Kind kind,
        String iterable,
        int column) {

    /**
     * The construct that introduced a name.
     */
    public enum Kind {
        VARIABLE,
        LOOP_BINDING,
        CATCH_BINDING,
        DESTRUCTURED,
        FUNCTION_PARAMETER
    }

    public static LexicalDeclaration variable(String name, String type, String initializer, int column) {
        return new LexicalDeclaration(name, type, initializer, Kind.VARIABLE, null, column);
    }
}
