package com.raditha.extract.validation;

/**
 * A problem reported while parsing a scaffold.
 *
 * @param kind       structural problem or unresolved name
 * @param identifier the unresolved name, null for structural problems
 * @param line       1-based line in the scaffold text, 0 when unknown
 * @param message    parser message
 */
public record ScaffoldDiagnostic(Kind kind, String identifier, int line, String message) {

    public enum Kind {
        STRUCTURAL,
        UNRESOLVED_IDENTIFIER
    }

    public static ScaffoldDiagnostic structural(int line, String message) {
        return new ScaffoldDiagnostic(Kind.STRUCTURAL, null, line, message);
    }

    public static ScaffoldDiagnostic unresolved(String identifier, int line) {
        return new ScaffoldDiagnostic(Kind.UNRESOLVED_IDENTIFIER, identifier, line,
                "Cannot resolve symbol '" + identifier + "'");
    }
}
