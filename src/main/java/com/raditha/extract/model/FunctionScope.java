package com.raditha.extract.model;

import java.util.List;

/**
 * A function, method or constructor found in a source file.
 *
 * @param name       function name ("constructor" for TypeScript constructors, the type name for Java ones)
 * @param container  enclosing type name, or an empty string for module-level functions
 * @param range      lines spanned by the whole declaration
 * @param parameters declared parameters in order
 * @param returnType declared return type, the host's placeholder when none is written
 * @param isStatic   declared static
 * @param isAsync    declared async
 */
public record FunctionScope(
        String name,
        String container,
        LineRange range,
        List<ParameterSpec> parameters,
        String returnType,
        boolean isStatic,
        boolean isAsync) {

    public FunctionScope {
        container = container == null ? "" : container;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public boolean contains(int line) {
        return range.contains(line);
    }

    public String qualifiedName() {
        return container.isEmpty() ? name : container + "." + name;
    }
}
