package com.raditha.extract.model;

import java.util.List;

/**
 * Language-neutral structure of a source file, as far as extraction cares about it.
 *
 * @param functions functions in document pre-order (outer before inner)
 * @param imports   import statements, verbatim
 * @param typeNames names of the types declared in the file
 */
public record SourceModel(List<FunctionScope> functions, List<String> imports, List<String> typeNames) {

    public SourceModel {
        functions = functions == null ? List.of() : List.copyOf(functions);
        imports = imports == null ? List.of() : List.copyOf(imports);
        typeNames = typeNames == null ? List.of() : List.copyOf(typeNames);
    }

    public static SourceModel empty() {
        return new SourceModel(List.of(), List.of(), List.of());
    }
}
