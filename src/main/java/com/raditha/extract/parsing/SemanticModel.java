package com.raditha.extract.parsing;

import com.github.javaparser.ast.CompilationUnit;

/**
 * A compilation unit whose nodes can be resolved to declarations and types.
 *
 * @param compilationUnit parsed source with a symbol resolver attached
 */
public record SemanticModel(CompilationUnit compilationUnit) {
}
