package com.raditha.extract.parsing;

import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.extract.model.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Builds a symbol-solving JavaParser model for Java buffers. Source with syntax problems
 * gets no model, and the caller falls back to lexical analysis.
 */
public class JavaSemanticModelProvider implements SemanticModelProvider {

    private static final Logger logger = LoggerFactory.getLogger(JavaSemanticModelProvider.class);

    @Override
    public Optional<SemanticModel> modelFor(SourceBuffer buffer) {
        ParseResult<CompilationUnit> result = JavaParsers.newSymbolSolvingParser().parse(buffer.text());
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            logger.debug("No semantic model: {} parse problem(s)", result.getProblems().size());
            return Optional.empty();
        }
        return Optional.of(new SemanticModel(result.getResult().get()));
    }
}
