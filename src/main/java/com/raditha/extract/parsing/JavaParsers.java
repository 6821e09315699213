package com.raditha.extract.parsing;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;

/**
 * Factory for JavaParser instances. Each call returns a new parser so that no
 * parser or type solver is ever shared between concurrent requests.
 */
public class JavaParsers {

    private JavaParsers() {
        /* this is only a utility class */
    }

    /**
     * A parser that only builds syntax trees.
     */
    public static JavaParser newSyntaxParser() {
        return new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    /**
     * A parser whose trees can answer symbol and type questions through the symbol solver.
     * Types are resolved against the JDK only.
     */
    public static JavaParser newSymbolSolvingParser() {
        CombinedTypeSolver typeSolver = new CombinedTypeSolver(new ReflectionTypeSolver());
        return new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(typeSolver)));
    }
}
