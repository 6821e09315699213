package com.raditha.extract.validation;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.resolution.UnsolvedSymbolException;
import com.raditha.extract.parsing.JavaParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses Java scaffolds with JavaParser. Names used in the selection are resolved through the symbol solver;
 * capitalized names are taken to be types and are not resolved.
 */
public class JavaScaffoldParser implements ScaffoldParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaScaffoldParser.class);

    @Override
    public List<ScaffoldDiagnostic> check(Scaffold scaffold) {
        JavaParser parser = scaffold.resolveIdentifiers()
                ? JavaParsers.newSymbolSolvingParser()
                : JavaParsers.newSyntaxParser();
        ParseResult<CompilationUnit> result = parser.parse(scaffold.text());

        List<ScaffoldDiagnostic> diagnostics = new ArrayList<>();
        for (Problem p : result.getProblems()) {
            int line = p.getLocation()
                    .flatMap(TokenRange::toRange)
                    .map(r -> r.begin.line)
                    .orElse(0);
            diagnostics.add(ScaffoldDiagnostic.structural(line, p.getMessage()));
        }
        if (!diagnostics.isEmpty() || result.getResult().isEmpty() || !scaffold.resolveIdentifiers()) {
            return diagnostics;
        }

        for (NameExpr name : result.getResult().get().findAll(NameExpr.class)) {
            int line = name.getBegin().map(b -> b.line).orElse(0);
            if (!scaffold.inSelection(line) || Character.isUpperCase(name.getNameAsString().charAt(0))) {
                continue;
            }
            try {
                name.resolve();
            } catch (UnsolvedSymbolException e) {
                diagnostics.add(ScaffoldDiagnostic.unresolved(name.getNameAsString(), line));
            } catch (Exception e) {
                logger.debug("Could not resolve {} at scaffold line {}: {}", name, line, e.getMessage());
            }
        }
        return diagnostics;
    }
}
