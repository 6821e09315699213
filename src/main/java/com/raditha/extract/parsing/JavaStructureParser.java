package com.raditha.extract.parsing;

import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LineRange;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.SourceBuffer;
import com.raditha.extract.model.SourceModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Structure of Java source: methods and constructors, imports and declared types.
 */
public class JavaStructureParser implements StructureParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaStructureParser.class);

    @Override
    public SourceModel parse(SourceBuffer buffer) {
        ParseResult<CompilationUnit> result = JavaParsers.newSyntaxParser().parse(buffer.text());
        if (result.getResult().isEmpty()) {
            logger.warn("Java source could not be parsed: {}", result.getProblems());
            return SourceModel.empty();
        }
        if (!result.isSuccessful()) {
            logger.debug("Java source parsed with {} problem(s)", result.getProblems().size());
        }
        return toModel(result.getResult().get());
    }

    /**
     * Build the model from an already parsed compilation unit.
     */
    public SourceModel toModel(CompilationUnit cu) {
        List<FunctionScope> functions = new ArrayList<>();
        // findAll walks in pre-order, so outer callables come before the ones nested in them
        for (CallableDeclaration<?> callable : cu.findAll(CallableDeclaration.class)) {
            if (callable.getRange().isEmpty()) {
                continue;
            }
            String container = callable.findAncestor(TypeDeclaration.class)
                    .map(TypeDeclaration::getNameAsString)
                    .orElse("");
            String returnType = callable instanceof MethodDeclaration m ? m.getTypeAsString() : "";
            functions.add(new FunctionScope(
                    callable.getNameAsString(),
                    container,
                    LineRange.from(callable.getRange().get()),
                    toParameters(callable.getParameters()),
                    returnType,
                    callable.isStatic(),
                    false));
        }

        List<String> imports = cu.getImports().stream()
                .map(JavaStructureParser::importText)
                .toList();
        List<String> typeNames = cu.findAll(TypeDeclaration.class).stream()
                .map(t -> t.getNameAsString())
                .toList();
        return new SourceModel(functions, imports, typeNames);
    }

    private static List<ParameterSpec> toParameters(List<Parameter> parameters) {
        List<ParameterSpec> specs = new ArrayList<>();
        for (Parameter p : parameters) {
            String type = p.getTypeAsString() + (p.isVarArgs() ? "..." : "");
            specs.add(new ParameterSpec(p.getNameAsString(), type));
        }
        return specs;
    }

    private static String importText(ImportDeclaration i) {
        return "import " + (i.isStatic() ? "static " : "") + i.getNameAsString() + (i.isAsterisk() ? ".*" : "") + ";";
    }
}
