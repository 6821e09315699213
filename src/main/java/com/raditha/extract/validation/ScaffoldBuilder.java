package com.raditha.extract.validation;

import com.raditha.extract.analysis.SelectionContext;
import com.raditha.extract.analysis.VariableAnalysis;
import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.VariableUsage;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the scaffolds used by the syntax gate.
 */
public class ScaffoldBuilder {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final HostDialect dialect;

    public ScaffoldBuilder(HostDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * The selection inside a throwaway function inside a throwaway type, nothing else.
     */
    public Scaffold minimal(SelectionContext selection, boolean isAsync) {
        List<String> header = dialect.scaffoldHeader(List.of(), List.of(), isAsync);
        return assemble(header, List.of(), selection, false);
    }

    /**
     * The selection with the file's imports, stubs for the file's other functions and a
     * placeholder declaration for every variable the selection uses but does not declare.
     */
    public Scaffold enriched(SelectionContext selection, VariableAnalysis analysis, boolean isAsync) {
        Set<String> stubs = new LinkedHashSet<>();
        for (FunctionScope function : selection.structure().functions()) {
            if (selection.range().contains(function.range()) || !IDENTIFIER.matcher(function.name()).matches()) {
                continue;
            }
            String stub = dialect.functionStub(function);
            if (!stub.isBlank()) {
                stubs.add(stub);
            }
        }

        List<String> declarations = new ArrayList<>();
        for (VariableUsage usage : analysis.variables().values()) {
            if (!usage.declaredInSelection()) {
                declarations.add(dialect.placeholderDeclaration(usage));
            }
        }

        List<String> header = dialect.scaffoldHeader(selection.structure().imports(), new ArrayList<>(stubs), isAsync);
        return assemble(header, declarations, selection, true);
    }

    private Scaffold assemble(List<String> header, List<String> declarations, SelectionContext selection,
                              boolean resolve) {
        List<String> lines = new ArrayList<>();
        // imports and stubs may span several lines
        header.forEach(h -> lines.addAll(List.of(h.split("\n", -1))));
        lines.addAll(declarations);
        int firstSelectionLine = lines.size() + 1;
        List<String> selected = selection.lines().subList(selection.startLine() - 1, selection.endLine());
        lines.addAll(selected);
        lines.addAll(dialect.scaffoldFooter());
        return new Scaffold(String.join("\n", lines), firstSelectionLine, selected.size(),
                selection.startLine(), resolve);
    }
}
