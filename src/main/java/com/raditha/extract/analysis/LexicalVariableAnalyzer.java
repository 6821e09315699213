package com.raditha.extract.analysis;

import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.dialect.LexicalDeclaration;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LineRange;
import com.raditha.extract.model.ParameterSpec;
import com.raditha.extract.model.ReturnSite;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationMessage;
import com.raditha.extract.model.VariableUsage;
import com.raditha.extract.util.CancellationToken;
import com.raditha.extract.util.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Variable analysis by pattern matching over comment- and string-stripped lines.
 * Used for hosts without a semantic model, and as the fallback when a model cannot be built.
 * Block structure is followed through brace depth, so a declaration whose block closes inside
 * the selection is never reported as used after it.
 */
public class LexicalVariableAnalyzer implements VariableAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(LexicalVariableAnalyzer.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Pattern ASSIGNMENT = Pattern.compile(
            "^\\s*(?<op>\\*\\*|<<|>>>|>>|\\?\\?|&&|\\|\\||[-+*/%&|^])?=(?![=>])");
    private static final Pattern INCREMENT_AFTER = Pattern.compile("^\\s*(?:\\+\\+|--)");
    private static final Pattern INCREMENT_BEFORE = Pattern.compile("(?:\\+\\+|--)\\s*$");
    private static final Pattern CALL = Pattern.compile("^\\s*\\(");
    private static final Pattern KEY_OR_LABEL = Pattern.compile("^\\s*\\??\\s*:(?!:)");
    private static final Pattern FOR_HEADER = Pattern.compile("\\bfor\\s*\\([^)]*$");
    private static final Pattern RETURN = Pattern.compile("\\breturn\\b");

    private final HostDialect dialect;
    private final TypeInferenceHeuristics heuristics;
    private final Pattern lambdaParameters;
    private final Pattern lambdaBlock;

    public LexicalVariableAnalyzer(HostDialect dialect) {
        this.dialect = dialect;
        this.heuristics = new TypeInferenceHeuristics(dialect);
        String arrow = Pattern.quote(dialect.lambdaArrow());
        this.lambdaParameters = Pattern.compile(
                "(?:\\((?<list>[^()]*)\\)|(?<single>[A-Za-z_$][\\w$]*))\\s*(?::\\s*[^=()]+?)?\\s*" + arrow);
        this.lambdaBlock = Pattern.compile(arrow + "\\s*\\{");
    }

    /**
     * A name introduced somewhere in the enclosing function.
     *
     * @param declaration   what the line declared
     * @param line          line of the declaration
     * @param depth         brace depth of the block the name lives in
     * @param functionRange lines of the function a parameter belongs to, null for other declarations
     */
    private record Declared(LexicalDeclaration declaration, int line, int depth, LineRange functionRange) {
        String name() {
            return declaration.name();
        }

        int column() {
            return declaration.column();
        }
    }

    private record Occurrence(String name, int column, int end) {
    }

    /**
     * What an occurrence refers to: a declaration in or before the selection, or nothing known.
     */
    private record Binding(String name, Declared declared) {
    }

    private record Span(int startLine, int startColumn, int endLine, int endColumn) {
        boolean contains(int line, int column) {
            boolean afterStart = line > startLine || line == startLine && column >= startColumn;
            boolean beforeEnd = line < endLine || line == endLine && column <= endColumn;
            return afterStart && beforeEnd;
        }
    }

    @Override
    public VariableAnalysis analyze(SelectionContext selection, CancellationToken token) {
        List<String> raw = selection.lines();
        List<String> stripped = SourceText.stripCommentsAndStrings(raw);
        FunctionScope scope = selection.scope();
        int scopeStart = scope.range().startLine();
        int scopeEnd = Math.min(scope.range().endLine(), raw.size());
        int start = selection.startLine();
        int end = Math.min(selection.endLine(), scopeEnd);

        BraceDepth braces = new BraceDepth(stripped, scopeStart, scopeEnd);
        Map<Integer, List<Declared>> declarations = collectDeclarations(selection, stripped, braces, scopeStart, scopeEnd);
        token.throwIfCancellationRequested();

        Set<String> declaredNames = new HashSet<>();
        declarations.values().forEach(list -> list.forEach(d -> declaredNames.add(d.name())));
        scope.parameters().forEach(p -> declaredNames.add(p.name()));
        Set<String> functionNames = new HashSet<>();
        selection.structure().functions().forEach(f -> functionNames.add(f.name()));

        List<String> scopeLines = stripped.subList(scopeStart - 1, scopeEnd);
        Map<String, String> knownTypes = new HashMap<>();
        Map<String, Declared> before = visibleBefore(scope, declarations, braces, scopeStart, start);
        for (Declared d : before.values()) {
            knownTypes.put(d.name(), typeOf(d, knownTypes, scopeLines));
        }

        Map<Declared, String> declaredTypes = new HashMap<>();
        before.values().forEach(d -> declaredTypes.put(d, knownTypes.get(d.name())));

        Map<Binding, VariableUsage.Builder> builders = new LinkedHashMap<>();
        List<Declared> inSelection = new ArrayList<>();
        for (int line = start; line <= end; line++) {
            token.throwIfCancellationRequested();
            String text = stripped.get(line - 1);
            List<Declared> declaredHere = declarations.getOrDefault(line, List.of());
            List<Occurrence> occurrences = references(text, declaredHere, declaredNames, functionNames);

            int next = 0;
            for (Occurrence occurrence : occurrences) {
                while (next < declaredHere.size() && declaredHere.get(next).column() < occurrence.column()) {
                    register(declaredHere.get(next++), line, inSelection, builders, knownTypes, declaredTypes,
                            scopeLines);
                }
                Binding binding = bind(occurrence.name(), line, occurrence.column(), inSelection, before, braces);
                recordReference(occurrence, text, line,
                        builders.computeIfAbsent(binding, b -> VariableUsage.builder(b.name())));
            }
            while (next < declaredHere.size()) {
                register(declaredHere.get(next++), line, inSelection, builders, knownTypes, declaredTypes, scopeLines);
            }
        }
        token.throwIfCancellationRequested();

        List<String> selectionLines = stripped.subList(start - 1, end);
        Map<String, VariableUsage.Builder> byName = new LinkedHashMap<>();
        for (Map.Entry<Binding, VariableUsage.Builder> entry : builders.entrySet()) {
            String name = entry.getKey().name();
            Declared declared = entry.getKey().declared();
            VariableUsage.Builder builder = entry.getValue();
            boolean local = declared != null && inSelection.contains(declared);
            builder.declaredInSelection(local);
            builder.declaredBeforeSelection(!local && declared != null);
            if (declared != null) {
                builder.inferredType(declaredTypes.get(declared));
            } else {
                builder.inferredType(heuristics.inferUndeclared(name, selectionLines));
            }
            builder.usedAfterSelection(usedAfter(name, declared, local, stripped, declarations, braces, declaredNames,
                    functionNames, start, end, scopeEnd));

            // a name shadowed inside the selection is reported once; the outer binding decides its role
            VariableUsage.Builder existing = byName.get(name);
            if (existing == null) {
                byName.put(name, builder);
            } else if (existing.declaredInSelection() && !local) {
                byName.put(name, builder);
            } else if (existing.declaredInSelection()) {
                existing.merge(builder);
            }
        }
        Map<String, VariableUsage> usages = new LinkedHashMap<>();
        byName.forEach((name, builder) -> usages.put(name, builder.build(dialect.untypedPlaceholder())));

        List<ReturnSite> returns = findReturns(selection, raw, stripped, knownTypes, start, end, scopeEnd);
        int complexity = ComplexityCalculator.cyclomaticLexical(selectionLines);
        logger.debug("Lexical analysis of {} lines {}-{}: {} variables, {} returns",
                scope.qualifiedName(), start, end, usages.size(), returns.size());

        List<ValidationMessage> warnings = List.of(new ValidationMessage(ValidationCodes.HEURISTIC_ANALYSIS,
                "Variables were classified by " + dialect.languageName()
                        + " source patterns; inferred types are best-effort guesses"));
        return new VariableAnalysis(usages, returns, complexity, warnings);
    }

    /**
     * All declarations between the first and last line of the enclosing function, sorted by column.
     */
    private Map<Integer, List<Declared>> collectDeclarations(SelectionContext selection, List<String> stripped,
                                                             BraceDepth braces, int scopeStart, int scopeEnd) {
        FunctionScope scope = selection.scope();
        Set<String> parameterNames = new HashSet<>();
        scope.parameters().forEach(p -> parameterNames.add(p.name()));

        Map<Integer, List<Declared>> byLine = new HashMap<>();
        for (int line = scopeStart; line <= scopeEnd; line++) {
            String text = stripped.get(line - 1);
            List<Declared> found = new ArrayList<>();
            for (LexicalDeclaration d : dialect.findDeclarations(text)) {
                if (line == scopeStart && parameterNames.contains(d.name())) {
                    continue;
                }
                int depth = braces.depthAt(line, d.column());
                boolean headerBound = d.kind() == LexicalDeclaration.Kind.LOOP_BINDING
                        || d.kind() == LexicalDeclaration.Kind.CATCH_BINDING
                        || FOR_HEADER.matcher(text.substring(0, d.column())).find();
                found.add(new Declared(d, line, headerBound ? depth + 1 : depth, null));
            }
            for (LexicalDeclaration d : lambdaParametersOn(text)) {
                if (line == scopeStart && parameterNames.contains(d.name())) {
                    continue;
                }
                found.add(new Declared(d, line, braces.depthAt(line, d.column()) + 1, null));
            }
            byLine.put(line, found);
        }

        // parameters of functions nested inside the enclosing one
        for (FunctionScope nested : selection.structure().functions()) {
            if (nested.equals(scope) || !scope.range().contains(nested.range())) {
                continue;
            }
            int line = nested.range().startLine();
            List<Declared> found = byLine.computeIfAbsent(line, l -> new ArrayList<>());
            String text = stripped.get(line - 1);
            for (ParameterSpec p : nested.parameters()) {
                boolean known = found.stream().anyMatch(d -> d.name().equals(p.name()));
                if (!known) {
                    int column = Math.max(0, columnOf(text, p.name()));
                    LexicalDeclaration d = new LexicalDeclaration(p.name(), p.type(), null,
                            LexicalDeclaration.Kind.FUNCTION_PARAMETER, null, column);
                    found.add(new Declared(d, line, braces.depthAt(line, column) + 1, nested.range()));
                }
            }
        }
        byLine.values().forEach(list -> list.sort(Comparator.comparingInt(Declared::column)));
        return byLine;
    }

    private List<LexicalDeclaration> lambdaParametersOn(String text) {
        List<LexicalDeclaration> found = new ArrayList<>();
        Matcher m = lambdaParameters.matcher(text);
        while (m.find()) {
            if (m.group("single") != null) {
                String name = m.group("single");
                if (!dialect.isStrictlyReserved(name)) {
                    found.add(new LexicalDeclaration(name, null, null,
                            LexicalDeclaration.Kind.FUNCTION_PARAMETER, null, m.start("single")));
                }
                continue;
            }
            int base = m.start("list");
            int offset = 0;
            for (String part : m.group("list").split(",", -1)) {
                String name = parameterName(part);
                if (name != null) {
                    int column = base + offset + Math.max(0, columnOf(part, name));
                    found.add(new LexicalDeclaration(name, null, null,
                            LexicalDeclaration.Kind.FUNCTION_PARAMETER, null, column));
                }
                offset += part.length() + 1;
            }
        }
        return found;
    }

    /**
     * Name in a parameter list entry such as {@code a}, {@code String a}, {@code a?: number}
     * or {@code ...rest}.
     */
    private String parameterName(String part) {
        String p = part;
        for (char stop : new char[]{'=', ':', '?'}) {
            int i = p.indexOf(stop);
            if (i >= 0) {
                p = p.substring(0, i);
            }
        }
        p = p.trim();
        Matcher m = IDENTIFIER.matcher(p);
        String last = null;
        while (m.find()) {
            last = m.group();
        }
        return last == null || dialect.isStrictlyReserved(last) ? null : last;
    }

    private static int columnOf(String text, String name) {
        Matcher m = Pattern.compile("(?<![\\w$])" + Pattern.quote(name) + "(?![\\w$])").matcher(text);
        return m.find() ? m.start() : -1;
    }

    /**
     * Names visible at the first selected line: the function's parameters, then every earlier
     * declaration whose block is still open. Later declarations replace earlier ones.
     */
    private Map<String, Declared> visibleBefore(FunctionScope scope, Map<Integer, List<Declared>> declarations,
                                                BraceDepth braces, int scopeStart, int start) {
        Map<String, Declared> visible = new LinkedHashMap<>();
        for (ParameterSpec p : scope.parameters()) {
            LexicalDeclaration d = new LexicalDeclaration(p.name(), p.type(), null,
                    LexicalDeclaration.Kind.FUNCTION_PARAMETER, null, 0);
            visible.put(p.name(), new Declared(d, scopeStart, 0, scope.range()));
        }
        for (int line = scopeStart; line < start; line++) {
            for (Declared d : declarations.getOrDefault(line, List.of())) {
                if (isVisible(d, braces, start)) {
                    visible.remove(d.name());
                    visible.put(d.name(), d);
                }
            }
        }
        return visible;
    }

    private static boolean isVisible(Declared d, BraceDepth braces, int line) {
        return isVisible(d, braces, line, 0);
    }

    private static boolean isVisible(Declared d, BraceDepth braces, int line, int column) {
        if (d.functionRange() != null) {
            return d.functionRange().contains(line);
        }
        return braces.staysOpen(d.line(), d.column(), line, column, d.depth());
    }

    /**
     * Bind an occurrence to the innermost declaration visible at its position. Declarations made
     * earlier in the selection shadow the ones made before it, for as long as their block is open.
     */
    private static Binding bind(String name, int line, int column, List<Declared> inSelection,
                                Map<String, Declared> before, BraceDepth braces) {
        for (int i = inSelection.size() - 1; i >= 0; i--) {
            Declared d = inSelection.get(i);
            if (d.name().equals(name) && isVisible(d, braces, line, column)) {
                return new Binding(name, d);
            }
        }
        return new Binding(name, before.get(name));
    }

    private String typeOf(Declared d, Map<String, String> knownTypes, List<String> usageLines) {
        LexicalDeclaration declaration = d.declaration();
        if (declaration.kind() == LexicalDeclaration.Kind.FUNCTION_PARAMETER
                && dialect.untypedPlaceholder().equals(declaration.declaredType())) {
            declaration = new LexicalDeclaration(declaration.name(), null, null,
                    declaration.kind(), null, declaration.column());
        }
        return heuristics.inferDeclared(declaration, knownTypes, usageLines);
    }

    private void register(Declared d, int line, List<Declared> inSelection,
                          Map<Binding, VariableUsage.Builder> builders, Map<String, String> knownTypes,
                          Map<Declared, String> declaredTypes, List<String> usageLines) {
        inSelection.add(d);
        String type = typeOf(d, knownTypes, usageLines);
        knownTypes.put(d.name(), type);
        declaredTypes.put(d, type);
        builders.computeIfAbsent(new Binding(d.name(), d), b -> VariableUsage.builder(b.name())).seenAt(line);
    }

    private static void recordReference(Occurrence occurrence, String text, int line, VariableUsage.Builder builder) {
        builder.countUsage(line);

        String after = text.substring(occurrence.end());
        String before = text.substring(0, occurrence.column());
        Matcher assignment = ASSIGNMENT.matcher(after);
        if (assignment.find()) {
            builder.markModified();
            if (assignment.group("op") != null) {
                builder.markRead();
            }
        } else if (INCREMENT_AFTER.matcher(after).find() || INCREMENT_BEFORE.matcher(before).find()) {
            builder.markModified();
            builder.markRead();
        } else {
            builder.markRead();
        }
    }

    /**
     * Identifier occurrences on a line that refer to variables. Members after a dot, called
     * functions, keywords, labels, object keys and type names are left out, as are the
     * declarations themselves.
     */
    private List<Occurrence> references(String text, List<Declared> declaredHere, Set<String> declaredNames,
                                        Set<String> functionNames) {
        Set<Integer> declarationColumns = new HashSet<>();
        declaredHere.forEach(d -> declarationColumns.add(d.column()));

        List<Occurrence> found = new ArrayList<>();
        Matcher m = IDENTIFIER.matcher(text);
        while (m.find()) {
            int start = m.start();
            if (declarationColumns.contains(start)) {
                continue;
            }
            if (isReference(text, m.group(), start, m.end(), declaredNames, functionNames)) {
                found.add(new Occurrence(m.group(), start, m.end()));
            }
        }
        return found;
    }

    private boolean isReference(String text, String name, int start, int end, Set<String> declaredNames,
                                Set<String> functionNames) {
        boolean declared = declaredNames.contains(name);
        if (dialect.isStrictlyReserved(name) || dialect.isReserved(name) && !declared
                || dialect.isInferredTypeKeyword(name) || dialect.wellKnownGlobals().contains(name)) {
            return false;
        }
        if (start > 0 && Character.isDigit(text.charAt(start - 1))) {
            return false;
        }
        String before = text.substring(0, start).stripTrailing();
        if (before.endsWith("@") || before.endsWith("::")) {
            return false;
        }
        if (before.endsWith(".") && !before.endsWith("...")) {
            return false;
        }
        String after = text.substring(end);
        if (!declared && (CALL.matcher(after).find() || functionNames.contains(name))) {
            return false;
        }
        if (!declared && Character.isUpperCase(name.charAt(0))) {
            return false;
        }
        return !(KEY_OR_LABEL.matcher(after).find() && before.indexOf('?') < 0);
    }

    /**
     * Whether the variable is referenced after the selection before it goes out of scope or is
     * declared again.
     */
    private boolean usedAfter(String name, Declared declared, boolean local, List<String> stripped,
                              Map<Integer, List<Declared>> declarations, BraceDepth braces,
                              Set<String> declaredNames, Set<String> functionNames,
                              int start, int end, int scopeEnd) {
        if (local) {
            if (declared.declaration().kind() == LexicalDeclaration.Kind.FUNCTION_PARAMETER) {
                return false;
            }
            if (!braces.staysOpen(declared.line(), declared.column(), end, stripped.get(end - 1).length(),
                    declared.depth())) {
                return false;
            }
        }

        for (int line = end + 1; line <= scopeEnd; line++) {
            List<Declared> declaredHere = declarations.getOrDefault(line, List.of());
            int redeclaredAt = declaredHere.stream()
                    .filter(d -> d.name().equals(name))
                    .mapToInt(Declared::column)
                    .min()
                    .orElse(Integer.MAX_VALUE);
            Optional<Occurrence> first = references(stripped.get(line - 1), declaredHere, declaredNames, functionNames)
                    .stream()
                    .filter(o -> o.name().equals(name))
                    .findFirst();
            if (first.isPresent() && first.get().column() < redeclaredAt) {
                if (declared == null) {
                    return true;
                }
                if (declared.functionRange() != null) {
                    return declared.functionRange().contains(line);
                }
                return braces.staysOpen(declared.line(), declared.column(), line, first.get().column(),
                        declared.depth());
            }
            if (redeclaredAt != Integer.MAX_VALUE) {
                return false;
            }
        }
        return false;
    }

    /**
     * Explicit returns of the selection. Returns inside lambdas or functions that begin within the
     * selection belong to those and are skipped.
     */
    private List<ReturnSite> findReturns(SelectionContext selection, List<String> raw, List<String> stripped,
                                         Map<String, String> knownTypes, int start, int end, int scopeEnd) {
        List<Span> nested = nestedBodies(selection, stripped, start, end, scopeEnd);
        List<ReturnSite> sites = new ArrayList<>();
        for (int line = start; line <= end; line++) {
            String text = stripped.get(line - 1);
            Matcher m = RETURN.matcher(text);
            while (m.find()) {
                int column = m.start();
                int at = line;
                if (nested.stream().anyMatch(span -> span.contains(at, column))) {
                    continue;
                }
                int stop = statementEnd(text, m.end());
                String expression = raw.get(line - 1).substring(m.end(), stop).trim();
                String strippedExpression = text.substring(m.end(), stop).trim();
                String type = expression.isEmpty()
                        ? dialect.voidType()
                        : heuristics.expressionType(strippedExpression, knownTypes).orElse(dialect.untypedPlaceholder());
                sites.add(new ReturnSite(line, expression, type));
            }
        }
        return sites;
    }

    private List<Span> nestedBodies(SelectionContext selection, List<String> stripped, int start, int end,
                                    int scopeEnd) {
        List<Span> spans = new ArrayList<>();
        FunctionScope scope = selection.scope();
        for (FunctionScope f : selection.structure().functions()) {
            int first = f.range().startLine();
            if (!f.equals(scope) && scope.range().contains(f.range()) && first >= start && first <= end) {
                spans.add(new Span(first, bodyStart(stripped.get(first - 1)), f.range().endLine(), Integer.MAX_VALUE));
            }
        }
        for (int line = start; line <= end; line++) {
            Matcher m = lambdaBlock.matcher(stripped.get(line - 1));
            while (m.find()) {
                int open = m.end() - 1;
                spans.add(closingSpan(stripped, line, open, scopeEnd));
            }
        }
        return spans;
    }

    /**
     * Column where a function starting on this line begins: its keyword, its arrow or its brace.
     */
    private int bodyStart(String text) {
        int function = columnOf(text, "function");
        if (function >= 0) {
            return function;
        }
        int arrow = text.indexOf(dialect.lambdaArrow());
        if (arrow >= 0) {
            return arrow;
        }
        return Math.max(0, text.indexOf('{'));
    }

    private static Span closingSpan(List<String> stripped, int line, int openColumn, int lastLine) {
        int depth = 0;
        for (int l = line; l <= lastLine; l++) {
            String text = stripped.get(l - 1);
            for (int i = l == line ? openColumn : 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    return new Span(line, openColumn, l, i);
                }
            }
        }
        return new Span(line, openColumn, lastLine, Integer.MAX_VALUE);
    }

    /**
     * End of the returned expression: the first top-level semicolon or unmatched closing bracket.
     */
    private static int statementEnd(String text, int from) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (c == ';' && depth == 0) {
                return i;
            }
        }
        return text.length();
    }
}
