package com.raditha.extract.analysis;

import com.github.javaparser.Position;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.resolution.declarations.ResolvedValueDeclaration;
import com.raditha.extract.dialect.HostDialect;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.ReturnSite;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationMessage;
import com.raditha.extract.model.VariableUsage;
import com.raditha.extract.parsing.SemanticModel;
import com.raditha.extract.util.CancellationToken;
import com.raditha.extract.util.TypeNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Variable analysis over a JavaParser tree with the symbol solver attached.
 * Every name reference is resolved to its declaration node, so shadowing and liveness follow
 * the compiler's view of the code rather than name matching.
 */
public class SemanticVariableAnalyzer implements VariableAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(SemanticVariableAnalyzer.class);

    private final SemanticModel model;
    private final HostDialect dialect;
    private final TypeInferenceHeuristics heuristics;

    public SemanticVariableAnalyzer(SemanticModel model, HostDialect dialect) {
        this.model = model;
        this.dialect = dialect;
        this.heuristics = new TypeInferenceHeuristics(dialect);
    }

    /**
     * Where a name reference leads.
     */
    private enum BindingKind {
        SELECTION,
        BEFORE,
        EXTERNAL,
        TYPE_REFERENCE
    }

    /**
     * @param kind        classification of the reference
     * @param declaration declaration node, null for fields and unresolved names
     * @param type        type of the declaration, null when unknown
     */
    private record Binding(BindingKind kind, Node declaration, String type) {
    }

    @Override
    public VariableAnalysis analyze(SelectionContext selection, CancellationToken token) {
        CallableDeclaration<?> callable = findCallable(model.compilationUnit(), selection.scope())
                .orElseThrow(() -> new IllegalStateException(
                        "No method or constructor matches " + selection.scope().qualifiedName()));
        Optional<BlockStmt> body = bodyOf(callable);
        if (body.isEmpty()) {
            return VariableAnalysis.empty();
        }

        List<Statement> selected = selectStatements(body.get(), selection.startLine(), selection.endLine());
        if (selected.isEmpty()) {
            logger.debug("No statements of {} overlap lines {}-{}", selection.scope().qualifiedName(),
                    selection.startLine(), selection.endLine());
            return VariableAnalysis.empty();
        }
        token.throwIfCancellationRequested();
        return new Walk(callable, body.get(), selected, token).run();
    }

    /**
     * The method or constructor the structure model reported as the enclosing scope.
     */
    static Optional<CallableDeclaration<?>> findCallable(CompilationUnit cu, FunctionScope scope) {
        for (CallableDeclaration<?> callable : cu.findAll(CallableDeclaration.class)) {
            if (callable.getRange().isEmpty()) {
                continue;
            }
            int begin = callable.getRange().get().begin.line;
            int end = callable.getRange().get().end.line;
            if (begin == scope.range().startLine() && end == scope.range().endLine()
                    && callable.getNameAsString().equals(scope.name())) {
                return Optional.of(callable);
            }
        }
        return Optional.empty();
    }

    private static Optional<BlockStmt> bodyOf(CallableDeclaration<?> callable) {
        if (callable instanceof MethodDeclaration md) {
            return md.getBody();
        }
        if (callable instanceof ConstructorDeclaration cd) {
            return Optional.of(cd.getBody());
        }
        return Optional.empty();
    }

    /**
     * The outermost statements lying fully inside the lines. When none do, the innermost
     * statement overlapping them.
     */
    static List<Statement> selectStatements(BlockStmt body, int startLine, int endLine) {
        List<Statement> candidates = body.findAll(Statement.class).stream()
                .filter(s -> s != body && s.getRange().isPresent())
                .toList();

        List<Statement> inside = candidates.stream()
                .filter(s -> !(s instanceof BlockStmt))
                .filter(s -> s.getRange().get().begin.line >= startLine && s.getRange().get().end.line <= endLine)
                .toList();
        List<Statement> outermost = inside.stream()
                .filter(s -> inside.stream().noneMatch(o -> o != s && s.isDescendantOf(o)))
                .toList();
        if (!outermost.isEmpty()) {
            return outermost;
        }

        Statement innermost = null;
        int smallest = Integer.MAX_VALUE;
        for (Statement s : candidates) {
            int begin = s.getRange().get().begin.line;
            int end = s.getRange().get().end.line;
            if (begin <= endLine && startLine <= end && end - begin <= smallest) {
                innermost = s;
                smallest = end - begin;
            }
        }
        return innermost == null ? List.of() : List.of(innermost);
    }

    /**
     * State of one analysis run.
     */
    private class Walk {
        private final CallableDeclaration<?> callable;
        private final BlockStmt body;
        private final List<Statement> selected;
        private final CancellationToken token;
        private final Set<Node> selectionDeclarations = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Map<String, VariableUsage.Builder> builders = new LinkedHashMap<>();
        private final Map<String, Node> declarationOf = new HashMap<>();
        private final Map<String, String> knownTypes = new HashMap<>();
        private boolean partial;

        Walk(CallableDeclaration<?> callable, BlockStmt body, List<Statement> selected, CancellationToken token) {
            this.callable = callable;
            this.body = body;
            this.selected = selected;
            this.token = token;
        }

        VariableAnalysis run() {
            for (Statement statement : selected) {
                selectionDeclarations.addAll(statement.findAll(VariableDeclarator.class));
                selectionDeclarations.addAll(statement.findAll(Parameter.class));
            }

            for (Statement statement : selected) {
                token.throwIfCancellationRequested();
                statement.walk(Node.TreeTraversal.PREORDER, this::visit);
            }
            token.throwIfCancellationRequested();

            Position selectionEnd = selected.get(selected.size() - 1).getRange().get().end;
            markUsedAfter(selectionEnd);

            Map<String, VariableUsage> usages = new LinkedHashMap<>();
            builders.forEach((name, builder) -> usages.put(name, builder.build(dialect.untypedPlaceholder())));

            List<ReturnSite> returns = findReturns();
            int complexity = ComplexityCalculator.cyclomatic(selected);

            List<ValidationMessage> warnings = new ArrayList<>();
            if (partial) {
                warnings.add(new ValidationMessage(ValidationCodes.PARTIAL_SEMANTIC_RESOLUTION,
                        "Some names could not be resolved by the symbol solver and were matched by name"));
            }
            logger.debug("Semantic analysis of {}: {} statements, {} variables, {} returns",
                    callable.getNameAsString(), selected.size(), usages.size(), returns.size());
            return new VariableAnalysis(usages, returns, complexity, warnings);
        }

        private void visit(Node node) {
            if (node instanceof VariableDeclarator vd) {
                declareLocal(vd.getNameAsString(), vd, typeOf(vd), line(vd));
            } else if (node instanceof Parameter p) {
                declareLocal(p.getNameAsString(), p, typeOf(p), line(p));
            } else if (node instanceof NameExpr nameExpr) {
                reference(nameExpr);
            }
        }

        private void declareLocal(String name, Node declaration, String type, int line) {
            VariableUsage.Builder builder = builders.computeIfAbsent(name, VariableUsage::builder);
            builder.declaredInSelection(true).declaredBeforeSelection(false).inferredType(type).seenAt(line);
            declarationOf.put(name, declaration);
            knownTypes.put(name, type);
        }

        private void reference(NameExpr nameExpr) {
            Binding binding = bind(nameExpr);
            if (binding.kind() == BindingKind.TYPE_REFERENCE) {
                return;
            }
            String name = nameExpr.getNameAsString();
            VariableUsage.Builder builder = builders.computeIfAbsent(name, VariableUsage::builder);
            switch (binding.kind()) {
                case SELECTION -> {
                    builder.declaredInSelection(true).declaredBeforeSelection(false);
                    declarationOf.put(name, binding.declaration());
                }
                case BEFORE -> {
                    if (!builder.declaredInSelection()) {
                        builder.declaredBeforeSelection(true);
                        declarationOf.put(name, binding.declaration());
                    }
                }
                default -> {
                    // a field or an unresolved name
                }
            }
            if (builder.inferredType() == null && binding.type() != null) {
                builder.inferredType(binding.type());
                knownTypes.putIfAbsent(name, binding.type());
            }

            builder.countUsage(line(nameExpr));
            Node parent = nameExpr.getParentNode().orElse(null);
            if (parent instanceof AssignExpr assign && assign.getTarget() == nameExpr) {
                builder.markModified();
                if (assign.getOperator() != AssignExpr.Operator.ASSIGN) {
                    builder.markRead();
                }
            } else if (parent instanceof UnaryExpr unary && isIncrementOrDecrement(unary.getOperator())) {
                builder.markModified();
                builder.markRead();
            } else {
                builder.markRead();
            }
        }

        private Binding bind(NameExpr nameExpr) {
            try {
                ResolvedValueDeclaration resolved = nameExpr.resolve();
                if (resolved.isField()) {
                    return new Binding(BindingKind.EXTERNAL, null, describe(resolved));
                }
                Optional<Node> ast = resolved.toAst().map(n -> normalize(n, nameExpr.getNameAsString()));
                if (ast.isPresent()) {
                    return classify(ast.get());
                }
                if (resolved.isVariable() || resolved.isParameter()) {
                    return bindByName(nameExpr, false);
                }
                return new Binding(BindingKind.EXTERNAL, null, describe(resolved));
            } catch (Exception e) {
                return bindByName(nameExpr, true);
            }
        }

        /**
         * Name-based lookup used when the solver gives up: the closest earlier declaration in the
         * callable, then a field of the enclosing type.
         */
        private Binding bindByName(NameExpr nameExpr, boolean solverFailed) {
            String name = nameExpr.getNameAsString();
            Position at = nameExpr.getRange().map(r -> r.begin).orElse(null);
            Node closest = null;
            if (at != null) {
                List<Node> declarations = new ArrayList<>();
                declarations.addAll(callable.findAll(VariableDeclarator.class));
                declarations.addAll(callable.findAll(Parameter.class));
                for (Node candidate : declarations) {
                    if (nameOf(candidate).equals(name) && candidate.getRange().isPresent()
                            && candidate.getRange().get().begin.isBefore(at)
                            && (closest == null || closest.getRange().get().begin.isBefore(candidate.getRange().get().begin))) {
                        closest = candidate;
                    }
                }
            }
            if (closest != null) {
                partial |= solverFailed;
                return classify(closest);
            }

            Optional<String> fieldType = fieldType(nameExpr, name);
            if (fieldType.isPresent()) {
                return new Binding(BindingKind.EXTERNAL, null, fieldType.get());
            }
            if (Character.isUpperCase(name.charAt(0))) {
                // System, Math and the like
                logger.debug("Treating unresolved {} as a type reference", name);
                return new Binding(BindingKind.TYPE_REFERENCE, null, null);
            }
            partial = true;
            return new Binding(BindingKind.EXTERNAL, null, null);
        }

        private Binding classify(Node declaration) {
            String type = declaration instanceof VariableDeclarator vd ? typeOf(vd)
                    : declaration instanceof Parameter p ? typeOf(p) : null;
            if (selectionDeclarations.contains(declaration)) {
                return new Binding(BindingKind.SELECTION, declaration, type);
            }
            if (declaration == callable || declaration.isDescendantOf(callable)) {
                return new Binding(BindingKind.BEFORE, declaration, type);
            }
            return new Binding(BindingKind.EXTERNAL, declaration, type);
        }

        /**
         * References after the selection that bind to the same declaration as a selection variable.
         */
        private void markUsedAfter(Position selectionEnd) {
            for (NameExpr nameExpr : body.findAll(NameExpr.class)) {
                String name = nameExpr.getNameAsString();
                VariableUsage.Builder builder = builders.get(name);
                if (builder == null || nameExpr.getRange().isEmpty()
                        || !nameExpr.getRange().get().begin.isAfter(selectionEnd)) {
                    continue;
                }
                token.throwIfCancellationRequested();
                Node expected = declarationOf.get(name);
                Binding binding = bind(nameExpr);
                if (binding.kind() == BindingKind.TYPE_REFERENCE) {
                    continue;
                }
                if (expected == null ? binding.declaration() == null : expected == binding.declaration()) {
                    builder.usedAfterSelection(true);
                }
            }
        }

        private List<ReturnSite> findReturns() {
            List<ReturnSite> sites = new ArrayList<>();
            for (Statement statement : selected) {
                for (ReturnStmt returnStmt : statement.findAll(ReturnStmt.class)) {
                    if (belongsToNestedFunction(returnStmt, statement)) {
                        continue;
                    }
                    int line = line(returnStmt);
                    Optional<Expression> expression = returnStmt.getExpression();
                    if (expression.isEmpty()) {
                        sites.add(new ReturnSite(line, "", dialect.voidType()));
                    } else {
                        sites.add(new ReturnSite(line, expression.get().toString(), typeOf(expression.get())));
                    }
                }
            }
            return sites;
        }

        private boolean belongsToNestedFunction(Node node, Statement selectedStatement) {
            Node current = node.getParentNode().orElse(null);
            while (current != null && current != selectedStatement) {
                if (current instanceof LambdaExpr || current instanceof BodyDeclaration<?>) {
                    return true;
                }
                current = current.getParentNode().orElse(null);
            }
            return false;
        }

        private String typeOf(Expression expression) {
            try {
                String described = TypeNames.simplify(expression.calculateResolvedType().describe());
                if (!"null".equals(described)) {
                    return described;
                }
            } catch (Exception e) {
                logger.debug("Could not resolve the type of {}: {}", expression, e.getMessage());
            }
            if (expression instanceof NameExpr nameExpr) {
                VariableUsage.Builder builder = builders.get(nameExpr.getNameAsString());
                if (builder != null && builder.inferredType() != null) {
                    return builder.inferredType();
                }
            }
            return heuristics.expressionType(expression.toString(), knownTypes).orElse(dialect.untypedPlaceholder());
        }

        private String typeOf(VariableDeclarator vd) {
            if (!vd.getType().isVarType()) {
                return vd.getType().asString();
            }
            try {
                return TypeNames.simplify(vd.resolve().getType().describe());
            } catch (Exception e) {
                return vd.getInitializer()
                        .flatMap(init -> heuristics.expressionType(init.toString(), knownTypes))
                        .orElse(dialect.untypedPlaceholder());
            }
        }

        private String typeOf(Parameter p) {
            if (p.getType().isUnknownType()) {
                try {
                    return TypeNames.simplify(p.resolve().getType().describe());
                } catch (Exception e) {
                    return dialect.untypedPlaceholder();
                }
            }
            String type = p.getType().asString();
            return p.isVarArgs() ? type + "[]" : type;
        }

        private String describe(ResolvedValueDeclaration resolved) {
            try {
                return TypeNames.simplify(resolved.getType().describe());
            } catch (Exception e) {
                return null;
            }
        }

        private Optional<String> fieldType(Node node, String name) {
            Optional<TypeDeclaration> type = node.findAncestor(TypeDeclaration.class);
            while (type.isPresent()) {
                Optional<FieldDeclaration> field = type.get().getFieldByName(name);
                if (field.isPresent()) {
                    return Optional.of(field.get().getCommonType().asString());
                }
                type = type.get().findAncestor(TypeDeclaration.class);
            }
            return Optional.empty();
        }
    }

    /**
     * Resolution may hand back the whole declaration expression; narrow it to the declarator.
     */
    private static Node normalize(Node node, String name) {
        if (node instanceof VariableDeclarationExpr expr) {
            for (VariableDeclarator vd : expr.getVariables()) {
                if (vd.getNameAsString().equals(name)) {
                    return vd;
                }
            }
        }
        return node;
    }

    private static String nameOf(Node declaration) {
        if (declaration instanceof VariableDeclarator vd) {
            return vd.getNameAsString();
        }
        if (declaration instanceof Parameter p) {
            return p.getNameAsString();
        }
        return "";
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator operator) {
        return operator == UnaryExpr.Operator.PREFIX_INCREMENT
                || operator == UnaryExpr.Operator.PREFIX_DECREMENT
                || operator == UnaryExpr.Operator.POSTFIX_INCREMENT
                || operator == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }

    private static int line(Node node) {
        return node.getRange().map(r -> r.begin.line).orElse(0);
    }
}
