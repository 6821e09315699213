package com.raditha.extract.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.extract.model.VariableUsage;

import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Complexity measures used by the aggregator.
 */
public class ComplexityCalculator {

    private static final Pattern DECISION_KEYWORD = Pattern.compile("\\b(?:if|for|while|catch|case)\\b");
    private static final Pattern LOGICAL_OPERATOR = Pattern.compile("&&|\\|\\|");
    // a '?' that is not optional chaining, nullish coalescing, an optional property or a wildcard
    private static final Pattern TERNARY = Pattern.compile("(?<![<?,]\\s{0,2})\\?(?![?.:])(?=\\s*[^\\s)>,])");

    private ComplexityCalculator() {
        /* this is only a utility class */
    }

    /**
     * Cyclomatic complexity of the given statements: one plus every decision point.
     */
    public static int cyclomatic(Collection<? extends Node> statements) {
        int complexity = 1;
        for (Node statement : statements) {
            complexity += statement.findAll(IfStmt.class).size();
            complexity += statement.findAll(ForStmt.class).size();
            complexity += statement.findAll(ForEachStmt.class).size();
            complexity += statement.findAll(WhileStmt.class).size();
            complexity += statement.findAll(DoStmt.class).size();
            complexity += statement.findAll(CatchClause.class).size();
            complexity += statement.findAll(ConditionalExpr.class).size();
            complexity += (int) statement.findAll(SwitchEntry.class).stream()
                    .filter(entry -> !entry.getLabels().isEmpty())
                    .count();
            complexity += (int) statement.findAll(BinaryExpr.class).stream()
                    .filter(b -> b.getOperator() == BinaryExpr.Operator.AND
                            || b.getOperator() == BinaryExpr.Operator.OR)
                    .count();
        }
        return complexity;
    }

    /**
     * Cyclomatic complexity counted over comment- and string-stripped lines.
     * {@code else if} counts once, through its {@code if}, and a do loop through its {@code while}.
     */
    public static int cyclomaticLexical(List<String> strippedLines) {
        int complexity = 1;
        for (String line : strippedLines) {
            complexity += count(DECISION_KEYWORD.matcher(line));
            complexity += count(LOGICAL_OPERATOR.matcher(line));
            complexity += count(TERNARY.matcher(line));
        }
        return complexity;
    }

    private static int count(Matcher matcher) {
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }

    /**
     * Weighted score of how entangled the selection is with its surroundings.
     */
    public static int variableComplexity(Collection<VariableUsage> usages) {
        int score = 0;
        for (VariableUsage usage : usages) {
            score += 1;
            if (usage.isModified()) {
                score += 2;
            }
            if (usage.usageCount() > 3) {
                score += 1;
            }
            if (!usage.declaredBeforeSelection() && !usage.declaredInSelection()) {
                score += 2;
            }
            if (usage.isFlowOut()) {
                score += 3;
            }
        }
        return score;
    }
}
