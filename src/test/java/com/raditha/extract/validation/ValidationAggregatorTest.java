package com.raditha.extract.validation;

import com.raditha.extract.analysis.VariableAnalysis;
import com.raditha.extract.config.ExtractionConfig;
import com.raditha.extract.model.ExtractionAnalysis;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LineRange;
import com.raditha.extract.model.ReturnAnalysis;
import com.raditha.extract.model.ReturnSite;
import com.raditha.extract.model.ReturnStrategy;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import com.raditha.extract.model.VariableUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationAggregatorTest {

    private static final FunctionScope SCOPE = new FunctionScope("run", "Worker", new LineRange(2, 20),
            List.of(), "void", false, false);

    private ValidationReport report;

    @BeforeEach
    void setUp() {
        report = new ValidationReport();
    }

    private static VariableAnalysis analysis(int complexity, List<ReturnSite> returns, VariableUsage... usages) {
        Map<String, VariableUsage> variables = new LinkedHashMap<>();
        for (VariableUsage usage : usages) {
            variables.put(usage.name(), usage);
        }
        return new VariableAnalysis(variables, returns, complexity, List.of());
    }

    private static VariableUsage modifiedExternal(String name) {
        return VariableUsage.builder(name).declaredBeforeSelection(true).markRead().markModified().countUsage(5).build("int");
    }

    @Test
    void testAggregate_Classification() {
        VariableAnalysis analysis = analysis(1, List.of(),
                VariableUsage.builder("b").declaredInSelection(true).usedAfterSelection(true).build("int"),
                VariableUsage.builder("a").declaredBeforeSelection(true).markRead().build("int"),
                modifiedExternal("sum"),
                VariableUsage.builder("count").markRead().build("int"));

        ExtractionAnalysis result = new ValidationAggregator(ExtractionConfig.moderate())
                .aggregate(SCOPE, analysis, null, report);

        assertEquals("Worker.run", result.containingScopeName());
        assertTrue(result.scopeValid());
        assertEquals(List.of("b"), result.localVariables());
        assertEquals(List.of("a", "sum"), result.externalVariables());
        assertEquals(List.of("sum"), result.modifiedVariables());
        assertEquals(List.of("count"), result.undeclaredVariables());
        assertEquals(ReturnStrategy.VOID, result.returnStrategy());
        assertTrue(report.hasWarning(ValidationCodes.VARIABLE_NEEDS_RETURN));
        assertTrue(report.hasWarning(ValidationCodes.UNDECLARED_VARIABLE));
        assertTrue(report.isValid());
    }

    @Test
    void testAggregate_Thresholds() {
        VariableAnalysis analysis = analysis(12, List.of(),
                modifiedExternal("a"), modifiedExternal("b"), modifiedExternal("c"), modifiedExternal("d"));

        ExtractionAnalysis result = new ValidationAggregator(ExtractionConfig.strict())
                .aggregate(SCOPE, analysis, null, report);

        assertEquals(12, result.cyclomaticComplexity());
        assertEquals(12, result.variableComplexityScore());
        assertTrue(report.hasWarning(ValidationCodes.TOO_MANY_MODIFIED_VARS));
        assertTrue(report.hasWarning(ValidationCodes.TOO_MANY_DEPENDENCIES));
        assertTrue(report.hasWarning(ValidationCodes.HIGH_COMPLEXITY));
        assertTrue(report.hasWarning(ValidationCodes.HIGH_VARIABLE_COMPLEXITY));
    }

    @Test
    void testAggregate_ThresholdsNotReachedWhenLenient() {
        VariableAnalysis analysis = analysis(12, List.of(),
                modifiedExternal("a"), modifiedExternal("b"), modifiedExternal("c"), modifiedExternal("d"));

        new ValidationAggregator(ExtractionConfig.lenient()).aggregate(SCOPE, analysis, null, report);

        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void testAggregate_ReturnsWithModification() {
        VariableAnalysis analysis = analysis(2, List.of(new ReturnSite(7, "total", "int")), modifiedExternal("total"));
        ReturnAnalysis returns = new ReturnAnalysis(ReturnStrategy.EXPLICIT_RETURN, "int",
                "Selection returns int (line 7)", List.of(), List.of());

        ExtractionAnalysis result = new ValidationAggregator(ExtractionConfig.moderate())
                .aggregate(SCOPE, analysis, returns, report);

        assertTrue(result.hasReturnStatements());
        assertEquals(ReturnStrategy.EXPLICIT_RETURN, result.returnStrategy());
        assertTrue(report.hasWarning(ValidationCodes.HAS_RETURN_STATEMENTS));
        assertTrue(report.hasWarning(ValidationCodes.COMPLEX_REFACTORING_NEEDED));
        assertTrue(report.hasWarning(ValidationCodes.RETURN_TYPE_ANALYSIS));
    }

    @Test
    void testAggregate_VoidReturnAddsNoAdvisory() {
        new ValidationAggregator(ExtractionConfig.moderate())
                .aggregate(SCOPE, VariableAnalysis.empty(), ReturnAnalysis.voidReturn("nothing"), report);

        assertFalse(report.hasWarning(ValidationCodes.RETURN_TYPE_ANALYSIS));
    }

    @Test
    void testAggregate_NoScope() {
        ExtractionAnalysis result = new ValidationAggregator(ExtractionConfig.moderate())
                .aggregate(null, VariableAnalysis.empty(), null, report);

        assertFalse(result.scopeValid());
        assertEquals("", result.containingScopeName());
        assertEquals(1, result.cyclomaticComplexity());
    }
}
