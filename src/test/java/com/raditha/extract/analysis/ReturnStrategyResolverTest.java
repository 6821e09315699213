package com.raditha.extract.analysis;

import com.raditha.extract.dialect.JavaDialect;
import com.raditha.extract.dialect.TypeScriptDialect;
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

class ReturnStrategyResolverTest {

    private ReturnStrategyResolver resolver;
    private ValidationReport report;

    @BeforeEach
    void setUp() {
        resolver = new ReturnStrategyResolver(new JavaDialect(), 3);
        report = new ValidationReport();
    }

    private static VariableUsage flowOut(String name, String type) {
        return VariableUsage.builder(name).declaredInSelection(true).usedAfterSelection(true).build(type);
    }

    private static VariableAnalysis analysis(List<VariableUsage> usages, List<ReturnSite> sites) {
        Map<String, VariableUsage> variables = new LinkedHashMap<>();
        usages.forEach(u -> variables.put(u.name(), u));
        return new VariableAnalysis(variables, sites, 1, List.of());
    }

    @Test
    void testResolve_Void() {
        ReturnAnalysis result = resolver.resolve(analysis(List.of(), List.of()), "helper", report);

        assertEquals(ReturnStrategy.VOID, result.strategy());
        assertEquals("void", result.suggestedType());
        assertFalse(result.requiresReturnValue());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void testResolve_SingleVariable() {
        ReturnAnalysis result = resolver.resolve(analysis(List.of(flowOut("y", "int")), List.of()), "helper", report);

        assertEquals(ReturnStrategy.SINGLE_VARIABLE, result.strategy());
        assertEquals("int", result.suggestedType());
        assertEquals(List.of("y"), result.flowOutVariables());
        assertTrue(result.reason().contains("'y'"));
    }

    @Test
    void testResolve_ExplicitReturn() {
        List<ReturnSite> sites = List.of(new ReturnSite(4, "total", "int"), new ReturnSite(7, "0", "int"));

        ReturnAnalysis result = resolver.resolve(analysis(List.of(), sites), "helper", report);

        assertEquals(ReturnStrategy.EXPLICIT_RETURN, result.strategy());
        assertEquals("int", result.suggestedType());
        assertTrue(result.reason().contains("4, 7"));
    }

    @Test
    void testResolve_ExplicitReturnsDisagree() {
        List<ReturnSite> sites = List.of(new ReturnSite(4, "name", "String"), new ReturnSite(7, "1", "int"));

        ReturnAnalysis result = resolver.resolve(analysis(List.of(), sites), "helper", report);

        assertEquals(ReturnStrategy.MIXED, result.strategy());
        assertEquals("Object", result.suggestedType());
        assertTrue(report.hasWarning(ValidationCodes.AMBIGUOUS_RETURN_TYPE));
    }

    @Test
    void testResolve_MixedReturnAndFlowOut() {
        ReturnAnalysis result = resolver.resolve(
                analysis(List.of(flowOut("y", "int")), List.of(new ReturnSite(3, "", "void"))), "helper", report);

        assertEquals(ReturnStrategy.MIXED, result.strategy());
        assertTrue(report.hasWarning(ValidationCodes.MIXED_RETURN_STRATEGY));
    }

    @Test
    void testResolve_MultipleVariablesJava() {
        ReturnAnalysis result = resolver.resolve(
                analysis(List.of(flowOut("min", "int"), flowOut("max", "int")), List.of()), "bounds", report);

        assertEquals(ReturnStrategy.MULTIPLE_VARIABLES, result.strategy());
        assertEquals("BoundsResult", result.suggestedType());
        assertEquals(2, result.components().size());
        assertTrue(result.reason().contains("record BoundsResult(int min, int max)"));
    }

    @Test
    void testResolve_MultipleVariablesTypeScript() {
        ReturnStrategyResolver ts = new ReturnStrategyResolver(new TypeScriptDialect(), 3);

        ReturnAnalysis result = ts.resolve(
                analysis(List.of(flowOut("min", "number"), flowOut("label", "string")), List.of()), "bounds", report);

        assertEquals("{ min: number, label: string }", result.suggestedType());
    }

    @Test
    void testResolve_TooManyVariables() {
        List<VariableUsage> four = List.of(flowOut("a", "int"), flowOut("b", "int"),
                flowOut("c", "int"), flowOut("d", "int"));

        ReturnAnalysis result = resolver.resolve(analysis(four, List.of()), "helper", report);

        assertEquals(ReturnStrategy.VOID, result.strategy());
        assertEquals("void", result.suggestedType());
        assertEquals(List.of("a", "b", "c", "d"), result.flowOutVariables());
        assertTrue(report.hasWarning(ValidationCodes.TOO_MANY_RETURN_VALUES));
    }

    @Test
    void testResolve_TupleLimitIsConfigurable() {
        ReturnStrategyResolver strict = new ReturnStrategyResolver(new JavaDialect(), 2);
        List<VariableUsage> three = List.of(flowOut("a", "int"), flowOut("b", "int"), flowOut("c", "int"));

        assertEquals(ReturnStrategy.VOID, strict.resolve(analysis(three, List.of()), "helper", report).strategy());
        assertEquals(ReturnStrategy.MULTIPLE_VARIABLES,
                resolver.resolve(analysis(three, List.of()), "helper", new ValidationReport()).strategy());
    }
}
