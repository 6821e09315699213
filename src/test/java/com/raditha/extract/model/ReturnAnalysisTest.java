package com.raditha.extract.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReturnAnalysisTest {

    @Test
    void testRequiresReturnValue() {
        assertFalse(ReturnAnalysis.voidReturn("nothing").requiresReturnValue());

        ReturnAnalysis bareReturns = new ReturnAnalysis(ReturnStrategy.EXPLICIT_RETURN, "void", "bare", List.of(), List.of());
        assertFalse(bareReturns.requiresReturnValue());

        ReturnAnalysis single = new ReturnAnalysis(ReturnStrategy.SINGLE_VARIABLE, "int", "y", List.of("y"), List.of());
        assertTrue(single.requiresReturnValue());
    }

    @Test
    void testVariableUsageScope() {
        VariableUsage local = VariableUsage.builder("y").declaredInSelection(true).usedAfterSelection(true).build("Object");
        VariableUsage flowIn = VariableUsage.builder("x").declaredBeforeSelection(true).markRead().build("Object");
        VariableUsage field = VariableUsage.builder("count").markRead().build("Object");

        assertEquals(VariableScope.LOCAL, local.scope());
        assertTrue(local.isFlowOut());
        assertEquals(VariableScope.FLOW_IN, flowIn.scope());
        assertTrue(flowIn.isFlowIn());
        assertEquals(VariableScope.EXTERNAL, field.scope());
        assertFalse(field.isFlowIn());
        assertEquals("Object", field.inferredType());
    }
}
