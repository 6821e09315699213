package com.raditha.extract.validation;

import com.raditha.extract.dialect.JavaDialect;
import com.raditha.extract.dialect.TypeScriptDialect;
import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LineRange;
import com.raditha.extract.model.SourceModel;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NamingValidatorTest {

    private NamingValidator java;
    private ValidationReport report;

    @BeforeEach
    void setUp() {
        java = new NamingValidator(new JavaDialect());
        report = new ValidationReport();
    }

    private static FunctionScope function(String name, String container, int start, int end) {
        return new FunctionScope(name, container, new LineRange(start, end), List.of(), "void", false, false);
    }

    @Test
    void testCheckName_Valid() {
        java.checkName("computeTotal", report);

        assertTrue(report.isValid());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void testCheckName_Reserved() {
        java.checkName("for", report);

        assertTrue(report.hasError(ValidationCodes.METHOD_NAME_RESERVED));
        assertEquals("'for' is a reserved keyword in Java and cannot be used as a function name",
                report.errors().get(0).message());
        assertFalse(report.hasWarning(ValidationCodes.METHOD_NAME_CONVENTION));
    }

    @Test
    void testCheckName_InvalidStart() {
        java.checkName("1st", report);

        assertTrue(report.hasError(ValidationCodes.METHOD_NAME_INVALID_START));
    }

    @Test
    void testCheckName_InvalidCharacterReportedOnce() {
        java.checkName("do-it-now", report);

        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).message().contains("'-'"));
    }

    @Test
    void testCheckName_Convention() {
        java.checkName("Compute_total", report);

        assertTrue(report.isValid());
        assertTrue(report.hasWarning(ValidationCodes.METHOD_NAME_CONVENTION));
    }

    @Test
    void testCheckName_DollarAllowed() {
        new NamingValidator(new TypeScriptDialect()).checkName("$load", report);

        assertTrue(report.isValid());
    }

    @Test
    void testCheckName_BlankIgnored() {
        java.checkName("", report);

        assertTrue(report.errors().isEmpty());
    }

    @Test
    void testCheckConflicts_SameContainer() {
        FunctionScope enclosing = function("run", "Worker", 2, 8);
        SourceModel structure = new SourceModel(
                List.of(enclosing, function("helper", "Worker", 10, 12), function("other", "Other", 15, 17)),
                List.of(), List.of("Worker", "Other"));

        java.checkConflicts("helper", enclosing, structure, report);
        assertTrue(report.hasError(ValidationCodes.METHOD_NAME_CONFLICT));
        assertTrue(report.errors().get(0).message().contains("line 10"));
    }

    @Test
    void testCheckConflicts_OtherContainer() {
        FunctionScope enclosing = function("run", "Worker", 2, 8);
        SourceModel structure = new SourceModel(
                List.of(enclosing, function("other", "Other", 15, 17)), List.of(), List.of());

        java.checkConflicts("other", enclosing, structure, report);

        assertTrue(report.isValid());
    }

    @Test
    void testCheckConflicts_ScanFailure() {
        SourceModel structure = mock(SourceModel.class);
        when(structure.functions()).thenThrow(new IllegalStateException("broken"));

        java.checkConflicts("helper", function("run", "", 1, 3), structure, report);

        assertTrue(report.isValid());
        assertTrue(report.hasWarning(ValidationCodes.NAME_CONFLICT_CHECK_FAILED));
    }
}
