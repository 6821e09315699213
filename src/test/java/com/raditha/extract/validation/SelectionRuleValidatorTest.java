package com.raditha.extract.validation;

import com.raditha.extract.dialect.JavaDialect;
import com.raditha.extract.dialect.TypeScriptDialect;
import com.raditha.extract.model.ExtractionOptions;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectionRuleValidatorTest {

    private ValidationReport report;

    @BeforeEach
    void setUp() {
        report = new ValidationReport();
    }

    private static ExtractionOptions options(boolean isStatic, boolean isAsync) {
        return new ExtractionOptions(1, 1, "helper", isStatic, isAsync, "private");
    }

    @Test
    void testCheck_ThisInStatic() {
        new SelectionRuleValidator(new JavaDialect())
                .check(List.of("this.count++;"), options(true, false), report);

        assertTrue(report.hasError(ValidationCodes.THIS_IN_STATIC_CONTEXT));
    }

    @Test
    void testCheck_ThisInsideStringIgnored() {
        new SelectionRuleValidator(new JavaDialect())
                .check(List.of("log(\"this is fine\"); // this too"), options(true, false), report);

        assertTrue(report.isValid());
    }

    @Test
    void testCheck_AwaitNeedsAsync() {
        new SelectionRuleValidator(new TypeScriptDialect())
                .check(List.of("const data = await fetchData();"), options(false, false), report);

        assertTrue(report.hasWarning(ValidationCodes.ASYNC_REQUIRED));
    }

    @Test
    void testCheck_AsyncWithAwaitIsFine() {
        new SelectionRuleValidator(new TypeScriptDialect())
                .check(List.of("const data = await fetchData();"), options(false, true), report);

        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void testCheck_AsyncUnsupported() {
        new SelectionRuleValidator(new JavaDialect())
                .check(List.of("run();"), options(false, true), report);

        assertTrue(report.hasWarning(ValidationCodes.UNSUPPORTED_MODIFIER));
    }

    @Test
    void testCheck_IncompleteStatement() {
        new SelectionRuleValidator(new JavaDialect())
                .check(List.of("int total = a +", "    b", "   "), options(false, false), report);

        assertTrue(report.hasWarning(ValidationCodes.INCOMPLETE_STATEMENT));
    }

    @Test
    void testCheck_EndsWithBlock() {
        new SelectionRuleValidator(new JavaDialect())
                .check(List.of("if (ready) {", "  go();", "}  // done"), options(false, false), report);

        assertTrue(report.warnings().isEmpty());
    }
}
