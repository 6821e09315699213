package com.raditha.extract.validation;

import com.raditha.extract.model.ExtractionRequest;
import com.raditha.extract.model.LanguageVariant;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private static final String SOURCE = """
            class A {
                void run() {
                    int x = 1;

                    // just a note
                }
            }""";

    private RequestValidator validator;
    private ValidationReport report;

    @BeforeEach
    void setUp() {
        validator = new RequestValidator();
        report = new ValidationReport();
    }

    private boolean validate(int start, int end, String name) {
        return validator.validate(ExtractionRequest.of(SOURCE, LanguageVariant.TYPED_WITH_SEMANTIC_MODEL, start, end, name),
                report);
    }

    @Test
    void testValidate_GoodRequest() {
        assertTrue(validate(3, 3, "init"));
        assertTrue(report.isValid());
    }

    @Test
    void testValidate_EmptyName() {
        assertTrue(validate(3, 3, "  "));
        assertTrue(report.hasError(ValidationCodes.METHOD_NAME_EMPTY));
    }

    @Test
    void testValidate_StartOutOfRange() {
        assertFalse(validate(0, 3, "init"));
        assertTrue(report.hasError(ValidationCodes.START_LINE_INVALID));
        assertFalse(report.hasError(ValidationCodes.LINE_RANGE_INVALID));
    }

    @Test
    void testValidate_EndPastFile() {
        assertFalse(validate(3, 8, "init"));
        assertTrue(report.hasError(ValidationCodes.END_LINE_INVALID));
        assertTrue(report.errors().get(0).message().contains("1-7"));
    }

    @Test
    void testValidate_Reversed() {
        assertFalse(validate(5, 3, "init"));
        assertTrue(report.hasError(ValidationCodes.LINE_RANGE_INVALID));
        assertFalse(report.hasError(ValidationCodes.START_LINE_INVALID));
    }

    @Test
    void testValidate_BlankAndCommentLines() {
        assertTrue(validate(4, 5, "init"));
        assertTrue(report.hasError(ValidationCodes.EMPTY_SELECTION));
    }
}
