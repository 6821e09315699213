package com.raditha.extract.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaScaffoldParserTest {

    private final JavaScaffoldParser parser = new JavaScaffoldParser();

    private static Scaffold scaffold(String body, boolean resolve) {
        String text = """
                class ExtractScaffold {
                    void scaffold() {
                %s
                    }
                }""".formatted(body);
        return new Scaffold(text, 3, 1, 10, resolve);
    }

    @Test
    void testCheck_Clean() {
        assertTrue(parser.check(scaffold("        int y = 1 + 2;", false)).isEmpty());
    }

    @Test
    void testCheck_SyntaxError() {
        List<ScaffoldDiagnostic> diagnostics = parser.check(scaffold("        int y = 1 +;", false));

        assertFalse(diagnostics.isEmpty());
        assertEquals(ScaffoldDiagnostic.Kind.STRUCTURAL, diagnostics.get(0).kind());
        assertEquals(3, diagnostics.get(0).line());
    }

    @Test
    void testCheck_UndeclaredNameOnlyWhenResolving() {
        assertTrue(parser.check(scaffold("        int y = x + 1;", false)).isEmpty());

        List<ScaffoldDiagnostic> diagnostics = parser.check(scaffold("        int y = x + 1;", true));

        assertEquals(1, diagnostics.size());
        assertEquals(ScaffoldDiagnostic.Kind.UNRESOLVED_IDENTIFIER, diagnostics.get(0).kind());
        assertEquals("x", diagnostics.get(0).identifier());
        assertEquals("Cannot resolve symbol 'x'", diagnostics.get(0).message());
    }

    @Test
    void testCheck_DeclaredAndTypeNamesResolve() {
        String text = """
                class ExtractScaffold {
                    void scaffold() {
                int x = (int) 0;
                        int y = x + 1;
                        System.out.println(y);
                    }
                }""";

        assertTrue(parser.check(new Scaffold(text, 4, 2, 10, true)).isEmpty());
    }
}
