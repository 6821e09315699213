package com.raditha.extract.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    @Test
    void testStripCommentsAndStrings_KeepsColumns() {
        List<String> lines = List.of(
                "int a = 1; // count",
                "String s = \"a + b\";",
                "/* start",
                "   still comment */ int b = 2;");

        List<String> stripped = SourceText.stripCommentsAndStrings(lines);

        for (int i = 0; i < lines.size(); i++) {
            assertEquals(lines.get(i).length(), stripped.get(i).length(), "line " + i + " keeps its length");
        }
        assertEquals("int a = 1;", stripped.get(0).trim());
        assertFalse(stripped.get(1).contains("+"), "string contents are blanked");
        assertTrue(stripped.get(1).contains("\"     \""));
        assertTrue(stripped.get(2).isBlank());
        assertEquals("int b = 2;", stripped.get(3).trim());
    }

    @Test
    void testStripCommentsAndStrings_TemplateLiteralSpansLines() {
        List<String> stripped = SourceText.stripCommentsAndStrings(List.of(
                "const t = `first ${x}",
                "second`; const y = 1;"));

        assertFalse(stripped.get(0).contains("first"));
        assertFalse(stripped.get(1).contains("second"));
        assertTrue(stripped.get(1).contains("const y = 1;"));
    }

    @Test
    void testStripCommentsAndStrings_EscapedQuote() {
        List<String> stripped = SourceText.stripCommentsAndStrings(List.of("s = \"a\\\"b\"; t = 1;"));

        assertTrue(stripped.get(0).endsWith("; t = 1;"));
    }

    @Test
    void testIsBlankOrComment() {
        assertTrue(SourceText.isBlankOrComment("   "));
        assertTrue(SourceText.isBlankOrComment(""));
        assertTrue(SourceText.isBlankOrComment("  // note"));
        assertTrue(SourceText.isBlankOrComment("/* block"));
        assertTrue(SourceText.isBlankOrComment(" * javadoc line"));
        assertFalse(SourceText.isBlankOrComment("x++; // note"));
    }
}
