package com.raditha.extract.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceBufferTest {

    @Test
    void testLines_DropCarriageReturns() {
        SourceBuffer buffer = new SourceBuffer("a\r\nb\nc", LanguageVariant.LEXICAL_ONLY);

        assertEquals(List.of("a", "b", "c"), buffer.lines());
        assertEquals(3, buffer.lineCount());
        assertEquals("b", buffer.line(2));
    }

    @Test
    void testSlice() {
        SourceBuffer buffer = new SourceBuffer("one\ntwo\nthree\n", LanguageVariant.TYPED_WITH_SEMANTIC_MODEL);

        assertEquals("two\nthree", buffer.slice(2, 3));
        assertEquals(4, buffer.lineCount(), "a trailing newline opens an empty last line");
    }

    @Test
    void testRejectsNulls() {
        assertThrows(NullPointerException.class, () -> new SourceBuffer(null, LanguageVariant.LEXICAL_ONLY));
        assertThrows(NullPointerException.class, () -> new SourceBuffer("", null));
    }
}
