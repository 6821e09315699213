package com.raditha.extract.parsing;

import com.raditha.extract.model.FunctionScope;
import com.raditha.extract.model.LanguageVariant;
import com.raditha.extract.model.SourceBuffer;
import com.raditha.extract.model.SourceModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaStructureParserTest {

    private static final String SOURCE = """
            import java.util.List;
            import static java.lang.Math.max;

            public class Inventory {
                private int count;

                public Inventory(int count) {
                    this.count = count;
                }

                public static int total(List<Integer> values, int... extra) {
                    int sum = 0;
                    return sum;
                }

                class Line {
                    void print() {
                    }
                }
            }
            """;

    @Test
    void testParse_FunctionsInPreOrder() {
        SourceModel model = new JavaStructureParser().parse(new SourceBuffer(SOURCE, LanguageVariant.TYPED_WITH_SEMANTIC_MODEL));

        List<String> names = model.functions().stream().map(FunctionScope::qualifiedName).toList();
        assertEquals(List.of("Inventory.Inventory", "Inventory.total", "Line.print"), names);

        FunctionScope total = model.functions().get(1);
        assertEquals(11, total.range().startLine());
        assertEquals(14, total.range().endLine());
        assertTrue(total.isStatic());
        assertEquals("int", total.returnType());
        assertEquals("List<Integer> values", total.parameters().get(0).toParameterDeclaration());
        assertEquals("int... extra", total.parameters().get(1).toParameterDeclaration());
    }

    @Test
    void testParse_ImportsAndTypes() {
        SourceModel model = new JavaStructureParser().parse(new SourceBuffer(SOURCE, LanguageVariant.TYPED_WITH_SEMANTIC_MODEL));

        assertEquals(List.of("import java.util.List;", "import static java.lang.Math.max;"), model.imports());
        assertEquals(List.of("Inventory", "Line"), model.typeNames());
    }

    @Test
    void testParse_Garbage() {
        SourceModel model = new JavaStructureParser().parse(new SourceBuffer("}}} not java {{{", LanguageVariant.TYPED_WITH_SEMANTIC_MODEL));

        assertNotNull(model);
    }
}
