package com.raditha.extract.analysis;

import com.raditha.extract.dialect.JavaDialect;
import com.raditha.extract.dialect.LexicalDeclaration;
import com.raditha.extract.dialect.TypeScriptDialect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypeInferenceHeuristicsTest {

    private final TypeInferenceHeuristics java = new TypeInferenceHeuristics(new JavaDialect());
    private final TypeInferenceHeuristics typeScript = new TypeInferenceHeuristics(new TypeScriptDialect());

    private String javaType(String expression) {
        return java.expressionType(expression, Map.of("x", "int", "name", "String")).orElse(null);
    }

    @Test
    void testExpressionType_JavaLiterals() {
        assertEquals("int", javaType("42"));
        assertEquals("long", javaType("42L"));
        assertEquals("double", javaType("3.14"));
        assertEquals("float", javaType("2.5f"));
        assertEquals("boolean", javaType("true"));
        assertEquals("String", javaType("\"hi\""));
        assertEquals("char", javaType("'c'"));
    }

    @Test
    void testExpressionType_Constructors() {
        assertEquals("ArrayList", javaType("new ArrayList<>()"));
        assertEquals("HashMap<String, Integer>", javaType("new HashMap<String, Integer>()"));
        assertEquals("int[]", javaType("new int[3]"));
    }

    @Test
    void testExpressionType_Operators() {
        assertEquals("boolean", javaType("a > b"));
        assertEquals("boolean", javaType("name.isEmpty()"));
        assertEquals("int", javaType("x + 1"));
        assertEquals("double", javaType("x * 1.5"));
        assertEquals("String", javaType("name + x"));
        assertEquals("int", javaType("list.size()"));
        assertEquals("int", javaType("x"));
    }

    @Test
    void testExpressionType_Unknown() {
        assertNull(javaType("compute(arg)"));
        assertNull(javaType("unknown"));
        assertEquals(Optional.empty(), java.expressionType("  ;", Map.of()));
    }

    @Test
    void testExpressionType_TypeScript() {
        assertEquals(Optional.of("string"), typeScript.expressionType("`a${b}`", Map.of()));
        assertEquals(Optional.of("string"), typeScript.expressionType("'x'", Map.of()));
        assertEquals(Optional.of("object"), typeScript.expressionType("{ a: 1 }", Map.of()));
        assertEquals(Optional.of("any[]"), typeScript.expressionType("[1, 2]", Map.of()));
        assertEquals(Optional.of("number"), typeScript.expressionType("items.length", Map.of()));
    }

    @Test
    void testFromName() {
        assertEquals(Optional.of("boolean"), java.fromName("isReady"));
        assertEquals(Optional.of("int"), java.fromName("itemCount"));
        assertEquals(Optional.of("double"), java.fromName("averageScore"));
        assertEquals(Optional.empty(), java.fromName("customer"));
        assertEquals(Optional.empty(), java.fromName("island"), "prefix must be followed by a capital");
    }

    @Test
    void testFromCollectionHints() {
        assertEquals(Optional.of("List<Object>"),
                java.fromCollectionHints("items", List.of("for (String s : items) {")));
        assertEquals(Optional.of("any[]"),
                typeScript.fromCollectionHints("queue", List.of("queue.push(next);")));
        assertEquals(Optional.empty(), java.fromCollectionHints("items", List.of("print(items);")));
    }

    @Test
    void testInferDeclared_VarUsesInitializer() {
        LexicalDeclaration declaration = LexicalDeclaration.variable("sb", "var", "new StringBuilder()", 0);

        assertEquals("StringBuilder", java.inferDeclared(declaration, Map.of(), List.of()));
    }

    @Test
    void testInferDeclared_WrittenTypeWins() {
        LexicalDeclaration declaration = LexicalDeclaration.variable("ids", "List<Long>", "load()", 0);

        assertEquals("List<Long>", java.inferDeclared(declaration, Map.of(), List.of()));
    }

    @Test
    void testInferDeclared_LoopBindingFromArray() {
        LexicalDeclaration declaration = new LexicalDeclaration(
                "item", null, null, LexicalDeclaration.Kind.LOOP_BINDING, "items", 0);

        assertEquals("number", typeScript.inferDeclared(declaration, Map.of("items", "number[]"), List.of()));
    }

    @Test
    void testInferUndeclared_FallsBackToPlaceholder() {
        assertEquals("any", typeScript.inferUndeclared("thing", List.of()));
        assertEquals("Object", java.inferUndeclared("thing", List.of()));
    }
}
