package com.raditha.extract.analysis;

import com.raditha.extract.dialect.JavaDialect;
import com.raditha.extract.dialect.TypeScriptDialect;
import com.raditha.extract.model.ValidationCodes;
import com.raditha.extract.model.VariableScope;
import com.raditha.extract.model.VariableUsage;
import com.raditha.extract.util.CancellationToken;
import com.raditha.extract.util.ExtractionCancelledException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexicalVariableAnalyzerTest {

    private final LexicalVariableAnalyzer typeScript = new LexicalVariableAnalyzer(new TypeScriptDialect());

    private static final String LOOP = """
            function total(items: number[]): number {
              let sum = 0;
              for (const item of items) {
                sum += item;
              }
              const avg = sum / items.length;
              return avg;
            }
            """;

    @Test
    void testAnalyze_LoopBody() {
        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(LOOP, 3, 5), CancellationToken.none());

        VariableUsage item = analysis.variables().get("item");
        assertEquals(VariableScope.LOCAL, item.scope());
        assertEquals("number", item.inferredType());
        assertFalse(item.usedAfterSelection());

        VariableUsage items = analysis.variables().get("items");
        assertTrue(items.isFlowIn());
        assertEquals("number[]", items.inferredType());
        assertFalse(items.isModified());

        VariableUsage sum = analysis.variables().get("sum");
        assertTrue(sum.isFlowIn());
        assertTrue(sum.isModified());
        assertTrue(sum.isRead());
        assertTrue(sum.usedAfterSelection());
        assertEquals("number", sum.inferredType());

        assertTrue(analysis.returnSites().isEmpty());
        assertEquals(2, analysis.cyclomaticComplexity());
        assertEquals(ValidationCodes.HEURISTIC_ANALYSIS, analysis.warnings().get(0).code());
    }

    @Test
    void testAnalyze_FlowOut() {
        String source = """
                function report(items: string[]) {
                  const count = items.length;
                  const doubled = count * 2;
                  console.log(doubled);
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 2, 3), CancellationToken.none());

        assertEquals(List.of("doubled"), analysis.flowOut().stream().map(VariableUsage::name).toList());
        assertFalse(analysis.variables().get("count").usedAfterSelection());
        assertEquals("number", analysis.variables().get("count").inferredType());
        assertEquals("number", analysis.variables().get("doubled").inferredType());
        assertEquals("string[]", analysis.variables().get("items").inferredType());
        assertFalse(analysis.variables().containsKey("console"));
        assertFalse(analysis.variables().containsKey("length"));
    }

    @Test
    void testAnalyze_BlockClosesInsideSelection() {
        String source = """
                function f(flag: boolean) {
                  if (flag) {
                    const temp = 1;
                    console.log(temp);
                  }
                  const temp = 2;
                  return temp;
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 2, 5), CancellationToken.none());

        assertFalse(analysis.variables().get("temp").usedAfterSelection());
        assertTrue(analysis.flowOut().isEmpty());
        assertEquals("boolean", analysis.variables().get("flag").inferredType());
    }

    @Test
    void testAnalyze_ReturnInsideCallbackIgnored() {
        String source = """
                function names(users: User[]): string[] {
                  const result = users.map(u => {
                    return u.name;
                  });
                  return result;
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 2, 4), CancellationToken.none());

        assertTrue(analysis.returnSites().isEmpty());
        assertEquals(VariableScope.LOCAL, analysis.variables().get("u").scope());
        assertFalse(analysis.variables().get("u").usedAfterSelection());
        assertTrue(analysis.variables().get("result").isFlowOut());
        assertTrue(analysis.variables().get("users").isFlowIn());
        assertFalse(analysis.variables().containsKey("name"));
    }

    @Test
    void testAnalyze_JavaFallback() {
        String source = """
                class Calc {
                    int run(int base) {
                        int x = base * 2;
                        int y = x + 1;
                        return y;
                    }
                }
                """;
        LexicalVariableAnalyzer java = new LexicalVariableAnalyzer(new JavaDialect());

        VariableAnalysis analysis = java.analyze(Selections.java(source, 4, 4), CancellationToken.none());

        assertTrue(analysis.variables().get("x").isFlowIn());
        assertEquals("int", analysis.variables().get("x").inferredType());
        assertTrue(analysis.variables().get("y").isFlowOut());
        assertEquals("int", analysis.variables().get("y").inferredType());
        assertFalse(analysis.variables().containsKey("base"));
        assertFalse(analysis.variables().containsKey("int"));
    }

    @Test
    void testAnalyze_ShadowedInNestedBlock() {
        String source = """
                function show() {
                  let x = 1;
                  console.log(x);
                  { let x = 2; console.log(x); }
                  console.log(x);
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 3, 4), CancellationToken.none());

        VariableUsage x = analysis.variables().get("x");
        assertTrue(x.isFlowIn(), "the read before the inner declaration binds to the outer x");
        assertFalse(x.declaredInSelection());
        assertFalse(x.isModified());
        assertEquals("number", x.inferredType());
        assertEquals(List.of("x"), analysis.flowIn().stream().map(VariableUsage::name).toList());
    }

    @Test
    void testAnalyze_SiblingBlocksRedeclare() {
        String source = """
                function pick(flag: boolean) {
                  if (flag) {
                    const t = 1;
                    console.log(t);
                  } else {
                    const t = 2;
                    console.log(t);
                  }
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 2, 8), CancellationToken.none());

        VariableUsage t = analysis.variables().get("t");
        assertEquals(VariableScope.LOCAL, t.scope());
        assertEquals(2, t.usageCount());
        assertFalse(t.usedAfterSelection());
        assertTrue(analysis.variables().get("flag").isFlowIn());
    }

    @Test
    void testAnalyze_MultipleDeclaratorsFlowIn() {
        String source = """
                function pair() {
                  let a = 1, b = 2;
                  console.log(b);
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 3, 3), CancellationToken.none());

        VariableUsage b = analysis.variables().get("b");
        assertTrue(b.isFlowIn());
        assertEquals("number", b.inferredType());
        assertFalse(analysis.variables().containsKey("a"));
    }

    @Test
    void testAnalyze_MultipleDeclaratorsFlowOut() {
        String source = """
                function pair() {
                  let a = 1, b = 2;
                  console.log(a + b);
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 2, 2), CancellationToken.none());

        assertEquals(List.of("a", "b"), analysis.flowOut().stream().map(VariableUsage::name).toList());
        assertEquals("number", analysis.variables().get("b").inferredType());
    }

    @Test
    void testAnalyze_JavaFallbackMultipleDeclarators() {
        String source = """
                class Calc {
                    void run() {
                        int lo = 0, hi = 10;
                        System.out.println(hi - lo);
                    }
                }
                """;
        LexicalVariableAnalyzer java = new LexicalVariableAnalyzer(new JavaDialect());

        VariableAnalysis analysis = java.analyze(Selections.java(source, 4, 4), CancellationToken.none());

        assertTrue(analysis.variables().get("lo").isFlowIn());
        assertTrue(analysis.variables().get("hi").isFlowIn());
        assertEquals("int", analysis.variables().get("hi").inferredType());
    }

    @Test
    void testAnalyze_ContextualKeywordAsName() {
        String source = """
                function describe(node: Node) {
                  const type = node.kind;
                  const of = [type];
                  console.log(type, of);
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 4, 4), CancellationToken.none());

        assertTrue(analysis.variables().get("type").isFlowIn());
        assertTrue(analysis.variables().get("of").isFlowIn());
        assertFalse(analysis.variables().containsKey("console"));
    }

    @Test
    void testAnalyze_ContextualKeywordNotDeclared() {
        String source = """
                function cast(value: unknown) {
                  const n = value as number;
                  return n;
                }
                """;

        VariableAnalysis analysis = typeScript.analyze(Selections.typeScript(source, 2, 2), CancellationToken.none());

        assertFalse(analysis.variables().containsKey("as"));
        assertFalse(analysis.variables().containsKey("number"));
        assertTrue(analysis.variables().get("value").isFlowIn());
    }

    @Test
    void testAnalyze_Cancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        SelectionContext selection = Selections.typeScript(LOOP, 3, 5);

        assertThrows(ExtractionCancelledException.class, () -> typeScript.analyze(selection, token));
    }
}
