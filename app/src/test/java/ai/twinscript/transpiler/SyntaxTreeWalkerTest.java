package ai.twinscript.transpiler;

import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.testutil.TestSources;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

class SyntaxTreeWalkerTest {

    private static final String SOURCE = """
            namespace Demo
            {
                public class Outer
                {
                    public class Inner
                    {
                        public enum Flavor { Sweet, Sour }
                    }
                    public struct Point { public double X; }
                    private List<Rect> boxes;
                    public MouseTrajectory Last(Dictionary<string, WorkerOutputMessage> byId) { return null; }
                }
                public interface IMarker { }
            }
            """;

    @Test
    void enterAndLeaveAreBalanced() {
        var parsed = TestSources.parse(SOURCE);
        var entered = new ArrayList<String>();
        var left = new ArrayList<String>();
        var walker = new SyntaxTreeWalker() {
            @Override
            protected void enter(TSNode node) {
                entered.add(node.getType());
            }

            @Override
            protected void leave(TSNode node) {
                left.add(node.getType());
            }
        };
        walker.walk(parsed.root());

        assertEquals("compilation_unit", entered.get(0));
        assertEquals("compilation_unit", left.get(left.size() - 1));
        assertEquals(entered.size(), left.size());
        assertEquals(entered.size(), walker.visitedNodeCount());
        // anonymous tokens are visited too
        assertTrue(entered.contains("{"));
    }

    @Test
    void visitsTheNodesOfASmallTreeInPreOrder() {
        var parsed = TestSources.parse("class A { }");
        var entered = new ArrayList<String>();
        new SyntaxTreeWalker() {
            @Override
            protected void enter(TSNode node) {
                entered.add(node.getType());
            }
        }.walk(parsed.root());
        assertEquals(
                List.of("compilation_unit", "class_declaration", "class", "identifier", "declaration_list", "{", "}"),
                entered);
    }

    @Test
    void visitedCountMatchesAChildByChildCount() {
        var parsed = TestSources.parse(SOURCE);
        var walker = new SyntaxTreeWalker() {};
        walker.walk(parsed.root());
        assertEquals(countNodes(parsed.root()), walker.visitedNodeCount());
    }

    @Test
    void longOperatorChainsDoNotExhaustTheStack() {
        var single = new SyntaxTreeWalker() {};
        single.walk(TestSources.parse("class C { int F() { return 1; } }").root());
        var chained = new SyntaxTreeWalker() {};
        chained.walk(TestSources.parse("class C { int F() { return 1" + " + 1".repeat(20_000) + "; } }").root());
        // each extra term adds a binary_expression, its operator token and a literal
        assertEquals(single.visitedNodeCount() + 3 * 20_000, chained.visitedNodeCount());
    }

    private static int countNodes(TSNode node) {
        int count = 1;
        for (int i = 0; i < node.getChildCount(); i++) {
            count += countNodes(node.getChild(i));
        }
        return count;
    }

    @Test
    void visitedCountAccumulatesAcrossWalks() {
        var parsed = TestSources.parse("public class A { }");
        var walker = new SyntaxTreeWalker() {};
        walker.walk(parsed.root());
        int once = walker.visitedNodeCount();
        walker.walk(parsed.root());
        assertEquals(2 * once, walker.visitedNodeCount());
    }

    @Test
    void nestedTypeCollectorSkipsTopLevelTypes() {
        var parsed = TestSources.parse(SOURCE);
        var nested = new ArrayList<TSNode>();
        new NestedTypeCollector(nested).walk(parsed.root());
        List<String> names = nested.stream()
                .map(n -> parsed.text(n.getChildByFieldName("name")))
                .toList();
        assertEquals(List.of("Inner", "Flavor", "Point"), names);
    }

    @Test
    void referenceCollectorSeesTypeNamesInEveryPosition() {
        var parsed = TestSources.parse(SOURCE);
        var references = new HashSet<String>();
        new ReferenceCollector(parsed, references).walk(parsed.root());
        assertTrue(references.containsAll(List.of("Rect", "MouseTrajectory", "WorkerOutputMessage", "List", "Dictionary")));
        assertTrue(references.contains("Outer"));
        assertFalse(references.contains("class"));
    }
}
