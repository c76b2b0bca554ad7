package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.BLOCK;
import static org.junit.jupiter.api.Assertions.*;

import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.testutil.TestSources;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

class BindingKeywordsTest {

    private static final String BODY = """
            var steady = 1;
            var bumped = 2;
            bumped++;
            var decremented = 3;
            --decremented;
            var assigned = 4;
            assigned = steady;
            var compound = 5;
            compound *= 2;
            int viaOut = 0;
            Parse("7", out viaOut);
            int viaRef = 0;
            Touch(ref viaRef);
            var readOnly = steady + bumped;
            """;

    private final ParsedSource parsed = TestSources.parse(TestSources.inMethod("", BODY));
    private final TSNode body = TestSources.first(parsed, BLOCK);

    @Test
    void detectsEveryKindOfWrite() {
        for (var name : new String[] {"bumped", "decremented", "assigned", "compound", "viaOut", "viaRef"}) {
            assertTrue(BindingKeywords.isReassigned(parsed, name, body), name);
        }
    }

    @Test
    void readsAreNotWrites() {
        assertFalse(BindingKeywords.isReassigned(parsed, "steady", body));
        assertFalse(BindingKeywords.isReassigned(parsed, "readOnly", body));
    }

    @Test
    void suffixOverridesAnalysis() {
        assertEquals("const", BindingKeywords.choose(parsed, "bumped_const", true, false, body));
        assertEquals("let", BindingKeywords.choose(parsed, "steady_let", true, false, body));
    }

    @Test
    void defaults() {
        assertEquals("const", BindingKeywords.choose(parsed, "steady", true, false, body));
        assertEquals("let", BindingKeywords.choose(parsed, "bumped", true, false, body));
        assertEquals("let", BindingKeywords.choose(parsed, "anything", false, false, body));
        assertEquals("const", BindingKeywords.choose(parsed, "bumped", true, true, body));
        assertEquals("const", BindingKeywords.choose(parsed, "bumped", true, false, null));
    }
}
