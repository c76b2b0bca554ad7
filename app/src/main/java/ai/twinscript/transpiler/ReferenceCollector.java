package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import java.util.Set;
import org.treesitter.TSNode;

/** Collects the text of every simple and generic name in a file into a caller-owned set. */
public final class ReferenceCollector extends SyntaxTreeWalker {
    private final ParsedSource source;
    private final Set<String> references;

    public ReferenceCollector(ParsedSource source, Set<String> references) {
        this.source = source;
        this.references = references;
    }

    @Override
    protected void enter(TSNode node) {
        switch (node.getType()) {
            case IDENTIFIER -> references.add(source.text(node));
            case GENERIC_NAME -> {
                var name = SyntaxTrees.field(node, "name");
                if (name == null) {
                    name = SyntaxTrees.firstChildOfType(node, IDENTIFIER);
                }
                if (name != null) {
                    references.add(source.text(name));
                }
            }
            default -> {}
        }
    }
}
