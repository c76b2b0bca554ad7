package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import java.util.List;
import org.treesitter.TSNode;

/**
 * Collects type declarations nested inside another type declaration, in source order, into a caller-owned list.
 * Top-level types (directly in a namespace or the file) are not collected.
 */
public final class NestedTypeCollector extends SyntaxTreeWalker {
    private final List<TSNode> nestedTypes;
    private int depth;

    public NestedTypeCollector(List<TSNode> nestedTypes) {
        this.nestedTypes = nestedTypes;
    }

    @Override
    protected void enter(TSNode node) {
        if (TYPE_DECLARATIONS.contains(node.getType())) {
            depth++;
            if (depth > 1) {
                nestedTypes.add(node);
            }
        }
    }

    @Override
    protected void leave(TSNode node) {
        if (TYPE_DECLARATIONS.contains(node.getType())) {
            depth--;
        }
    }
}
