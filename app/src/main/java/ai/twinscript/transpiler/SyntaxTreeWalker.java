package ai.twinscript.transpiler;

import ai.twinscript.frontend.csharp.SyntaxTrees;
import java.util.ArrayDeque;
import org.treesitter.TSNode;

/**
 * Pre-order walk over every node of a tree, named and anonymous. Subclasses hook {@link #enter} and {@link #leave};
 * the walk itself always descends, so a collector sees every node regardless of what it matches. The walk keeps its
 * own stack, so deeply nested expressions do not exhaust the thread's.
 */
public abstract class SyntaxTreeWalker {
    private int visitedNodes;

    private static final class Frame {
        final TSNode node;
        int nextChild;

        Frame(TSNode node) {
            this.node = node;
        }
    }

    public final void walk(TSNode root) {
        if (!SyntaxTrees.isPresent(root)) {
            return;
        }
        var stack = new ArrayDeque<Frame>();
        stack.push(open(root));
        while (!stack.isEmpty()) {
            var frame = stack.peek();
            if (frame.nextChild < frame.node.getChildCount()) {
                var child = frame.node.getChild(frame.nextChild++);
                if (SyntaxTrees.isPresent(child)) {
                    stack.push(open(child));
                }
            } else {
                stack.pop();
                leave(frame.node);
            }
        }
    }

    private Frame open(TSNode node) {
        visitedNodes++;
        enter(node);
        return new Frame(node);
    }

    protected void enter(TSNode node) {}

    protected void leave(TSNode node) {}

    /** Number of nodes visited so far across all walks. */
    public int visitedNodeCount() {
        return visitedNodes;
    }
}
