package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Chooses {@code const} or {@code let} for a local declaration. */
final class BindingKeywords {

    private BindingKeywords() {}

    /**
     * An explicit {@code _const}/{@code _let} suffix wins. Otherwise uninitialized locals are {@code let}, and
     * initialized ones are {@code const} unless the enclosing scope writes to them again.
     */
    static String choose(
            ParsedSource source, String rawName, boolean initialized, boolean isConst, @Nullable TSNode scope) {
        if (rawName.endsWith("_const")) {
            return "const";
        }
        if (rawName.endsWith("_let")) {
            return "let";
        }
        if (isConst) {
            return "const";
        }
        if (!initialized) {
            return "let";
        }
        return scope != null && isReassigned(source, rawName, scope) ? "let" : "const";
    }

    /** Shadowing is ignored, so a same-named variable in a nested scope also counts. */
    static boolean isReassigned(ParsedSource source, String rawName, TSNode scope) {
        return SyntaxTrees.findNodeRecursive(scope, node -> writes(source, rawName, node)) != null;
    }

    private static boolean writes(ParsedSource source, String rawName, TSNode node) {
        return switch (node.getType()) {
            case ASSIGNMENT_EXPRESSION -> {
                var left = SyntaxTrees.field(node, "left");
                yield isName(source, left != null ? left : SyntaxTrees.firstNamedChild(node), rawName);
            }
            case PREFIX_UNARY_EXPRESSION -> {
                var text = source.text(node).strip();
                yield (text.startsWith("++") || text.startsWith("--"))
                        && isName(source, SyntaxTrees.firstNamedChild(node), rawName);
            }
            case POSTFIX_UNARY_EXPRESSION -> {
                var text = source.text(node).strip();
                yield (text.endsWith("++") || text.endsWith("--"))
                        && isName(source, SyntaxTrees.firstNamedChild(node), rawName);
            }
            case ARGUMENT -> SyntaxTrees.children(node).stream()
                            .anyMatch(c -> "ref".equals(c.getType()) || "out".equals(c.getType()))
                    && isName(source, SyntaxTrees.argumentExpression(node), rawName);
            default -> false;
        };
    }

    private static boolean isName(ParsedSource source, @Nullable TSNode node, String rawName) {
        return node != null && IDENTIFIER.equals(node.getType()) && rawName.equals(source.text(node));
    }
}
