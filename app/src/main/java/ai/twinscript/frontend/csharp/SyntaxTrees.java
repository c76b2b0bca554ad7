package ai.twinscript.frontend.csharp;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.frontend.ParsedSource;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Common traversal patterns over tree-sitter C# trees. Grammar releases differ in small ways (field names, whether an
 * initializer is wrapped in {@code equals_value_clause}), so lookups here accept either shape.
 */
public final class SyntaxTrees {

    private static final Set<String> MODIFIER_KEYWORDS = Set.of(
            "public",
            "private",
            "protected",
            "internal",
            "static",
            "readonly",
            "const",
            "abstract",
            "virtual",
            "override",
            "sealed",
            "partial",
            "async",
            "extern",
            "new",
            "unsafe",
            "volatile");

    private SyntaxTrees() {}

    /** Identity of a node within one tree: its span and type. */
    public record NodeKey(int startByte, int endByte, String type) {}

    public static NodeKey key(TSNode node) {
        return new NodeKey(node.getStartByte(), node.getEndByte(), node.getType());
    }

    public static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    /** Field lookup that maps tree-sitter's null node to {@code null}. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    /** First field that is present, in the given order. */
    public static @Nullable TSNode field(TSNode node, String fieldName, String alternative) {
        var child = field(node, fieldName);
        return child != null ? child : field(node, alternative);
    }

    /** All children, named and anonymous, in source order. */
    public static List<TSNode> children(TSNode node) {
        var result = new ArrayList<TSNode>(node.getChildCount());
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /** Named children without comments. */
    public static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (isPresent(child) && !COMMENT.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> childrenOfType(TSNode node, String type) {
        return namedChildren(node).stream().filter(c -> type.equals(c.getType())).toList();
    }

    public static @Nullable TSNode firstChildOfType(TSNode node, String... types) {
        for (var child : namedChildren(node)) {
            for (var type : types) {
                if (type.equals(child.getType())) {
                    return child;
                }
            }
        }
        return null;
    }

    public static @Nullable TSNode firstNamedChild(TSNode node) {
        var named = namedChildren(node);
        return named.isEmpty() ? null : named.get(0);
    }

    public static @Nullable TSNode lastNamedChild(TSNode node) {
        var named = namedChildren(node);
        return named.isEmpty() ? null : named.get(named.size() - 1);
    }

    /** Nearest proper ancestor whose type is in {@code types}. */
    public static @Nullable TSNode ancestor(TSNode node, Set<String> types) {
        var current = node.getParent();
        while (isPresent(current)) {
            if (types.contains(current.getType())) {
                return current;
            }
            current = current.getParent();
        }
        return null;
    }

    /** Finds the first node in pre-order matching the given predicate, root included. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (!isPresent(rootNode)) {
            return null;
        }
        var pending = new ArrayDeque<TSNode>();
        pending.push(rootNode);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (predicate.test(node)) {
                return node;
            }
            pushChildren(node, pending);
        }
        return null;
    }

    /** Finds all nodes matching the given predicate, in pre-order. Iterative, so tree depth does not matter. */
    public static List<TSNode> findAllNodesRecursive(TSNode rootNode, Predicate<TSNode> predicate) {
        var results = new ArrayList<TSNode>();
        if (!isPresent(rootNode)) {
            return results;
        }
        var pending = new ArrayDeque<TSNode>();
        pending.push(rootNode);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            if (predicate.test(node)) {
                results.add(node);
            }
            pushChildren(node, pending);
        }
        return results;
    }

    // last child first, so the first child is popped next
    private static void pushChildren(TSNode node, Deque<TSNode> pending) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            var child = node.getChild(i);
            if (isPresent(child)) {
                pending.push(child);
            }
        }
    }

    public static List<TSNode> findAllNodesByType(TSNode rootNode, String nodeType) {
        return findAllNodesRecursive(rootNode, node -> nodeType.equals(node.getType()));
    }

    /** Modifier keywords of a declaration, e.g. {@code [public, static]}. */
    public static Set<String> modifiers(TSNode declaration, ParsedSource source) {
        var result = new LinkedHashSet<String>();
        for (var child : children(declaration)) {
            if (MODIFIER.equals(child.getType())) {
                result.add(source.text(child).strip());
            } else if (!child.isNamed() && MODIFIER_KEYWORDS.contains(child.getType())) {
                result.add(child.getType());
            }
        }
        return result;
    }

    /**
     * The value after {@code =} in a declarator, parameter or enum member, whether the grammar wraps it in an
     * {@code equals_value_clause} or not.
     */
    public static @Nullable TSNode initializerValue(TSNode declarator) {
        var sawEquals = false;
        for (var child : children(declarator)) {
            if (EQUALS_VALUE_CLAUSE.equals(child.getType())) {
                return lastNamedChild(child);
            }
            if (!child.isNamed() && "=".equals(child.getType())) {
                sawEquals = true;
                continue;
            }
            if (sawEquals && child.isNamed() && !COMMENT.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /** The declared name of a declarator, parameter or member. */
    public static @Nullable TSNode nameNode(TSNode declaration) {
        var name = field(declaration, "name");
        return name != null ? name : firstChildOfType(declaration, IDENTIFIER);
    }

    /** The expression carried by an {@code argument}: its last named child (after any name and colon). */
    public static @Nullable TSNode argumentExpression(TSNode argument) {
        if (!ARGUMENT.equals(argument.getType())) {
            return argument;
        }
        return lastNamedChild(argument);
    }

    /** Argument expressions of an {@code argument_list} or {@code bracketed_argument_list}. */
    public static List<TSNode> arguments(@Nullable TSNode argumentList) {
        if (argumentList == null) {
            return List.of();
        }
        var result = new ArrayList<TSNode>();
        for (var child : namedChildren(argumentList)) {
            var expression = argumentExpression(child);
            if (expression != null) {
                result.add(expression);
            }
        }
        return result;
    }

    /** Strips generic arguments, qualification and nullability from a type's source text: {@code A.B<C>?} is B. */
    public static String simpleTypeName(String typeText) {
        var name = typeText.strip();
        int generic = name.indexOf('<');
        if (generic >= 0) {
            name = name.substring(0, generic);
        }
        while (name.endsWith("?") || name.endsWith("]")) {
            int cut = name.endsWith("?") ? name.length() - 1 : name.lastIndexOf('[');
            name = name.substring(0, Math.max(0, cut)).strip();
        }
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            name = name.substring(dot + 1);
        }
        return name.startsWith("@") ? name.substring(1) : name;
    }
}
