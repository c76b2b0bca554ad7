package ai.twinscript.frontend.csharp;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.frontend.ParsedSource;
import ai.twinscript.frontend.SymbolBinding;
import ai.twinscript.frontend.SymbolResolver;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Resolves identifiers of one parsed file against its lexical scopes and the batch-wide {@link SymbolIndex}.
 *
 * <p>Lookup order follows C#: locals and parameters of enclosing blocks and functions, then members of the enclosing
 * type and its bases, then static members of outer types, then type names.
 */
public final class CSharpSymbolResolver implements SymbolResolver {

    private static final Set<String> FUNCTION_SCOPES = Set.of(
            METHOD_DECLARATION, CONSTRUCTOR_DECLARATION, LOCAL_FUNCTION_STATEMENT, LAMBDA_EXPRESSION);

    // bounds the var-inference recursion on self-referential initializers
    private static final int MAX_INFERENCE_DEPTH = 8;

    private final SymbolIndex index;
    private final ParsedSource source;

    public CSharpSymbolResolver(SymbolIndex index, ParsedSource source) {
        this.index = index;
        this.source = source;
    }

    @Override
    public SymbolBinding resolve(TSNode identifier) {
        return resolve(identifier, 0);
    }

    private SymbolBinding resolve(TSNode identifier, int depth) {
        var name = identifierName(identifier);
        if (name.isEmpty()) {
            return SymbolBinding.unresolved(name);
        }

        var local = findLocal(identifier, name, depth);
        if (local != null) {
            return local;
        }

        boolean innermost = true;
        var enclosing = SyntaxTrees.ancestor(identifier, TYPE_DECLARATIONS);
        while (enclosing != null) {
            var typeName = enclosingTypeName(enclosing);
            if (typeName != null) {
                var lookup = index.findMember(typeName, name);
                if (lookup.isPresent()) {
                    var member = lookup.get().member();
                    var owner = lookup.get().owner().name();
                    if (member.kind() == SymbolIndex.MemberKind.NESTED_TYPE) {
                        return new SymbolBinding(SymbolBinding.Kind.TYPE, name, owner, null);
                    }
                    if (member.isStatic()) {
                        return new SymbolBinding(
                                SymbolBinding.Kind.STATIC_MEMBER, name, owner, member.declaredType());
                    }
                    if (innermost) {
                        return new SymbolBinding(
                                SymbolBinding.Kind.INSTANCE_MEMBER, name, owner, member.declaredType());
                    }
                }
            }
            innermost = false;
            enclosing = SyntaxTrees.ancestor(enclosing, TYPE_DECLARATIONS);
        }

        if (index.contains(name)) {
            return new SymbolBinding(SymbolBinding.Kind.TYPE, name, null, null);
        }
        return SymbolBinding.unresolved(name);
    }

    private String identifierName(TSNode identifier) {
        var node = identifier;
        if (GENERIC_NAME.equals(node.getType())) {
            var inner = SyntaxTrees.firstChildOfType(node, IDENTIFIER);
            if (inner == null) {
                return "";
            }
            node = inner;
        }
        var text = source.text(node);
        return text.startsWith("@") ? text.substring(1) : text;
    }

    private @Nullable String enclosingTypeName(TSNode typeDeclaration) {
        var nameNode = SyntaxTrees.field(typeDeclaration, "name");
        return nameNode == null ? null : source.text(nameNode);
    }

    /** Walks outward from the identifier through blocks and function scopes, stopping at the enclosing type. */
    private @Nullable SymbolBinding findLocal(TSNode identifier, String name, int depth) {
        var current = identifier.getParent();
        while (SyntaxTrees.isPresent(current) && !TYPE_DECLARATIONS.contains(current.getType())) {
            var found = declarationIn(current, identifier, name, depth);
            if (found != null) {
                return found;
            }
            current = current.getParent();
        }
        return null;
    }

    private @Nullable SymbolBinding declarationIn(TSNode scope, TSNode use, String name, int depth) {
        switch (scope.getType()) {
            case BLOCK, SWITCH_SECTION -> {
                for (var statement : SyntaxTrees.namedChildren(scope)) {
                    if (LOCAL_DECLARATION_STATEMENT.equals(statement.getType())) {
                        var declaration = SyntaxTrees.firstChildOfType(statement, VARIABLE_DECLARATION);
                        var found = declarator(declaration, name, depth);
                        if (found != null) {
                            return found;
                        }
                    } else if (LOCAL_FUNCTION_STATEMENT.equals(statement.getType())) {
                        var fnName = SyntaxTrees.field(statement, "name");
                        if (fnName != null && name.equals(source.text(fnName))) {
                            var returns = SyntaxTrees.field(statement, "returns", "type");
                            return SymbolBinding.local(name, returns == null ? null : source.text(returns));
                        }
                    }
                }
            }
            case FOR_STATEMENT -> {
                var declaration = SyntaxTrees.firstChildOfType(scope, VARIABLE_DECLARATION);
                var found = declarator(declaration, name, depth);
                if (found != null) {
                    return found;
                }
            }
            case FOREACH_STATEMENT -> {
                var left = SyntaxTrees.field(scope, "left");
                if (left != null && name.equals(source.text(left)) && !isInsideIterable(scope, use)) {
                    var type = SyntaxTrees.field(scope, "type");
                    var typeText = type == null ? null : source.text(type);
                    if (typeText == null || "var".equals(typeText)) {
                        typeText = elementTypeOf(SyntaxTrees.field(scope, "right"), depth);
                    }
                    return SymbolBinding.local(name, typeText);
                }
            }
            case CATCH_CLAUSE -> {
                var declaration = SyntaxTrees.firstChildOfType(scope, CATCH_DECLARATION);
                if (declaration != null) {
                    var declName = SyntaxTrees.field(declaration, "name");
                    if (declName != null && name.equals(source.text(declName))) {
                        var type = SyntaxTrees.field(declaration, "type");
                        return SymbolBinding.local(name, type == null ? null : source.text(type));
                    }
                }
            }
            case ACCESSOR_DECLARATION -> {
                if ("value".equals(name) && isSetter(scope)) {
                    var property = SyntaxTrees.ancestor(scope, Set.of(PROPERTY_DECLARATION));
                    var type = property == null ? null : SyntaxTrees.field(property, "type");
                    return SymbolBinding.local(name, type == null ? null : source.text(type));
                }
            }
            default -> {
                if (FUNCTION_SCOPES.contains(scope.getType())) {
                    return parameterIn(scope, name);
                }
            }
        }
        return null;
    }

    private boolean isInsideIterable(TSNode foreach, TSNode use) {
        var right = SyntaxTrees.field(foreach, "right");
        return right != null && use.getStartByte() >= right.getStartByte() && use.getEndByte() <= right.getEndByte();
    }

    private boolean isSetter(TSNode accessor) {
        for (var child : SyntaxTrees.children(accessor)) {
            var type = child.getType();
            if ("set".equals(type) || "init".equals(type)) {
                return true;
            }
        }
        var text = source.text(accessor).strip();
        return text.startsWith("set") || text.startsWith("init");
    }

    private @Nullable SymbolBinding declarator(@Nullable TSNode declaration, String name, int depth) {
        if (declaration == null) {
            return null;
        }
        var type = SyntaxTrees.field(declaration, "type");
        for (var declarator : SyntaxTrees.childrenOfType(declaration, VARIABLE_DECLARATOR)) {
            var nameNode = SyntaxTrees.nameNode(declarator);
            if (nameNode == null || !name.equals(source.text(nameNode))) {
                continue;
            }
            String typeText = type == null ? null : source.text(type);
            if (typeText == null || "var".equals(typeText)) {
                var value = SyntaxTrees.initializerValue(declarator);
                typeText = depth >= MAX_INFERENCE_DEPTH || value == null
                        ? null
                        : declaredTypeOf(value, depth + 1).orElse(null);
            }
            return SymbolBinding.local(name, typeText);
        }
        return null;
    }

    private @Nullable SymbolBinding parameterIn(TSNode function, String name) {
        var parameters = SyntaxTrees.field(function, "parameters");
        if (parameters == null) {
            parameters = SyntaxTrees.firstChildOfType(function, PARAMETER_LIST, IMPLICIT_PARAMETER, IDENTIFIER);
        }
        if (parameters == null) {
            return null;
        }
        if (IMPLICIT_PARAMETER.equals(parameters.getType()) || IDENTIFIER.equals(parameters.getType())) {
            return name.equals(source.text(parameters)) ? SymbolBinding.local(name, null) : null;
        }
        for (var parameter : SyntaxTrees.namedChildren(parameters)) {
            var parameterName = SyntaxTrees.nameNode(parameter);
            if (parameterName != null && name.equals(source.text(parameterName))) {
                var type = SyntaxTrees.field(parameter, "type");
                return SymbolBinding.local(name, type == null ? null : source.text(type));
            }
        }
        return null;
    }

    @Override
    public Optional<String> declaredTypeOf(TSNode expression) {
        return declaredTypeOf(expression, 0);
    }

    private Optional<String> declaredTypeOf(TSNode expression, int depth) {
        if (depth > MAX_INFERENCE_DEPTH) {
            return Optional.empty();
        }
        return switch (expression.getType()) {
            case IDENTIFIER, GENERIC_NAME -> Optional.ofNullable(resolve(expression, depth).declaredType());
            case PARENTHESIZED_EXPRESSION -> {
                var inner = SyntaxTrees.firstNamedChild(expression);
                yield inner == null ? Optional.empty() : declaredTypeOf(inner, depth + 1);
            }
            case OBJECT_CREATION_EXPRESSION, CAST_EXPRESSION -> {
                var type = SyntaxTrees.field(expression, "type");
                yield type == null ? Optional.empty() : Optional.of(source.text(type));
            }
            case AS_EXPRESSION -> {
                var type = SyntaxTrees.field(expression, "right");
                yield type == null ? Optional.empty() : Optional.of(source.text(type));
            }
            case INVOCATION_EXPRESSION -> {
                var function = SyntaxTrees.field(expression, "function");
                yield function == null ? Optional.empty() : declaredTypeOf(function, depth + 1);
            }
            case MEMBER_ACCESS_EXPRESSION -> memberAccessType(expression, depth);
            default -> Optional.empty();
        };
    }

    private Optional<String> memberAccessType(TSNode access, int depth) {
        var receiver = SyntaxTrees.field(access, "expression");
        var nameNode = SyntaxTrees.field(access, "name");
        if (receiver == null || nameNode == null) {
            return Optional.empty();
        }
        var memberName = identifierName(nameNode);
        String receiverType;
        if (THIS_EXPRESSION.equals(receiver.getType()) || THIS.equals(receiver.getType())) {
            var enclosing = SyntaxTrees.ancestor(access, TYPE_DECLARATIONS);
            receiverType = enclosing == null ? null : enclosingTypeName(enclosing);
        } else if (IDENTIFIER.equals(receiver.getType())
                && resolve(receiver, depth).kind() == SymbolBinding.Kind.TYPE) {
            receiverType = identifierName(receiver);
        } else {
            receiverType = declaredTypeOf(receiver, depth + 1).orElse(null);
        }
        if (receiverType == null) {
            return Optional.empty();
        }
        return index.findMember(SyntaxTrees.simpleTypeName(receiverType), memberName)
                .map(lookup -> lookup.member().declaredType());
    }

    /** Element type of a foreach iterable when the iterable's declared type is a one-argument generic or array. */
    private @Nullable String elementTypeOf(@Nullable TSNode iterable, int depth) {
        if (iterable == null || depth >= MAX_INFERENCE_DEPTH) {
            return null;
        }
        var declared = declaredTypeOf(iterable, depth + 1).orElse(null);
        if (declared == null) {
            return null;
        }
        var text = declared.strip();
        if (text.endsWith("[]")) {
            return text.substring(0, text.length() - 2);
        }
        int open = text.indexOf('<');
        int close = text.lastIndexOf('>');
        if (open < 0 || close < open) {
            return null;
        }
        var arguments = text.substring(open + 1, close);
        var simple = SyntaxTrees.simpleTypeName(text);
        if (simple.equals("Dictionary") || simple.equals("JsMap") || simple.equals("IDictionary")) {
            return "KeyValuePair<" + arguments + ">";
        }
        return arguments.contains(",") ? null : arguments;
    }

    @Override
    public boolean isKnownType(String simpleName) {
        return index.contains(simpleName);
    }

    @Override
    public boolean isInterface(String simpleName) {
        return index.type(simpleName)
                .map(t -> t.kind() == SymbolIndex.TypeKind.INTERFACE)
                .orElse(false);
    }

    @Override
    public boolean isEnum(String simpleName) {
        return index.type(simpleName)
                .map(t -> t.kind() == SymbolIndex.TypeKind.ENUM)
                .orElse(false);
    }
}
