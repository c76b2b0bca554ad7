package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.TranspilerConfig;
import ai.twinscript.frontend.SymbolBinding;
import ai.twinscript.frontend.TranslationUnit;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Translates one expression node to TypeScript text. Every call returns non-empty text: node kinds outside the
 * supported set, and nodes whose translation fails, become an {@code UNSUPPORTED} placeholder naming the node kind.
 *
 * <p>Instances are per file; the only state they read is the shared {@link GeneratorContext} (for pair-iteration
 * aliases) and the translation unit's symbol bindings.
 */
public final class ExpressionGenerator {
    private static final Logger logger = LogManager.getLogger(ExpressionGenerator.class);

    private static final Set<String> ROUNDING_CALLS = Set.of("Math.Floor", "Math.Ceiling", "Math.Round", "Math.Truncate");
    private static final Pattern HOST_FUNCTION = Pattern.compile("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*");
    private static final Pattern FIXED_FORMAT = Pattern.compile("[Ff](\\d*)");
    private static final Set<String> UNSUPPORTED_PREFIX_OPERATORS = Set.of("^", "&", "*");

    // kinds that can take a trailing member access without parentheses
    private static final Set<SyntaxKind> PRIMARY_KINDS = Set.of(
            SyntaxKind.IDENTIFIER,
            SyntaxKind.MEMBER_ACCESS,
            SyntaxKind.INVOCATION,
            SyntaxKind.ELEMENT_ACCESS,
            SyntaxKind.PARENTHESIZED,
            SyntaxKind.THIS_ACCESS);

    private final TranslationUnit unit;
    private final GeneratorContext context;
    private final TranspilerConfig config;
    private final TypeMapper typeMapper;
    private final Set<String> hoistedTypeNames;
    private @Nullable Function<TSNode, String> blockRenderer;

    public ExpressionGenerator(
            TranslationUnit unit, GeneratorContext context, TranspilerConfig config, Set<String> hoistedTypeNames) {
        this.unit = unit;
        this.context = context;
        this.config = config;
        this.typeMapper = new TypeMapper(unit.parsed());
        this.hoistedTypeNames = Set.copyOf(hoistedTypeNames);
    }

    /** Renders block-bodied lambdas; without one they become placeholders. */
    void setBlockRenderer(@Nullable Function<TSNode, String> blockRenderer) {
        this.blockRenderer = blockRenderer;
    }

    public TypeMapper typeMapper() {
        return typeMapper;
    }

    public static String placeholder(String kindName) {
        return "/* UNSUPPORTED: " + kindName + " */";
    }

    public String generate(@Nullable TSNode expression) {
        if (!SyntaxTrees.isPresent(expression)) {
            return placeholder("missing_expression");
        }
        String result;
        try {
            result = dispatch(expression);
        } catch (RuntimeException e) {
            logger.warn(
                    "Failed to translate {} at {}:{}; emitting placeholder",
                    expression.getType(),
                    unit.file(),
                    unit.parsed().line(expression),
                    e);
            return placeholder(expression.getType());
        }
        return result.isBlank() ? placeholder(expression.getType()) : result;
    }

    private String dispatch(TSNode node) {
        var kind = SyntaxKind.of(node);
        return switch (kind) {
            case IDENTIFIER -> identifier(node);
            case GENERIC_NAME -> genericName(node);
            case PREDEFINED_TYPE -> typeMapper.map(node);
            case NUMERIC_LITERAL -> numericLiteral(text(node));
            case STRING_LITERAL -> stringLiteral(node);
            case VERBATIM_STRING_LITERAL -> verbatimString(text(node));
            case CHARACTER_LITERAL -> characterLiteral(text(node));
            case BOOLEAN_LITERAL -> text(node).strip();
            case NULL_LITERAL -> "null";
            case MEMBER_ACCESS -> memberAccess(node);
            case INVOCATION -> invocation(node);
            case OBJECT_CREATION -> objectCreation(node);
            case IMPLICIT_OBJECT_CREATION -> implicitObjectCreation(node);
            case INITIALIZER -> "[" + joinGenerated(SyntaxTrees.namedChildren(node)) + "]";
            case BINARY -> binary(node);
            case ASSIGNMENT -> assignment(node);
            case ELEMENT_ACCESS -> elementAccess(node);
            case CONDITIONAL -> conditional(node);
            case THIS_ACCESS -> "this";
            case CAST -> cast(node);
            case AS -> asExpression(node);
            case ARRAY_CREATION -> arrayCreation(node);
            case IMPLICIT_ARRAY_CREATION -> implicitArrayCreation(node);
            case PARENTHESIZED -> "(" + generate(SyntaxTrees.firstNamedChild(node)) + ")";
            case PREFIX_UNARY -> prefixUnary(node);
            case POSTFIX_UNARY -> postfixUnary(node);
            case INTERPOLATED_STRING -> interpolatedString(node);
            case LAMBDA -> lambda(node);
            case COMPILATION_UNIT,
                    NAMESPACE,
                    FILE_SCOPED_NAMESPACE,
                    USING,
                    CLASS_LIKE,
                    INTERFACE,
                    ENUM,
                    DELEGATE,
                    FIELD,
                    PROPERTY,
                    METHOD,
                    CONSTRUCTOR,
                    BLOCK,
                    EXPRESSION_STATEMENT,
                    LOCAL_DECLARATION,
                    RETURN,
                    BREAK,
                    CONTINUE,
                    IF,
                    FOR,
                    FOREACH,
                    WHILE,
                    DO,
                    THROW,
                    EMPTY,
                    COMMENT,
                    UNSUPPORTED -> unsupported(node);
        };
    }

    String unsupported(TSNode node) {
        logger.warn("Unsupported {} at {}:{}", node.getType(), unit.file(), unit.parsed().line(node));
        return placeholder(node.getType());
    }

    // ----- names -----

    private String identifier(TSNode node) {
        var name = bareName(text(node));
        var binding = unit.symbols().resolve(node);
        return switch (binding.kind()) {
            case LOCAL -> MemberNameMapper.localName(name);
            case INSTANCE_MEMBER -> "this." + MemberNameMapper.toCamelCase(name);
            case STATIC_MEMBER -> staticQualifier(binding) + "."
                    + (isEnumMember(binding) ? name : MemberNameMapper.toCamelCase(name));
            case TYPE -> name;
            case UNRESOLVED -> freeName(name);
        };
    }

    private boolean isEnumMember(SymbolBinding binding) {
        var owner = binding.declaringType();
        return owner != null && unit.symbols().isEnum(owner);
    }

    private String staticQualifier(SymbolBinding binding) {
        var owner = binding.declaringType();
        return owner == null ? "this.constructor" : owner;
    }

    private String freeName(String name) {
        var special = MemberNameMapper.specialIdentifier(name);
        if (special.isPresent()) {
            return special.get();
        }
        if (isTypeName(name)) {
            return name;
        }
        return MemberNameMapper.toCamelCase(name);
    }

    private boolean isTypeName(String name) {
        return config.companionTypes().contains(name)
                || config.plainDataTypes().contains(name)
                || hoistedTypeNames.contains(name)
                || unit.symbols().isKnownType(name);
    }

    private String genericName(TSNode node) {
        var nameNode = SyntaxTrees.firstChildOfType(node, IDENTIFIER);
        if (nameNode == null) {
            return unsupported(node);
        }
        return identifier(nameNode) + typeArguments(node);
    }

    private String typeArguments(TSNode maybeGeneric) {
        if (!GENERIC_NAME.equals(maybeGeneric.getType())) {
            return "";
        }
        var list = SyntaxTrees.firstChildOfType(maybeGeneric, TYPE_ARGUMENT_LIST);
        if (list == null) {
            return "";
        }
        return SyntaxTrees.namedChildren(list).stream()
                .map(typeMapper::map)
                .collect(Collectors.joining(", ", "<", ">"));
    }

    private String memberName(TSNode nameNode) {
        if (GENERIC_NAME.equals(nameNode.getType())) {
            var inner = SyntaxTrees.firstChildOfType(nameNode, IDENTIFIER);
            return inner == null ? text(nameNode) : text(inner);
        }
        return text(nameNode);
    }

    private static String bareName(String name) {
        var stripped = name.strip();
        return stripped.startsWith("@") ? stripped.substring(1) : stripped;
    }

    // ----- member access and calls -----

    private String memberAccess(TSNode node) {
        var receiver = SyntaxTrees.field(node, "expression");
        var nameNode = SyntaxTrees.field(node, "name");
        if (receiver == null || nameNode == null) {
            return unsupported(node);
        }
        var member = bareName(memberName(nameNode));
        var receiverText = text(receiver).strip();
        if (PREDEFINED_TYPE.equals(receiver.getType()) || IDENTIFIER.equals(receiver.getType())) {
            var constant = MemberNameMapper.numericConstant(receiverText, member);
            if (constant.isPresent()) {
                return constant.get();
            }
        }
        var path = memberPath(receiver, nameNode, member);
        return MemberNameMapper.rewriteMemberPath(path).orElse(path);
    }

    /** {@code receiver.member} with pair aliases and member renames applied, before any call-site rewrite. */
    private String memberPath(TSNode receiver, TSNode nameNode, String member) {
        var left = generate(receiver);
        var alias = context.pairAlias(left);
        if (alias != null) {
            if ("Key".equals(member)) {
                return alias.keyName();
            }
            if ("Value".equals(member)) {
                return alias.valueName();
            }
        }
        var typeArguments = typeArguments(nameNode);
        if ("Math".equals(left)) {
            var mapped = MemberNameMapper.mathMember(member)
                    .orElseThrow(() -> new UnsupportedOperationException("Math." + member + " has no counterpart"));
            return "Math." + mapped + typeArguments;
        }
        if (IDENTIFIER.equals(receiver.getType()) && unit.symbols().isEnum(bareName(text(receiver)))) {
            return left + "." + member;
        }
        var family = TypeMapper.family(unit.symbols().declaredTypeOf(receiver).orElse(null));
        return left + "." + MemberNameMapper.renameMember(member, family) + typeArguments;
    }

    private String invocation(TSNode node) {
        var function = SyntaxTrees.field(node, "function");
        if (function == null) {
            return unsupported(node);
        }
        var argumentList = SyntaxTrees.field(node, "arguments");
        if (argumentList == null) {
            argumentList = SyntaxTrees.firstChildOfType(node, ARGUMENT_LIST);
        }
        var arguments = SyntaxTrees.arguments(argumentList);
        var calleeSource = withoutTypeArguments(text(function).replaceAll("\\s+", ""));

        if ("Array.Copy".equals(calleeSource) && arguments.size() == 5) {
            return blockCopy(arguments);
        }
        if ("Script.Call".equals(calleeSource)) {
            var hostCall = hostCall(arguments);
            if (hostCall != null) {
                return hostCall;
            }
        }
        if (("String.Join".equals(calleeSource) || "string.Join".equals(calleeSource)) && arguments.size() == 2) {
            return receiverForm(arguments.get(1)) + ".join(" + generate(arguments.get(0)) + ")";
        }
        if ("Math.Clamp".equals(calleeSource) && arguments.size() == 3) {
            return "Math.min(Math.max(%s, %s), %s)"
                    .formatted(generate(arguments.get(0)), generate(arguments.get(1)), generate(arguments.get(2)));
        }
        if ("Math.Log".equals(calleeSource) && arguments.size() == 2) {
            return "(Math.log(%s) / Math.log(%s))".formatted(generate(arguments.get(0)), generate(arguments.get(1)));
        }
        if ("Array.IndexOf".equals(calleeSource) && arguments.size() == 2) {
            return receiverForm(arguments.get(0)) + ".indexOf(" + generate(arguments.get(1)) + ")";
        }
        return callee(function) + "(" + joinGenerated(arguments) + ")";
    }

    private String callee(TSNode function) {
        if (MEMBER_ACCESS_EXPRESSION.equals(function.getType())) {
            var receiver = SyntaxTrees.field(function, "expression");
            var nameNode = SyntaxTrees.field(function, "name");
            if (receiver != null && nameNode != null) {
                var path = memberPath(receiver, nameNode, bareName(memberName(nameNode)));
                return MemberNameMapper.rewriteCallee(path);
            }
        }
        return generate(function);
    }

    /**
     * {@code Array.Copy(src, srcIndex, dst, dstIndex, length)}: the target has no block copy, so slice the source
     * range and assign element by element.
     */
    private String blockCopy(List<TSNode> arguments) {
        var source = receiverForm(arguments.get(0));
        var sourceIndex = generate(arguments.get(1));
        var destination = generate(arguments.get(2));
        var destinationIndex = generate(arguments.get(3));
        var length = generate(arguments.get(4));
        return "%s.slice(%s, %s + %s).forEach((__v, __i) => %s[%s + __i] = __v)"
                .formatted(source, sourceIndex, sourceIndex, length, destination, destinationIndex);
    }

    /** {@code Script.Call("name", args...)} becomes {@code name(args...)}; null if the selector is not a literal name. */
    private @Nullable String hostCall(List<TSNode> arguments) {
        if (arguments.isEmpty() || !STRING_LITERAL.equals(arguments.get(0).getType())) {
            return null;
        }
        var literal = text(arguments.get(0)).strip();
        if (literal.length() < 2) {
            return null;
        }
        var name = literal.substring(1, literal.length() - 1);
        if (!HOST_FUNCTION.matcher(name).matches()) {
            return null;
        }
        return name + "(" + joinGenerated(arguments.subList(1, arguments.size())) + ")";
    }

    private static String withoutTypeArguments(String callee) {
        int open = callee.indexOf('<');
        return open < 0 ? callee : callee.substring(0, open);
    }

    // ----- object and array creation -----

    private String objectCreation(TSNode node) {
        var typeNode = SyntaxTrees.field(node, "type");
        var typeText = typeNode == null ? "" : text(typeNode);
        var simpleName = SyntaxTrees.simpleTypeName(typeText);
        var argumentList = SyntaxTrees.field(node, "arguments");
        if (argumentList == null) {
            argumentList = SyntaxTrees.firstChildOfType(node, ARGUMENT_LIST);
        }
        var arguments = SyntaxTrees.arguments(argumentList);
        var initializer = SyntaxTrees.field(node, "initializer");
        if (initializer == null) {
            initializer = SyntaxTrees.firstChildOfType(node, INITIALIZER_EXPRESSION);
        }

        if (simpleName.endsWith("Exception") && !unit.symbols().isKnownType(simpleName)) {
            return "new Error(" + joinGenerated(arguments) + ")";
        }
        var mappedType = typeMapper.map(typeNode);
        var construct = "new " + mappedType + "(" + joinGenerated(arguments) + ")";
        if (initializer == null) {
            return construct;
        }

        var elements = SyntaxTrees.namedChildren(initializer);
        if (!elements.isEmpty() && elements.stream().noneMatch(e -> ASSIGNMENT_EXPRESSION.equals(e.getType()))) {
            return collectionInitializer(initializer, mappedType, typeText, elements);
        }
        var literal = objectLiteral(elements);
        if (arguments.isEmpty() && isPlainData(simpleName)) {
            return literal;
        }
        return "Object.assign(" + construct + ", " + literal + ")";
    }

    private String collectionInitializer(TSNode initializer, String mappedType, String typeText, List<TSNode> items) {
        var family = TypeMapper.family(typeText);
        return switch (family) {
            case LIST -> "[" + joinGenerated(items) + "]";
            case SET, MAP -> "new " + mappedType + "([" + joinGenerated(items) + "])";
            case UNKNOWN -> unsupported(initializer);
        };
    }

    private boolean isPlainData(String simpleName) {
        return config.plainDataTypes().contains(simpleName) || hoistedTypeNames.contains(simpleName);
    }

    /** {@code { a: x, b }}; members named like their value use shorthand. */
    private String objectLiteral(List<TSNode> elements) {
        if (elements.isEmpty()) {
            return "{}";
        }
        var parts = new ArrayList<String>();
        for (var element : elements) {
            if (ASSIGNMENT_EXPRESSION.equals(element.getType())) {
                var left = SyntaxTrees.field(element, "left");
                var right = SyntaxTrees.field(element, "right");
                var name = MemberNameMapper.toCamelCase(left == null ? "" : bareName(text(left)));
                var value = generate(right);
                parts.add(name.equals(value) ? name : name + ": " + value);
            } else {
                parts.add(generate(element));
            }
        }
        return "{ " + String.join(", ", parts) + " }";
    }

    private String implicitObjectCreation(TSNode node) {
        var arguments = SyntaxTrees.arguments(SyntaxTrees.firstChildOfType(node, ARGUMENT_LIST));
        var initializer = SyntaxTrees.firstChildOfType(node, INITIALIZER_EXPRESSION);
        var targetType = targetTypeOf(node);
        if (initializer != null) {
            var literal = objectLiteral(SyntaxTrees.namedChildren(initializer));
            if (arguments.isEmpty()) {
                return literal;
            }
            return targetType == null
                    ? unsupported(node)
                    : "Object.assign(new " + targetType + "(" + joinGenerated(arguments) + "), " + literal + ")";
        }
        if (targetType != null) {
            return "new " + targetType + "(" + joinGenerated(arguments) + ")";
        }
        return arguments.isEmpty() ? "{}" : unsupported(node);
    }

    /** Mapped declared type a target-typed {@code new(...)} is constructing, when it is written on the declaration. */
    private @Nullable String targetTypeOf(TSNode node) {
        var parent = node.getParent();
        if (SyntaxTrees.isPresent(parent) && EQUALS_VALUE_CLAUSE.equals(parent.getType())) {
            parent = parent.getParent();
        }
        if (!SyntaxTrees.isPresent(parent)) {
            return null;
        }
        if (VARIABLE_DECLARATOR.equals(parent.getType())) {
            var declaration = parent.getParent();
            var type = SyntaxTrees.isPresent(declaration) ? SyntaxTrees.field(declaration, "type") : null;
            if (type != null && !"var".equals(text(type).strip())) {
                return typeMapper.map(type);
            }
        }
        return null;
    }

    private String arrayCreation(TSNode node) {
        var initializer = SyntaxTrees.field(node, "initializer");
        if (initializer == null) {
            initializer = SyntaxTrees.firstChildOfType(node, INITIALIZER_EXPRESSION);
        }
        if (initializer != null) {
            return "[" + joinGenerated(SyntaxTrees.namedChildren(initializer)) + "]";
        }
        var arrayType = SyntaxTrees.field(node, "type");
        if (arrayType == null) {
            arrayType = SyntaxTrees.firstChildOfType(node, ARRAY_TYPE);
        }
        if (arrayType == null) {
            return unsupported(node);
        }
        var rank = SyntaxTrees.field(arrayType, "rank");
        if (rank == null) {
            rank = SyntaxTrees.firstChildOfType(arrayType, ARRAY_RANK_SPECIFIER);
        }
        var sizes = rank == null ? List.<TSNode>of() : SyntaxTrees.namedChildren(rank);
        if (sizes.isEmpty()) {
            return "[]";
        }
        if (sizes.size() > 1) {
            return unsupported(node);
        }
        var element = SyntaxTrees.field(arrayType, "type");
        var elementType = typeMapper.map(element != null ? element : SyntaxTrees.firstNamedChild(arrayType));
        var construct = "new Array<" + elementType + ">(" + generate(sizes.get(0)) + ")";
        // C# zero-initializes value-type arrays
        return switch (elementType) {
            case "number" -> construct + ".fill(0)";
            case "boolean" -> construct + ".fill(false)";
            default -> construct;
        };
    }

    private String implicitArrayCreation(TSNode node) {
        var initializer = SyntaxTrees.firstChildOfType(node, INITIALIZER_EXPRESSION);
        return initializer == null ? "[]" : "[" + joinGenerated(SyntaxTrees.namedChildren(initializer)) + "]";
    }

    // ----- operators -----

    /** Left-nested chains such as {@code a + b + c} are unrolled along the left spine instead of recursing. */
    private String binary(TSNode node) {
        var spine = new ArrayList<TSNode>();
        var current = node;
        while (BINARY_EXPRESSION.equals(current.getType())) {
            spine.add(current);
            var left = SyntaxTrees.field(current, "left");
            if (left == null) {
                return unsupported(node);
            }
            current = left;
        }
        var builder = new StringBuilder(generate(current));
        for (int i = spine.size() - 1; i >= 0; i--) {
            var binary = spine.get(i);
            var left = SyntaxTrees.field(binary, "left");
            var right = SyntaxTrees.field(binary, "right");
            var operator = right == null ? "" : operatorBetween(binary, left, right);
            if (right == null || "is".equals(operator)) {
                builder = new StringBuilder(unsupported(binary));
                continue;
            }
            var mapped = switch (operator) {
                case "==" -> "===";
                case "!=" -> "!==";
                default -> operator;
            };
            builder.append(' ').append(mapped).append(' ').append(generate(right));
        }
        return builder.toString();
    }

    private String assignment(TSNode node) {
        var left = SyntaxTrees.field(node, "left");
        var right = SyntaxTrees.field(node, "right");
        if (left == null || right == null) {
            return unsupported(node);
        }
        var operator = operatorBetween(node, left, right);
        var mapIndex = mapIndex(left);
        if (mapIndex != null) {
            // Map has no indexer: m[k] = v is m.set(k, v), m[k] op= v is m.set(k, m.get(k) op v)
            var target = receiverForm(mapIndex.target());
            var key = generate(mapIndex.key());
            var value = generate(right);
            if (!"=".equals(operator)) {
                var binaryOperator = operator.substring(0, operator.length() - 1);
                value = target + ".get(" + key + ") " + binaryOperator + " " + value;
            }
            return target + ".set(" + key + ", " + value + ")";
        }
        return generate(left) + " " + operator + " " + generate(right);
    }

    private record MapIndex(TSNode target, TSNode key) {}

    /** {@code m[k]} where {@code m} is declared as a dictionary type; null for any other element access. */
    private @Nullable MapIndex mapIndex(TSNode node) {
        if (!ELEMENT_ACCESS_EXPRESSION.equals(node.getType())) {
            return null;
        }
        var target = SyntaxTrees.field(node, "expression");
        var subscript = SyntaxTrees.field(node, "subscript");
        if (subscript == null) {
            subscript = SyntaxTrees.firstChildOfType(node, BRACKETED_ARGUMENT_LIST);
        }
        if (target == null || subscript == null) {
            return null;
        }
        var keys = SyntaxTrees.arguments(subscript);
        var family = TypeMapper.family(unit.symbols().declaredTypeOf(target).orElse(null));
        return keys.size() == 1 && family == MemberNameMapper.ContainerFamily.MAP
                ? new MapIndex(target, keys.get(0))
                : null;
    }

    private String operatorBetween(TSNode node, TSNode left, TSNode right) {
        var operator = SyntaxTrees.field(node, "operator");
        if (operator != null) {
            return text(operator).strip();
        }
        return unit.parsed().text(left.getEndByte(), right.getStartByte()).strip();
    }

    private String prefixUnary(TSNode node) {
        var operand = SyntaxTrees.lastNamedChild(node);
        if (operand == null) {
            return unsupported(node);
        }
        var operator = unit.parsed().text(node.getStartByte(), operand.getStartByte()).strip();
        if (UNSUPPORTED_PREFIX_OPERATORS.contains(operator)) {
            return unsupported(node);
        }
        return joinPrefix(operator, generate(operand));
    }

    /** Keeps {@code -} followed by a negative operand from fusing into {@code --}; same for {@code +}. */
    static String joinPrefix(String operator, String operand) {
        if (operator.isEmpty() || operand.isEmpty()) {
            return operator + operand;
        }
        char last = operator.charAt(operator.length() - 1);
        boolean fuses = (last == '-' || last == '+') && operand.charAt(0) == last;
        return fuses ? operator + " " + operand : operator + operand;
    }

    private String postfixUnary(TSNode node) {
        var operand = SyntaxTrees.firstNamedChild(node);
        if (operand == null) {
            return unsupported(node);
        }
        var operator = unit.parsed().text(operand.getEndByte(), node.getEndByte()).strip();
        return generate(operand) + operator;
    }

    private String elementAccess(TSNode node) {
        var mapIndex = mapIndex(node);
        if (mapIndex != null) {
            return receiverForm(mapIndex.target()) + ".get(" + generate(mapIndex.key()) + ")";
        }
        var target = SyntaxTrees.field(node, "expression");
        if (target == null) {
            target = SyntaxTrees.firstNamedChild(node);
        }
        var subscript = SyntaxTrees.field(node, "subscript");
        if (subscript == null) {
            subscript = SyntaxTrees.firstChildOfType(node, BRACKETED_ARGUMENT_LIST);
        }
        if (target == null || subscript == null) {
            return unsupported(node);
        }
        var builder = new StringBuilder(generate(target));
        for (var index : SyntaxTrees.arguments(subscript)) {
            builder.append('[').append(generate(index)).append(']');
        }
        return builder.toString();
    }

    private String conditional(TSNode node) {
        var condition = SyntaxTrees.field(node, "condition");
        var consequence = SyntaxTrees.field(node, "consequence");
        var alternative = SyntaxTrees.field(node, "alternative");
        return generate(condition) + " ? " + generate(consequence) + " : " + generate(alternative);
    }

    /** A cast is a compile-time assertion, dropped when the value is already a rounded number. */
    private String cast(TSNode node) {
        var type = SyntaxTrees.field(node, "type");
        var value = SyntaxTrees.field(node, "value");
        if (value == null) {
            value = SyntaxTrees.lastNamedChild(node);
        }
        var mapped = typeMapper.map(type);
        var inner = generate(value);
        if ("number".equals(mapped) && value != null && isRoundingCall(value)) {
            return inner;
        }
        return "(" + inner + " as " + mapped + ")";
    }

    private boolean isRoundingCall(TSNode value) {
        var current = value;
        while (PARENTHESIZED_EXPRESSION.equals(current.getType())) {
            var inner = SyntaxTrees.firstNamedChild(current);
            if (inner == null) {
                return false;
            }
            current = inner;
        }
        if (!INVOCATION_EXPRESSION.equals(current.getType())) {
            return false;
        }
        var function = SyntaxTrees.field(current, "function");
        return function != null && ROUNDING_CALLS.contains(text(function).replaceAll("\\s+", ""));
    }

    private String asExpression(TSNode node) {
        var left = SyntaxTrees.field(node, "left");
        var right = SyntaxTrees.field(node, "right");
        if (left == null) {
            left = SyntaxTrees.firstNamedChild(node);
        }
        if (right == null) {
            right = SyntaxTrees.lastNamedChild(node);
        }
        return "(" + generate(left) + " as " + typeMapper.map(right) + ")";
    }

    // ----- lambdas -----

    private String lambda(TSNode node) {
        var parameters = SyntaxTrees.field(node, "parameters");
        if (parameters == null) {
            parameters = SyntaxTrees.firstChildOfType(node, PARAMETER_LIST, IMPLICIT_PARAMETER, IDENTIFIER);
        }
        var body = SyntaxTrees.field(node, "body");
        if (body == null) {
            body = SyntaxTrees.lastNamedChild(node);
        }
        if (body == null) {
            return unsupported(node);
        }
        String parameterText;
        if (parameters == null) {
            parameterText = "()";
        } else if (PARAMETER_LIST.equals(parameters.getType())) {
            parameterText = "(" + parameterList(parameters) + ")";
        } else {
            parameterText = "(" + MemberNameMapper.localName(bareName(text(parameters))) + ")";
        }
        var async = SyntaxTrees.modifiers(node, unit.parsed()).contains("async") ? "async " : "";

        if (BLOCK.equals(body.getType())) {
            if (blockRenderer == null) {
                return unsupported(node);
            }
            return async + parameterText + " => " + blockRenderer.apply(body);
        }
        return async + parameterText + " => " + generate(body);
    }

    /** Parameters of a method, constructor, delegate or lambda as {@code name: type = default, ...rest: T[]}. */
    public String parameterList(@Nullable TSNode parameterList) {
        if (parameterList == null) {
            return "";
        }
        var parts = new ArrayList<String>();
        for (var parameter : SyntaxTrees.namedChildren(parameterList)) {
            if (!PARAMETER.equals(parameter.getType()) && !"parameter_array".equals(parameter.getType())) {
                continue;
            }
            var nameNode = SyntaxTrees.nameNode(parameter);
            if (nameNode == null) {
                continue;
            }
            var rest = isParamsArray(parameter) ? "..." : "";
            var type = SyntaxTrees.field(parameter, "type");
            var annotation = type == null ? "" : ": " + typeMapper.map(type);
            var defaultValue = SyntaxTrees.initializerValue(parameter);
            var initializer = defaultValue == null ? "" : " = " + generate(defaultValue);
            parts.add(rest + MemberNameMapper.localName(bareName(text(nameNode))) + annotation + initializer);
        }
        return String.join(", ", parts);
    }

    private boolean isParamsArray(TSNode parameter) {
        if ("parameter_array".equals(parameter.getType())) {
            return true;
        }
        for (var child : SyntaxTrees.children(parameter)) {
            if ("params".equals(child.getType())
                    || (MODIFIER.equals(child.getType()) && "params".equals(text(child).strip()))) {
                return true;
            }
        }
        return false;
    }

    // ----- literals -----

    static String numericLiteral(String literal) {
        var trimmed = literal.strip();
        var lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x") || lower.startsWith("0b")) {
            return trimmed.replaceAll("[uUlL]+$", "");
        }
        return trimmed.replaceAll("[fFdDmMuUlL]+$", "");
    }

    private String stringLiteral(TSNode node) {
        var literal = text(node).strip();
        // UTF-8 literals ("..."u8) have no target counterpart
        if (literal.endsWith("u8") || literal.length() < 2) {
            return unsupported(node);
        }
        return "\"" + escapeDoubleQuoted(unescape(literal.substring(1, literal.length() - 1))) + "\"";
    }

    /**
     * Decodes C# escape sequences: the single-character ones, the fixed-width unicode forms and the variable-length hex
     * form of one to four digits.
     */
    static String unescape(String body) {
        var builder = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                builder.append(c);
                i++;
                continue;
            }
            char escape = body.charAt(i + 1);
            i += 2;
            switch (escape) {
                case '\'' -> builder.append('\'');
                case '"' -> builder.append('"');
                case '\\' -> builder.append('\\');
                case '0' -> builder.append('\0');
                case 'a' -> builder.append('\u0007');
                case 'b' -> builder.append('\b');
                case 'e' -> builder.append('\u001B');
                case 'f' -> builder.append('\f');
                case 'n' -> builder.append('\n');
                case 'r' -> builder.append('\r');
                case 't' -> builder.append('\t');
                case 'v' -> builder.append('\u000B');
                case 'u' -> {
                    builder.append((char) Integer.parseInt(body.substring(i, i + 4), 16));
                    i += 4;
                }
                case 'U' -> {
                    builder.appendCodePoint(Integer.parseInt(body.substring(i, i + 8), 16));
                    i += 8;
                }
                case 'x' -> {
                    int end = i;
                    while (end < body.length() && end < i + 4 && Character.digit(body.charAt(end), 16) >= 0) {
                        end++;
                    }
                    if (end == i) {
                        throw new IllegalArgumentException("\\x escape without hex digits");
                    }
                    builder.append((char) Integer.parseInt(body.substring(i, end), 16));
                    i = end;
                }
                default -> throw new IllegalArgumentException("Unknown escape \\" + escape);
            }
        }
        return builder.toString();
    }

    static String verbatimString(String literal) {
        var body = literal.strip();
        body = body.substring(body.indexOf('"') + 1, body.length() - 1).replace("\"\"", "\"");
        return "\"" + escapeDoubleQuoted(body) + "\"";
    }

    static String escapeDoubleQuoted(String value) {
        return escape(value, true);
    }

    private static String escape(String value, boolean doubleQuoted) {
        var builder = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append(doubleQuoted ? "\\\"" : "\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7F) {
                        builder.append(String.format("\\u%04X", (int) c));
                    } else {
                        builder.append(c);
                    }
                }
            }
        }
        return builder.toString();
    }

    static String characterLiteral(String literal) {
        var body = literal.strip();
        return "\"" + escapeDoubleQuoted(unescape(body.substring(1, body.length() - 1))) + "\"";
    }

    // ----- interpolation -----

    private String interpolatedString(TSNode node) {
        var raw = text(node);
        int quote = raw.indexOf('"');
        if (quote < 0 || raw.startsWith("\"\"\"", quote)) {
            return unsupported(node);
        }
        boolean verbatim = raw.substring(0, quote).contains("@");
        // the prefix ($", $@" or @$") is ASCII, so its length in chars equals its length in bytes
        int contentStart = node.getStartByte() + quote + 1;
        int contentEnd = node.getEndByte() - 1;

        var builder = new StringBuilder("`");
        int cursor = contentStart;
        for (var hole : SyntaxTrees.childrenOfType(node, INTERPOLATION)) {
            builder.append(templateText(unit.parsed().text(cursor, hole.getStartByte()), verbatim));
            builder.append("${").append(interpolationHole(hole)).append('}');
            cursor = hole.getEndByte();
        }
        builder.append(templateText(unit.parsed().text(cursor, contentEnd), verbatim));
        return builder.append('`').toString();
    }

    static String templateText(String text, boolean verbatim) {
        var result = verbatim ? text.replace("\"\"", "\"") : unescape(text);
        result = result.replace("{{", "{").replace("}}", "}");
        return escape(result, false).replace("`", "\\`").replace("${", "\\${");
    }

    private String interpolationHole(TSNode hole) {
        TSNode expression = null;
        for (var child : SyntaxTrees.namedChildren(hole)) {
            if (!child.getType().startsWith("interpolation_")) {
                expression = child;
                break;
            }
        }
        if (expression == null) {
            return unsupported(hole);
        }
        var generated = generate(expression);
        var clauses = unit.parsed().text(expression.getEndByte(), hole.getEndByte() - 1);
        int colon = clauses.indexOf(':');
        if (colon < 0) {
            return generated;
        }
        var digits = fixedDigits(clauses.substring(colon + 1).strip());
        if (digits == null) {
            return generated;
        }
        var receiver = PRIMARY_KINDS.contains(SyntaxKind.of(expression)) ? generated : "(" + generated + ")";
        return receiver + ".toFixed(" + digits + ")";
    }

    /** Decimal digits for {@code 0} and {@code F<n>} format specifiers; null for any other specifier. */
    static @Nullable String fixedDigits(String format) {
        if ("0".equals(format)) {
            return "0";
        }
        var matcher = FIXED_FORMAT.matcher(format);
        if (matcher.matches()) {
            return matcher.group(1).isEmpty() ? "2" : matcher.group(1);
        }
        return null;
    }

    // ----- helpers -----

    private String receiverForm(TSNode expression) {
        var generated = generate(expression);
        return PRIMARY_KINDS.contains(SyntaxKind.of(expression)) ? generated : "(" + generated + ")";
    }

    private String joinGenerated(List<TSNode> nodes) {
        return nodes.stream().map(this::generate).collect(Collectors.joining(", "));
    }

    private String text(TSNode node) {
        return unit.text(node);
    }
}
