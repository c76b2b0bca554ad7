package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.TranspilerConfig;
import ai.twinscript.frontend.TranslationUnit;
import ai.twinscript.frontend.csharp.SyntaxTrees;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Translates one C# file to TypeScript: import block, hoisted nested types, then a single walk over the tree emitting
 * one line per statement or member. Expressions go to {@link ExpressionGenerator}, types to {@link TypeMapper}.
 *
 * <p>One instance per file. {@link #generate()} may be called repeatedly and always produces the same text.
 */
public final class TypeScriptGenerator {
    private static final Logger logger = LogManager.getLogger(TypeScriptGenerator.class);

    private static final List<String> PAIR_SUFFIXES = List.of("Entry", "entry", "Kvp", "kvp", "Pair", "pair");
    private static final Set<String> MEMBER_BODIES =
            Set.of(METHOD_DECLARATION, CONSTRUCTOR_DECLARATION, ACCESSOR_DECLARATION);

    private final TranslationUnit unit;
    private final TranspilerConfig config;
    private final GeneratorContext context;
    private final ExpressionGenerator expressions;
    private final Set<SyntaxTrees.NodeKey> hoistedKeys;
    private final List<TSNode> hoistedTypes;
    private StringBuilder output = new StringBuilder();

    public TypeScriptGenerator(TranslationUnit unit, TranspilerConfig config) {
        this.unit = unit;
        this.config = config;
        this.context = new GeneratorContext(config.indentWidth());

        var nested = new ArrayList<TSNode>();
        new NestedTypeCollector(nested).walk(unit.root());
        this.hoistedTypes = List.copyOf(nested);
        this.hoistedKeys = nested.stream().map(SyntaxTrees::key).collect(Collectors.toUnmodifiableSet());
        var hoistedNames = new HashSet<String>();
        for (var type : nested) {
            var name = SyntaxTrees.field(type, "name");
            if (name != null) {
                hoistedNames.add(text(name));
            }
        }

        this.expressions = new ExpressionGenerator(unit, context, config, hoistedNames);
        this.expressions.setBlockRenderer(this::renderDetachedBlock);
    }

    public GeneratorContext context() {
        return context;
    }

    public ExpressionGenerator expressions() {
        return expressions;
    }

    public String generate() {
        output = new StringBuilder();
        emitImports();
        for (var type : hoistedTypes) {
            visitGuarded(type, () -> emitHoistedType(type));
        }
        visit(unit.root());
        logger.debug("Generated {} ({} chars)", unit.file(), output.length());
        return output.toString();
    }

    // ----- pre-pass output -----

    private void emitImports() {
        var references = new HashSet<String>();
        new ReferenceCollector(unit.parsed(), references).walk(unit.root());

        var declaredHere = new HashSet<String>();
        for (var declaration : SyntaxTrees.findAllNodesRecursive(
                unit.root(), n -> TYPE_DECLARATIONS.contains(n.getType()))) {
            var name = SyntaxTrees.field(declaration, "name");
            if (name != null) {
                declaredHere.add(text(name));
            }
        }

        var imports = new TreeSet<String>();
        for (var reference : references) {
            if (config.companionTypes().contains(reference) && !declaredHere.contains(reference)) {
                imports.add(reference);
            }
        }
        if (imports.isEmpty()) {
            return;
        }
        var indent = " ".repeat(config.indentWidth());
        output.append("import {\n");
        for (var name : imports) {
            output.append(indent).append(name).append(",\n");
        }
        output.append("} from '").append(config.companionModule()).append("';\n\n");
    }

    /** A nested type becomes a top-level structural type holding only its settable members. */
    private void emitHoistedType(TSNode declaration) {
        if (ENUM_DECLARATION.equals(declaration.getType())) {
            emitEnum(declaration);
            return;
        }
        var name = text(SyntaxTrees.field(declaration, "name"));
        writeLine("export interface " + name + typeParameters(declaration) + " {");
        indented(() -> {
            var primary = SyntaxTrees.firstChildOfType(declaration, PARAMETER_LIST);
            if (primary != null) {
                for (var parameter : SyntaxTrees.childrenOfType(primary, PARAMETER)) {
                    emitShapeMember(SyntaxTrees.nameNode(parameter), SyntaxTrees.field(parameter, "type"));
                }
            }
            for (var member : bodyMembers(declaration)) {
                var modifiers = modifiers(member);
                if (PROPERTY_DECLARATION.equals(member.getType())) {
                    if (!modifiers.contains("static") && isSettableProperty(member)) {
                        emitShapeMember(SyntaxTrees.field(member, "name"), SyntaxTrees.field(member, "type"));
                    }
                } else if (FIELD_DECLARATION.equals(member.getType())) {
                    if (modifiers.contains("static") || modifiers.contains("const") || modifiers.contains("readonly")) {
                        continue;
                    }
                    var variables = SyntaxTrees.firstChildOfType(member, VARIABLE_DECLARATION);
                    if (variables == null) {
                        continue;
                    }
                    var type = SyntaxTrees.field(variables, "type");
                    for (var declarator : SyntaxTrees.childrenOfType(variables, VARIABLE_DECLARATOR)) {
                        emitShapeMember(SyntaxTrees.nameNode(declarator), type);
                    }
                }
            }
        });
        writeLine("}");
        blankLine();
    }

    private void emitShapeMember(@Nullable TSNode name, @Nullable TSNode type) {
        if (name != null) {
            writeLine(MemberNameMapper.toCamelCase(text(name)) + ": " + expressions.typeMapper().map(type) + ";");
        }
    }

    private boolean isSettableProperty(TSNode property) {
        if (SyntaxTrees.firstChildOfType(property, ARROW_EXPRESSION_CLAUSE) != null) {
            return false;
        }
        var accessors = SyntaxTrees.firstChildOfType(property, ACCESSOR_LIST);
        if (accessors == null) {
            return false;
        }
        for (var accessor : SyntaxTrees.childrenOfType(accessors, ACCESSOR_DECLARATION)) {
            var kind = accessorKind(accessor);
            if ("set".equals(kind) || "init".equals(kind)) {
                return true;
            }
        }
        return false;
    }

    // ----- dispatch -----

    /** Visits one node. Indentation and alias scope are the same afterwards as before, even if translation fails. */
    void visit(TSNode node) {
        Runnable action = switch (SyntaxKind.of(node)) {
            case COMPILATION_UNIT -> () -> visitChildren(node);
            case NAMESPACE, FILE_SCOPED_NAMESPACE -> () -> visitNamespace(node);
            case USING, COMMENT, EMPTY -> () -> {};
            case CLASS_LIKE -> () -> visitClass(node);
            case INTERFACE -> () -> visitInterface(node);
            case ENUM -> () -> visitEnum(node);
            case DELEGATE -> () -> visitDelegate(node);
            case FIELD -> () -> visitField(node);
            case PROPERTY -> () -> visitProperty(node);
            case METHOD -> () -> visitMethod(node);
            case CONSTRUCTOR -> () -> visitConstructor(node);
            case BLOCK -> () -> visitNestedBlock(node);
            case EXPRESSION_STATEMENT -> () -> visitExpressionStatement(node);
            case LOCAL_DECLARATION -> () -> visitLocalDeclaration(node);
            case RETURN -> () -> visitReturn(node);
            case BREAK -> () -> writeLine("break;");
            case CONTINUE -> () -> writeLine("continue;");
            case IF -> () -> visitIf(node);
            case FOR -> () -> visitFor(node);
            case FOREACH -> () -> visitForEach(node);
            case WHILE -> () -> visitWhile(node);
            case DO -> () -> visitDo(node);
            case THROW -> () -> visitThrow(node);
            case IDENTIFIER,
                    GENERIC_NAME,
                    PREDEFINED_TYPE,
                    NUMERIC_LITERAL,
                    STRING_LITERAL,
                    VERBATIM_STRING_LITERAL,
                    CHARACTER_LITERAL,
                    BOOLEAN_LITERAL,
                    NULL_LITERAL,
                    MEMBER_ACCESS,
                    INVOCATION,
                    OBJECT_CREATION,
                    IMPLICIT_OBJECT_CREATION,
                    INITIALIZER,
                    BINARY,
                    ASSIGNMENT,
                    ELEMENT_ACCESS,
                    CONDITIONAL,
                    THIS_ACCESS,
                    CAST,
                    AS,
                    ARRAY_CREATION,
                    IMPLICIT_ARRAY_CREATION,
                    PARENTHESIZED,
                    PREFIX_UNARY,
                    POSTFIX_UNARY,
                    INTERPOLATED_STRING,
                    LAMBDA -> () -> writeLine(expressions.generate(node) + ";");
            case UNSUPPORTED -> () -> unsupportedLine(node);
        };
        visitGuarded(node, action);
    }

    private void visitGuarded(TSNode node, Runnable action) {
        int level = context.indentLevel();
        var aliases = context.pairAliases();
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.warn(
                    "Failed to translate {} at {}:{}; emitting placeholder",
                    node.getType(),
                    unit.file(),
                    unit.parsed().line(node),
                    e);
            while (context.indentLevel() > level) {
                context.outdent();
            }
            context.exitPairScope(aliases);
            writeLine(ExpressionGenerator.placeholder(node.getType()));
        }
    }

    private void visitChildren(TSNode node) {
        for (var child : SyntaxTrees.namedChildren(node)) {
            visit(child);
        }
    }

    private void unsupportedLine(TSNode node) {
        logger.warn("Unsupported {} at {}:{}", node.getType(), unit.file(), unit.parsed().line(node));
        writeLine(ExpressionGenerator.placeholder(node.getType()));
    }

    // ----- declarations -----

    private void visitNamespace(TSNode node) {
        var name = SyntaxTrees.field(node, "name");
        writeLine("// Namespace: " + (name == null ? "" : text(name)));
        blankLine();
        var body = SyntaxTrees.field(node, "body");
        if (body == null) {
            body = SyntaxTrees.firstChildOfType(node, DECLARATION_LIST);
        }
        if (body != null) {
            visitChildren(body);
            return;
        }
        // file-scoped: declarations are children of the namespace node itself
        for (var child : SyntaxTrees.namedChildren(node)) {
            if (name == null || !SyntaxTrees.key(child).equals(SyntaxTrees.key(name))) {
                visit(child);
            }
        }
    }

    private void visitClass(TSNode node) {
        if (hoistedKeys.contains(SyntaxTrees.key(node))) {
            return;
        }
        var modifiers = modifiers(node);
        var header = new StringBuilder("export ");
        if (modifiers.contains("abstract")) {
            header.append("abstract ");
        }
        header.append("class ").append(text(SyntaxTrees.field(node, "name"))).append(typeParameters(node));

        var implemented = new ArrayList<String>();
        var extended = baseClass(node);
        for (var base : baseTypes(node)) {
            var simple = SyntaxTrees.simpleTypeName(text(base));
            if (unit.symbols().isInterface(simple)) {
                implemented.add(expressions.typeMapper().map(base));
            }
        }
        if (extended != null) {
            header.append(" extends ").append(expressions.typeMapper().map(extended));
        }
        if (!implemented.isEmpty()) {
            header.append(" implements ").append(String.join(", ", implemented));
        }
        writeLine(header + " {");
        indented(() -> {
            var primary = SyntaxTrees.firstChildOfType(node, PARAMETER_LIST);
            if (primary != null) {
                emitPrimaryConstructor(primary);
            }
            for (var member : bodyMembers(node)) {
                visit(member);
            }
        });
        writeLine("}");
        blankLine();
    }

    /** Record parameters become properties assigned by a constructor. */
    private void emitPrimaryConstructor(TSNode parameters) {
        var names = new ArrayList<String>();
        for (var parameter : SyntaxTrees.childrenOfType(parameters, PARAMETER)) {
            var name = SyntaxTrees.nameNode(parameter);
            if (name == null) {
                continue;
            }
            var property = MemberNameMapper.toCamelCase(text(name));
            names.add(property);
            writeLine("readonly " + property + ": "
                    + expressions.typeMapper().map(SyntaxTrees.field(parameter, "type")) + ";");
        }
        blankLine();
        writeLine("constructor(" + expressions.parameterList(parameters) + ") {");
        indented(() -> names.forEach(name -> writeLine("this." + name + " = " + name + ";")));
        writeLine("}");
        blankLine();
    }

    private List<TSNode> baseTypes(TSNode declaration) {
        var baseList = SyntaxTrees.firstChildOfType(declaration, BASE_LIST);
        if (baseList == null) {
            return List.of();
        }
        return SyntaxTrees.namedChildren(baseList).stream()
                .filter(base -> !ARGUMENT_LIST.equals(base.getType()))
                .toList();
    }

    /** The base class, if one is declared in the translated sources; host base classes are dropped. */
    private @Nullable TSNode baseClass(TSNode declaration) {
        for (var base : baseTypes(declaration)) {
            var simple = SyntaxTrees.simpleTypeName(text(base));
            if (unit.symbols().isKnownType(simple) && !unit.symbols().isInterface(simple)) {
                return base;
            }
            if (!unit.symbols().isKnownType(simple)) {
                logger.debug("Dropping unknown base type {} in {}", simple, unit.file());
            }
        }
        return null;
    }

    private List<TSNode> bodyMembers(TSNode declaration) {
        var body = SyntaxTrees.field(declaration, "body");
        if (body == null) {
            body = SyntaxTrees.firstChildOfType(declaration, DECLARATION_LIST, ENUM_MEMBER_DECLARATION_LIST);
        }
        return body == null ? List.of() : SyntaxTrees.namedChildren(body);
    }

    private void visitInterface(TSNode node) {
        if (hoistedKeys.contains(SyntaxTrees.key(node))) {
            return;
        }
        var header = new StringBuilder("export interface ")
                .append(text(SyntaxTrees.field(node, "name")))
                .append(typeParameters(node));
        var extended = baseTypes(node).stream()
                .filter(base -> unit.symbols().isInterface(SyntaxTrees.simpleTypeName(text(base))))
                .map(base -> expressions.typeMapper().map(base))
                .toList();
        if (!extended.isEmpty()) {
            header.append(" extends ").append(String.join(", ", extended));
        }
        writeLine(header + " {");
        indented(() -> {
            for (var member : bodyMembers(node)) {
                switch (member.getType()) {
                    case PROPERTY_DECLARATION -> {
                        var readonly = isSettableProperty(member) ? "" : "readonly ";
                        writeLine(readonly + MemberNameMapper.toCamelCase(text(SyntaxTrees.field(member, "name")))
                                + ": " + expressions.typeMapper().map(SyntaxTrees.field(member, "type")) + ";");
                    }
                    case METHOD_DECLARATION -> writeLine(signature(member) + ";");
                    default -> unsupportedLine(member);
                }
            }
        });
        writeLine("}");
        blankLine();
    }

    private void visitEnum(TSNode node) {
        if (!hoistedKeys.contains(SyntaxTrees.key(node))) {
            emitEnum(node);
        }
    }

    private void emitEnum(TSNode node) {
        writeLine("export enum " + text(SyntaxTrees.field(node, "name")) + " {");
        indented(() -> {
            for (var member : bodyMembers(node)) {
                if (!ENUM_MEMBER_DECLARATION.equals(member.getType())) {
                    continue;
                }
                var value = SyntaxTrees.field(member, "value");
                if (value == null) {
                    value = SyntaxTrees.initializerValue(member);
                }
                var name = text(SyntaxTrees.nameNode(member));
                writeLine(name + (value == null ? "" : " = " + expressions.generate(value)) + ",");
            }
        });
        writeLine("}");
        blankLine();
    }

    private void visitDelegate(TSNode node) {
        if (SyntaxTrees.ancestor(node, TYPE_DECLARATIONS) != null) {
            unsupportedLine(node);
            return;
        }
        var returns = SyntaxTrees.field(node, "returns", "type");
        writeLine("export type " + text(SyntaxTrees.field(node, "name")) + typeParameters(node) + " = ("
                + expressions.parameterList(parameterListOf(node)) + ") => "
                + expressions.typeMapper().map(returns) + ";");
        blankLine();
    }

    private void visitField(TSNode node) {
        var modifiers = modifiers(node);
        var variables = SyntaxTrees.firstChildOfType(node, VARIABLE_DECLARATION);
        if (variables == null) {
            unsupportedLine(node);
            return;
        }
        boolean isConst = modifiers.contains("const");
        var prefix = visibility(modifiers)
                + (isConst || modifiers.contains("static") ? "static " : "")
                + (isConst || modifiers.contains("readonly") ? "readonly " : "");
        var type = expressions.typeMapper().map(SyntaxTrees.field(variables, "type"));
        for (var declarator : SyntaxTrees.childrenOfType(variables, VARIABLE_DECLARATOR)) {
            var value = SyntaxTrees.initializerValue(declarator);
            writeLine(prefix + MemberNameMapper.toCamelCase(text(SyntaxTrees.nameNode(declarator))) + ": " + type
                    + (value == null ? "" : " = " + expressions.generate(value)) + ";");
        }
    }

    private void visitProperty(TSNode node) {
        var modifiers = modifiers(node);
        var prefix = visibility(modifiers)
                + (modifiers.contains("static") ? "static " : "")
                + (modifiers.contains("abstract") ? "abstract " : "");
        var name = MemberNameMapper.toCamelCase(text(SyntaxTrees.field(node, "name")));
        var type = expressions.typeMapper().map(SyntaxTrees.field(node, "type"));

        var arrow = SyntaxTrees.firstChildOfType(node, ARROW_EXPRESSION_CLAUSE);
        if (arrow != null) {
            writeLine(prefix + "get " + name + "(): " + type + " {");
            indented(() -> writeLine("return " + expressions.generate(SyntaxTrees.firstNamedChild(arrow)) + ";"));
            writeLine("}");
            blankLine();
            return;
        }
        var accessorList = SyntaxTrees.firstChildOfType(node, ACCESSOR_LIST);
        if (accessorList == null) {
            unsupportedLine(node);
            return;
        }
        var accessors = SyntaxTrees.childrenOfType(accessorList, ACCESSOR_DECLARATION);
        boolean isAuto = accessors.stream().allMatch(a -> accessorBody(a) == null);
        if (isAuto) {
            var readonly = accessors.stream().map(this::accessorKind).anyMatch(k -> k.equals("set") || k.equals("init"))
                    ? ""
                    : "readonly ";
            var value = SyntaxTrees.initializerValue(node);
            writeLine(prefix + readonly + name + ": " + type
                    + (value == null ? "" : " = " + expressions.generate(value)) + ";");
            return;
        }
        for (var accessor : accessors) {
            var kind = accessorKind(accessor);
            var body = accessorBody(accessor);
            boolean getter = "get".equals(kind);
            if (body == null || !(getter || "set".equals(kind) || "init".equals(kind))) {
                unsupportedLine(accessor);
                continue;
            }
            writeLine(prefix + (getter ? "get " + name + "(): " + type : "set " + name + "(value: " + type + ")")
                    + " {");
            indented(() -> emitFunctionBody(body, getter));
            writeLine("}");
            blankLine();
        }
    }

    private String accessorKind(TSNode accessor) {
        var name = SyntaxTrees.field(accessor, "name");
        if (name != null) {
            return text(name).strip();
        }
        for (var child : SyntaxTrees.children(accessor)) {
            switch (child.getType()) {
                case "get", "set", "init", "add", "remove" -> {
                    return child.getType();
                }
                default -> {}
            }
        }
        return "";
    }

    private @Nullable TSNode accessorBody(TSNode accessor) {
        return SyntaxTrees.firstChildOfType(accessor, BLOCK, ARROW_EXPRESSION_CLAUSE);
    }

    private void visitMethod(TSNode node) {
        var body = SyntaxTrees.field(node, "body");
        if (body == null) {
            body = SyntaxTrees.firstChildOfType(node, BLOCK, ARROW_EXPRESSION_CLAUSE);
        }
        var modifiers = modifiers(node);
        var prefix = visibility(modifiers)
                + (modifiers.contains("static") ? "static " : "")
                + (modifiers.contains("abstract") ? "abstract " : "")
                + (modifiers.contains("async") ? "async " : "");
        if (body == null) {
            writeLine(prefix + signature(node) + ";");
            blankLine();
            return;
        }
        var returns = expressions.typeMapper().map(SyntaxTrees.field(node, "returns", "type"));
        var methodBody = body;
        writeLine(prefix + signature(node) + " {");
        indented(() -> emitFunctionBody(methodBody, !"void".equals(returns)));
        writeLine("}");
        blankLine();
    }

    /** {@code name<T>(params): ret} */
    private String signature(TSNode method) {
        var returns = SyntaxTrees.field(method, "returns", "type");
        return MemberNameMapper.toCamelCase(text(SyntaxTrees.field(method, "name"))) + typeParameters(method) + "("
                + expressions.parameterList(parameterListOf(method)) + "): "
                + expressions.typeMapper().map(returns);
    }

    private @Nullable TSNode parameterListOf(TSNode declaration) {
        var parameters = SyntaxTrees.field(declaration, "parameters");
        return parameters != null ? parameters : SyntaxTrees.firstChildOfType(declaration, PARAMETER_LIST);
    }

    /** Block bodies emit their statements; expression bodies become a return (or a bare statement for void). */
    private void emitFunctionBody(TSNode body, boolean returnsValue) {
        if (ARROW_EXPRESSION_CLAUSE.equals(body.getType())) {
            var expression = expressions.generate(SyntaxTrees.firstNamedChild(body));
            writeLine((returnsValue ? "return " : "") + expression + ";");
        } else {
            visitChildren(body);
        }
    }

    private void visitConstructor(TSNode node) {
        var modifiers = modifiers(node);
        var body = SyntaxTrees.field(node, "body");
        if (body == null) {
            body = SyntaxTrees.firstChildOfType(node, BLOCK, ARROW_EXPRESSION_CLAUSE);
        }
        var constructorBody = body;
        if (modifiers.contains("static")) {
            writeLine("static {");
            indented(() -> {
                if (constructorBody != null) {
                    emitFunctionBody(constructorBody, false);
                }
            });
            writeLine("}");
            blankLine();
            return;
        }

        writeLine(visibility(modifiers) + "constructor(" + expressions.parameterList(parameterListOf(node)) + ") {");
        indented(() -> {
            var initializer = SyntaxTrees.firstChildOfType(node, CONSTRUCTOR_INITIALIZER);
            if (initializer != null) {
                var arguments = SyntaxTrees.arguments(SyntaxTrees.firstChildOfType(initializer, ARGUMENT_LIST));
                if (text(initializer).replaceAll("\\s+", "").startsWith(":base")) {
                    writeLine("super(" + arguments.stream().map(expressions::generate).collect(Collectors.joining(", "))
                            + ");");
                } else {
                    unsupportedLine(initializer);
                }
            } else {
                var enclosing = SyntaxTrees.ancestor(node, TYPE_DECLARATIONS);
                if (enclosing != null && baseClass(enclosing) != null) {
                    writeLine("super();");
                }
            }
            if (constructorBody != null) {
                emitFunctionBody(constructorBody, false);
            }
        });
        writeLine("}");
        blankLine();
    }

    // ----- statements -----

    private void visitNestedBlock(TSNode block) {
        writeLine("{");
        indented(() -> visitChildren(block));
        writeLine("}");
    }

    /** Body of a control-flow statement, already inside its braces. */
    private void emitEmbedded(@Nullable TSNode statement) {
        if (statement == null) {
            return;
        }
        if (BLOCK.equals(statement.getType())) {
            visitChildren(statement);
        } else {
            visit(statement);
        }
    }

    private void visitExpressionStatement(TSNode node) {
        writeLine(expressions.generate(SyntaxTrees.firstNamedChild(node)) + ";");
    }

    private void visitLocalDeclaration(TSNode node) {
        var variables = SyntaxTrees.firstChildOfType(node, VARIABLE_DECLARATION);
        if (variables == null) {
            unsupportedLine(node);
            return;
        }
        boolean isConst = modifiers(node).contains("const");
        var type = SyntaxTrees.field(variables, "type");
        var annotation = type == null || isImplicitType(type) ? "" : ": " + expressions.typeMapper().map(type);
        var scope = node.getParent();
        for (var declarator : SyntaxTrees.childrenOfType(variables, VARIABLE_DECLARATOR)) {
            var rawName = text(SyntaxTrees.nameNode(declarator));
            var value = SyntaxTrees.initializerValue(declarator);
            var keyword = BindingKeywords.choose(unit.parsed(), rawName, value != null, isConst, scope);
            writeLine(keyword + " " + MemberNameMapper.localName(rawName) + annotation
                    + (value == null ? "" : " = " + expressions.generate(value)) + ";");
        }
    }

    private boolean isImplicitType(TSNode type) {
        return IMPLICIT_TYPE.equals(type.getType()) || "var".equals(text(type).strip());
    }

    private void visitReturn(TSNode node) {
        var value = SyntaxTrees.firstNamedChild(node);
        writeLine(value == null ? "return;" : "return " + expressions.generate(value) + ";");
    }

    private void visitIf(TSNode node) {
        writeLine("if (" + expressions.generate(SyntaxTrees.field(node, "condition")) + ") {");
        indented(() -> emitEmbedded(SyntaxTrees.field(node, "consequence")));
        var alternative = elseBranch(node);
        while (alternative != null) {
            if (IF_STATEMENT.equals(alternative.getType())) {
                var elseIf = alternative;
                writeLine("} else if (" + expressions.generate(SyntaxTrees.field(elseIf, "condition")) + ") {");
                indented(() -> emitEmbedded(SyntaxTrees.field(elseIf, "consequence")));
                alternative = elseBranch(elseIf);
            } else {
                var elseBody = alternative;
                writeLine("} else {");
                indented(() -> emitEmbedded(elseBody));
                alternative = null;
            }
        }
        writeLine("}");
    }

    private @Nullable TSNode elseBranch(TSNode ifStatement) {
        var alternative = SyntaxTrees.field(ifStatement, "alternative");
        if (alternative != null && "else_clause".equals(alternative.getType())) {
            return SyntaxTrees.firstNamedChild(alternative);
        }
        return alternative;
    }

    /** The header is read positionally (initializers ; condition ; updates) so it works with or without field names. */
    private void visitFor(TSNode node) {
        List<List<TSNode>> segments = List.of(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
        int segment = -1;
        TSNode body = null;
        for (var child : SyntaxTrees.children(node)) {
            var type = child.getType();
            if (segment < 0) {
                if ("(".equals(type)) {
                    segment = 0;
                }
            } else if (segment < 3) {
                if (";".equals(type)) {
                    segment = Math.min(segment + 1, 2);
                } else if (")".equals(type)) {
                    segment = 3;
                } else if (child.isNamed() && !COMMENT.equals(type)) {
                    segments.get(segment).add(child);
                }
            } else if (child.isNamed() && !COMMENT.equals(type)) {
                body = child;
            }
        }

        var initializer = segments.get(0).stream()
                .map(this::forInitializer)
                .collect(Collectors.joining(", "));
        var condition = segments.get(1).isEmpty() ? "" : expressions.generate(segments.get(1).get(0));
        var updates = segments.get(2).stream().map(expressions::generate).collect(Collectors.joining(", "));
        writeLine("for (" + initializer + "; " + condition + "; " + updates + ") {");
        var loopBody = body;
        indented(() -> emitEmbedded(loopBody));
        writeLine("}");
    }

    private String forInitializer(TSNode initializer) {
        if (!VARIABLE_DECLARATION.equals(initializer.getType())) {
            return expressions.generate(initializer);
        }
        var declarators = new ArrayList<String>();
        for (var declarator : SyntaxTrees.childrenOfType(initializer, VARIABLE_DECLARATOR)) {
            var value = SyntaxTrees.initializerValue(declarator);
            declarators.add(MemberNameMapper.localName(text(SyntaxTrees.nameNode(declarator)))
                    + (value == null ? "" : " = " + expressions.generate(value)));
        }
        return "let " + String.join(", ", declarators);
    }

    private void visitForEach(TSNode node) {
        var left = SyntaxTrees.field(node, "left");
        var right = SyntaxTrees.field(node, "right");
        var body = SyntaxTrees.field(node, "body");
        if (body == null) {
            body = SyntaxTrees.lastNamedChild(node);
        }
        if (left == null || right == null || !IDENTIFIER.equals(left.getType())) {
            unsupportedLine(node);
            return;
        }
        var name = MemberNameMapper.localName(text(left));
        var iterable = expressions.generate(right);
        var loopBody = body;

        if (isDictionaryIteration(SyntaxTrees.field(node, "type"), right)) {
            var alias = pairAlias(name, namesInScope(node));
            writeLine("for (const [" + alias.keyName() + ", " + alias.valueName() + "] of " + iterable + ") {");
            var previous = context.enterPairScope(name, alias);
            try {
                indented(() -> emitEmbedded(loopBody));
            } finally {
                context.exitPairScope(previous);
            }
        } else {
            writeLine("for (const " + name + " of " + iterable + ") {");
            indented(() -> emitEmbedded(loopBody));
        }
        writeLine("}");
    }

    private boolean isDictionaryIteration(@Nullable TSNode loopType, TSNode iterable) {
        if (loopType != null && "KeyValuePair".equals(SyntaxTrees.simpleTypeName(text(loopType)))) {
            return true;
        }
        return unit.symbols()
                .declaredTypeOf(iterable)
                .map(SyntaxTrees::simpleTypeName)
                .filter(config.dictionaryTypes()::contains)
                .isPresent();
    }

    /**
     * Local names the destructured key and value must not collide with: everything declared in the enclosing member
     * plus the aliases of enclosing dictionary loops.
     */
    private Set<String> namesInScope(TSNode loop) {
        var names = new HashSet<String>();
        var aliases = context.pairAliases();
        if (aliases != null) {
            for (var alias : aliases.values()) {
                names.add(alias.keyName());
                names.add(alias.valueName());
            }
        }
        var member = SyntaxTrees.ancestor(loop, MEMBER_BODIES);
        var scope = member != null ? member : unit.parsed().root();
        for (var declaration : SyntaxTrees.findAllNodesRecursive(
                scope, n -> VARIABLE_DECLARATOR.equals(n.getType()) || PARAMETER.equals(n.getType()))) {
            var nameNode = SyntaxTrees.nameNode(declaration);
            if (nameNode != null) {
                names.add(MemberNameMapper.localName(text(nameNode)));
            }
        }
        for (var forEach : SyntaxTrees.findAllNodesByType(scope, FOREACH_STATEMENT)) {
            var variable = SyntaxTrees.field(forEach, "left");
            if (variable != null && IDENTIFIER.equals(variable.getType())) {
                names.add(MemberNameMapper.localName(text(variable)));
            }
        }
        return names;
    }

    /**
     * Picks destructured names for a dictionary loop variable. The short form comes first; if it is taken the loop
     * variable's full name is used as prefix, then a numeric suffix.
     */
    static GeneratorContext.PairAlias pairAlias(String loopVariable, Set<String> taken) {
        var preferred = pairAlias(loopVariable);
        if (isFree(preferred, taken)) {
            return preferred;
        }
        var prefixed = new GeneratorContext.PairAlias(loopVariable + "Key", loopVariable + "Value");
        if (isFree(prefixed, taken)) {
            return prefixed;
        }
        for (int n = 2; ; n++) {
            var numbered = new GeneratorContext.PairAlias(prefixed.keyName() + n, prefixed.valueName() + n);
            if (isFree(numbered, taken)) {
                return numbered;
            }
        }
    }

    private static boolean isFree(GeneratorContext.PairAlias alias, Set<String> taken) {
        return !taken.contains(alias.keyName()) && !taken.contains(alias.valueName());
    }

    /** {@code kvp} gives key/value; {@code scoreEntry} gives scoreKey/scoreValue. */
    static GeneratorContext.PairAlias pairAlias(String loopVariable) {
        var base = loopVariable;
        for (var suffix : PAIR_SUFFIXES) {
            if (base.endsWith(suffix)) {
                base = base.substring(0, base.length() - suffix.length());
                break;
            }
        }
        if (base.isEmpty()) {
            return new GeneratorContext.PairAlias("key", "value");
        }
        return new GeneratorContext.PairAlias(base + "Key", base + "Value");
    }

    private void visitWhile(TSNode node) {
        writeLine("while (" + expressions.generate(SyntaxTrees.field(node, "condition")) + ") {");
        var body = SyntaxTrees.field(node, "body");
        indented(() -> emitEmbedded(body != null ? body : SyntaxTrees.lastNamedChild(node)));
        writeLine("}");
    }

    private void visitDo(TSNode node) {
        var body = SyntaxTrees.field(node, "body");
        writeLine("do {");
        indented(() -> emitEmbedded(body != null ? body : SyntaxTrees.firstNamedChild(node)));
        writeLine("} while (" + expressions.generate(SyntaxTrees.field(node, "condition")) + ");");
    }

    private void visitThrow(TSNode node) {
        var value = SyntaxTrees.firstNamedChild(node);
        if (value == null) {
            // a bare rethrow only exists inside catch blocks, which are not translated
            unsupportedLine(node);
            return;
        }
        writeLine("throw " + expressions.generate(value) + ";");
    }

    // ----- emission helpers -----

    /** Renders a lambda's block body as {@code {\n...}} ending at the current indentation. */
    private String renderDetachedBlock(TSNode block) {
        var saved = output;
        int level = context.indentLevel();
        output = new StringBuilder();
        try {
            indented(() -> visitChildren(block));
            return "{\n" + output + context.indentation() + "}";
        } finally {
            output = saved;
            while (context.indentLevel() > level) {
                context.outdent();
            }
        }
    }

    private void indented(Runnable body) {
        context.indent();
        try {
            body.run();
        } finally {
            context.outdent();
        }
    }

    private String typeParameters(TSNode declaration) {
        var list = SyntaxTrees.firstChildOfType(declaration, TYPE_PARAMETER_LIST);
        if (list == null) {
            return "";
        }
        return SyntaxTrees.childrenOfType(list, TYPE_PARAMETER).stream()
                .map(parameter -> {
                    var name = SyntaxTrees.nameNode(parameter);
                    return text(name != null ? name : parameter);
                })
                .collect(Collectors.joining(", ", "<", ">"));
    }

    /** TypeScript members are public by default; C# class members are private by default. */
    static String visibility(Set<String> modifiers) {
        if (modifiers.contains("private")) {
            return "private ";
        }
        if (modifiers.contains("protected")) {
            return "protected ";
        }
        if (modifiers.contains("public") || modifiers.contains("internal")) {
            return "";
        }
        return "private ";
    }

    private Set<String> modifiers(TSNode declaration) {
        return SyntaxTrees.modifiers(declaration, unit.parsed());
    }

    private void writeLine(String line) {
        if (line.isEmpty()) {
            output.append('\n');
            return;
        }
        output.append(context.indentation()).append(line).append('\n');
    }

    private void blankLine() {
        output.append('\n');
    }

    private String text(@Nullable TSNode node) {
        return node == null ? "" : unit.text(node);
    }
}
