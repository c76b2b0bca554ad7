package ai.twinscript.transpiler;

import static ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes.*;

import ai.twinscript.frontend.csharp.CSharpTreeSitterNodeTypes;
import java.util.HashMap;
import java.util.Map;
import org.treesitter.TSNode;

/**
 * The closed set of syntax categories the translator understands. Dispatch switches over this enum without a default
 * branch, so adding a constant forces every dispatcher to decide what to do with it. Node types outside the set map to
 * {@link #UNSUPPORTED} and become placeholders.
 */
public enum SyntaxKind {
    // declarations
    COMPILATION_UNIT(Category.DECLARATION, CSharpTreeSitterNodeTypes.COMPILATION_UNIT),
    NAMESPACE(Category.DECLARATION, NAMESPACE_DECLARATION),
    FILE_SCOPED_NAMESPACE(Category.DECLARATION, FILE_SCOPED_NAMESPACE_DECLARATION),
    USING(Category.DECLARATION, USING_DIRECTIVE),
    CLASS_LIKE(
            Category.DECLARATION,
            CLASS_DECLARATION,
            STRUCT_DECLARATION,
            RECORD_DECLARATION,
            RECORD_STRUCT_DECLARATION),
    INTERFACE(Category.DECLARATION, INTERFACE_DECLARATION),
    ENUM(Category.DECLARATION, ENUM_DECLARATION),
    DELEGATE(Category.DECLARATION, DELEGATE_DECLARATION),
    FIELD(Category.DECLARATION, FIELD_DECLARATION),
    PROPERTY(Category.DECLARATION, PROPERTY_DECLARATION),
    METHOD(Category.DECLARATION, METHOD_DECLARATION),
    CONSTRUCTOR(Category.DECLARATION, CONSTRUCTOR_DECLARATION),

    // statements
    BLOCK(Category.STATEMENT, CSharpTreeSitterNodeTypes.BLOCK),
    EXPRESSION_STATEMENT(Category.STATEMENT, CSharpTreeSitterNodeTypes.EXPRESSION_STATEMENT),
    LOCAL_DECLARATION(Category.STATEMENT, LOCAL_DECLARATION_STATEMENT),
    RETURN(Category.STATEMENT, RETURN_STATEMENT),
    BREAK(Category.STATEMENT, BREAK_STATEMENT),
    CONTINUE(Category.STATEMENT, CONTINUE_STATEMENT),
    IF(Category.STATEMENT, IF_STATEMENT),
    FOR(Category.STATEMENT, FOR_STATEMENT),
    FOREACH(Category.STATEMENT, FOREACH_STATEMENT),
    WHILE(Category.STATEMENT, WHILE_STATEMENT),
    DO(Category.STATEMENT, DO_STATEMENT),
    THROW(Category.STATEMENT, THROW_STATEMENT),
    EMPTY(Category.STATEMENT, EMPTY_STATEMENT),

    // expressions
    IDENTIFIER(Category.EXPRESSION, CSharpTreeSitterNodeTypes.IDENTIFIER),
    GENERIC_NAME(Category.EXPRESSION, CSharpTreeSitterNodeTypes.GENERIC_NAME),
    PREDEFINED_TYPE(Category.EXPRESSION, CSharpTreeSitterNodeTypes.PREDEFINED_TYPE),
    NUMERIC_LITERAL(Category.EXPRESSION, INTEGER_LITERAL, REAL_LITERAL),
    STRING_LITERAL(Category.EXPRESSION, CSharpTreeSitterNodeTypes.STRING_LITERAL),
    VERBATIM_STRING_LITERAL(Category.EXPRESSION, CSharpTreeSitterNodeTypes.VERBATIM_STRING_LITERAL),
    CHARACTER_LITERAL(Category.EXPRESSION, CSharpTreeSitterNodeTypes.CHARACTER_LITERAL),
    BOOLEAN_LITERAL(Category.EXPRESSION, CSharpTreeSitterNodeTypes.BOOLEAN_LITERAL),
    NULL_LITERAL(Category.EXPRESSION, CSharpTreeSitterNodeTypes.NULL_LITERAL),
    MEMBER_ACCESS(Category.EXPRESSION, MEMBER_ACCESS_EXPRESSION),
    INVOCATION(Category.EXPRESSION, INVOCATION_EXPRESSION),
    OBJECT_CREATION(Category.EXPRESSION, OBJECT_CREATION_EXPRESSION),
    IMPLICIT_OBJECT_CREATION(Category.EXPRESSION, IMPLICIT_OBJECT_CREATION_EXPRESSION),
    INITIALIZER(Category.EXPRESSION, INITIALIZER_EXPRESSION),
    BINARY(Category.EXPRESSION, BINARY_EXPRESSION),
    ASSIGNMENT(Category.EXPRESSION, ASSIGNMENT_EXPRESSION),
    ELEMENT_ACCESS(Category.EXPRESSION, ELEMENT_ACCESS_EXPRESSION),
    CONDITIONAL(Category.EXPRESSION, CONDITIONAL_EXPRESSION),
    THIS_ACCESS(Category.EXPRESSION, THIS_EXPRESSION, THIS),
    CAST(Category.EXPRESSION, CAST_EXPRESSION),
    AS(Category.EXPRESSION, AS_EXPRESSION),
    ARRAY_CREATION(Category.EXPRESSION, ARRAY_CREATION_EXPRESSION),
    IMPLICIT_ARRAY_CREATION(Category.EXPRESSION, IMPLICIT_ARRAY_CREATION_EXPRESSION),
    PARENTHESIZED(Category.EXPRESSION, PARENTHESIZED_EXPRESSION),
    PREFIX_UNARY(Category.EXPRESSION, PREFIX_UNARY_EXPRESSION),
    POSTFIX_UNARY(Category.EXPRESSION, POSTFIX_UNARY_EXPRESSION),
    INTERPOLATED_STRING(Category.EXPRESSION, INTERPOLATED_STRING_EXPRESSION),
    LAMBDA(Category.EXPRESSION, LAMBDA_EXPRESSION),

    // trivia
    COMMENT(Category.TRIVIA, CSharpTreeSitterNodeTypes.COMMENT),

    UNSUPPORTED(Category.UNSUPPORTED);

    public enum Category {
        DECLARATION,
        STATEMENT,
        EXPRESSION,
        TRIVIA,
        UNSUPPORTED
    }

    private static final Map<String, SyntaxKind> BY_NODE_TYPE = new HashMap<>();

    static {
        for (var kind : values()) {
            for (var nodeType : kind.nodeTypes) {
                BY_NODE_TYPE.put(nodeType, kind);
            }
        }
    }

    private final Category category;
    private final String[] nodeTypes;

    SyntaxKind(Category category, String... nodeTypes) {
        this.category = category;
        this.nodeTypes = nodeTypes;
    }

    public Category category() {
        return category;
    }

    public static SyntaxKind of(TSNode node) {
        return of(node.getType());
    }

    public static SyntaxKind of(String nodeType) {
        return BY_NODE_TYPE.getOrDefault(nodeType, UNSUPPORTED);
    }
}
