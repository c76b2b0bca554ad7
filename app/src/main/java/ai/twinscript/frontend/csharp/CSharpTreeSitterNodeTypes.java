package ai.twinscript.frontend.csharp;

import java.util.Set;

/** Constants for C# TreeSitter node type names. */
public final class CSharpTreeSitterNodeTypes {

    // ===== STRUCTURE =====
    public static final String COMPILATION_UNIT = "compilation_unit";
    public static final String NAMESPACE_DECLARATION = "namespace_declaration";
    public static final String FILE_SCOPED_NAMESPACE_DECLARATION = "file_scoped_namespace_declaration";
    public static final String USING_DIRECTIVE = "using_directive";
    public static final String DECLARATION_LIST = "declaration_list";
    public static final String COMMENT = "comment";
    public static final String ERROR = "ERROR";

    // ===== TYPE DECLARATIONS =====
    public static final String CLASS_DECLARATION = "class_declaration";
    public static final String STRUCT_DECLARATION = "struct_declaration";
    public static final String RECORD_DECLARATION = "record_declaration";
    public static final String RECORD_STRUCT_DECLARATION = "record_struct_declaration";
    public static final String INTERFACE_DECLARATION = "interface_declaration";
    public static final String ENUM_DECLARATION = "enum_declaration";
    public static final String ENUM_MEMBER_DECLARATION = "enum_member_declaration";
    public static final String ENUM_MEMBER_DECLARATION_LIST = "enum_member_declaration_list";
    public static final String DELEGATE_DECLARATION = "delegate_declaration";
    public static final String BASE_LIST = "base_list";
    public static final String TYPE_PARAMETER_LIST = "type_parameter_list";
    public static final String TYPE_PARAMETER = "type_parameter";

    // ===== MEMBERS =====
    public static final String FIELD_DECLARATION = "field_declaration";
    public static final String PROPERTY_DECLARATION = "property_declaration";
    public static final String METHOD_DECLARATION = "method_declaration";
    public static final String CONSTRUCTOR_DECLARATION = "constructor_declaration";
    public static final String CONSTRUCTOR_INITIALIZER = "constructor_initializer";
    public static final String EVENT_FIELD_DECLARATION = "event_field_declaration";
    public static final String ACCESSOR_LIST = "accessor_list";
    public static final String ACCESSOR_DECLARATION = "accessor_declaration";
    public static final String ARROW_EXPRESSION_CLAUSE = "arrow_expression_clause";
    public static final String MODIFIER = "modifier";
    public static final String ATTRIBUTE_LIST = "attribute_list";
    public static final String PARAMETER_LIST = "parameter_list";
    public static final String PARAMETER = "parameter";
    public static final String VARIABLE_DECLARATION = "variable_declaration";
    public static final String VARIABLE_DECLARATOR = "variable_declarator";
    public static final String EQUALS_VALUE_CLAUSE = "equals_value_clause";

    // ===== STATEMENTS =====
    public static final String BLOCK = "block";
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String LOCAL_DECLARATION_STATEMENT = "local_declaration_statement";
    public static final String LOCAL_FUNCTION_STATEMENT = "local_function_statement";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String IF_STATEMENT = "if_statement";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String FOREACH_STATEMENT = "foreach_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String DO_STATEMENT = "do_statement";
    public static final String THROW_STATEMENT = "throw_statement";
    public static final String EMPTY_STATEMENT = "empty_statement";
    public static final String CATCH_DECLARATION = "catch_declaration";
    public static final String CATCH_CLAUSE = "catch_clause";
    public static final String SWITCH_SECTION = "switch_section";

    // ===== EXPRESSIONS =====
    public static final String IDENTIFIER = "identifier";
    public static final String GENERIC_NAME = "generic_name";
    public static final String QUALIFIED_NAME = "qualified_name";
    public static final String PREDEFINED_TYPE = "predefined_type";
    public static final String INTEGER_LITERAL = "integer_literal";
    public static final String REAL_LITERAL = "real_literal";
    public static final String STRING_LITERAL = "string_literal";
    public static final String VERBATIM_STRING_LITERAL = "verbatim_string_literal";
    public static final String CHARACTER_LITERAL = "character_literal";
    public static final String BOOLEAN_LITERAL = "boolean_literal";
    public static final String NULL_LITERAL = "null_literal";
    public static final String MEMBER_ACCESS_EXPRESSION = "member_access_expression";
    public static final String INVOCATION_EXPRESSION = "invocation_expression";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String ARGUMENT = "argument";
    public static final String BRACKETED_ARGUMENT_LIST = "bracketed_argument_list";
    public static final String OBJECT_CREATION_EXPRESSION = "object_creation_expression";
    public static final String IMPLICIT_OBJECT_CREATION_EXPRESSION = "implicit_object_creation_expression";
    public static final String INITIALIZER_EXPRESSION = "initializer_expression";
    public static final String BINARY_EXPRESSION = "binary_expression";
    public static final String ASSIGNMENT_EXPRESSION = "assignment_expression";
    public static final String ELEMENT_ACCESS_EXPRESSION = "element_access_expression";
    public static final String CONDITIONAL_EXPRESSION = "conditional_expression";
    public static final String THIS_EXPRESSION = "this_expression";
    public static final String THIS = "this";
    public static final String CAST_EXPRESSION = "cast_expression";
    public static final String AS_EXPRESSION = "as_expression";
    public static final String ARRAY_CREATION_EXPRESSION = "array_creation_expression";
    public static final String IMPLICIT_ARRAY_CREATION_EXPRESSION = "implicit_array_creation_expression";
    public static final String ARRAY_RANK_SPECIFIER = "array_rank_specifier";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String PREFIX_UNARY_EXPRESSION = "prefix_unary_expression";
    public static final String POSTFIX_UNARY_EXPRESSION = "postfix_unary_expression";
    public static final String INTERPOLATED_STRING_EXPRESSION = "interpolated_string_expression";
    public static final String INTERPOLATION = "interpolation";
    public static final String INTERPOLATION_FORMAT_CLAUSE = "interpolation_format_clause";
    public static final String LAMBDA_EXPRESSION = "lambda_expression";
    public static final String IMPLICIT_PARAMETER = "implicit_parameter";

    // ===== TYPES =====
    public static final String ARRAY_TYPE = "array_type";
    public static final String NULLABLE_TYPE = "nullable_type";
    public static final String IMPLICIT_TYPE = "implicit_type";
    public static final String TYPE_ARGUMENT_LIST = "type_argument_list";

    /** Declarations that introduce a class-like type with members. */
    public static final Set<String> CLASS_LIKE_DECLARATIONS = Set.of(
            CLASS_DECLARATION, STRUCT_DECLARATION, RECORD_DECLARATION, RECORD_STRUCT_DECLARATION);

    /** Every declaration that introduces a named type. */
    public static final Set<String> TYPE_DECLARATIONS = Set.of(
            CLASS_DECLARATION,
            STRUCT_DECLARATION,
            RECORD_DECLARATION,
            RECORD_STRUCT_DECLARATION,
            INTERFACE_DECLARATION,
            ENUM_DECLARATION);

    private CSharpTreeSitterNodeTypes() {}
}
