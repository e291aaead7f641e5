package org.pragmatica.scripter.syntax;

/**
 * Syntax kinds a parser adapter reports for its elements.
 *
 * <p>The set mirrors the TypeScript compiler's own node kinds. Kinds listed under
 * "recognized but not translated" are reported by parsers for newer syntax; the
 * analyzer has no rule for them and treats them as unsupported constructs.
 */
public enum SyntaxKind {
    // === Files and blocks ===
    SOURCE_FILE,
    BLOCK,
    MODULE_BLOCK,
    CASE_BLOCK,

    // === Tokens ===
    END_OF_FILE_TOKEN,
    CLOSE_BRACE_TOKEN,
    CLOSE_BRACKET_TOKEN,
    CLOSE_PAREN_TOKEN,
    QUESTION_TOKEN,
    COLON_TOKEN,
    DOT_DOT_DOT_TOKEN,
    EQUALS_TOKEN,
    OPERATOR_TOKEN,
    MODIFIER,
    DECORATOR,
    VAR_KEYWORD,
    LET_KEYWORD,
    CONST_KEYWORD,
    EXTENDS_KEYWORD,
    IMPLEMENTS_KEYWORD,
    DEFAULT_KEYWORD,

    // === Module level declarations ===
    CLASS_DECLARATION,
    INTERFACE_DECLARATION,
    TYPE_ALIAS_DECLARATION,
    ENUM_DECLARATION,
    ENUM_MEMBER,
    MODULE_DECLARATION,
    IMPORT_EQUALS_DECLARATION,
    EXTERNAL_MODULE_REFERENCE,
    IMPORT_DECLARATION,
    IMPORT_CLAUSE,
    NAMESPACE_IMPORT,
    NAMED_IMPORTS,
    IMPORT_SPECIFIER,
    EXPORT_DECLARATION,
    NAMED_EXPORTS,
    EXPORT_SPECIFIER,
    EXPORT_ASSIGNMENT,
    HERITAGE_CLAUSE,
    EXPRESSION_WITH_TYPE_ARGUMENTS,

    // === Statements ===
    VARIABLE_STATEMENT,
    VARIABLE_DECLARATION_LIST,
    VARIABLE_DECLARATION,
    FUNCTION_DECLARATION,
    EXPRESSION_STATEMENT,
    EMPTY_STATEMENT,
    IF_STATEMENT,
    DO_STATEMENT,
    WHILE_STATEMENT,
    FOR_STATEMENT,
    FOR_IN_STATEMENT,
    FOR_OF_STATEMENT,
    CONTINUE_STATEMENT,
    BREAK_STATEMENT,
    RETURN_STATEMENT,
    WITH_STATEMENT,
    SWITCH_STATEMENT,
    CASE_CLAUSE,
    DEFAULT_CLAUSE,
    LABELED_STATEMENT,
    THROW_STATEMENT,
    TRY_STATEMENT,
    CATCH_CLAUSE,
    DEBUGGER_STATEMENT,

    // === Class and type members ===
    PROPERTY_DECLARATION,
    PROPERTY_SIGNATURE,
    METHOD_DECLARATION,
    METHOD_SIGNATURE,
    CONSTRUCTOR,
    GET_ACCESSOR,
    SET_ACCESSOR,
    CALL_SIGNATURE,
    CONSTRUCT_SIGNATURE,
    INDEX_SIGNATURE,
    SEMICOLON_CLASS_ELEMENT,
    PARAMETER,
    TYPE_PARAMETER,

    // === Names and bindings ===
    IDENTIFIER,
    QUALIFIED_NAME,
    COMPUTED_PROPERTY_NAME,
    OBJECT_BINDING_PATTERN,
    ARRAY_BINDING_PATTERN,
    BINDING_ELEMENT,

    // === Expressions ===
    NUMERIC_LITERAL,
    STRING_LITERAL,
    TRUE_KEYWORD,
    FALSE_KEYWORD,
    NULL_KEYWORD,
    THIS_KEYWORD,
    SUPER_KEYWORD,
    REGULAR_EXPRESSION_LITERAL,
    NO_SUBSTITUTION_TEMPLATE_LITERAL,
    TEMPLATE_EXPRESSION,
    TEMPLATE_HEAD,
    TEMPLATE_SPAN,
    TEMPLATE_MIDDLE,
    TEMPLATE_TAIL,
    TAGGED_TEMPLATE_EXPRESSION,
    ARRAY_LITERAL_EXPRESSION,
    OBJECT_LITERAL_EXPRESSION,
    PROPERTY_ASSIGNMENT,
    SHORTHAND_PROPERTY_ASSIGNMENT,
    PROPERTY_ACCESS_EXPRESSION,
    ELEMENT_ACCESS_EXPRESSION,
    CALL_EXPRESSION,
    NEW_EXPRESSION,
    TYPE_ASSERTION_EXPRESSION,
    PARENTHESIZED_EXPRESSION,
    FUNCTION_EXPRESSION,
    ARROW_FUNCTION,
    DELETE_EXPRESSION,
    TYPE_OF_EXPRESSION,
    VOID_EXPRESSION,
    PREFIX_UNARY_EXPRESSION,
    POSTFIX_UNARY_EXPRESSION,
    BINARY_EXPRESSION,
    CONDITIONAL_EXPRESSION,
    SPREAD_ELEMENT,
    OMITTED_EXPRESSION,

    // === Types ===
    TYPE_REFERENCE,
    FUNCTION_TYPE,
    CONSTRUCTOR_TYPE,
    TYPE_QUERY,
    TYPE_LITERAL,
    ARRAY_TYPE,
    TUPLE_TYPE,
    UNION_TYPE,
    PARENTHESIZED_TYPE,
    ANY_KEYWORD,
    BOOLEAN_KEYWORD,
    NUMBER_KEYWORD,
    STRING_KEYWORD,
    SYMBOL_KEYWORD,
    VOID_KEYWORD,

    // === Recognized but not translated ===
    AWAIT_EXPRESSION,
    YIELD_EXPRESSION,
    AS_EXPRESSION,
    CLASS_EXPRESSION,
    INTERSECTION_TYPE,
    JSX_ELEMENT,
    UNKNOWN
}
