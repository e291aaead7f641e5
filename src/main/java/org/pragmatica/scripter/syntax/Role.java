package org.pragmatica.scripter.syntax;

/**
 * Structural slot a child element occupies inside its parent.
 *
 * <p>Single-valued slots hold at most one element; list slots keep source order.
 */
public enum Role {
    // === Names ===
    NAME,
    PROPERTY_NAME,
    LABEL,
    LEFT,
    RIGHT,

    // === Types ===
    TYPE,
    TYPES,
    TYPE_ARGUMENTS,
    TYPE_PARAMETERS,
    ELEMENT_TYPE,
    CONSTRAINT,
    HERITAGE_CLAUSES,

    // === Expressions ===
    EXPRESSION,
    ARGUMENT_EXPRESSION,
    INITIALIZER,
    CONDITION,
    WHEN_TRUE,
    WHEN_FALSE,
    INCREMENTOR,
    OPERAND,
    TAG,
    TEMPLATE,
    HEAD,
    TEMPLATE_SPANS,
    LITERAL,

    // === Lists ===
    STATEMENTS,
    MEMBERS,
    ELEMENTS,
    PROPERTIES,
    ARGUMENTS,
    PARAMETERS,
    DECLARATIONS,
    CLAUSES,
    MODIFIERS,
    DECORATORS,

    // === Statement parts ===
    STATEMENT,
    BODY,
    BLOCK,
    THEN_STATEMENT,
    ELSE_STATEMENT,
    TRY_BLOCK,
    CATCH_CLAUSE,
    FINALLY_BLOCK,
    VARIABLE_DECLARATION,
    DECLARATION_LIST,
    CASE_BLOCK,

    // === Modules ===
    MODULE_REFERENCE,
    MODULE_SPECIFIER,
    IMPORT_CLAUSE,
    NAMED_BINDINGS,
    EXPORT_CLAUSE,

    // === Tokens ===
    KEYWORD,
    OPERATOR_TOKEN,
    QUESTION_TOKEN,
    COLON_TOKEN,
    DOT_DOT_DOT_TOKEN,
    CLOSE_TOKEN
}
