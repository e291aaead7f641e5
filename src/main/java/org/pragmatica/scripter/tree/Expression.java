package org.pragmatica.scripter.tree;

/**
 * Nodes usable where a value is expected.
 */
public sealed interface Expression extends TemplatePart
    permits TypeAssertion, New, ElementAccess, ObjectLiteral, RegexLiteral, ArrayLiteral, TemplatePattern,
            AtomicValue, Identifier, UnaryOperation, BinaryOperation, Parenthetical, TernaryOperation,
            PropertyAccess, Call, TaggedTemplate, EmptyExpression, TypeOf, FunctionDeclaration, Lambda,
            KeywordOperator {
}
