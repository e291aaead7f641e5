package org.pragmatica.scripter.tree;

/**
 * Block of comma separated elements, such as array items or enum members.
 */
public abstract sealed class ExpressionBlock extends Block
    permits EnumDeclaration, ArrayLiteral, ObjectLiteral, VariableDeclaration {
    @Override
    protected String buildString() {
        return joinExpressions(elements());
    }
}
