package org.pragmatica.scripter.tree;

/**
 * Object literal; elements are {@link ObjectLiteralProperty} nodes, methods and accessors.
 */
public final class ObjectLiteral extends ExpressionBlock implements Expression {
    @Override
    protected String buildString() {
        return "{" + super.buildString() + "}";
    }
}
