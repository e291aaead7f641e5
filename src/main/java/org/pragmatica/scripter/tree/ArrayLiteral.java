package org.pragmatica.scripter.tree;

public final class ArrayLiteral extends ExpressionBlock implements Expression {
    @Override
    protected String buildString() {
        return "[" + super.buildString() + "]";
    }
}
