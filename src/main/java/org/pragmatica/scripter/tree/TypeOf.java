package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code typeof x}, both as an expression and as a type query.
 */
public final class TypeOf extends CodeNode implements Expression, TypeNode {
    private Expression expression;

    public TypeOf(Expression expression) {
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    @Override
    protected String buildString() {
        return "typeof " + expression;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
