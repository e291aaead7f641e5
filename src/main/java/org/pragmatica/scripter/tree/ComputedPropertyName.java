package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Member name computed from an expression, {@code [Symbol.iterator]}.
 */
public final class ComputedPropertyName extends CodeNode implements ElementName {
    private Expression expression;

    public ComputedPropertyName(Expression expression) {
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
        return "[" + expression + "]";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
