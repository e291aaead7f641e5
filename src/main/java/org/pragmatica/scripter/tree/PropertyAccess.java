package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code expression.property}.
 */
public final class PropertyAccess extends CodeNode implements Expression {
    private Expression expression;
    private String property;

    public PropertyAccess(Expression expression, String property) {
        this.expression = expression;
        this.property = property;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public String property() {
        return property;
    }

    public void setProperty(String property) {
        this.property = property;
    }

    @Override
    protected String buildString() {
        return expression + "." + property;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
