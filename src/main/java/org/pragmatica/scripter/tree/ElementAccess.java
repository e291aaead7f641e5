package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code expression[argument]}.
 */
public final class ElementAccess extends CodeNode implements Expression {
    private Expression expression;
    private Expression argument;

    public ElementAccess(Expression expression, Expression argument) {
        this.expression = expression;
        this.argument = argument;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public Expression argument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = argument;
    }

    @Override
    protected String buildString() {
        return expression + "[" + argument + "]";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        result.add(node(argument));
        return result;
    }
}
