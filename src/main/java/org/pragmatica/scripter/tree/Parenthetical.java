package org.pragmatica.scripter.tree;

import java.util.List;

public final class Parenthetical extends CodeNode implements Expression {
    private Expression expression;

    public Parenthetical(Expression expression) {
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
        return "(" + expression + ")";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
