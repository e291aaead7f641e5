package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code case expression:} clause, or {@code default:} when the expression is {@code null},
 * with its statements as elements.
 */
public final class Case extends StatementBlock {
    private Expression expression;

    public Case(Expression expression) {
        this.expression = expression;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public boolean isDefault() {
        return expression == null;
    }

    @Override
    protected String buildString() {
        var head = expression == null ? "default:" : "case " + expression + ":";
        return head + super.buildString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
