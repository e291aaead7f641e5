package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code switch (expression) { ... }} with {@link Case} elements.
 */
public final class Switch extends BracedBlock {
    private Expression expression;

    public Switch(Expression expression) {
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
        return "switch (" + expression + ") " + super.buildString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
