package org.pragmatica.scripter.tree;

import java.util.List;

public final class With extends CodeNode {
    private Expression expression;
    private CodeNode body;

    public With(Expression expression, CodeNode body) {
        this.expression = expression;
        this.body = body;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public CodeNode body() {
        return body;
    }

    public void setBody(CodeNode body) {
        this.body = body;
    }

    @Override
    protected String buildString() {
        return "with (" + expression + ") " + body.render();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        result.add(body);
        return result;
    }

    @Override
    public String statementTerminator() {
        return body.statementTerminator();
    }
}
