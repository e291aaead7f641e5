package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code while (condition) body} or {@code do body while (condition)}.
 */
public final class Loop extends CodeNode {
    private Expression condition;
    private CodeNode body;
    private boolean doWhile;

    public Loop(Expression condition, CodeNode body, boolean doWhile) {
        this.condition = condition;
        this.body = body;
        this.doWhile = doWhile;
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public CodeNode body() {
        return body;
    }

    public void setBody(CodeNode body) {
        this.body = body;
    }

    public boolean isDoWhile() {
        return doWhile;
    }

    public void setDoWhile(boolean doWhile) {
        this.doWhile = doWhile;
    }

    @Override
    protected String buildString() {
        return doWhile
               ? "do " + body.render() + body.statementTerminator() + " while (" + condition + ")"
               : "while (" + condition + ") " + body.render();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(condition));
        result.add(body);
        return result;
    }

    @Override
    public String statementTerminator() {
        return doWhile ? ";" : body.statementTerminator();
    }
}
