package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Classic {@code for (init; condition; incrementor) body}; every part is optional.
 */
public final class For extends CodeNode {
    private CodeNode initializer;
    private Expression condition;
    private Expression incrementor;
    private CodeNode body;

    public For(CodeNode initializer, Expression condition, Expression incrementor, CodeNode body) {
        this.initializer = initializer;
        this.condition = condition;
        this.incrementor = incrementor;
        this.body = body;
    }

    public CodeNode initializer() {
        return initializer;
    }

    public void setInitializer(CodeNode initializer) {
        this.initializer = initializer;
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public Expression incrementor() {
        return incrementor;
    }

    public void setIncrementor(Expression incrementor) {
        this.incrementor = incrementor;
    }

    public CodeNode body() {
        return body;
    }

    public void setBody(CodeNode body) {
        this.body = body;
    }

    @Override
    protected String buildString() {
        return "for (" + orEmpty(initializer) + "; " + orEmpty(condition) + "; " + orEmpty(incrementor) + ") "
               + orEmpty(body);
    }

    private static String orEmpty(Object part) {
        return part == null ? "" : part.toString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(initializer);
        result.add(node(condition));
        result.add(node(incrementor));
        result.add(body);
        return result;
    }

    @Override
    public String statementTerminator() {
        return body == null ? ";" : body.statementTerminator();
    }
}
