package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code for (x in container)} and {@code for (x of container)}. The initializer is a
 * {@link VariableDeclaration} or an expression.
 */
public final class ForInOf extends CodeNode {
    private CodeNode initializer;
    private Expression container;
    private CodeNode body;
    private boolean of;

    public ForInOf(CodeNode initializer, Expression container, CodeNode body, boolean of) {
        this.initializer = initializer;
        this.container = container;
        this.body = body;
        this.of = of;
    }

    public CodeNode initializer() {
        return initializer;
    }

    public void setInitializer(CodeNode initializer) {
        this.initializer = initializer;
    }

    public Expression container() {
        return container;
    }

    public void setContainer(Expression container) {
        this.container = container;
    }

    public CodeNode body() {
        return body;
    }

    public void setBody(CodeNode body) {
        this.body = body;
    }

    public boolean isOf() {
        return of;
    }

    public void setOf(boolean of) {
        this.of = of;
    }

    @Override
    protected String buildString() {
        return "for (" + initializer.render() + (of ? " of " : " in ") + container + ") " + body.render();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(initializer);
        result.add(node(container));
        result.add(body);
        return result;
    }

    @Override
    public String statementTerminator() {
        return body.statementTerminator();
    }
}
