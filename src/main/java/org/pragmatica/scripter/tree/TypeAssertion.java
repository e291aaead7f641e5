package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Angle bracket cast, {@code <string>value}.
 */
public final class TypeAssertion extends CodeNode implements Expression {
    private Expression expression;
    private TypeNode type;

    public TypeAssertion(Expression expression, TypeNode type) {
        this.expression = expression;
        this.type = type;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public TypeNode type() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    @Override
    protected String buildString() {
        return "<" + type + ">" + expression;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        result.add(node(type));
        return result;
    }
}
