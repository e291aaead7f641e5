package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Operator applied to one operand, prefix ({@code !x}, {@code return x}) or postfix ({@code x++}).
 */
public final class UnaryOperation extends CodeNode implements Expression {
    private String operator;
    private Expression expression;
    private boolean postfix;

    public UnaryOperation(String operator, Expression expression, boolean postfix) {
        this.operator = operator;
        this.expression = expression;
        this.postfix = postfix;
    }

    /**
     * {@code return expression}, or a bare {@code return} when the expression is {@code null}.
     */
    public static UnaryOperation returning(Expression expression) {
        return expression == null
               ? new UnaryOperation("return", new Identifier(""), false)
               : new UnaryOperation("return ", expression, false);
    }

    public static UnaryOperation throwing(Expression expression) {
        return new UnaryOperation("throw ", expression, false);
    }

    public static UnaryOperation delete(Expression expression) {
        return new UnaryOperation("delete ", expression, false);
    }

    public static UnaryOperation spread(Expression expression) {
        return new UnaryOperation("...", expression, false);
    }

    public String operator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public boolean isPostfix() {
        return postfix;
    }

    public void setPostfix(boolean postfix) {
        this.postfix = postfix;
    }

    @Override
    protected String buildString() {
        return postfix ? expression + operator : operator + expression;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
