package org.pragmatica.scripter.tree;

import java.util.List;

public final class BinaryOperation extends CodeNode implements Expression {
    private String operator;
    private Expression left;
    private Expression right;

    public BinaryOperation(String operator, Expression left, Expression right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public static BinaryOperation instanceOf(Expression left, Expression right) {
        return new BinaryOperation("instanceof", left, right);
    }

    public String operator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Expression left() {
        return left;
    }

    public void setLeft(Expression left) {
        this.left = left;
    }

    public Expression right() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = right;
    }

    @Override
    protected String buildString() {
        return left + " " + operator + " " + right;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(left));
        result.add(node(right));
        return result;
    }
}
