package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Arrow function. A single expression body renders without braces; a single unparenthesized
 * parameter renders without parentheses.
 */
public final class Lambda extends BracedBlock implements Expression {
    private CallableSignature signature;
    private boolean singleExpression;
    private boolean withoutParentheses;

    public Lambda(CallableSignature signature) {
        this(signature, false, false);
    }

    public Lambda(CallableSignature signature, boolean singleExpression, boolean withoutParentheses) {
        this.signature = signature;
        this.singleExpression = singleExpression;
        this.withoutParentheses = withoutParentheses;
    }

    public CallableSignature signature() {
        return signature;
    }

    public void setSignature(CallableSignature signature) {
        this.signature = signature;
    }

    public boolean isSingleExpression() {
        return singleExpression;
    }

    public void setSingleExpression(boolean singleExpression) {
        this.singleExpression = singleExpression;
    }

    public boolean isWithoutParentheses() {
        return withoutParentheses;
    }

    public void setWithoutParentheses(boolean withoutParentheses) {
        this.withoutParentheses = withoutParentheses;
    }

    @Override
    protected String buildString() {
        var result = signature.toString();
        if (withoutParentheses && result.startsWith("(")) {
            result = result.substring(1, result.length() - 1);
        }
        result += " =>";

        return singleExpression
               ? result + joinExpressions(elements())
               : result + " " + super.buildString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(signature);
        return result;
    }

    @Override
    public String statementTerminator() {
        return singleExpression ? ";" : "";
    }
}
