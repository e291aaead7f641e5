package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Keyword with an optional operand: {@code break label}, {@code continue}, {@code void 0}.
 */
public final class KeywordOperator extends CodeNode implements Expression {
    private String keyword;
    private Expression expression;

    public KeywordOperator(String keyword) {
        this(keyword, null);
    }

    public KeywordOperator(String keyword, Expression expression) {
        this.keyword = keyword;
        this.expression = expression;
    }

    public static KeywordOperator breaking(Expression label) {
        return new KeywordOperator("break", label);
    }

    public static KeywordOperator continuing(Expression label) {
        return new KeywordOperator("continue", label);
    }

    public static KeywordOperator voiding(Expression expression) {
        return new KeywordOperator("void", expression);
    }

    public String keyword() {
        return keyword;
    }

    public void setKeyword(String keyword) {
        this.keyword = keyword;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    @Override
    protected String buildString() {
        return expression == null ? keyword : keyword + " " + expression;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
