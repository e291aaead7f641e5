package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code condition ? whenTrue : whenFalse}.
 */
public final class TernaryOperation extends CodeNode implements Expression {
    private Expression condition;
    private Expression whenTrue;
    private Expression whenFalse;
    private String questionToken;
    private String colonToken;

    public TernaryOperation(Expression condition, Expression whenTrue, Expression whenFalse) {
        this(condition, whenTrue, whenFalse, "?", ":");
    }

    public TernaryOperation(Expression condition, Expression whenTrue, Expression whenFalse,
                            String questionToken, String colonToken) {
        this.condition = condition;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
        this.questionToken = questionToken;
        this.colonToken = colonToken;
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public Expression whenTrue() {
        return whenTrue;
    }

    public void setWhenTrue(Expression whenTrue) {
        this.whenTrue = whenTrue;
    }

    public Expression whenFalse() {
        return whenFalse;
    }

    public void setWhenFalse(Expression whenFalse) {
        this.whenFalse = whenFalse;
    }

    public String questionToken() {
        return questionToken;
    }

    public void setQuestionToken(String questionToken) {
        this.questionToken = questionToken;
    }

    public String colonToken() {
        return colonToken;
    }

    public void setColonToken(String colonToken) {
        this.colonToken = colonToken;
    }

    @Override
    protected String buildString() {
        return String.join(" ", condition.toString(), questionToken, whenTrue.toString(),
                           colonToken, whenFalse.toString());
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(condition));
        result.add(node(whenTrue));
        result.add(node(whenFalse));
        return result;
    }
}
