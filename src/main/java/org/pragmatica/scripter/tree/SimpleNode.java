package org.pragmatica.scripter.tree;

/**
 * Node rendered as a single token.
 */
public abstract sealed class SimpleNode extends CodeNode
    permits Keyword, EmptyExpression, KeywordType, Trivia, AtomicValue, Identifier {
    private String token;

    protected SimpleNode(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    @Override
    protected String buildString() {
        return token;
    }
}
