package org.pragmatica.scripter.tree;

/**
 * Whitespace and comments between block elements, kept verbatim.
 */
public final class Trivia extends SimpleNode {
    public Trivia(String token) {
        super(token);
    }

    @Override
    public String statementTerminator() {
        return "";
    }
}
