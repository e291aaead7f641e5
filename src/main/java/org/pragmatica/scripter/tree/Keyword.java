package org.pragmatica.scripter.tree;

/**
 * Reserved word used as a statement on its own, such as {@code debugger}.
 */
public final class Keyword extends SimpleNode {
    public Keyword(String token) {
        super(token);
    }
}
