package org.pragmatica.scripter.tree;

/**
 * Empty statement, array hole or stray class-level semicolon.
 */
public final class EmptyExpression extends SimpleNode implements Expression, BindingEntry {
    public EmptyExpression() {
        super("");
    }
}
