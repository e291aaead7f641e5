package org.pragmatica.scripter.tree;

public final class Identifier extends SimpleNode implements Expression, ElementName, BindingTarget {
    public Identifier(String token) {
        super(token);
    }
}
