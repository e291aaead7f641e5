package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code type Name = Type}.
 */
public final class TypeAlias extends CodeNode {
    private String name;
    private TypeNode type;
    private final List<String> modifiers;

    public TypeAlias(String name, TypeNode type) {
        this(name, type, new ArrayList<>());
    }

    public TypeAlias(String name, TypeNode type, List<String> modifiers) {
        this.name = name;
        this.type = type;
        this.modifiers = modifiers;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public TypeNode type() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    protected String buildString() {
        return Render.words(modifiers, "type", name, "=", type.toString());
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(type));
        return result;
    }
}
