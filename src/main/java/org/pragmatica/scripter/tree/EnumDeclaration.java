package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code enum Name { ... }} with {@link EnumMember} elements.
 */
public final class EnumDeclaration extends ExpressionBlock {
    private String name;
    private final List<String> modifiers;

    public EnumDeclaration(String name) {
        this(name, new ArrayList<>());
    }

    public EnumDeclaration(String name, List<String> modifiers) {
        this.name = name;
        this.modifiers = modifiers;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    protected String buildString() {
        return Render.words(modifiers, "enum", name, "{") + super.buildString() + "}";
    }
}
