package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Type parameter with an optional {@code extends} constraint.
 */
public final class TypeParameter extends CodeNode {
    private String name;
    private TypeNode constraint;

    public TypeParameter(String name) {
        this(name, null);
    }

    public TypeParameter(String name, TypeNode constraint) {
        this.name = name;
        this.constraint = constraint;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public TypeNode constraint() {
        return constraint;
    }

    public void setConstraint(TypeNode constraint) {
        this.constraint = constraint;
    }

    @Override
    protected String buildString() {
        return constraint == null ? name : name + " extends " + constraint;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(constraint));
        return result;
    }
}
