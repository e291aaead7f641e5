package org.pragmatica.scripter.tree;

import java.util.List;

public final class UnionType extends CodeNode implements TypeNode {
    private final List<TypeNode> types;

    public UnionType(List<TypeNode> types) {
        this.types = types;
    }

    public List<TypeNode> types() {
        return types;
    }

    @Override
    protected String buildString() {
        return Render.join(types, "|");
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(nodes(types));
        return result;
    }
}
