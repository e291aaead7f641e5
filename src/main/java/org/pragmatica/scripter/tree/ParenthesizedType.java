package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Type in parentheses, as in {@code (string | number)[]}.
 */
public final class ParenthesizedType extends CodeNode implements TypeNode {
    private TypeNode type;

    public ParenthesizedType(TypeNode type) {
        this.type = type;
    }

    public TypeNode type() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    @Override
    protected String buildString() {
        return "(" + type + ")";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(type));
        return result;
    }
}
