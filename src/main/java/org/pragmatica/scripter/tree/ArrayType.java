package org.pragmatica.scripter.tree;

import java.util.List;

public final class ArrayType extends CodeNode implements TypeNode {
    private TypeNode elementType;

    public ArrayType(TypeNode elementType) {
        this.elementType = elementType;
    }

    public TypeNode elementType() {
        return elementType;
    }

    public void setElementType(TypeNode elementType) {
        this.elementType = elementType;
    }

    @Override
    protected String buildString() {
        return elementType + "[]";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(elementType));
        return result;
    }
}
