package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code [key:KeyType]:ValueType} member.
 */
public final class IndexSignature extends CodeNode implements Member {
    private String keyName;
    private TypeNode keyType;
    private TypeNode valueType;

    public IndexSignature(String keyName, TypeNode keyType, TypeNode valueType) {
        this.keyName = keyName;
        this.keyType = keyType;
        this.valueType = valueType;
    }

    public String keyName() {
        return keyName;
    }

    public void setKeyName(String keyName) {
        this.keyName = keyName;
    }

    public TypeNode keyType() {
        return keyType;
    }

    public void setKeyType(TypeNode keyType) {
        this.keyType = keyType;
    }

    public TypeNode valueType() {
        return valueType;
    }

    public void setValueType(TypeNode valueType) {
        this.valueType = valueType;
    }

    @Override
    protected String buildString() {
        return "[" + keyName + ":" + keyType + "]:" + valueType;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(keyType));
        result.add(node(valueType));
        return result;
    }
}
