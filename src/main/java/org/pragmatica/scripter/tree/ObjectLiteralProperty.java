package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code name: value}, or the shorthand {@code name} when there is no initializer.
 */
public final class ObjectLiteralProperty extends CodeNode {
    private ElementName name;
    private Expression initializer;

    public ObjectLiteralProperty(ElementName name) {
        this(name, null);
    }

    public ObjectLiteralProperty(ElementName name, Expression initializer) {
        this.name = name;
        this.initializer = initializer;
    }

    public ElementName name() {
        return name;
    }

    public void setName(ElementName name) {
        this.name = name;
    }

    public Expression initializer() {
        return initializer;
    }

    public void setInitializer(Expression initializer) {
        this.initializer = initializer;
    }

    @Override
    protected String buildString() {
        return initializer == null ? name.toString() : name + ": " + initializer;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(name));
        result.add(node(initializer));
        return result;
    }
}
