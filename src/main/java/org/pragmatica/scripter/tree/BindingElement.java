package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * One destructured entity: {@code propertyName: binding = initializer}, optionally spread.
 */
public final class BindingElement extends CodeNode implements BindingEntry {
    private BindingTarget binding;
    private ElementName propertyName;
    private boolean spread;
    private Expression initializer;

    public BindingElement(BindingTarget binding) {
        this(binding, null, false, null);
    }

    public BindingElement(BindingTarget binding, ElementName propertyName, boolean spread, Expression initializer) {
        this.binding = binding;
        this.propertyName = propertyName;
        this.spread = spread;
        this.initializer = initializer;
    }

    public BindingTarget binding() {
        return binding;
    }

    public void setBinding(BindingTarget binding) {
        this.binding = binding;
    }

    public ElementName propertyName() {
        return propertyName;
    }

    public void setPropertyName(ElementName propertyName) {
        this.propertyName = propertyName;
    }

    public boolean isSpread() {
        return spread;
    }

    public void setSpread(boolean spread) {
        this.spread = spread;
    }

    public Expression initializer() {
        return initializer;
    }

    public void setInitializer(Expression initializer) {
        this.initializer = initializer;
    }

    @Override
    protected String buildString() {
        var result = propertyName == null ? binding.toString() : propertyName + ": " + binding;
        if (spread) {
            result = "..." + result;
        }
        return initializer == null ? result : result + "=" + initializer;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(binding));
        result.add(node(initializer));
        result.add(node(propertyName));
        return result;
    }
}
