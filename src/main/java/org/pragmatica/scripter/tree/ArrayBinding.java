package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Array destructuring pattern, {@code [a, , b]}.
 */
public final class ArrayBinding extends CodeNode implements BindingTarget {
    private final List<BindingEntry> bindings;

    public ArrayBinding() {
        this(new ArrayList<>());
    }

    public ArrayBinding(List<BindingEntry> bindings) {
        this.bindings = bindings;
    }

    public List<BindingEntry> bindings() {
        return bindings;
    }

    @Override
    protected String buildString() {
        return "[" + Render.join(bindings, ", ") + "]";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(nodes(bindings));
        return result;
    }
}
