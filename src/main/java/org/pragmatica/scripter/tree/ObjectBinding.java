package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Object destructuring pattern, {@code {a, b: c}}.
 */
public final class ObjectBinding extends CodeNode implements BindingTarget {
    private final List<BindingEntry> bindings;

    public ObjectBinding() {
        this(new ArrayList<>());
    }

    public ObjectBinding(List<BindingEntry> bindings) {
        this.bindings = bindings;
    }

    public List<BindingEntry> bindings() {
        return bindings;
    }

    @Override
    protected String buildString() {
        return "{" + Render.join(bindings, ", ") + "}";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(nodes(bindings));
        return result;
    }
}
