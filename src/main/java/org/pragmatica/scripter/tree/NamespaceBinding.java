package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code * as Name}.
 */
public final class NamespaceBinding extends CodeNode implements ImportBinding {
    private Identifier name;

    public NamespaceBinding(Identifier name) {
        this.name = name;
    }

    public Identifier name() {
        return name;
    }

    public void setName(Identifier name) {
        this.name = name;
    }

    @Override
    protected String buildString() {
        return "* as " + name;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(name);
        return result;
    }
}
