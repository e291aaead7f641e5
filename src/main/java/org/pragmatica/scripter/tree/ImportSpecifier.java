package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * One entry of a named import or export list: {@code name} or {@code name as alias}.
 */
public final class ImportSpecifier extends CodeNode {
    private Identifier name;
    private Identifier alias;

    public ImportSpecifier(Identifier name) {
        this(name, null);
    }

    public ImportSpecifier(Identifier name, Identifier alias) {
        this.name = name;
        this.alias = alias;
    }

    public Identifier name() {
        return name;
    }

    public void setName(Identifier name) {
        this.name = name;
    }

    public Identifier alias() {
        return alias;
    }

    public void setAlias(Identifier alias) {
        this.alias = alias;
    }

    @Override
    protected String buildString() {
        return alias == null ? name.toString() : name + " as " + alias;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(name);
        result.add(alias);
        return result;
    }
}
