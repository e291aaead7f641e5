package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code { A, B as C }} in ES module imports and exports.
 */
public final class NamedImports extends CodeNode implements ImportBinding {
    private final List<ImportSpecifier> specifiers;

    public NamedImports() {
        this(new ArrayList<>());
    }

    public NamedImports(List<ImportSpecifier> specifiers) {
        this.specifiers = specifiers;
    }

    public List<ImportSpecifier> specifiers() {
        return specifiers;
    }

    @Override
    protected String buildString() {
        return "{ " + Render.join(specifiers, ", ") + " }";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(specifiers);
        return result;
    }
}
