package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * Import for side effects only: {@code import "./polyfill"}.
 */
public final class SimpleImport extends CodeNode {
    private Expression modulePath;

    public SimpleImport(Expression modulePath) {
        this.modulePath = modulePath;
    }

    public Expression modulePath() {
        return modulePath;
    }

    public void setModulePath(Expression modulePath) {
        this.modulePath = modulePath;
    }

    @Override
    protected String buildString() {
        return "import " + modulePath;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(modulePath));
        return result;
    }
}
