package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code export { A, B as C } from "path"} or {@code export * from "path"}.
 */
public final class ExportDeclaration extends CodeNode {
    private ImportBinding bindings;
    private Expression modulePath;

    public ExportDeclaration(ImportBinding bindings, Expression modulePath) {
        this.bindings = bindings;
        this.modulePath = modulePath;
    }

    public ImportBinding bindings() {
        return bindings;
    }

    public void setBindings(ImportBinding bindings) {
        this.bindings = bindings;
    }

    public Expression modulePath() {
        return modulePath;
    }

    public void setModulePath(Expression modulePath) {
        this.modulePath = modulePath;
    }

    @Override
    protected String buildString() {
        var result = "export " + (bindings == null ? "*" : bindings.toString());
        return modulePath == null ? result : result + " from " + modulePath;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(modulePath));
        result.add(node(bindings));
        return result;
    }
}
