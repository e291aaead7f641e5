package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code export = expr} or {@code export default expr}.
 */
public final class ExportAssignment extends CodeNode {
    private Expression expression;
    private boolean defaultExport;

    public ExportAssignment(Expression expression, boolean defaultExport) {
        this.expression = expression;
        this.defaultExport = defaultExport;
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = expression;
    }

    public boolean isDefaultExport() {
        return defaultExport;
    }

    public void setDefaultExport(boolean defaultExport) {
        this.defaultExport = defaultExport;
    }

    @Override
    protected String buildString() {
        return "export " + (defaultExport ? "default " : "= ") + expression;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(expression));
        return result;
    }
}
