package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code label: statement}.
 */
public final class LabeledStatement extends CodeNode {
    private Identifier label;
    private CodeNode statement;

    public LabeledStatement(Identifier label, CodeNode statement) {
        this.label = label;
        this.statement = statement;
    }

    public Identifier label() {
        return label;
    }

    public void setLabel(Identifier label) {
        this.label = label;
    }

    public CodeNode statement() {
        return statement;
    }

    public void setStatement(CodeNode statement) {
        this.statement = statement;
    }

    @Override
    protected String buildString() {
        return label + ": " + (statement == null ? "" : statement.render());
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(label);
        result.add(statement);
        return result;
    }

    @Override
    public String statementTerminator() {
        return statement == null ? ";" : statement.statementTerminator();
    }
}
