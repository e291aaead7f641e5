package org.pragmatica.scripter.tree;

import java.util.List;

/**
 * {@code if (condition) then else otherwise}. Branches are blocks or single statements.
 */
public final class If extends CodeNode {
    private Expression condition;
    private CodeNode thenStatement;
    private CodeNode elseStatement;

    public If(Expression condition, CodeNode thenStatement) {
        this(condition, thenStatement, null);
    }

    public If(Expression condition, CodeNode thenStatement, CodeNode elseStatement) {
        this.condition = condition;
        this.thenStatement = thenStatement;
        this.elseStatement = elseStatement;
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = condition;
    }

    public CodeNode thenStatement() {
        return thenStatement;
    }

    public void setThenStatement(CodeNode thenStatement) {
        this.thenStatement = thenStatement;
    }

    public CodeNode elseStatement() {
        return elseStatement;
    }

    public void setElseStatement(CodeNode elseStatement) {
        this.elseStatement = elseStatement;
    }

    @Override
    protected String buildString() {
        var result = "if (" + condition + ") " + thenStatement.render();
        if (elseStatement != null) {
            result += thenStatement.statementTerminator() + " else " + elseStatement.render();
        }
        return result;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(condition));
        result.add(thenStatement);
        result.add(elseStatement);
        return result;
    }

    @Override
    public String statementTerminator() {
        return (elseStatement == null ? thenStatement : elseStatement).statementTerminator();
    }
}
