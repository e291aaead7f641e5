package org.pragmatica.scripter.tree;

import java.util.List;

public final class New extends CodeNode implements Expression {
    private Call call;

    public New(Call call) {
        this.call = call;
    }

    public Call call() {
        return call;
    }

    public void setCall(Call call) {
        this.call = call;
    }

    @Override
    protected String buildString() {
        return "new " + call;
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(call);
        return result;
    }
}
