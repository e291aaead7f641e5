package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Invocation {@code callee<TypeArgs>(args)}. A {@code null} argument list renders no
 * parentheses, as in {@code new Foo<T>}.
 */
public final class Call extends CodeNode implements Expression {
    private Expression callee;
    private List<Expression> arguments;
    private final List<TypeNode> typeArguments;

    public Call(Expression callee) {
        this(callee, new ArrayList<>(), new ArrayList<>());
    }

    public Call(Expression callee, List<Expression> arguments, List<TypeNode> typeArguments) {
        this.callee = callee;
        this.arguments = arguments;
        this.typeArguments = typeArguments;
    }

    public Expression callee() {
        return callee;
    }

    public void setCallee(Expression callee) {
        this.callee = callee;
    }

    /**
     * Live argument list, {@code null} when the call has no parentheses.
     */
    public List<Expression> arguments() {
        return arguments;
    }

    public void setArguments(List<Expression> arguments) {
        this.arguments = arguments;
    }

    public List<TypeNode> typeArguments() {
        return typeArguments;
    }

    @Override
    protected String buildString() {
        var result = callee + Render.angled(typeArguments);
        return arguments == null ? result : result + "(" + Render.join(arguments, ", ") + ")";
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        if (arguments != null) {
            result.addAll(nodes(arguments));
        }
        result.addAll(nodes(typeArguments));
        result.add(node(callee));
        return result;
    }
}
