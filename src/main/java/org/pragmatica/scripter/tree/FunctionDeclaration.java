package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Function declared with {@code function} syntax, a method, an accessor or a constructor.
 *
 * <p>Methods omit the {@code function} keyword. Declarations without a body (ambient or
 * overload signatures) render no braces and end with {@code ;}.
 */
public final class FunctionDeclaration extends BracedBlock implements Expression {
    private CallableSignature signature;
    private final List<String> modifiers;
    private boolean method;
    private boolean declaredOnly;
    private final List<Expression> decorators;

    public FunctionDeclaration(CallableSignature signature) {
        this(signature, new ArrayList<>(), false, false, new ArrayList<>());
    }

    public FunctionDeclaration(CallableSignature signature, List<String> modifiers, boolean method,
                               boolean declaredOnly, List<Expression> decorators) {
        this.signature = signature;
        this.modifiers = modifiers;
        this.method = method;
        this.declaredOnly = declaredOnly;
        this.decorators = decorators;
    }

    public CallableSignature signature() {
        return signature;
    }

    public void setSignature(CallableSignature signature) {
        this.signature = signature;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    public boolean isMethod() {
        return method;
    }

    public void setMethod(boolean method) {
        this.method = method;
    }

    public boolean isDeclaredOnly() {
        return declaredOnly;
    }

    public void setDeclaredOnly(boolean declaredOnly) {
        this.declaredOnly = declaredOnly;
    }

    public List<Expression> decorators() {
        return decorators;
    }

    @Override
    protected String buildString() {
        var head = new ArrayList<>(Render.decorated(decorators));
        head.addAll(modifiers);
        head.add(method ? "" : "function ");

        var result = String.join(" ", head) + signature;
        return declaredOnly ? result : result + " " + super.buildString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(nodes(decorators));
        result.add(signature);
        return result;
    }

    @Override
    public String statementTerminator() {
        return declaredOnly ? ";" : "";
    }
}
