package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Name, type parameters, parameters and return type of something callable.
 *
 * <p>{@link CallableSignature} writes the return type after {@code :}; {@link CallableType}
 * writes it after {@code =>} and always has one, defaulting to {@code void}.
 */
public abstract sealed class Signature extends CodeNode permits CallableSignature, CallableType {
    private DeclarationName name;
    private final List<Property> parameters;
    private TypeNode returnType;
    private final List<TypeParameter> typeParameters;
    private boolean optional;

    protected Signature(DeclarationName name, List<Property> parameters, TypeNode returnType,
                        List<TypeParameter> typeParameters, boolean optional) {
        this.name = name;
        this.parameters = parameters;
        this.returnType = returnType;
        this.typeParameters = typeParameters;
        this.optional = optional;
    }

    protected Signature() {
        this(null, new ArrayList<>(), null, new ArrayList<>(), false);
    }

    public DeclarationName name() {
        return name;
    }

    public void setName(DeclarationName name) {
        this.name = name;
    }

    public List<Property> parameters() {
        return parameters;
    }

    public TypeNode returnType() {
        return returnType;
    }

    public void setReturnType(TypeNode returnType) {
        this.returnType = returnType;
    }

    public List<TypeParameter> typeParameters() {
        return typeParameters;
    }

    public boolean isOptional() {
        return optional;
    }

    public void setOptional(boolean optional) {
        this.optional = optional;
    }

    protected abstract boolean isPropertyType();

    @Override
    protected String buildString() {
        var sb = new StringBuilder();
        if (name != null) {
            sb.append(name);
        }
        if (optional) {
            sb.append("?");
        }
        sb.append(Render.angled(typeParameters));
        sb.append("(").append(Render.join(parameters, ", ")).append(")");

        if (isPropertyType() || returnType != null) {
            sb.append(isPropertyType() ? "=>" : ":");
            sb.append(returnType == null ? "void" : returnType.toString());
        }
        return sb.toString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(parameters);
        result.addAll(typeParameters);
        result.add(node(returnType));
        result.add(node(name));
        return result;
    }
}
