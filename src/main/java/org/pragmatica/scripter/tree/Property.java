package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Declaration of a variable, parameter or member: {@code @dec public name?: Type = init}.
 */
public final class Property extends CodeNode implements Member {
    private DeclarationName name;
    private PropertyType type;
    private Expression initializer;
    private final List<String> modifiers;
    private final List<Expression> decorators;
    private boolean optional;
    private boolean dotDotDot;

    public Property(DeclarationName name) {
        this(name, null, null);
    }

    public Property(DeclarationName name, PropertyType type, Expression initializer) {
        this(name, type, initializer, new ArrayList<>(), new ArrayList<>(), false, false);
    }

    public Property(DeclarationName name, PropertyType type, Expression initializer, List<String> modifiers,
                    List<Expression> decorators, boolean optional, boolean dotDotDot) {
        this.name = name;
        this.type = type;
        this.initializer = initializer;
        this.modifiers = modifiers;
        this.decorators = decorators;
        this.optional = optional;
        this.dotDotDot = dotDotDot;
    }

    public DeclarationName name() {
        return name;
    }

    public void setName(DeclarationName name) {
        this.name = name;
    }

    public PropertyType type() {
        return type;
    }

    public void setType(PropertyType type) {
        this.type = type;
    }

    public Expression initializer() {
        return initializer;
    }

    public void setInitializer(Expression initializer) {
        this.initializer = initializer;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    public List<Expression> decorators() {
        return decorators;
    }

    public boolean isOptional() {
        return optional;
    }

    public void setOptional(boolean optional) {
        this.optional = optional;
    }

    public boolean isDotDotDot() {
        return dotDotDot;
    }

    public void setDotDotDot(boolean dotDotDot) {
        this.dotDotDot = dotDotDot;
    }

    @Override
    protected String buildString() {
        var head = new ArrayList<>(Render.decorated(decorators));
        head.addAll(modifiers);
        head.add(dotDotDot ? "..." + name : name.toString());

        var sb = new StringBuilder(String.join(" ", head));
        if (optional) {
            sb.append("?");
        }
        if (type != null) {
            sb.append(": ").append(type);
        }
        if (initializer != null) {
            sb.append(" = ").append(initializer);
        }
        return sb.toString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(nodes(decorators));
        result.add(node(type));
        result.add(node(initializer));
        result.add(node(name));
        return result;
    }
}
