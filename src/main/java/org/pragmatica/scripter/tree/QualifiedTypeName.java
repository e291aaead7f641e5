package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference to a named type with optional type arguments, e.g. {@code Map<string, number>}.
 */
public final class QualifiedTypeName extends CodeNode implements TypeNode {
    private QualifiedName name;
    private final List<TypeNode> typeArguments;

    public QualifiedTypeName(QualifiedName name) {
        this(name, new ArrayList<>());
    }

    public QualifiedTypeName(QualifiedName name, List<TypeNode> typeArguments) {
        this.name = name;
        this.typeArguments = typeArguments;
    }

    public static QualifiedTypeName fromSimpleName(String name) {
        return new QualifiedTypeName(new QualifiedName(name));
    }

    public QualifiedName name() {
        return name;
    }

    public void setName(QualifiedName name) {
        this.name = name;
    }

    public List<TypeNode> typeArguments() {
        return typeArguments;
    }

    /**
     * {@code new Name<Args>(arguments)} for this type.
     */
    public New asNew(List<Expression> arguments) {
        return new New(new Call(name.asExpression(), new ArrayList<>(arguments), new ArrayList<>(typeArguments)));
    }

    @Override
    protected String buildString() {
        return name + Render.angled(typeArguments);
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(nodes(typeArguments));
        result.add(name);
        return result;
    }
}
