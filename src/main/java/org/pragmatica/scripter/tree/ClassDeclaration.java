package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Class with properties, methods and accessors as elements. Decorators go on their own lines above the head.
 */
public final class ClassDeclaration extends BracedBlock {
    private String name;
    private final List<String> modifiers;
    private QualifiedTypeName parentClass;
    private final List<TypeParameter> typeParameters;
    private final List<QualifiedTypeName> implementedInterfaces;
    private final List<Expression> decorators;

    public ClassDeclaration(String name) {
        this(name, new ArrayList<>(), null, new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    public ClassDeclaration(String name, List<String> modifiers, QualifiedTypeName parentClass,
                            List<TypeParameter> typeParameters, List<QualifiedTypeName> implementedInterfaces,
                            List<Expression> decorators) {
        this.name = name;
        this.modifiers = modifiers;
        this.parentClass = parentClass;
        this.typeParameters = typeParameters;
        this.implementedInterfaces = implementedInterfaces;
        this.decorators = decorators;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    public QualifiedTypeName parentClass() {
        return parentClass;
    }

    public void setParentClass(QualifiedTypeName parentClass) {
        this.parentClass = parentClass;
    }

    public List<TypeParameter> typeParameters() {
        return typeParameters;
    }

    public List<QualifiedTypeName> implementedInterfaces() {
        return implementedInterfaces;
    }

    public List<Expression> decorators() {
        return decorators;
    }

    @Override
    protected String buildString() {
        var head = Render.words(modifiers, "class", name) + Render.angled(typeParameters);
        if (parentClass != null) {
            head += " extends " + parentClass;
        }
        if (!implementedInterfaces.isEmpty()) {
            head += " implements " + Render.join(implementedInterfaces, ", ");
        }

        var lines = new ArrayList<>(Render.decorated(decorators));
        lines.add(head);
        return String.join("\n", lines) + " " + super.buildString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(typeParameters);
        result.addAll(implementedInterfaces);
        result.addAll(nodes(decorators));
        result.add(parentClass);
        return result;
    }
}
