package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Interface with {@link Member} elements.
 */
public final class InterfaceDeclaration extends BracedBlock {
    private String name;
    private final List<TypeParameter> typeParameters;
    private final List<QualifiedTypeName> extendedInterfaces;
    private final List<String> modifiers;

    public InterfaceDeclaration(String name) {
        this(name, new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    public InterfaceDeclaration(String name, List<TypeParameter> typeParameters,
                                List<QualifiedTypeName> extendedInterfaces, List<String> modifiers) {
        this.name = name;
        this.typeParameters = typeParameters;
        this.extendedInterfaces = extendedInterfaces;
        this.modifiers = modifiers;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<TypeParameter> typeParameters() {
        return typeParameters;
    }

    public List<QualifiedTypeName> extendedInterfaces() {
        return extendedInterfaces;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    protected String buildString() {
        var head = Render.words(modifiers, "interface", name) + Render.angled(typeParameters);
        if (!extendedInterfaces.isEmpty()) {
            head += " extends " + Render.join(extendedInterfaces, ", ");
        }
        return head + " " + super.buildString();
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.addAll(typeParameters);
        result.addAll(extendedInterfaces);
        return result;
    }
}
