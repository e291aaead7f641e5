package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code module A.B { ... }} or {@code declare module "name" { ... }}.
 */
public final class ModuleDeclaration extends BracedBlock {
    private ModuleName name;
    private final List<String> modifiers;

    public ModuleDeclaration(ModuleName name) {
        this(name, new ArrayList<>());
    }

    public ModuleDeclaration(ModuleName name, List<String> modifiers) {
        this.name = name;
        this.modifiers = modifiers;
    }

    public ModuleName name() {
        return name;
    }

    public void setName(ModuleName name) {
        this.name = name;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    protected String buildString() {
        return Render.words(modifiers, "module", name.toString(), super.buildString());
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(name));
        return result;
    }
}
