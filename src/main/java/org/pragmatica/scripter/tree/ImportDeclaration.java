package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * ES module import with bindings: {@code import def, * as ns from "path"}.
 */
public final class ImportDeclaration extends CodeNode {
    private Expression modulePath;
    private Identifier defaultBinding;
    private ImportBinding namedBindings;
    private final List<String> modifiers;

    public ImportDeclaration(Expression modulePath, Identifier defaultBinding, ImportBinding namedBindings) {
        this(modulePath, defaultBinding, namedBindings, new ArrayList<>());
    }

    public ImportDeclaration(Expression modulePath, Identifier defaultBinding, ImportBinding namedBindings,
                             List<String> modifiers) {
        this.modulePath = modulePath;
        this.defaultBinding = defaultBinding;
        this.namedBindings = namedBindings;
        this.modifiers = modifiers;
    }

    public Expression modulePath() {
        return modulePath;
    }

    public void setModulePath(Expression modulePath) {
        this.modulePath = modulePath;
    }

    public Identifier defaultBinding() {
        return defaultBinding;
    }

    public void setDefaultBinding(Identifier defaultBinding) {
        this.defaultBinding = defaultBinding;
    }

    public ImportBinding namedBindings() {
        return namedBindings;
    }

    public void setNamedBindings(ImportBinding namedBindings) {
        this.namedBindings = namedBindings;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    protected String buildString() {
        var bindings = new ArrayList<String>();
        if (defaultBinding != null) {
            bindings.add(defaultBinding.toString());
        }
        if (namedBindings != null) {
            bindings.add(namedBindings.toString());
        }
        return Render.words(modifiers, "import", String.join(", ", bindings), "from", modulePath.toString());
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(modulePath));
        result.add(defaultBinding);
        result.add(node(namedBindings));
        return result;
    }
}
