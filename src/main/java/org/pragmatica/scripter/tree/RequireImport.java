package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * CommonJS style import: {@code import fs = require("fs")}.
 */
public final class RequireImport extends CodeNode {
    private Identifier importedAs;
    private Expression importPath;
    private final List<String> modifiers;

    public RequireImport(Identifier importedAs, Expression importPath) {
        this(importedAs, importPath, new ArrayList<>());
    }

    public RequireImport(Identifier importedAs, Expression importPath, List<String> modifiers) {
        this.importedAs = importedAs;
        this.importPath = importPath;
        this.modifiers = modifiers;
    }

    public Identifier importedAs() {
        return importedAs;
    }

    public void setImportedAs(Identifier importedAs) {
        this.importedAs = importedAs;
    }

    public Expression importPath() {
        return importPath;
    }

    public void setImportPath(Expression importPath) {
        this.importPath = importPath;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    protected String buildString() {
        return Render.words(modifiers, "import", importedAs.toString(), "=", "require(" + importPath + ")");
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(node(importPath));
        result.add(importedAs);
        return result;
    }
}
