package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Alias of an internal module: {@code import Hat = Body.Head.Hat}.
 */
public final class InternalModuleImport extends CodeNode {
    private String symbolName;
    private QualifiedName moduleName;
    private final List<String> modifiers;

    public InternalModuleImport(String symbolName, QualifiedName moduleName) {
        this(symbolName, moduleName, new ArrayList<>());
    }

    public InternalModuleImport(String symbolName, QualifiedName moduleName, List<String> modifiers) {
        this.symbolName = symbolName;
        this.moduleName = moduleName;
        this.modifiers = modifiers;
    }

    public String symbolName() {
        return symbolName;
    }

    public void setSymbolName(String symbolName) {
        this.symbolName = symbolName;
    }

    public QualifiedName moduleName() {
        return moduleName;
    }

    public void setModuleName(QualifiedName moduleName) {
        this.moduleName = moduleName;
    }

    public List<String> modifiers() {
        return modifiers;
    }

    @Override
    protected String buildString() {
        return Render.words(modifiers, "import", symbolName, "=", moduleName.toString());
    }

    @Override
    protected List<CodeNode> buildChildren() {
        var result = super.buildChildren();
        result.add(moduleName);
        return result;
    }
}
