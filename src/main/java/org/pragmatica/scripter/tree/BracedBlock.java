package org.pragmatica.scripter.tree;

/**
 * Statement block enclosed in braces.
 */
public abstract sealed class BracedBlock extends StatementBlock
    permits CodeBlock, ModuleDeclaration, InterfaceDeclaration, TypeLiteral, FunctionDeclaration, Lambda,
            ClassDeclaration, Switch {
    @Override
    protected String buildString() {
        return "{" + super.buildString() + "}";
    }
}
