package org.pragmatica.scripter.tree;

/**
 * Block of statements, each rendered with its terminator.
 */
public abstract sealed class StatementBlock extends Block permits BracedBlock, Source, Case {
    @Override
    protected String buildString() {
        return joinStatements(elements());
    }
}
