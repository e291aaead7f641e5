package org.pragmatica.scripter.tree;

/**
 * Literal text kept for an element the analyzer could not translate.
 *
 * <p>The node cannot rebuild itself, so {@link #markDirty(boolean)} leaves its text in place.
 * The text includes any terminator the element had in the source.
 */
public final class Opaque extends CodeNode {
    @Override
    public CodeNode markDirty(boolean recursive) {
        return this;
    }

    @Override
    protected String buildString() {
        throw new IllegalStateException("No text found for opaque node");
    }

    @Override
    public String statementTerminator() {
        return "";
    }
}
