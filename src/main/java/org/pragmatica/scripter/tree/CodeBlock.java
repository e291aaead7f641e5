package org.pragmatica.scripter.tree;

/**
 * Plain {@code { ... }} statement block.
 */
public final class CodeBlock extends BracedBlock {
}
